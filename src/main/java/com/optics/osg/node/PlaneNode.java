package com.optics.osg.node;

import java.util.List;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/** A single-path node whose train is one flat detection plane at its origin. */
public abstract class PlaneNode extends SinglePathNode {
    private final OpticSurface plane;

    protected PlaneNode(String nodeType, String name) {
        super(nodeType, name);
        this.plane = addSurface(new OpticSurface(OpticPorts.INPUT_1, Plane.INSTANCE));
    }

    /** The surface rays are recorded on. */
    public OpticSurface plane() {
        return plane;
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        return List.of(TrainStep.detect(plane, ctx.resources().getAmbientIndex()));
    }
}
