package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/** Ideal thin lens of focal length f; negative f diverges. */
public final class ParaxialSurface extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String FOCAL_LENGTH = "focal length";

    private final OpticSurface surface;

    public ParaxialSurface(String name, double focalLength) {
        super("paraxial surface", name);
        properties().create(FOCAL_LENGTH, "focal length in metres", focalLength, PropertyValidator.finite(),
                PropertyValidator.nonZero());
        this.surface = addSurface(new OpticSurface(OpticPorts.INPUT_1, Plane.INSTANCE));
    }

    public double focalLength() {
        return properties().getDouble(FOCAL_LENGTH);
    }

    public OpticSurface surface() {
        return surface;
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        RefractiveIndex ambient = ctx.resources().getAmbientIndex();
        double f = focalLength();
        return List.of(new TrainStep(surface, ambient, ambient, (b, s, next, c) -> {
            b.refractParaxial(s, f, c.missedSurfaceStrategy(), c.recordsHits());
            b.apodize(s);
            return null;
        }));
    }
}
