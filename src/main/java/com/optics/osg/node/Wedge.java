package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.geom.Pose;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/** Glass wedge: a flat front surface and a flat rear surface tilted about x by the wedge angle. */
public final class Wedge extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String CENTER_THICKNESS = "center thickness";
    public static final String WEDGE_ANGLE = "wedge angle";
    public static final String REFRACTIVE_INDEX = "refractive index";

    private final OpticSurface front;
    private final OpticSurface rear;

    public Wedge(String name, double centerThickness, double wedgeAngle, RefractiveIndex index) {
        super("wedge", name);
        properties().create(CENTER_THICKNESS, "thickness on the optical axis", centerThickness,
                PropertyValidator.finite(), PropertyValidator.inRange(0.0, Double.MAX_VALUE));
        properties().create(WEDGE_ANGLE, "angle between front and rear surface in radians", wedgeAngle,
                PropertyValidator.inRange(-Math.PI / 2.0, Math.PI / 2.0));
        properties().create(REFRACTIVE_INDEX, "refractive index model of the wedge material",
                RefractiveIndex.class, index);
        this.front = addSurface(new OpticSurface("front", Plane.INSTANCE));
        this.rear = addSurface(new OpticSurface("rear", Plane.INSTANCE));
        updateGeometry();
    }

    public OpticSurface front() {
        return front;
    }

    public OpticSurface rear() {
        return rear;
    }

    @Override
    public double axialLength() {
        return properties().getDouble(CENTER_THICKNESS);
    }

    private void updateGeometry() {
        double angle = properties().getDouble(WEDGE_ANGLE);
        rear.setLocalPose(Pose.translation(0, 0, axialLength()).append(Pose.rotationX(angle)));
        placeSurfaces();
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        updateGeometry();
        RefractiveIndex ambient = ctx.resources().getAmbientIndex();
        RefractiveIndex glass = properties().get(REFRACTIVE_INDEX, RefractiveIndex.class);
        return List.of(TrainStep.refract(front, ambient, glass), TrainStep.refract(rear, glass, ambient));
    }
}
