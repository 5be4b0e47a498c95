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

/**
 * Thick lens of two spherical (or flat) surfaces. The front vertex sits at the
 * node origin, the rear vertex one center thickness further along z. Radii
 * follow the usual sign convention: positive when the centre of curvature
 * lies behind the vertex, infinite for a flat surface.
 */
public final class Lens extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String FRONT_CURVATURE = "front curvature";
    public static final String REAR_CURVATURE = "rear curvature";
    public static final String CENTER_THICKNESS = "center thickness";
    public static final String REFRACTIVE_INDEX = "refractive index";

    private final OpticSurface front;
    private final OpticSurface rear;

    public Lens(String name, double frontCurvature, double rearCurvature, double centerThickness,
            RefractiveIndex index) {
        super("lens", name);
        properties().create(FRONT_CURVATURE, "radius of curvature of the front surface", frontCurvature,
                PropertyValidator.nonZero());
        properties().create(REAR_CURVATURE, "radius of curvature of the rear surface", rearCurvature,
                PropertyValidator.nonZero());
        properties().create(CENTER_THICKNESS, "thickness on the optical axis", centerThickness,
                PropertyValidator.finite(), PropertyValidator.inRange(0.0, Double.MAX_VALUE));
        properties().create(REFRACTIVE_INDEX, "refractive index model of the lens material",
                RefractiveIndex.class, index);
        this.front = addSurface(new OpticSurface("front", sphereOrPlane(frontCurvature)));
        this.rear = addSurface(new OpticSurface("rear", sphereOrPlane(rearCurvature)));
        updateGeometry();
    }

    public OpticSurface front() {
        return front;
    }

    public OpticSurface rear() {
        return rear;
    }

    public RefractiveIndex refractiveIndex() {
        return properties().get(REFRACTIVE_INDEX, RefractiveIndex.class);
    }

    @Override
    public double axialLength() {
        return properties().getDouble(CENTER_THICKNESS);
    }

    private void updateGeometry() {
        front.setGeometry(sphereOrPlane(properties().getDouble(FRONT_CURVATURE)));
        rear.setGeometry(sphereOrPlane(properties().getDouble(REAR_CURVATURE)));
        rear.setLocalPose(Pose.translation(0, 0, axialLength()));
        placeSurfaces();
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        updateGeometry();
        RefractiveIndex ambient = ctx.resources().getAmbientIndex();
        RefractiveIndex glass = refractiveIndex();
        return List.of(TrainStep.refract(front, ambient, glass), TrainStep.refract(rear, glass, ambient));
    }
}
