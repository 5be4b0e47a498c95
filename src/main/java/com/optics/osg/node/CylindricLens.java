package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.geom.Pose;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.Cylinder;
import com.optics.osg.surface.GeoSurface;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/**
 * Lens with cylindrical surfaces whose axes run along the local y axis, so it
 * focuses in the x/z plane only.
 */
public final class CylindricLens extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String FRONT_CURVATURE = "front curvature";
    public static final String REAR_CURVATURE = "rear curvature";
    public static final String CENTER_THICKNESS = "center thickness";
    public static final String REFRACTIVE_INDEX = "refractive index";

    private final OpticSurface front;
    private final OpticSurface rear;

    public CylindricLens(String name, double frontCurvature, double rearCurvature, double centerThickness,
            RefractiveIndex index) {
        super("cylindric lens", name);
        properties().create(FRONT_CURVATURE, "radius of the front cylinder", frontCurvature,
                PropertyValidator.nonZero());
        properties().create(REAR_CURVATURE, "radius of the rear cylinder", rearCurvature,
                PropertyValidator.nonZero());
        properties().create(CENTER_THICKNESS, "thickness on the optical axis", centerThickness,
                PropertyValidator.finite(), PropertyValidator.inRange(0.0, Double.MAX_VALUE));
        properties().create(REFRACTIVE_INDEX, "refractive index model of the lens material",
                RefractiveIndex.class, index);
        this.front = addSurface(new OpticSurface("front", cylinderOrPlane(frontCurvature)));
        this.rear = addSurface(new OpticSurface("rear", cylinderOrPlane(rearCurvature)));
        updateGeometry();
    }

    private static GeoSurface cylinderOrPlane(double radius) {
        return Double.isInfinite(radius) ? Plane.INSTANCE : new Cylinder(radius);
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
        front.setGeometry(cylinderOrPlane(properties().getDouble(FRONT_CURVATURE)));
        rear.setGeometry(cylinderOrPlane(properties().getDouble(REAR_CURVATURE)));
        rear.setLocalPose(Pose.translation(0, 0, axialLength()));
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
