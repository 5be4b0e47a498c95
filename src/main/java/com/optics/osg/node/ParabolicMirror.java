package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.coating.ConstantReflectivity;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Parabola;

/**
 * Parabolic mirror. A collimated beam along +z is focused at the focal length
 * in front of the mirror; with an off-axis angle θ the beam is deflected by θ
 * towards the focus, in the x/z plane.
 */
public final class ParabolicMirror extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String FOCAL_LENGTH = "focal length";
    public static final String OFF_AXIS_ANGLE = "off-axis angle";

    private final OpticSurface mirror;

    public ParabolicMirror(String name, double focalLength) {
        this(name, focalLength, 0.0);
    }

    public ParabolicMirror(String name, double focalLength, double offAxisAngle) {
        super("parabolic mirror", name);
        properties().create(FOCAL_LENGTH, "focal length in metres, negative for a diverging mirror", focalLength,
                PropertyValidator.finite(), PropertyValidator.nonZero());
        properties().create(OFF_AXIS_ANGLE, "deflection of the on-axis ray in radians", offAxisAngle,
                PropertyValidator.inRange(-Math.PI / 2.0, Math.PI / 2.0));
        this.mirror = addSurface(new OpticSurface("mirror", geometry()));
        mirror.setCoating(new ConstantReflectivity(1.0));
    }

    private Parabola geometry() {
        // focus in front of the mirror, against the incoming light
        return new Parabola(-properties().getDouble(FOCAL_LENGTH), properties().getDouble(OFF_AXIS_ANGLE), 0.0);
    }

    public OpticSurface mirror() {
        return mirror;
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        mirror.setGeometry(geometry());
        return List.of(TrainStep.reflect(mirror, ctx.resources().getAmbientIndex()));
    }
}
