package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.coating.ConstantReflectivity;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.surface.OpticSurface;

/**
 * Infinitely thin mirror, flat or spherical. A negative radius of curvature
 * makes a concave (focusing) mirror for light arriving along +z. The surface
 * reflects fully unless another coating is set.
 */
public final class ThinMirror extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String CURVATURE = "curvature";

    private final OpticSurface mirror;

    public ThinMirror(String name) {
        this(name, Double.POSITIVE_INFINITY);
    }

    public ThinMirror(String name, double curvature) {
        super("mirror", name);
        properties().create(CURVATURE, "radius of curvature, infinite for a flat mirror", curvature,
                PropertyValidator.nonZero());
        this.mirror = addSurface(new OpticSurface("mirror", sphereOrPlane(curvature)));
        mirror.setCoating(new ConstantReflectivity(1.0));
    }

    public OpticSurface mirror() {
        return mirror;
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        mirror.setGeometry(sphereOrPlane(properties().getDouble(CURVATURE)));
        return List.of(TrainStep.reflect(mirror, ctx.resources().getAmbientIndex()));
    }
}
