package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.coating.ConstantReflectivity;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/**
 * Flat reflective grating with its lines along the local y axis. Rays leave in
 * the configured diffraction order; orders that do not propagate are lost.
 */
public final class ReflectiveGrating extends SinglePathNode implements EnergyAnalyzable, RayTraceAnalyzable {
    public static final String LINE_DENSITY = "line density";
    public static final String DIFFRACTION_ORDER = "diffraction order";

    private final OpticSurface grating;

    public ReflectiveGrating(String name, double lineDensity, int order) {
        super("reflective grating", name);
        properties().create(LINE_DENSITY, "lines per metre", lineDensity, PropertyValidator.positive(),
                PropertyValidator.finite());
        properties().create(DIFFRACTION_ORDER, "diffraction order", order);
        this.grating = addSurface(new OpticSurface("grating", Plane.INSTANCE));
        grating.setCoating(new ConstantReflectivity(1.0));
    }

    public OpticSurface grating() {
        return grating;
    }

    @Override
    protected List<TrainStep> opticalTrain(AnalysisContext ctx) {
        RefractiveIndex ambient = ctx.resources().getAmbientIndex();
        double density = properties().getDouble(LINE_DENSITY);
        int order = properties().getInt(DIFFRACTION_ORDER);
        return List.of(new TrainStep(grating, ambient, ambient, (b, s, next, c) -> {
            b.diffractOnGrating(s, density, order, c.missedSurfaceStrategy(), c.recordsHits());
            b.apodize(s);
            return null;
        }));
    }
}
