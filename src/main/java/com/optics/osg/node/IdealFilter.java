package com.optics.osg.node;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;

/** Attenuates the light by a constant or spectral transmission. */
public final class IdealFilter extends PlaneNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String FILTER = "filter type";

    public IdealFilter(String name, FilterType filter) {
        super("ideal filter", name);
        properties().create(FILTER, "transmission of the filter", FilterType.class, filter);
    }

    public IdealFilter(String name, double transmission) {
        this(name, FilterType.constant(transmission));
    }

    public FilterType filter() {
        return properties().get(FILTER, FilterType.class);
    }

    @Override
    protected Spectrum transformSpectrum(Spectrum spectrum, AnalysisContext ctx) {
        return filter().apply(spectrum);
    }

    @Override
    protected void transformRays(RayBundle bundle, AnalysisContext ctx) {
        if (!ctx.isPositioning())
            filter().apply(bundle);
    }
}
