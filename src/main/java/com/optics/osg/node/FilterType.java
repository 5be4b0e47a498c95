package com.optics.osg.node;

import com.optics.osg.api.OpticException;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;

/** Transmission of an ideal filter: constant or a spectral curve. */
public record FilterType(Double transmission, Spectrum curve) {

    public FilterType {
        if ((transmission == null) == (curve == null))
            throw OpticException.properties("a filter is either a constant or a spectral transmission");
        if (transmission != null && !(transmission >= 0.0 && transmission <= 1.0))
            throw OpticException.properties("transmission must be within [0.0, 1.0]");
    }

    public static FilterType constant(double transmission) {
        return new FilterType(transmission, null);
    }

    public static FilterType spectral(Spectrum curve) {
        return new FilterType(null, curve);
    }

    Spectrum apply(Spectrum spectrum) {
        return transmission != null ? spectrum.scale(transmission) : spectrum.filter(curve);
    }

    void apply(RayBundle bundle) {
        if (transmission != null)
            bundle.filterEnergy(transmission);
        else
            bundle.filterEnergy(curve);
    }

    @Override
    public String toString() {
        return transmission != null ? "constant " + transmission : "spectral " + curve;
    }
}
