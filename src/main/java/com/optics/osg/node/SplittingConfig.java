package com.optics.osg.node;

import com.optics.osg.api.OpticException;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;

/**
 * Split ratio of a beam splitter: a constant or a spectral curve. The ratio is
 * the transmitted share.
 */
public record SplittingConfig(Double ratio, Spectrum curve) {

    public SplittingConfig {
        if ((ratio == null) == (curve == null))
            throw OpticException.properties("a splitting config is either a ratio or a spectral curve");
        if (ratio != null && !(ratio >= 0.0 && ratio <= 1.0))
            throw OpticException.properties("splitting ratio must be within [0.0, 1.0]");
    }

    public static SplittingConfig ratio(double ratio) {
        return new SplittingConfig(ratio, null);
    }

    public static SplittingConfig spectral(Spectrum curve) {
        return new SplittingConfig(null, curve);
    }

    /** Keeps the transmitted part in {@code spectrum}, returns the reflected part. */
    Spectrum split(Spectrum spectrum) {
        return ratio != null ? spectrum.split(ratio) : spectrum.split(curve);
    }

    /** Keeps the transmitted part in {@code bundle}, returns the reflected part. */
    RayBundle split(RayBundle bundle) {
        return ratio != null ? bundle.split(ratio) : bundle.split(curve);
    }

    @Override
    public String toString() {
        return ratio != null ? "ratio " + ratio : "spectral " + curve;
    }
}
