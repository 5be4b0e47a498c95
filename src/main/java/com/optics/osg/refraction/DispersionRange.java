package com.optics.osg.refraction;

import com.optics.osg.api.OpticException;
import com.optics.osg.geom.Units;

/** Wavelength interval (metres) in which a dispersion fit is valid. */
record DispersionRange(double min, double max) {

    DispersionRange {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min <= 0.0 || max <= min)
            throw OpticException.other("dispersion range must be finite, positive and non-empty");
    }

    /** Checks the wavelength and returns it in micrometres. */
    double micrometers(double wavelength) {
        if (wavelength < min || wavelength > max)
            throw OpticException.other("wavelength " + wavelength + " m outside the valid range [" + min + ", "
                    + max + "] m");
        return Units.toMicrometer(wavelength);
    }
}
