package com.optics.osg.refraction;

import java.util.Arrays;

/**
 * Schott dispersion formula:
 * n&sup2; = a0 + a1&lambda;&sup2; + a2&lambda;<sup>-2</sup> +
 * a3&lambda;<sup>-4</sup> + a4&lambda;<sup>-6</sup> + a5&lambda;<sup>-8</sup>
 * with &lambda; in micrometres.
 */
public final class SchottIndex implements RefractiveIndex {
    private final double[] a;
    private final DispersionRange range;

    public SchottIndex(double a0, double a1, double a2, double a3, double a4, double a5, double minWavelength,
            double maxWavelength) {
        this.a = new double[] { a0, a1, a2, a3, a4, a5 };
        this.range = new DispersionRange(minWavelength, maxWavelength);
    }

    @Override
    public double at(double wavelength) {
        double l = range.micrometers(wavelength);
        double l2 = l * l;
        double inv = 1.0 / l2;
        double n2 = a[0] + a[1] * l2 + a[2] * inv + a[3] * inv * inv + a[4] * inv * inv * inv
                + a[5] * inv * inv * inv * inv;
        return Math.sqrt(n2);
    }

    @Override
    public String toString() {
        return "Schott" + Arrays.toString(a);
    }
}
