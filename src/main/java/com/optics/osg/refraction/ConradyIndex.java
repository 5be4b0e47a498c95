package com.optics.osg.refraction;

/**
 * Conrady formula: n = n0 + a/&lambda; + b/&lambda;<sup>3.5</sup> with
 * &lambda; in micrometres.
 */
public final class ConradyIndex implements RefractiveIndex {
    private final double n0, a, b;
    private final DispersionRange range;

    public ConradyIndex(double n0, double a, double b, double minWavelength, double maxWavelength) {
        this.n0 = n0;
        this.a = a;
        this.b = b;
        this.range = new DispersionRange(minWavelength, maxWavelength);
    }

    @Override
    public double at(double wavelength) {
        double l = range.micrometers(wavelength);
        return n0 + a / l + b / Math.pow(l, 3.5);
    }

    @Override
    public String toString() {
        return "Conrady[" + n0 + ", " + a + ", " + b + "]";
    }
}
