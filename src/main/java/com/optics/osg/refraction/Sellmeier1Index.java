package com.optics.osg.refraction;

/**
 * Sellmeier formula with three terms:
 * n&sup2; = 1 + &Sigma; k<sub>i</sub>&lambda;&sup2; / (&lambda;&sup2; - l<sub>i</sub>)
 * with &lambda; in micrometres.
 */
public final class Sellmeier1Index implements RefractiveIndex {
    private final double k1, k2, k3, l1, l2, l3;
    private final DispersionRange range;

    public Sellmeier1Index(double k1, double k2, double k3, double l1, double l2, double l3, double minWavelength,
            double maxWavelength) {
        this.k1 = k1;
        this.k2 = k2;
        this.k3 = k3;
        this.l1 = l1;
        this.l2 = l2;
        this.l3 = l3;
        this.range = new DispersionRange(minWavelength, maxWavelength);
    }

    /** N-BK7 from the Schott catalogue, valid from 300 nm to 2.5 um. */
    public static Sellmeier1Index nbk7() {
        return new Sellmeier1Index(1.03961212, 0.231792344, 1.01046945, 0.00600069867, 0.0200179144, 103.560653,
                300e-9, 2500e-9);
    }

    @Override
    public double at(double wavelength) {
        double l = range.micrometers(wavelength);
        double s = l * l;
        double n2 = 1.0 + k1 * s / (s - l1) + k2 * s / (s - l2) + k3 * s / (s - l3);
        return Math.sqrt(n2);
    }

    @Override
    public String toString() {
        return "Sellmeier1[" + k1 + ", " + k2 + ", " + k3 + "; " + l1 + ", " + l2 + ", " + l3 + "]";
    }
}
