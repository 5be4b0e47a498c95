package com.optics.osg.geom;

/**
 * SI conversion helpers.
 *
 * <p>
 * Every quantity inside the library is a plain {@code double} in SI units:
 * metres, joules, radians and J/m&sup2; for fluence. These helpers convert the
 * units optical engineers usually think in.
 */
public final class Units {
    private Units() {
        // Utility class
    }

    public static final double NANOMETER = 1e-9;
    public static final double MICROMETER = 1e-6;
    public static final double MILLIMETER = 1e-3;
    public static final double CENTIMETER = 1e-2;

    public static final double JOULE = 1.0;
    public static final double MILLIJOULE = 1e-3;
    public static final double PICOJOULE = 1e-12;

    /** 1 J/cm&sup2; expressed in J/m&sup2;. */
    public static final double J_PER_CM2 = 1e4;

    public static double nm(double value) {
        return value * NANOMETER;
    }

    public static double um(double value) {
        return value * MICROMETER;
    }

    public static double mm(double value) {
        return value * MILLIMETER;
    }

    public static double cm(double value) {
        return value * CENTIMETER;
    }

    public static double degrees(double value) {
        return Math.toRadians(value);
    }

    public static double toMicrometer(double meters) {
        return meters / MICROMETER;
    }

    public static double toNanometer(double meters) {
        return meters / NANOMETER;
    }

    public static double toMillimeter(double meters) {
        return meters / MILLIMETER;
    }
}
