package com.optics.osg.spectrum;

import java.util.List;

import com.optics.osg.api.OpticException;

/** Factory methods for common spectra. */
public final class Spectra {
    private Spectra() {
        // Utility class
    }

    /** Default sample spacing used when spectra are built from rays: 0.1 nm. */
    public static final double DEFAULT_RESOLUTION = 0.1e-9;

    private static final double MARGIN = 10e-9;

    /** Helium-neon laser line on the visible range 380 nm .. 750 nm at 0.1 nm. */
    public static Spectrum heNe(double energy) {
        return new Spectrum(380e-9, 750e-9, DEFAULT_RESOLUTION).addSinglePeak(632.816e-9, energy);
    }

    /** A single line, with a 10 nm margin on both sides. */
    public static Spectrum singleLine(double wavelength, double energy) {
        return new Spectrum(wavelength - MARGIN, wavelength + MARGIN, DEFAULT_RESOLUTION)
                .addSinglePeak(wavelength, energy);
    }

    /** One entry per line: {wavelength, energy}. */
    public static Spectrum lines(List<double[]> lines, double resolution) {
        if (lines.isEmpty())
            throw OpticException.other("at least one line is required");
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double[] l : lines) {
            min = Math.min(min, l[0]);
            max = Math.max(max, l[0]);
        }
        Spectrum s = new Spectrum(Math.max(resolution, min - MARGIN), max + MARGIN, resolution);
        for (double[] l : lines)
            s.addSinglePeak(l[0], l[1]);
        return s;
    }

    /** Flat transmission (or ratio) curve of the given value. */
    public static Spectrum constant(double start, double end, double resolution, double value) {
        Spectrum s = new Spectrum(start, end, resolution);
        for (int i = 0; i < s.size(); i++)
            s.addSinglePeak(s.wavelength(i), value);
        return s;
    }
}
