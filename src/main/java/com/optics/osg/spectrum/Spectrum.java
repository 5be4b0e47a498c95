package com.optics.osg.spectrum;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.OpticException;

/**
 * Energy sampled on a regular wavelength grid.
 *
 * <p>
 * Sample {@code i} sits at {@code start + i * resolution} (metres) and holds
 * the energy (joules) of the band around it, so {@link #totalEnergy()} is a
 * plain sum and scaling conserves energy exactly. The same grid is reused for
 * dimensionless transmission curves, read back with {@link #valueAt(double)}.
 */
public final class Spectrum {
    private static final Logger log = LogManager.getLogger(Spectrum.class);

    private final double start;
    private final double resolution;
    private final double[] values;

    /**
     * Creates an empty spectrum covering [start, end) with the given sample
     * spacing.
     */
    public Spectrum(double start, double end, double resolution) {
        if (!Double.isFinite(start) || start <= 0.0)
            throw OpticException.other("start wavelength must be positive and finite");
        if (!Double.isFinite(end) || end <= start)
            throw OpticException.other("end wavelength must be greater than start wavelength");
        if (!Double.isFinite(resolution) || resolution <= 0.0)
            throw OpticException.other("resolution must be positive and finite");
        int n = (int) Math.ceil((end - start) / resolution - 1e-9);
        if (n < 2)
            throw OpticException.other("spectrum needs at least two samples");
        this.start = start;
        this.resolution = resolution;
        this.values = new double[n];
    }

    private Spectrum(double start, double resolution, double[] values) {
        this.start = start;
        this.resolution = resolution;
        this.values = values;
    }

    public Spectrum copy() {
        return new Spectrum(start, resolution, values.clone());
    }

    public int size() {
        return values.length;
    }

    public double start() {
        return start;
    }

    /** Wavelength of the last sample. */
    public double end() {
        return wavelength(values.length - 1);
    }

    public double resolution() {
        return resolution;
    }

    public double wavelength(int i) {
        return start + i * resolution;
    }

    public double value(int i) {
        return values[i];
    }

    public double[] wavelengths() {
        double[] w = new double[values.length];
        for (int i = 0; i < w.length; i++)
            w[i] = wavelength(i);
        return w;
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Adds a line of the given energy, split linearly between the two
     * neighbouring samples.
     */
    public Spectrum addSinglePeak(double wavelength, double energy) {
        if (!Double.isFinite(energy) || energy < 0.0)
            throw OpticException.other("energy must be positive and finite");
        double x = (wavelength - start) / resolution;
        if (!Double.isFinite(x) || x < -1e-9 || x > values.length - 1 + 1e-9)
            throw OpticException.other("wavelength " + wavelength + " m is outside the spectrum range");
        int i = (int) Math.floor(x);
        if (i >= values.length - 1) {
            values[values.length - 1] += energy;
            return this;
        }
        if (i < 0) {
            values[0] += energy;
            return this;
        }
        double frac = x - i;
        values[i] += energy * (1.0 - frac);
        values[i + 1] += energy * frac;
        return this;
    }

    /**
     * Adds a Lorentzian line of the given full width at half maximum whose
     * samples sum to {@code energy}.
     */
    public Spectrum addLorentzian(double center, double fwhm, double energy) {
        if (!Double.isFinite(fwhm) || fwhm <= 0.0)
            throw OpticException.other("line width must be positive and finite");
        if (!Double.isFinite(energy) || energy < 0.0)
            throw OpticException.other("energy must be positive and finite");
        double gamma = fwhm / 2.0;
        double[] shape = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double d = wavelength(i) - center;
            shape[i] = gamma / (d * d + gamma * gamma);
            sum += shape[i];
        }
        if (sum == 0.0)
            throw OpticException.other("Lorentzian line does not overlap the spectrum");
        for (int i = 0; i < values.length; i++)
            values[i] += energy * shape[i] / sum;
        return this;
    }

    public double totalEnergy() {
        double sum = 0.0;
        for (double v : values)
            sum += v;
        return sum;
    }

    /** Energy-weighted mean wavelength, NaN for an empty spectrum. */
    public double centerWavelength() {
        double sum = 0.0, weighted = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            weighted += values[i] * wavelength(i);
        }
        return sum > 0.0 ? weighted / sum : Double.NaN;
    }

    /** Linear interpolation between samples, 0 outside the grid. */
    public double valueAt(double wavelength) {
        double x = (wavelength - start) / resolution;
        if (x < -1e-9 || x > values.length - 1 + 1e-9)
            return 0.0;
        int i = (int) Math.floor(x);
        if (i >= values.length - 1)
            return values[values.length - 1];
        if (i < 0)
            return values[0];
        double frac = x - i;
        return values[i] * (1.0 - frac) + values[i + 1] * frac;
    }

    public Spectrum scale(double factor) {
        if (!Double.isFinite(factor) || factor < 0.0)
            throw OpticException.other("scale factor must be positive and finite");
        for (int i = 0; i < values.length; i++)
            values[i] *= factor;
        return this;
    }

    /**
     * Multiplies every sample by the transmission curve evaluated at its
     * wavelength.
     */
    public Spectrum filter(Spectrum transmission) {
        for (int i = 0; i < values.length; i++) {
            double t = transmission.valueAt(wavelength(i));
            if (t < 0.0 || t > 1.0)
                throw OpticException.other("transmission must be within [0.0, 1.0]");
            values[i] *= t;
        }
        return this;
    }

    /**
     * Splits this spectrum by a constant ratio. This spectrum keeps
     * {@code ratio}, the returned one carries the rest.
     */
    public Spectrum split(double ratio) {
        if (!(ratio >= 0.0 && ratio <= 1.0))
            throw OpticException.other("splitting ratio must be within [0.0, 1.0]");
        Spectrum rest = copy();
        rest.scale(1.0 - ratio);
        scale(ratio);
        return rest;
    }

    /**
     * Splits by a wavelength dependent ratio curve. This spectrum keeps the
     * ratio part, the returned one carries the rest.
     */
    public Spectrum split(Spectrum ratio) {
        Spectrum rest = copy();
        for (int i = 0; i < values.length; i++) {
            double r = ratio.valueAt(wavelength(i));
            if (r < 0.0 || r > 1.0)
                throw OpticException.other("splitting ratio must be within [0.0, 1.0]");
            rest.values[i] = values[i] * (1.0 - r);
            values[i] *= r;
        }
        return rest;
    }

    /**
     * Adds the energy of {@code other}. On the same grid the samples are added
     * in place and this spectrum is returned; otherwise both spectra are
     * resampled into a new one spanning both ranges at the finer resolution.
     */
    public Spectrum merge(Spectrum other) {
        if (sameGrid(other)) {
            for (int i = 0; i < values.length; i++)
                values[i] += other.values[i];
            return this;
        }
        double res = Math.min(resolution, other.resolution);
        double lo = Math.min(start, other.start);
        double hi = Math.max(end(), other.end());
        Spectrum union = new Spectrum(lo, hi + 1.5 * res, res);
        union.accumulate(this);
        union.accumulate(other);
        return union;
    }

    /** Energy-conserving resampling onto a new grid; energy outside it is dropped. */
    public Spectrum resample(double newStart, double newEnd, double newResolution) {
        Spectrum target = new Spectrum(newStart, newEnd, newResolution);
        double lost = target.accumulate(this);
        if (lost > 0.0)
            log.warn("resampled spectrum does not cover the source range, {} J dropped", lost);
        return target;
    }

    /** Adds every sample of {@code other} as a line; returns the energy outside this grid. */
    private double accumulate(Spectrum other) {
        double lost = 0.0;
        for (int i = 0; i < other.values.length; i++) {
            double e = other.values[i];
            if (e == 0.0)
                continue;
            double w = other.wavelength(i);
            double x = (w - start) / resolution;
            if (x < -1e-9 || x > values.length - 1 + 1e-9)
                lost += e;
            else
                addSinglePeak(w, e);
        }
        return lost;
    }

    public boolean sameGrid(Spectrum other) {
        return start == other.start && resolution == other.resolution && values.length == other.values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Spectrum s))
            return false;
        return sameGrid(s) && Arrays.equals(values, s.values);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(start) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("Spectrum[%.1f nm .. %.1f nm, %d samples, %.6g J]", start * 1e9, end() * 1e9,
                values.length, totalEnergy());
    }
}
