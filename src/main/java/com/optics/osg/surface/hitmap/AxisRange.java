package com.optics.osg.surface.hitmap;

import java.util.List;
import java.util.function.ToDoubleFunction;

import com.optics.osg.api.OpticException;

/** Closed interval along one axis of a fluence map. */
public record AxisRange(double min, double max) {

    public AxisRange {
        if (!Double.isFinite(min) || !Double.isFinite(max) || max < min)
            throw OpticException.other("axis range must be finite and ordered");
    }

    public double width() {
        return max - min;
    }

    public AxisRange expand(double margin) {
        return new AxisRange(min - margin, max + margin);
    }

    /** {@code n} evenly spaced coordinates including both ends. */
    public double[] linspace(int n) {
        double[] v = new double[n];
        if (n == 1) {
            v[0] = (min + max) / 2.0;
            return v;
        }
        double step = width() / (n - 1);
        for (int i = 0; i < n; i++)
            v[i] = min + i * step;
        return v;
    }

    static <T> AxisRange of(List<T> items, ToDoubleFunction<T> axis) {
        if (items.isEmpty())
            throw OpticException.other("cannot derive an axis range from an empty hit map");
        double lo = Double.POSITIVE_INFINITY, hi = Double.NEGATIVE_INFINITY;
        for (T t : items) {
            double v = axis.applyAsDouble(t);
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        return new AxisRange(lo, hi);
    }
}
