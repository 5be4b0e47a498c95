package com.optics.osg.surface.hitmap;

import java.util.List;

import com.optics.osg.api.OpticException;

/**
 * Histogram of hit energy on {@code nx × ny} equal bins, divided by the bin
 * area. Points on the upper range border fall into the last bin; points
 * outside the range are dropped.
 */
public final class BinningEstimator {
    private BinningEstimator() {
    }

    public static FluenceData map(List<HitPoint> points, AxisRange xRange, AxisRange yRange, int nx, int ny) {
        if (points.isEmpty())
            throw OpticException.other("cannot bin an empty hit map");
        if (nx < 1 || ny < 1)
            throw OpticException.other("number of bins must be at least 1");
        AxisRange xr = xRange != null ? xRange : AxisRange.of(points, HitPoint::x);
        AxisRange yr = yRange != null ? yRange : AxisRange.of(points, HitPoint::y);
        if (xr.width() <= 0.0 || yr.width() <= 0.0)
            throw OpticException.other("binning range must have a non-zero extent");
        double binWidth = xr.width() / nx;
        double binHeight = yr.width() / ny;
        double binArea = binWidth * binHeight;
        double[][] values = new double[ny][nx];
        for (HitPoint p : points) {
            if (p.x() < xr.min() || p.x() > xr.max() || p.y() < yr.min() || p.y() > yr.max())
                continue;
            int col = Math.min((int) Math.floor((p.x() - xr.min()) / binWidth), nx - 1);
            int row = Math.min((int) Math.floor((p.y() - yr.min()) / binHeight), ny - 1);
            values[row][col] += p.energy() / binArea;
        }
        return new FluenceData(values, xr, yr, FluenceEstimator.BINNING);
    }

    /** Energy-weighted mean bin fluence: sum(E_b F_b) / sum(E_b). */
    public static double average(List<HitPoint> points, AxisRange xRange, AxisRange yRange, int nx, int ny) {
        return map(points, xRange, yRange, nx, ny).average();
    }

    /** Bins per axis used when none are given: about four points per bin. */
    static int defaultBins(int nrOfPoints) {
        return Math.max(1, (int) Math.round(Math.sqrt(nrOfPoints / 4.0)));
    }
}
