package com.optics.osg.surface.hitmap;

/**
 * Fluence sampled on a regular grid, {@code values[row][column]} with rows
 * along y and columns along x. Values are in J/m².
 */
public final class FluenceData {
    private final double[][] values;
    private final AxisRange xRange;
    private final AxisRange yRange;
    private final FluenceEstimator estimator;
    private final double peak;

    public FluenceData(double[][] values, AxisRange xRange, AxisRange yRange, FluenceEstimator estimator) {
        this.values = values;
        this.xRange = xRange;
        this.yRange = yRange;
        this.estimator = estimator;
        double p = 0.0;
        for (double[] row : values)
            for (double v : row)
                if (v > p)
                    p = v;
        this.peak = p;
    }

    public double peak() {
        return peak;
    }

    /** Energy-weighted mean over the grid: sum(F²) / sum(F). */
    public double average() {
        double sum = 0.0, sumSq = 0.0;
        for (double[] row : values)
            for (double v : row)
                if (Double.isFinite(v)) {
                    sum += v;
                    sumSq += v * v;
                }
        return sum > 0.0 ? sumSq / sum : 0.0;
    }

    /** Integral of the map, treating every sample as a cell of equal area. */
    public double totalEnergy() {
        double cellArea = xRange.width() / columns() * yRange.width() / rows();
        double sum = 0.0;
        for (double[] row : values)
            for (double v : row)
                if (Double.isFinite(v))
                    sum += v;
        return sum * cellArea;
    }

    public double value(int row, int column) {
        return values[row][column];
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public AxisRange xRange() {
        return xRange;
    }

    public AxisRange yRange() {
        return yRange;
    }

    public FluenceEstimator estimator() {
        return estimator;
    }

    @Override
    public String toString() {
        return String.format("FluenceData[%s, %dx%d, peak=%.4g J/m²]", estimator, columns(), rows(), peak);
    }
}
