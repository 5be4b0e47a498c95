package com.optics.osg.surface.hitmap;

import java.util.List;

/** Fluence of each hit point is its energy divided by the area of its Voronoi cell. */
final class VoronoiEstimator {
    private VoronoiEstimator() {
    }

    static FluenceData map(List<HitPoint> points, AxisRange xRange, AxisRange yRange, int nx, int ny) {
        VoronoiCells cells = new VoronoiCells(points);
        AxisRange xr = xRange != null ? xRange : cells.xRange();
        AxisRange yr = yRange != null ? yRange : cells.yRange();
        return new FluenceData(sample(cells, xr, yr, nx, ny, false), xr, yr, FluenceEstimator.VORONOI);
    }

    static double average(List<HitPoint> points) {
        VoronoiCells cells = new VoronoiCells(points);
        double sumE = 0.0, sumEF = 0.0;
        for (int i = 0; i < cells.siteCount(); i++) {
            double e = cells.energy(i);
            sumE += e;
            sumEF += e * cells.energyFluence(i);
        }
        return sumE > 0.0 ? sumEF / sumE : 0.0;
    }

    /** Piecewise constant sampling of the cell values on an nx by ny grid. */
    static double[][] sample(VoronoiCells cells, AxisRange xr, AxisRange yr, int nx, int ny, boolean carried) {
        double[] xs = xr.linspace(nx);
        double[] ys = yr.linspace(ny);
        double[][] values = new double[ny][nx];
        for (int row = 0; row < ny; row++)
            for (int col = 0; col < nx; col++) {
                int site = cells.siteAt(xs[col], ys[row]);
                if (site >= 0)
                    values[row][col] = carried ? cells.carriedFluence(site) : cells.energyFluence(site);
            }
        return values;
    }
}
