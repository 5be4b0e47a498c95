package com.optics.osg.surface.hitmap;

import java.util.List;

/**
 * Uses the fluence each ray derived from its helper-ray footprint. The map is
 * the nearest-hit-point (Voronoi) interpolation of those values.
 */
final class HelperRayEstimator {
    private HelperRayEstimator() {
    }

    static FluenceData map(List<HitPoint> points, AxisRange xRange, AxisRange yRange, int nx, int ny) {
        VoronoiCells cells = new VoronoiCells(points);
        AxisRange xr = xRange != null ? xRange : cells.xRange();
        AxisRange yr = yRange != null ? yRange : cells.yRange();
        double[][] values = VoronoiEstimator.sample(cells, xr, yr, nx, ny, true);
        return new FluenceData(values, xr, yr, FluenceEstimator.HELPER_RAYS);
    }

    static double peak(List<HitPoint> points) {
        double peak = 0.0;
        for (HitPoint p : points)
            peak = Math.max(peak, p.fluence());
        return peak;
    }

    static double average(List<HitPoint> points) {
        double sumE = 0.0, sumEF = 0.0;
        for (HitPoint p : points) {
            sumE += p.energy();
            sumEF += p.energy() * p.fluence();
        }
        return sumE > 0.0 ? sumEF / sumE : 0.0;
    }
}
