package com.optics.osg.surface.hitmap;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Strategies turning the hit points of one bundle into fluence.
 *
 * <p>
 * {@code VORONOI}, {@code KDE} and {@code BINNING} work on the hit energies;
 * {@code HELPER_RAYS} uses the per-ray fluences carried by rays with helper
 * rays. Hit maps of the other kind are handed to the matching fallback with a
 * warning.
 */
public enum FluenceEstimator {
    VORONOI {
        @Override
        FluenceData energyMap(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
            return VoronoiEstimator.map(points, x, y, nx, ny);
        }

        @Override
        double energyAverage(List<HitPoint> points) {
            return VoronoiEstimator.average(points);
        }
    },
    KDE {
        @Override
        FluenceData energyMap(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
            return new KdeEstimator(points).map(x, y, nx, ny);
        }

        @Override
        double energyAverage(List<HitPoint> points) {
            return new KdeEstimator(points).average();
        }
    },
    BINNING {
        @Override
        FluenceData energyMap(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
            return BinningEstimator.map(points, x, y, nx, ny);
        }

        @Override
        double energyAverage(List<HitPoint> points) {
            int bins = BinningEstimator.defaultBins(points.size());
            return BinningEstimator.average(points, null, null, bins, bins);
        }
    },
    HELPER_RAYS {
        @Override
        public FluenceData map(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
            if (carriesFluence(points))
                return HelperRayEstimator.map(points, x, y, nx, ny);
            log.warn("Unexpected type of hit points for helper-ray estimator! Changing to Voronoi estimator!");
            return VORONOI.energyMap(points, x, y, nx, ny);
        }

        @Override
        public double peak(List<HitPoint> points) {
            if (carriesFluence(points))
                return HelperRayEstimator.peak(points);
            return VORONOI.peak(points);
        }

        @Override
        public double average(List<HitPoint> points) {
            if (carriesFluence(points))
                return HelperRayEstimator.average(points);
            return VORONOI.energyAverage(points);
        }

        @Override
        FluenceData energyMap(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
            return VORONOI.energyMap(points, x, y, nx, ny);
        }

        @Override
        double energyAverage(List<HitPoint> points) {
            return VORONOI.energyAverage(points);
        }
    };

    private static final Logger log = LogManager.getLogger(FluenceEstimator.class);

    /** Grid resolution used for peak fluence evaluation. */
    public static final int PEAK_GRID = 101;

    abstract FluenceData energyMap(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny);

    abstract double energyAverage(List<HitPoint> points);

    /**
     * Fluence map on an {@code nx × ny} grid. Null ranges default to the hit
     * point bounding box (grown by the kernel margin for KDE).
     */
    public FluenceData map(List<HitPoint> points, AxisRange x, AxisRange y, int nx, int ny) {
        if (carriesFluence(points)) {
            log.warn("Unexpected type of hit points for {} estimator! Changing to helper-ray estimator!", this);
            return HELPER_RAYS.map(points, x, y, nx, ny);
        }
        return energyMap(points, x, y, nx, ny);
    }

    /** Peak of the fluence map on a {@value #PEAK_GRID}² grid. */
    public double peak(List<HitPoint> points) {
        return map(points, null, null, PEAK_GRID, PEAK_GRID).peak();
    }

    /** Energy-weighted average fluence of the hit points. */
    public double average(List<HitPoint> points) {
        if (carriesFluence(points))
            return HELPER_RAYS.average(points);
        return energyAverage(points);
    }

    static boolean carriesFluence(List<HitPoint> points) {
        return !points.isEmpty() && points.get(0).hasFluence();
    }
}
