package com.optics.osg.surface.hitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.optics.osg.api.OpticException;

/** Hit points of a single ray bundle on a surface. All points are of one kind. */
public final class RaysHitMap {
    private final List<HitPoint> points = new ArrayList<>();

    public void add(HitPoint point) {
        if (!points.isEmpty() && points.get(0).hasFluence() != point.hasFluence())
            throw OpticException.analysis("wrong hit point type for this hitmap! Must be "
                    + (points.get(0).hasFluence() ? "a fluence" : "an energy") + " hit point!");
        points.add(point);
    }

    public void merge(RaysHitMap other) {
        for (HitPoint p : other.points)
            add(p);
    }

    public List<HitPoint> points() {
        return Collections.unmodifiableList(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public boolean carriesFluence() {
        return FluenceEstimator.carriesFluence(points);
    }

    public double totalEnergy() {
        double sum = 0.0;
        for (HitPoint p : points)
            sum += p.energy();
        return sum;
    }

    public AxisRange xRange() {
        return AxisRange.of(points, HitPoint::x);
    }

    public AxisRange yRange() {
        return AxisRange.of(points, HitPoint::y);
    }

    public FluenceData fluenceMap(FluenceEstimator estimator, int nx, int ny) {
        return estimator.map(points, null, null, nx, ny);
    }

    public FluenceData fluenceMap(FluenceEstimator estimator, AxisRange x, AxisRange y, int nx, int ny) {
        return estimator.map(points, x, y, nx, ny);
    }

    public double peakFluence(FluenceEstimator estimator) {
        return estimator.peak(points);
    }

    public double averageFluence(FluenceEstimator estimator) {
        return estimator.average(points);
    }
}
