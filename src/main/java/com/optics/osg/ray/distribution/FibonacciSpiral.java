package com.optics.osg.ray.distribution;

import java.util.ArrayList;
import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.OpticException;

/** Sunflower pattern: golden-angle spiral with uniform point density on a disc. */
public final class FibonacciSpiral implements PositionDistribution {
    private static final double GOLDEN_ANGLE = Math.PI * (3.0 - Math.sqrt(5.0));

    private final double radius;
    private final int count;

    public FibonacciSpiral(double radius, int count) {
        if (!Double.isFinite(radius) || radius <= 0.0)
            throw OpticException.other("radius must be positive and finite");
        if (count < 1)
            throw OpticException.other("number of points must be at least 1");
        this.radius = radius;
        this.count = count;
    }

    @Override
    public List<Point3d> generate() {
        List<Point3d> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double r = radius * Math.sqrt((i + 0.5) / count);
            double phi = i * GOLDEN_ANGLE;
            points.add(new Point3d(r * Math.cos(phi), r * Math.sin(phi), 0.0));
        }
        return points;
    }

    @Override
    public double area() {
        return Math.PI * radius * radius;
    }

    @Override
    public double cellArea() {
        return area() / count;
    }
}
