package com.optics.osg.ray.distribution;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import javax.vecmath.Point3d;

import com.optics.osg.api.OpticException;

/** Uniformly random points on a disc, reproducible through the seed. */
public final class RandomUniform implements PositionDistribution {
    private final double radius;
    private final int count;
    private final long seed;

    public RandomUniform(double radius, int count, long seed) {
        if (!Double.isFinite(radius) || radius <= 0.0)
            throw OpticException.other("radius must be positive and finite");
        if (count < 1)
            throw OpticException.other("number of points must be at least 1");
        this.radius = radius;
        this.count = count;
        this.seed = seed;
    }

    @Override
    public List<Point3d> generate() {
        Random rnd = new Random(seed);
        List<Point3d> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double r = radius * Math.sqrt(rnd.nextDouble());
            double phi = 2.0 * Math.PI * rnd.nextDouble();
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
