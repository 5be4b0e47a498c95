package com.optics.osg.ray.distribution;

import java.util.ArrayList;
import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.OpticException;

/**
 * Centre point plus concentric rings; ring {@code k} carries {@code 6k}
 * equally spaced points at radius {@code k * radius / rings}.
 */
public final class Hexapolar implements PositionDistribution {
    private final double radius;
    private final int rings;

    public Hexapolar(double radius, int rings) {
        if (!Double.isFinite(radius) || radius < 0.0)
            throw OpticException.other("radius must be positive and finite");
        if (rings < 0)
            throw OpticException.other("number of rings must not be negative");
        this.radius = radius;
        this.rings = rings;
    }

    @Override
    public List<Point3d> generate() {
        List<Point3d> points = new ArrayList<>();
        points.add(new Point3d());
        if (radius == 0.0)
            return points;
        for (int k = 1; k <= rings; k++) {
            double r = k * radius / rings;
            int n = 6 * k;
            for (int i = 0; i < n; i++) {
                double phi = 2.0 * Math.PI * i / n;
                points.add(new Point3d(r * Math.cos(phi), r * Math.sin(phi), 0.0));
            }
        }
        return points;
    }

    @Override
    public double area() {
        return Math.PI * radius * radius;
    }
}
