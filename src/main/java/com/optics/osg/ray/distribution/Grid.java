package com.optics.osg.ray.distribution;

import java.util.ArrayList;
import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.OpticException;

/**
 * Rectangular grid of {@code nx × ny} cell centres covering a
 * {@code width × height} rectangle centred on the origin.
 */
public final class Grid implements PositionDistribution {
    private final double width;
    private final double height;
    private final int nx;
    private final int ny;

    public Grid(double width, double height, int nx, int ny) {
        if (!Double.isFinite(width) || width <= 0.0 || !Double.isFinite(height) || height <= 0.0)
            throw OpticException.other("grid size must be positive and finite");
        if (nx < 1 || ny < 1)
            throw OpticException.other("grid needs at least one point per axis");
        this.width = width;
        this.height = height;
        this.nx = nx;
        this.ny = ny;
    }

    public static Grid square(double side, int n) {
        return new Grid(side, side, n, n);
    }

    @Override
    public List<Point3d> generate() {
        List<Point3d> points = new ArrayList<>(nx * ny);
        double dx = width / nx, dy = height / ny;
        for (int j = 0; j < ny; j++)
            for (int i = 0; i < nx; i++)
                points.add(new Point3d(-width / 2.0 + (i + 0.5) * dx, -height / 2.0 + (j + 0.5) * dy, 0.0));
        return points;
    }

    @Override
    public double area() {
        return width * height;
    }

    @Override
    public double cellArea() {
        return area() / (nx * ny);
    }
}
