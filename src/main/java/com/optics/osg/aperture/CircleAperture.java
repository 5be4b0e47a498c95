package com.optics.osg.aperture;

import com.optics.osg.api.OpticException;

/** Circular opening; points on the rim are transmitted. */
public final class CircleAperture implements Aperture {
    private final double radius;
    private final double centerX;
    private final double centerY;

    public CircleAperture(double radius) {
        this(radius, 0.0, 0.0);
    }

    public CircleAperture(double radius, double centerX, double centerY) {
        if (!Double.isFinite(radius) || radius <= 0.0)
            throw OpticException.other("aperture radius must be positive and finite");
        if (!Double.isFinite(centerX) || !Double.isFinite(centerY))
            throw OpticException.other("aperture center must be finite");
        this.radius = radius;
        this.centerX = centerX;
        this.centerY = centerY;
    }

    public double radius() {
        return radius;
    }

    @Override
    public boolean transmits(double x, double y) {
        double dx = x - centerX, dy = y - centerY;
        return dx * dx + dy * dy <= radius * radius;
    }

    @Override
    public String toString() {
        return "Circle(r=" + radius + ")";
    }
}
