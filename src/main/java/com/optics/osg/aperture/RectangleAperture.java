package com.optics.osg.aperture;

import com.optics.osg.api.OpticException;

/** Axis-aligned rectangular opening centred on (centerX, centerY). */
public final class RectangleAperture implements Aperture {
    private final double width;
    private final double height;
    private final double centerX;
    private final double centerY;

    public RectangleAperture(double width, double height) {
        this(width, height, 0.0, 0.0);
    }

    public RectangleAperture(double width, double height, double centerX, double centerY) {
        if (!Double.isFinite(width) || width <= 0.0 || !Double.isFinite(height) || height <= 0.0)
            throw OpticException.other("aperture width and height must be positive and finite");
        if (!Double.isFinite(centerX) || !Double.isFinite(centerY))
            throw OpticException.other("aperture center must be finite");
        this.width = width;
        this.height = height;
        this.centerX = centerX;
        this.centerY = centerY;
    }

    @Override
    public boolean transmits(double x, double y) {
        return Math.abs(x - centerX) <= width / 2.0 && Math.abs(y - centerY) <= height / 2.0;
    }

    @Override
    public String toString() {
        return "Rectangle(" + width + " x " + height + ")";
    }
}
