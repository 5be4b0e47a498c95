package com.optics.osg.aperture;

/** Turns an aperture into an obstruction of the same shape. */
public final class InvertedAperture implements Aperture {
    private final Aperture delegate;

    InvertedAperture(Aperture delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean transmits(double x, double y) {
        return !delegate.transmits(x, y);
    }

    @Override
    public Aperture inverted() {
        return delegate;
    }

    @Override
    public String toString() {
        return "Inverted(" + delegate + ")";
    }
}
