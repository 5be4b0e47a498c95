package com.optics.osg.surface.hitmap;

import com.optics.osg.api.OpticException;

/**
 * A ray hitting a surface, in the surface's local x/y coordinates.
 *
 * <p>
 * Plain hit points only carry energy. Rays with helper rays additionally carry
 * the fluence derived from their footprint; for plain points {@code fluence}
 * is NaN.
 */
public record HitPoint(double x, double y, double energy, double fluence) {

    public HitPoint {
        if (!Double.isFinite(x) || !Double.isFinite(y))
            throw OpticException.other("hit point position must be finite");
        if (!Double.isFinite(energy) || energy < 0.0)
            throw OpticException.other("hit point energy must be positive and finite");
        if (!Double.isNaN(fluence) && (!Double.isFinite(fluence) || fluence < 0.0))
            throw OpticException.other("hit point fluence must be positive and finite");
    }

    public static HitPoint ofEnergy(double x, double y, double energy) {
        return new HitPoint(x, y, energy, Double.NaN);
    }

    public static HitPoint ofFluence(double x, double y, double energy, double fluence) {
        return new HitPoint(x, y, energy, fluence);
    }

    public boolean hasFluence() {
        return !Double.isNaN(fluence);
    }
}
