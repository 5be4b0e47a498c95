package com.optics.osg.aperture;

import java.util.List;

import com.optics.osg.api.OpticException;

/** Intersection of several apertures: a point passes only if all transmit it. */
public final class StackedAperture implements Aperture {
    private final List<Aperture> apertures;

    public StackedAperture(List<Aperture> apertures) {
        if (apertures.isEmpty())
            throw OpticException.other("aperture stack must not be empty");
        this.apertures = List.copyOf(apertures);
    }

    public static StackedAperture of(Aperture... apertures) {
        return new StackedAperture(List.of(apertures));
    }

    @Override
    public boolean transmits(double x, double y) {
        for (Aperture a : apertures)
            if (!a.transmits(x, y))
                return false;
        return true;
    }

    @Override
    public String toString() {
        return "Stack" + apertures;
    }
}
