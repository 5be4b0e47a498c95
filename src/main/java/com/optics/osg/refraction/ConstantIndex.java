package com.optics.osg.refraction;

import com.optics.osg.api.OpticException;

/** Wavelength-independent refractive index. */
public final class ConstantIndex implements RefractiveIndex {
    private final double index;

    public ConstantIndex(double index) {
        if (!Double.isFinite(index) || index < 1.0)
            throw OpticException.other("refractive index must be >= 1.0 and finite");
        this.index = index;
    }

    @Override
    public double at(double wavelength) {
        return index;
    }

    @Override
    public String toString() {
        return "Constant(" + index + ")";
    }
}
