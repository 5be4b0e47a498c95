package com.optics.osg.coating;

import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;

/** Angle and wavelength independent reflectivity. */
public final class ConstantReflectivity implements Coating {
    private final double reflectivity;

    public ConstantReflectivity(double reflectivity) {
        if (!(reflectivity >= 0.0 && reflectivity <= 1.0))
            throw OpticException.other("reflectivity must be within [0.0, 1.0]");
        this.reflectivity = reflectivity;
    }

    public double value() {
        return reflectivity;
    }

    @Override
    public double reflectivity(Vector3d direction, Vector3d normal, double n1, double n2) {
        return reflectivity;
    }

    @Override
    public String toString() {
        return "ConstantR(" + reflectivity + ")";
    }
}
