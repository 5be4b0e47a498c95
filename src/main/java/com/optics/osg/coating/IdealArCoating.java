package com.optics.osg.coating;

import javax.vecmath.Vector3d;

/** Perfect anti-reflective coating: nothing is reflected. */
public final class IdealArCoating implements Coating {
    public static final IdealArCoating INSTANCE = new IdealArCoating();

    private IdealArCoating() {
    }

    @Override
    public double reflectivity(Vector3d direction, Vector3d normal, double n1, double n2) {
        return 0.0;
    }

    @Override
    public String toString() {
        return "IdealAR";
    }
}
