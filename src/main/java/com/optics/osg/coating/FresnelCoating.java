package com.optics.osg.coating;

import javax.vecmath.Vector3d;

/**
 * Uncoated interface: reflectivity from the Fresnel equations, averaged over s
 * and p polarization.
 */
public final class FresnelCoating implements Coating {
    public static final FresnelCoating INSTANCE = new FresnelCoating();

    private FresnelCoating() {
    }

    @Override
    public double reflectivity(Vector3d direction, Vector3d normal, double n1, double n2) {
        Vector3d d = new Vector3d(direction);
        d.normalize();
        Vector3d n = new Vector3d(normal);
        n.normalize();
        double cosAlpha = Math.min(1.0, Math.abs(d.dot(n)));
        double sinAlpha2 = 1.0 - cosAlpha * cosAlpha;
        double radicand = n2 * n2 - n1 * n1 * sinAlpha2;
        if (radicand <= 0.0)
            return 1.0; // total internal reflection
        double cosBeta = Math.sqrt(radicand) / n2;
        double rs = (n1 * cosAlpha - n2 * cosBeta) / (n1 * cosAlpha + n2 * cosBeta);
        double rp = (n2 * cosAlpha - n1 * cosBeta) / (n2 * cosAlpha + n1 * cosBeta);
        return 0.5 * (rs * rs + rp * rp);
    }

    @Override
    public String toString() {
        return "Fresnel";
    }
}
