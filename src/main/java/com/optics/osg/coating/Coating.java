package com.optics.osg.coating;

import javax.vecmath.Vector3d;

/**
 * Reflectivity model of a surface.
 *
 * <p>
 * {@code normal} must point against the incoming {@code direction}; both are
 * expected normalized.
 */
public interface Coating {

    /**
     * Returns the fraction of energy reflected, in [0, 1].
     *
     * @param direction incoming ray direction
     * @param normal    surface normal facing the ray
     * @param n1        refractive index before the surface
     * @param n2        refractive index behind the surface
     */
    double reflectivity(Vector3d direction, Vector3d normal, double n1, double n2);
}
