package com.optics.osg.surface;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Surface shape in its own frame: the vertex sits at the origin and the optical
 * axis runs along +z.
 */
public interface GeoSurface {

    /** Smallest distance accepted as a forward intersection. */
    double EPSILON = 1e-12;

    /**
     * Intersects a ray given in the local frame.
     *
     * @param origin    ray position
     * @param direction normalized ray direction
     * @return the hit, empty if the ray misses or would have to travel backwards
     */
    Optional<SurfaceHit> intersect(Point3d origin, Vector3d direction);

    String name();
}
