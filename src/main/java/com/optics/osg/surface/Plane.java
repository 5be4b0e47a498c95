package com.optics.osg.surface;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/** The local x/y plane. */
public final class Plane implements GeoSurface {
    public static final Plane INSTANCE = new Plane();

    private Plane() {
    }

    @Override
    public Optional<SurfaceHit> intersect(Point3d origin, Vector3d direction) {
        if (direction.z == 0.0)
            return Optional.empty();
        double t = -origin.z / direction.z;
        if (t < -EPSILON)
            return Optional.empty();
        t = Math.max(t, 0.0);
        Point3d p = new Point3d(origin.x + t * direction.x, origin.y + t * direction.y, 0.0);
        return Optional.of(new SurfaceHit(p, new Vector3d(0, 0, 1), t));
    }

    @Override
    public String name() {
        return "Plane";
    }

    @Override
    public String toString() {
        return name();
    }
}
