package com.optics.osg.surface;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;

/**
 * Spherical surface through the origin with its centre at (0, 0, R).
 *
 * <p>
 * A positive radius bulges towards -z (convex for light travelling along +z),
 * a negative radius towards +z. Only the cap around the vertex is ever hit.
 */
public final class Sphere implements GeoSurface {
    private final double radius;

    public Sphere(double radius) {
        if (!Double.isFinite(radius) || radius == 0.0)
            throw OpticException.other("radius of curvature must be non-zero and finite");
        this.radius = radius;
    }

    public double radius() {
        return radius;
    }

    @Override
    public Optional<SurfaceHit> intersect(Point3d origin, Vector3d direction) {
        Vector3d oc = new Vector3d(origin.x, origin.y, origin.z - radius);
        double b = direction.dot(oc);
        double c = oc.lengthSquared() - radius * radius;
        double disc = b * b - c;
        if (disc < 0.0)
            return Optional.empty();
        double sq = Math.sqrt(disc);
        double t = vertexCapRoot(-b - sq, -b + sq, radius, direction.z);
        if (t < -EPSILON)
            return Optional.empty();
        Point3d p = new Point3d(origin);
        p.scaleAdd(t, direction, origin);
        Vector3d n = new Vector3d(p.x, p.y, p.z - radius);
        n.normalize();
        return Optional.of(new SurfaceHit(p, n, Math.max(t, 0.0)));
    }

    /**
     * Picks the root on the cap around the vertex. For a ray along +z this is the
     * near root if the centre lies ahead (R > 0), otherwise the far root.
     */
    static double vertexCapRoot(double tMin, double tMax, double radius, double dz) {
        boolean forward = dz >= 0.0;
        return (radius > 0.0) == forward ? tMin : tMax;
    }

    @Override
    public String name() {
        return "Sphere";
    }

    @Override
    public String toString() {
        return "Sphere(R=" + radius + ")";
    }
}
