package com.optics.osg.surface;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;

/**
 * Cylindrical surface through the origin, its axis parallel to y and passing
 * through (0, 0, R). Curved in x only; sign convention as {@link Sphere}.
 */
public final class Cylinder implements GeoSurface {
    private final double radius;

    public Cylinder(double radius) {
        if (!Double.isFinite(radius) || radius == 0.0)
            throw OpticException.other("radius of curvature must be non-zero and finite");
        this.radius = radius;
    }

    public double radius() {
        return radius;
    }

    @Override
    public Optional<SurfaceHit> intersect(Point3d origin, Vector3d direction) {
        double a = direction.x * direction.x + direction.z * direction.z;
        if (a < 1e-24)
            return Optional.empty(); // parallel to the cylinder axis
        double ox = origin.x, oz = origin.z - radius;
        double b = (ox * direction.x + oz * direction.z) / a;
        double c = (ox * ox + oz * oz - radius * radius) / a;
        double disc = b * b - c;
        if (disc < 0.0)
            return Optional.empty();
        double sq = Math.sqrt(disc);
        double t = Sphere.vertexCapRoot(-b - sq, -b + sq, radius, direction.z);
        if (t < -EPSILON)
            return Optional.empty();
        Point3d p = new Point3d();
        p.scaleAdd(t, direction, origin);
        Vector3d n = new Vector3d(p.x, 0.0, p.z - radius);
        n.normalize();
        return Optional.of(new SurfaceHit(p, n, Math.max(t, 0.0)));
    }

    @Override
    public String name() {
        return "Cylinder";
    }

    @Override
    public String toString() {
        return "Cylinder(R=" + radius + ")";
    }
}
