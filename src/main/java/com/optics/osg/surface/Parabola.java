package com.optics.osg.surface;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;

/**
 * Paraboloid {@code x² + y² = 4 f z}, optionally used off-axis.
 *
 * <p>
 * For an off-axis angle {@code θ} the local origin sits on the paraboloid at
 * the decenter {@code d = 2 f sin θ / (1 + cos θ)} along the off-axis
 * direction, so a ray travelling along the local z axis through the origin is
 * deflected by {@code θ} towards the focus.
 */
public final class Parabola implements GeoSurface {
    private final double focalLength;
    private final double offAxisAngle;
    private final double shiftX;
    private final double shiftY;
    private final double shiftZ;

    public Parabola(double focalLength) {
        this(focalLength, 0.0, 0.0);
    }

    /**
     * @param focalLength      signed focal length, focus at (0, 0, f) of the
     *                         parent paraboloid
     * @param offAxisAngle     deflection angle of an on-axis ray, |θ| &lt; π
     * @param offAxisDirection direction of the decenter in the x/y plane, measured
     *                         from the x axis
     */
    public Parabola(double focalLength, double offAxisAngle, double offAxisDirection) {
        if (!Double.isFinite(focalLength) || focalLength == 0.0)
            throw OpticException.other("focal length must not be 0.0 and finite");
        if (!Double.isFinite(offAxisAngle) || Math.abs(offAxisAngle) >= Math.PI)
            throw OpticException.other("off-axis angle must be finite and smaller than 180°");
        if (!Double.isFinite(offAxisDirection))
            throw OpticException.other("off-axis direction must be finite");
        this.focalLength = focalLength;
        this.offAxisAngle = offAxisAngle;
        double d = 2.0 * focalLength * Math.sin(offAxisAngle) / (1.0 + Math.cos(offAxisAngle));
        this.shiftX = d * Math.cos(offAxisDirection);
        this.shiftY = d * Math.sin(offAxisDirection);
        this.shiftZ = d * d / (4.0 * focalLength);
    }

    public double focalLength() {
        return focalLength;
    }

    public double offAxisAngle() {
        return offAxisAngle;
    }

    @Override
    public Optional<SurfaceHit> intersect(Point3d origin, Vector3d direction) {
        double ox = origin.x + shiftX, oy = origin.y + shiftY, oz = origin.z + shiftZ;
        double f4 = 4.0 * focalLength;
        double a = direction.x * direction.x + direction.y * direction.y;
        double b = 2.0 * (ox * direction.x + oy * direction.y) - f4 * direction.z;
        double c = ox * ox + oy * oy - f4 * oz;
        double t;
        if (Math.abs(a) < 1e-24) {
            if (b == 0.0)
                return Optional.empty();
            t = -c / b;
        } else {
            double disc = b * b - 4.0 * a * c;
            if (disc < 0.0)
                return Optional.empty();
            double sq = Math.sqrt(disc);
            double t1 = (-b - sq) / (2.0 * a);
            double t2 = (-b + sq) / (2.0 * a);
            double lo = Math.min(t1, t2), hi = Math.max(t1, t2);
            t = lo >= -EPSILON ? lo : hi;
        }
        if (t < -EPSILON)
            return Optional.empty();
        t = Math.max(t, 0.0);
        double px = ox + t * direction.x, py = oy + t * direction.y;
        Vector3d n = new Vector3d(2.0 * px, 2.0 * py, -f4);
        n.normalize();
        Point3d p = new Point3d();
        p.scaleAdd(t, direction, origin);
        return Optional.of(new SurfaceHit(p, n, t));
    }

    @Override
    public String name() {
        return "Parabola";
    }

    @Override
    public String toString() {
        return "Parabola(f=" + focalLength + ", oa=" + offAxisAngle + ")";
    }
}
