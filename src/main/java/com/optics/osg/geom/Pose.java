package com.optics.osg.geom;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;

/**
 * Rigid 3D transform (rotation followed by translation) placing a surface or a
 * node in world space.
 *
 * <p>
 * Instances are immutable. Every method that hands out a vecmath object hands
 * out a fresh copy.
 */
public final class Pose {
    private static final Pose IDENTITY = new Pose(identityMatrix(), new Vector3d());

    private final Matrix3d rotation;
    private final Matrix3d inverseRotation;
    private final Vector3d translation;

    private Pose(Matrix3d rotation, Vector3d translation) {
        this.rotation = new Matrix3d(rotation);
        this.inverseRotation = new Matrix3d(rotation);
        this.inverseRotation.transpose();
        this.translation = new Vector3d(translation);
    }

    public static Pose identity() {
        return IDENTITY;
    }

    public static Pose translation(double x, double y, double z) {
        checkFinite(x, y, z);
        return new Pose(identityMatrix(), new Vector3d(x, y, z));
    }

    /**
     * Creates a pose from a translation and roll/pitch/yaw angles (rotation about
     * x, then y, then z).
     */
    public static Pose of(double x, double y, double z, double rollX, double pitchY, double yawZ) {
        checkFinite(x, y, z);
        checkFinite(rollX, pitchY, yawZ);
        Matrix3d rx = new Matrix3d();
        rx.rotX(rollX);
        Matrix3d ry = new Matrix3d();
        ry.rotY(pitchY);
        Matrix3d rz = new Matrix3d();
        rz.rotZ(yawZ);
        Matrix3d r = new Matrix3d();
        r.mul(rz, ry);
        r.mul(rx);
        return new Pose(r, new Vector3d(x, y, z));
    }

    public static Pose rotationX(double angle) {
        return of(0, 0, 0, angle, 0, 0);
    }

    public static Pose rotationY(double angle) {
        return of(0, 0, 0, 0, angle, 0);
    }

    /**
     * Creates a pose located at {@code position} whose local z axis points along
     * {@code direction} and whose local y axis is as close to {@code up} as
     * possible.
     */
    public static Pose fromView(Point3d position, Vector3d direction, Vector3d up) {
        if (direction.lengthSquared() == 0.0)
            throw OpticException.other("view direction must not be zero");
        Vector3d z = new Vector3d(direction);
        z.normalize();
        Vector3d x = new Vector3d();
        x.cross(up, z);
        if (x.lengthSquared() < 1e-24) {
            // up parallel to the view direction, fall back to the global x axis
            Vector3d alt = Math.abs(z.x) < 0.9 ? new Vector3d(1, 0, 0) : new Vector3d(0, 1, 0);
            Vector3d y = new Vector3d();
            y.cross(z, alt);
            x.cross(y, z);
        }
        x.normalize();
        Vector3d y = new Vector3d();
        y.cross(z, x);
        Matrix3d r = new Matrix3d();
        r.setColumn(0, x);
        r.setColumn(1, y);
        r.setColumn(2, z);
        return new Pose(r, new Vector3d(position));
    }

    /** Returns {@code this * other}: {@code other} is applied first, in this pose's frame. */
    public Pose append(Pose other) {
        Matrix3d r = new Matrix3d();
        r.mul(rotation, other.rotation);
        Vector3d t = new Vector3d(other.translation);
        rotation.transform(t);
        t.add(translation);
        return new Pose(r, t);
    }

    public Pose inverse() {
        Vector3d t = new Vector3d(translation);
        inverseRotation.transform(t);
        t.negate();
        return new Pose(inverseRotation, t);
    }

    public Point3d transformPoint(Point3d local) {
        Point3d p = new Point3d(local);
        rotation.transform(p);
        p.add(translation);
        return p;
    }

    public Point3d inverseTransformPoint(Point3d world) {
        Point3d p = new Point3d(world);
        p.sub(translation);
        inverseRotation.transform(p);
        return p;
    }

    public Vector3d transformVector(Vector3d local) {
        Vector3d v = new Vector3d(local);
        rotation.transform(v);
        return v;
    }

    public Vector3d inverseTransformVector(Vector3d world) {
        Vector3d v = new Vector3d(world);
        inverseRotation.transform(v);
        return v;
    }

    public Point3d position() {
        return new Point3d(translation);
    }

    /** Local z axis in world coordinates. */
    public Vector3d axis() {
        Vector3d v = new Vector3d();
        rotation.getColumn(2, v);
        return v;
    }

    public Matrix3d rotation() {
        return new Matrix3d(rotation);
    }

    public boolean approxEquals(Pose other, double epsilon) {
        return rotation.epsilonEquals(other.rotation, epsilon)
                && translation.epsilonEquals(other.translation, epsilon);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pose p))
            return false;
        return rotation.equals(p.rotation) && translation.equals(p.translation);
    }

    @Override
    public int hashCode() {
        return 31 * rotation.hashCode() + translation.hashCode();
    }

    @Override
    public String toString() {
        return "Pose[t=" + translation + ", axis=" + axis() + "]";
    }

    private static Matrix3d identityMatrix() {
        Matrix3d m = new Matrix3d();
        m.setIdentity();
        return m;
    }

    private static void checkFinite(double a, double b, double c) {
        if (!Double.isFinite(a) || !Double.isFinite(b) || !Double.isFinite(c))
            throw OpticException.other("pose components must be finite");
    }
}
