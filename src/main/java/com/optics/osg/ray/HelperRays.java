package com.optics.osg.ray;

import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.geom.Pose;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.SurfaceHit;

/**
 * Three auxiliary rays spanning a small equilateral triangle around a main
 * ray. The triangle's footprint on a surface, compared with its area at
 * creation, gives the local fluence without any neighbour search.
 */
final class HelperRays {
    private final Point3d[] positions = new Point3d[3];
    private final Vector3d[] directions = new Vector3d[3];

    private HelperRays() {
    }

    /**
     * Creates helpers on a triangle of the given area, perpendicular to and
     * centred on the main ray, all travelling parallel to it.
     */
    static HelperRays around(Point3d position, Vector3d direction, double area) {
        double circumradius = Math.sqrt(4.0 * area / Math.sqrt(27.0));
        Vector3d u = new Vector3d();
        u.cross(direction, Math.abs(direction.x) < 0.9 ? new Vector3d(1, 0, 0) : new Vector3d(0, 1, 0));
        u.normalize();
        Vector3d v = new Vector3d();
        v.cross(direction, u);
        HelperRays h = new HelperRays();
        for (int i = 0; i < 3; i++) {
            double phi = 2.0 * Math.PI * i / 3.0;
            Point3d p = new Point3d(position);
            p.scaleAdd(circumradius * Math.cos(phi), u, p);
            p.scaleAdd(circumradius * Math.sin(phi), v, p);
            h.positions[i] = p;
            h.directions[i] = new Vector3d(direction);
        }
        return h;
    }

    HelperRays copy() {
        HelperRays h = new HelperRays();
        for (int i = 0; i < 3; i++) {
            h.positions[i] = new Point3d(positions[i]);
            h.directions[i] = new Vector3d(directions[i]);
        }
        return h;
    }

    double area() {
        Vector3d a = new Vector3d();
        a.sub(positions[1], positions[0]);
        Vector3d b = new Vector3d();
        b.sub(positions[2], positions[0]);
        Vector3d c = new Vector3d();
        c.cross(a, b);
        return 0.5 * c.length();
    }

    void propagate(double distance) {
        for (int i = 0; i < 3; i++)
            positions[i].scaleAdd(distance, directions[i], positions[i]);
    }

    /** Intersects all three helpers; empty if any of them misses. */
    Optional<SurfaceHit[]> intersect(OpticSurface surface) {
        SurfaceHit[] hits = new SurfaceHit[3];
        for (int i = 0; i < 3; i++) {
            Optional<SurfaceHit> hit = surface.intersect(positions[i], directions[i]);
            if (hit.isEmpty())
                return Optional.empty();
            hits[i] = hit.get();
        }
        return Optional.of(hits);
    }

    void moveTo(SurfaceHit[] hits) {
        for (int i = 0; i < 3; i++)
            positions[i] = new Point3d(hits[i].point());
    }

    Point3d position(int i) {
        return positions[i];
    }

    Vector3d direction(int i) {
        return directions[i];
    }

    void transform(Pose pose) {
        for (int i = 0; i < 3; i++) {
            positions[i] = pose.transformPoint(positions[i]);
            directions[i] = pose.transformVector(directions[i]);
        }
    }

    void setDirection(int i, Vector3d direction) {
        directions[i] = direction;
    }
}
