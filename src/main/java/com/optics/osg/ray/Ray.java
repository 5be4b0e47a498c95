package com.optics.osg.ray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;
import com.optics.osg.geom.Pose;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.SurfaceHit;
import com.optics.osg.surface.hitmap.HitPoint;

/**
 * A single geometric ray.
 *
 * <p>
 * Besides position and direction a ray carries its vacuum wavelength, its
 * energy, the number of reflections (bounces) and refractions it went
 * through, its optical path length and the refractive index of the medium it
 * currently travels in. Rays are mutable; bundles hand copies to each node.
 */
public final class Ray {
    private Point3d position;
    private Vector3d direction;
    private final double wavelength;
    private double energy;
    private int bounces;
    private int refractions;
    private boolean valid = true;
    private double pathLength;
    private double refractiveIndex = 1.0;
    private final List<Point3d> history = new ArrayList<>();
    private HelperRays helpers;
    private double helperFactor;

    public Ray(Point3d position, Vector3d direction, double wavelength, double energy) {
        if (!Double.isFinite(position.x) || !Double.isFinite(position.y) || !Double.isFinite(position.z))
            throw OpticException.other("ray position must be finite");
        if (!(direction.lengthSquared() > 0.0) || !Double.isFinite(direction.lengthSquared()))
            throw OpticException.other("ray direction must be finite and non-zero");
        if (!Double.isFinite(wavelength) || wavelength <= 0.0)
            throw OpticException.other("wavelength must be positive and finite");
        if (!Double.isFinite(energy) || energy < 0.0)
            throw OpticException.other("energy must be positive and finite");
        this.position = new Point3d(position);
        this.direction = new Vector3d(direction);
        this.direction.normalize();
        this.wavelength = wavelength;
        this.energy = energy;
        this.history.add(new Point3d(position));
    }

    private Ray(Ray other) {
        this.position = new Point3d(other.position);
        this.direction = new Vector3d(other.direction);
        this.wavelength = other.wavelength;
        this.energy = other.energy;
        this.bounces = other.bounces;
        this.refractions = other.refractions;
        this.valid = other.valid;
        this.pathLength = other.pathLength;
        this.refractiveIndex = other.refractiveIndex;
        for (Point3d p : other.history)
            this.history.add(new Point3d(p));
        this.helpers = other.helpers == null ? null : other.helpers.copy();
        this.helperFactor = other.helperFactor;
    }

    public Ray copy() {
        return new Ray(this);
    }

    public Point3d position() {
        return new Point3d(position);
    }

    public Vector3d direction() {
        return new Vector3d(direction);
    }

    public double wavelength() {
        return wavelength;
    }

    public double energy() {
        return energy;
    }

    public int bounces() {
        return bounces;
    }

    public int refractions() {
        return refractions;
    }

    public boolean isValid() {
        return valid;
    }

    public void invalidate() {
        valid = false;
    }

    /** Optical path length travelled so far (refractive index times distance). */
    public double pathLength() {
        return pathLength;
    }

    public double refractiveIndex() {
        return refractiveIndex;
    }

    public void setRefractiveIndex(double refractiveIndex) {
        if (!Double.isFinite(refractiveIndex) || refractiveIndex < 1.0)
            throw OpticException.other("refractive index must be >= 1.0 and finite");
        this.refractiveIndex = refractiveIndex;
    }

    public List<Point3d> positionHistory() {
        return Collections.unmodifiableList(history);
    }

    public boolean hasHelperRays() {
        return helpers != null;
    }

    /**
     * Attaches helper rays. {@code cellArea} is the beam area this ray stands
     * for at its current position.
     */
    public void attachHelperRays(double cellArea) {
        if (!Double.isFinite(cellArea) || cellArea <= 0.0)
            throw OpticException.other("helper ray cell area must be positive and finite");
        helpers = HelperRays.around(position, direction, wavelength * wavelength);
        helperFactor = helpers.area() / cellArea;
    }

    /** Moves the ray along its direction. */
    public void propagate(double distance) {
        if (!Double.isFinite(distance))
            throw OpticException.other("propagation distance must be finite");
        if (!valid)
            return;
        position.scaleAdd(distance, direction, position);
        pathLength += refractiveIndex * distance;
        history.add(new Point3d(position));
        if (helpers != null)
            helpers.propagate(distance);
    }

    /**
     * Moves the ray from a node's local frame into the frame given by
     * {@code pose}. The position history is transformed along.
     */
    public void transform(Pose pose) {
        position = pose.transformPoint(position);
        direction = pose.transformVector(direction);
        direction.normalize();
        for (int i = 0; i < history.size(); i++)
            history.set(i, pose.transformPoint(history.get(i)));
        if (helpers != null)
            helpers.transform(pose);
    }

    /**
     * Moves the ray onto {@code surface} and records the hit without changing
     * its direction, as a detector plane does.
     */
    public void passThrough(OpticSurface surface, MissedSurfaceStrategy missed, UUID recordAs) {
        if (!valid)
            return;
        Optional<SurfaceHit> found = surface.intersect(position, direction);
        if (found.isEmpty()) {
            if (missed == MissedSurfaceStrategy.STOP)
                valid = false;
            return;
        }
        double fluence = moveTo(found.get(), surface);
        record(surface, recordAs, energy, fluence);
    }

    /**
     * Interacts with a surface.
     *
     * <p>
     * With {@code refractionIntended} the ray is refracted into a medium of index
     * {@code n2} and keeps the transmitted energy; the coating's reflected share
     * is returned as a new ray with one more bounce, or null if nothing is
     * reflected. Total internal reflection turns the ray itself into a reflected
     * ray. Without {@code refractionIntended} (mirrors) the ray is reflected,
     * keeps the reflected energy and its bounce count, and null is returned.
     *
     * @param recordAs bundle id under which the hit is recorded in the surface's
     *                 hit map, null to skip recording
     */
    public Ray refractOnSurface(OpticSurface surface, double n2, boolean refractionIntended,
            MissedSurfaceStrategy missed, UUID recordAs) {
        if (!valid)
            return null;
        Optional<SurfaceHit> found = surface.intersect(position, direction);
        if (found.isEmpty()) {
            if (missed == MissedSurfaceStrategy.STOP)
                valid = false;
            return null;
        }
        SurfaceHit hit = found.get();
        double inputEnergy = energy;
        double fluence = moveTo(hit, surface);
        Vector3d n = facing(hit.normal(), direction);
        double n1 = refractiveIndex;
        Vector3d reflected = reflect(direction, n);
        Vector3d transmitted = refract(direction, n, n1 / n2);
        record(surface, recordAs, inputEnergy, fluence);

        if (!refractionIntended) {
            energy *= surface.coating().reflectivity(direction, n, n1, n2);
            direction = reflected;
            reflectHelpers(surface);
            return null;
        }
        if (transmitted == null) {
            direction = reflected;
            bounces++;
            reflectHelpers(surface);
            return null;
        }
        double r = surface.coating().reflectivity(direction, n, n1, n2);
        Ray reflectedRay = null;
        if (r > 0.0) {
            reflectedRay = copy();
            reflectedRay.direction = reflected;
            reflectedRay.energy = energy * r;
            reflectedRay.bounces++;
            reflectedRay.reflectHelpers(surface);
        }
        energy *= 1.0 - r;
        direction = transmitted;
        refractiveIndex = n2;
        refractions++;
        refractHelpers(surface, n1 / n2);
        return reflectedRay;
    }

    /**
     * Ideal thin lens of focal length {@code f} in the local x/y plane of
     * {@code surface}: the ray is moved onto the plane and bent so that parallel
     * rays meet in the focal point.
     */
    public void refractParaxial(OpticSurface surface, double f, MissedSurfaceStrategy missed, UUID recordAs) {
        if (!Double.isFinite(f) || f == 0.0)
            throw OpticException.other("focal length must not be 0.0 and finite");
        if (!valid)
            return;
        Optional<SurfaceHit> found = surface.intersect(position, direction);
        if (found.isEmpty()) {
            if (missed == MissedSurfaceStrategy.STOP)
                valid = false;
            return;
        }
        double fluence = moveTo(found.get(), surface);
        record(surface, recordAs, energy, fluence);
        Point3d local = surface.toLocal(position);
        direction = paraxialDirection(surface, local, direction, f);
        double r2 = local.x * local.x + local.y * local.y;
        pathLength -= refractiveIndex * (Math.sqrt(r2 + f * f) - Math.abs(f));
        refractions++;
        if (helpers != null)
            for (int i = 0; i < 3; i++)
                helpers.setDirection(i,
                        paraxialDirection(surface, surface.toLocal(helpers.position(i)), helpers.direction(i), f));
    }

    private static Vector3d paraxialDirection(OpticSurface surface, Point3d local, Vector3d worldDirection, double f) {
        Vector3d d = surface.pose().inverseTransformVector(worldDirection);
        double dz = Math.abs(d.z);
        if (dz < 1e-15)
            return worldDirection;
        d.scale(1.0 / dz);
        d.x -= local.x / f;
        d.y -= local.y / f;
        d.normalize();
        return surface.pose().transformVector(d);
    }

    /**
     * Reflection on a grating with {@code lineDensity} lines per metre along the
     * local x axis, into diffraction order {@code order}. Orders that do not
     * propagate invalidate the ray.
     */
    public void diffractOnGrating(OpticSurface surface, double lineDensity, int order, MissedSurfaceStrategy missed,
            UUID recordAs) {
        if (!Double.isFinite(lineDensity) || lineDensity <= 0.0)
            throw OpticException.other("line density must be positive and finite");
        if (!valid)
            return;
        Optional<SurfaceHit> found = surface.intersect(position, direction);
        if (found.isEmpty()) {
            if (missed == MissedSurfaceStrategy.STOP)
                valid = false;
            return;
        }
        double inputEnergy = energy;
        double fluence = moveTo(found.get(), surface);
        record(surface, recordAs, inputEnergy, fluence);
        Vector3d n = facing(found.get().normal(), direction);
        energy *= surface.coating().reflectivity(direction, n, refractiveIndex, refractiveIndex);
        double shift = order * wavelength / refractiveIndex * lineDensity;
        Vector3d d = gratingDirection(surface, direction, shift);
        if (d == null) {
            valid = false;
            return;
        }
        direction = d;
        if (helpers != null)
            for (int i = 0; i < 3; i++) {
                Vector3d hd = gratingDirection(surface, helpers.direction(i), shift);
                helpers.setDirection(i, hd != null ? hd : direction);
            }
    }

    private static Vector3d gratingDirection(OpticSurface surface, Vector3d worldDirection, double shift) {
        Vector3d d = surface.pose().inverseTransformVector(worldDirection);
        double x = d.x - shift;
        double rad = 1.0 - x * x - d.y * d.y;
        if (rad < 0.0)
            return null;
        Vector3d out = new Vector3d(x, d.y, -Math.signum(d.z) * Math.sqrt(rad));
        return surface.pose().transformVector(out);
    }

    /** Scales the energy by a transmission factor in [0, 1]. */
    public void filterEnergy(double transmission) {
        if (!(transmission >= 0.0 && transmission <= 1.0))
            throw OpticException.other("transmission must be within [0.0, 1.0]");
        energy *= transmission;
    }

    /**
     * Splits the ray by energy. This ray keeps {@code ratio} of its energy; the
     * returned copy carries the rest.
     */
    public Ray split(double ratio) {
        if (!(ratio >= 0.0 && ratio <= 1.0))
            throw OpticException.other("splitting ratio must be within [0.0, 1.0]");
        Ray rest = copy();
        rest.energy = energy * (1.0 - ratio);
        energy *= ratio;
        return rest;
    }

    /** Moves the ray (and helpers) onto a hit; returns the helper fluence or NaN. */
    private double moveTo(SurfaceHit hit, OpticSurface surface) {
        pathLength += refractiveIndex * hit.distance();
        position = new Point3d(hit.point());
        history.add(new Point3d(position));
        if (helpers == null)
            return Double.NaN;
        Optional<SurfaceHit[]> helperHits = helpers.intersect(surface);
        if (helperHits.isEmpty()) {
            helpers = null;
            return Double.NaN;
        }
        helpers.moveTo(helperHits.get());
        double footprint = helpers.area();
        return footprint > 0.0 ? energy * helperFactor / footprint : Double.NaN;
    }

    private void record(OpticSurface surface, UUID recordAs, double inputEnergy, double fluence) {
        if (recordAs == null)
            return;
        Point3d local = surface.toLocal(position);
        HitPoint point = Double.isNaN(fluence) ? HitPoint.ofEnergy(local.x, local.y, inputEnergy)
                : HitPoint.ofFluence(local.x, local.y, inputEnergy, fluence);
        surface.hitMap().add(bounces, recordAs, point);
    }

    private void reflectHelpers(OpticSurface surface) {
        if (helpers == null)
            return;
        for (int i = 0; i < 3; i++) {
            Vector3d d = helpers.direction(i);
            Vector3d n = helperNormal(surface, i, d);
            helpers.setDirection(i, n == null ? new Vector3d(direction) : reflect(d, n));
        }
    }

    private void refractHelpers(OpticSurface surface, double mu) {
        if (helpers == null)
            return;
        for (int i = 0; i < 3; i++) {
            Vector3d d = helpers.direction(i);
            Vector3d n = helperNormal(surface, i, d);
            Vector3d t = n == null ? null : refract(d, n, mu);
            helpers.setDirection(i, t == null ? new Vector3d(direction) : t);
        }
    }

    private Vector3d helperNormal(OpticSurface surface, int i, Vector3d d) {
        // helpers sit on the surface already, a zero-distance intersection yields the normal
        Point3d back = new Point3d(helpers.position(i));
        back.scaleAdd(-1e-9, d, back);
        return surface.intersect(back, d).map(h -> facing(h.normal(), d)).orElse(null);
    }

    /** Normal flipped, if necessary, so that it points against {@code direction}. */
    static Vector3d facing(Vector3d normal, Vector3d direction) {
        Vector3d n = new Vector3d(normal);
        n.normalize();
        if (n.dot(direction) > 0.0)
            n.negate();
        return n;
    }

    static Vector3d reflect(Vector3d s, Vector3d n) {
        Vector3d r = new Vector3d(s);
        r.scaleAdd(-2.0 * s.dot(n), n, r);
        r.normalize();
        return r;
    }

    /**
     * Snell's law in vector form; {@code n} faces the ray and
     * {@code mu = n1 / n2}. Returns null on total internal reflection.
     */
    static Vector3d refract(Vector3d s, Vector3d n, double mu) {
        double cosI = -n.dot(s);
        double dis = 1.0 - mu * mu * (1.0 - cosI * cosI);
        if (dis <= 0.0)
            return null;
        Vector3d t = new Vector3d(s);
        t.scale(mu);
        t.scaleAdd(mu * cosI - Math.sqrt(dis), n, t);
        t.normalize();
        return t;
    }

    @Override
    public String toString() {
        return String.format("Ray[pos=%s, dir=%s, λ=%.2f nm, E=%.4g J, bounces=%d, refractions=%d%s]", position,
                direction, wavelength * 1e9, energy, bounces, refractions, valid ? "" : ", invalid");
    }
}
