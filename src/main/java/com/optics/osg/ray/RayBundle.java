package com.optics.osg.ray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import javax.vecmath.Point3d;

import lombok.extern.log4j.Log4j2;

import com.optics.osg.api.OpticException;
import com.optics.osg.geom.Pose;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.spectrum.Spectrum;
import com.optics.osg.surface.OpticSurface;

/**
 * An ordered collection of rays travelling together.
 *
 * <p>
 * A bundle has an identity (UUID) under which its hits are recorded, and a
 * bounce level telling how many reflections produced it: primary bundles have
 * level 0, a bundle reflected off a partially reflecting surface gets its
 * parent's level plus one. Copies keep both.
 */
@Log4j2
public final class RayBundle implements Iterable<Ray> {
    private final List<Ray> rays;
    private final UUID id;
    private int bounceLevel;

    public RayBundle() {
        this(new ArrayList<>());
    }

    public RayBundle(List<Ray> rays) {
        this(new ArrayList<>(rays), UUID.randomUUID(), 0);
    }

    private RayBundle(List<Ray> rays, UUID id, int bounceLevel) {
        this.rays = rays;
        this.id = id;
        this.bounceLevel = bounceLevel;
    }

    /** Deep copy with the same identity and bounce level. */
    public RayBundle copy() {
        List<Ray> copied = new ArrayList<>(rays.size());
        for (Ray r : rays)
            copied.add(r.copy());
        return new RayBundle(copied, id, bounceLevel);
    }

    public UUID id() {
        return id;
    }

    public int bounceLevel() {
        return bounceLevel;
    }

    public void setBounceLevel(int bounceLevel) {
        this.bounceLevel = bounceLevel;
    }

    public void add(Ray ray) {
        rays.add(ray);
    }

    public List<Ray> rays() {
        return Collections.unmodifiableList(rays);
    }

    @Override
    public Iterator<Ray> iterator() {
        return rays().iterator();
    }

    public int size() {
        return rays.size();
    }

    public boolean isEmpty() {
        return rays.isEmpty();
    }

    public int nrOfValidRays() {
        int n = 0;
        for (Ray r : rays)
            if (r.isValid())
                n++;
        return n;
    }

    /** Total energy of the valid rays. */
    public double totalEnergy() {
        double sum = 0.0;
        for (Ray r : rays)
            if (r.isValid())
                sum += r.energy();
        return sum;
    }

    public void propagate(double distance) {
        for (Ray r : rays)
            r.propagate(distance);
    }

    public void setRefractiveIndex(double index) {
        for (Ray r : rays)
            r.setRefractiveIndex(index);
    }

    /**
     * Refracts (or reflects, see {@link Ray#refractOnSurface}) every valid ray at
     * {@code surface}. The index behind the surface is evaluated at each ray's
     * wavelength.
     *
     * @param recordHits whether hits go into the surface's hit map
     * @return the rays reflected by the coating as a new bundle one bounce level
     *         up; empty if nothing was reflected
     */
    public RayBundle refractOnSurface(OpticSurface surface, RefractiveIndex n2, boolean refractionIntended,
            MissedSurfaceStrategy missed, boolean recordHits) {
        List<Ray> reflected = new ArrayList<>();
        UUID recordAs = recordHits ? id : null;
        for (Ray r : rays) {
            if (!r.isValid())
                continue;
            Ray refl = r.refractOnSurface(surface, n2.at(r.wavelength()), refractionIntended, missed, recordAs);
            if (refl != null && refl.energy() > 0.0)
                reflected.add(refl);
        }
        return new RayBundle(reflected, UUID.randomUUID(), bounceLevel + 1);
    }

    public void transform(Pose pose) {
        for (Ray r : rays)
            r.transform(pose);
    }

    /** Moves every valid ray onto {@code surface} without deflecting it. */
    public void passThrough(OpticSurface surface, MissedSurfaceStrategy missed, boolean recordHits) {
        UUID recordAs = recordHits ? id : null;
        for (Ray r : rays)
            r.passThrough(surface, missed, recordAs);
    }

    public void refractParaxial(OpticSurface surface, double focalLength, MissedSurfaceStrategy missed,
            boolean recordHits) {
        UUID recordAs = recordHits ? id : null;
        for (Ray r : rays)
            r.refractParaxial(surface, focalLength, missed, recordAs);
    }

    public void diffractOnGrating(OpticSurface surface, double lineDensity, int order, MissedSurfaceStrategy missed,
            boolean recordHits) {
        UUID recordAs = recordHits ? id : null;
        for (Ray r : rays)
            r.diffractOnGrating(surface, lineDensity, order, missed, recordAs);
    }

    /**
     * Invalidates the rays the surface's aperture blocks at their current
     * position. Logs a warning if rays were lost.
     *
     * @return number of rays blocked
     */
    public int apodize(OpticSurface surface) {
        int blocked = 0;
        double lostEnergy = 0.0;
        for (Ray r : rays) {
            if (r.isValid() && !surface.transmits(r.position())) {
                lostEnergy += r.energy();
                r.invalidate();
                blocked++;
            }
        }
        if (blocked > 0)
            log.warn("Rays have been apodized at surface '{}': {} rays ({} J) lost", surface.name(), blocked,
                    lostEnergy);
        return blocked;
    }

    public void filterEnergy(double transmission) {
        for (Ray r : rays)
            r.filterEnergy(transmission);
    }

    /** Wavelength dependent transmission. */
    public void filterEnergy(Spectrum transmission) {
        for (Ray r : rays)
            r.filterEnergy(transmission.valueAt(r.wavelength()));
    }

    /**
     * Splits every ray by energy. This bundle keeps {@code ratio}; the returned
     * bundle carries the rest and gets a new identity.
     */
    public RayBundle split(double ratio) {
        List<Ray> rest = new ArrayList<>(rays.size());
        for (Ray r : rays)
            rest.add(r.split(ratio));
        return new RayBundle(rest, UUID.randomUUID(), bounceLevel);
    }

    /** Splits by a wavelength dependent ratio curve. */
    public RayBundle split(Spectrum ratio) {
        List<Ray> rest = new ArrayList<>(rays.size());
        for (Ray r : rays)
            rest.add(r.split(ratio.valueAt(r.wavelength())));
        return new RayBundle(rest, UUID.randomUUID(), bounceLevel);
    }

    /** Appends copies of the other bundle's rays. */
    public void merge(RayBundle other) {
        for (Ray r : other.rays)
            rays.add(r.copy());
    }

    /**
     * Invalidates rays with less energy than {@code minEnergy}. Rays without
     * energy are invalidated for any threshold.
     */
    public void invalidateByThreshold(double minEnergy) {
        if (!Double.isFinite(minEnergy) || minEnergy < 0.0)
            throw OpticException.other("energy threshold must be positive and finite");
        for (Ray r : rays)
            if (r.isValid() && (r.energy() <= 0.0 || r.energy() < minEnergy))
                r.invalidate();
    }

    /** Invalidates rays with more than {@code maxBounces} bounces. */
    public void filterByNrOfBounces(int maxBounces) {
        for (Ray r : rays)
            if (r.bounces() > maxBounces)
                r.invalidate();
    }

    /** Invalidates rays with more than {@code maxRefractions} refractions. */
    public void filterByNrOfRefractions(int maxRefractions) {
        for (Ray r : rays)
            if (r.refractions() > maxRefractions)
                r.invalidate();
    }

    /** Removes (rather than invalidates) rays with more than {@code maxBounces} bounces. */
    public void removeByNrOfBounces(int maxBounces) {
        rays.removeIf(r -> r.bounces() > maxBounces);
    }

    public void removeInvalid() {
        rays.removeIf(r -> !r.isValid());
    }

    public void attachHelperRays(double cellArea) {
        for (Ray r : rays)
            r.attachHelperRays(cellArea);
    }

    /** Geometric centre of the valid rays' positions, null if there are none. */
    public Point3d centroid() {
        double x = 0.0, y = 0.0, z = 0.0;
        int n = 0;
        for (Ray r : rays) {
            if (!r.isValid())
                continue;
            Point3d p = r.position();
            x += p.x;
            y += p.y;
            z += p.z;
            n++;
        }
        return n == 0 ? null : new Point3d(x / n, y / n, z / n);
    }

    /** Root mean square distance of the valid rays from their centroid. */
    public double rmsRadius() {
        Point3d c = centroid();
        if (c == null)
            return 0.0;
        double sum = 0.0;
        int n = 0;
        for (Ray r : rays)
            if (r.isValid()) {
                sum += r.position().distanceSquared(c);
                n++;
            }
        return Math.sqrt(sum / n);
    }

    /**
     * Optical path differences relative to the chief ray (the valid ray closest
     * to the centroid), in units of the chief ray's wavelength. One entry
     * {x, y, opd} per valid ray, positions in the frame of {@code surface}.
     */
    public List<double[]> wavefrontError(OpticSurface surface) {
        Point3d c = centroid();
        if (c == null)
            return List.of();
        Ray chief = null;
        double best = Double.POSITIVE_INFINITY;
        for (Ray r : rays) {
            if (!r.isValid())
                continue;
            double d = r.position().distanceSquared(c);
            if (d < best) {
                best = d;
                chief = r;
            }
        }
        List<double[]> opd = new ArrayList<>();
        for (Ray r : rays) {
            if (!r.isValid())
                continue;
            Point3d local = surface.toLocal(r.position());
            opd.add(new double[] { local.x, local.y, (r.pathLength() - chief.pathLength()) / chief.wavelength() });
        }
        return opd;
    }

    /** Spectrum of the valid rays' energies at the given resolution. */
    public Spectrum toSpectrum(double resolution) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (Ray r : rays)
            if (r.isValid()) {
                min = Math.min(min, r.wavelength());
                max = Math.max(max, r.wavelength());
            }
        if (min > max)
            throw OpticException.analysis("cannot build a spectrum from a bundle without valid rays");
        double margin = 10e-9;
        Spectrum s = new Spectrum(Math.max(resolution, min - margin), max + margin, resolution);
        for (Ray r : rays)
            if (r.isValid())
                s.addSinglePeak(r.wavelength(), r.energy());
        return s;
    }

    @Override
    public String toString() {
        return String.format("RayBundle[%s, level=%d, %d rays (%d valid), %.6g J]", id, bounceLevel, rays.size(),
                nrOfValidRays(), totalEnergy());
    }
}
