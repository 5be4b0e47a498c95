package com.optics.osg.surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.aperture.Aperture;
import com.optics.osg.api.OpticException;
import com.optics.osg.coating.Coating;
import com.optics.osg.coating.IdealArCoating;
import com.optics.osg.geom.Pose;
import com.optics.osg.geom.Units;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.surface.hitmap.HitMap;

/**
 * A geometric surface as it appears in a node: placed in world space, clipped
 * by an aperture, coated, and keeping track of where it was hit.
 *
 * <p>
 * Ghost-focus analysis parks the bundles reflected by this surface in two
 * caches, one per travel direction, until the next pass re-injects them.
 */
public final class OpticSurface {
    /** Default laser induced damage threshold: 1 J/cm². */
    public static final double DEFAULT_LIDT = Units.J_PER_CM2;

    private final String name;
    private GeoSurface geometry;
    private Pose localPose = Pose.identity();
    private Pose pose = Pose.identity();
    private Aperture aperture = Aperture.NONE;
    private Coating coating = IdealArCoating.INSTANCE;
    private double lidt = DEFAULT_LIDT;
    private final HitMap hitMap = new HitMap();
    private final List<RayBundle> forwardCache = new ArrayList<>();
    private final List<RayBundle> backwardCache = new ArrayList<>();

    public OpticSurface(String name, GeoSurface geometry) {
        this.name = name;
        this.geometry = geometry;
    }

    public String name() {
        return name;
    }

    public GeoSurface geometry() {
        return geometry;
    }

    public void setGeometry(GeoSurface geometry) {
        this.geometry = geometry;
    }

    /** Placement of the surface relative to its node. */
    public void setLocalPose(Pose localPose) {
        this.localPose = localPose;
    }

    /** Places the surface given the pose of its node. */
    public void placeWithin(Pose nodePose) {
        this.pose = nodePose.append(localPose);
    }

    public Pose pose() {
        return pose;
    }

    public Aperture aperture() {
        return aperture;
    }

    public void setAperture(Aperture aperture) {
        this.aperture = aperture;
    }

    public Coating coating() {
        return coating;
    }

    public void setCoating(Coating coating) {
        this.coating = coating;
    }

    public double lidt() {
        return lidt;
    }

    public void setLidt(double lidt) {
        if (!Double.isFinite(lidt) || lidt <= 0.0)
            throw OpticException.other("LIDT must be positive and finite");
        this.lidt = lidt;
    }

    public HitMap hitMap() {
        return hitMap;
    }

    /** Intersects a world-space ray; the hit is returned in world space. */
    public Optional<SurfaceHit> intersect(Point3d position, Vector3d direction) {
        Point3d o = pose.inverseTransformPoint(position);
        Vector3d d = pose.inverseTransformVector(direction);
        return geometry.intersect(o, d).map(h -> new SurfaceHit(pose.transformPoint(h.point()),
                pose.transformVector(h.normal()), h.distance()));
    }

    public Point3d toLocal(Point3d world) {
        return pose.inverseTransformPoint(world);
    }

    public boolean transmits(Point3d world) {
        Point3d p = toLocal(world);
        return aperture.transmits(p.x, p.y);
    }

    public void addToCache(RayBundle bundle, boolean backward) {
        (backward ? backwardCache : forwardCache).add(bundle);
    }

    /** Removes and returns the bundles cached for the given travel direction. */
    public List<RayBundle> drainCache(boolean backward) {
        List<RayBundle> cache = backward ? backwardCache : forwardCache;
        List<RayBundle> drained = new ArrayList<>(cache);
        cache.clear();
        return drained;
    }

    public void clearCaches() {
        forwardCache.clear();
        backwardCache.clear();
    }

    /** Clears hit points, damage events and ghost caches. */
    public void resetData() {
        hitMap.reset();
        clearCaches();
    }

    @Override
    public String toString() {
        return "OpticSurface[" + name + ", " + geometry + ", " + coating + "]";
    }
}
