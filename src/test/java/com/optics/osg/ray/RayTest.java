package com.optics.osg.ray;

import java.util.UUID;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;
import com.optics.osg.coating.ConstantReflectivity;
import com.optics.osg.coating.FresnelCoating;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

public class RayTest {

    private static final double EPS = 1e-12;

    private OpticSurface plane;

    @Before
    public void setUp() {
        plane = new OpticSurface("plane", Plane.INSTANCE);
    }

    private static Ray ray(double x, double y, double z, double dx, double dy, double dz) {
        return new Ray(new Point3d(x, y, z), new Vector3d(dx, dy, dz), 1054e-9, 1.0);
    }

    @Test
    public void testNormalIncidenceWithEqualIndicesKeepsDirection() {
        Ray r = ray(0.001, 0.0, -0.05, 0, 0, 1);
        Ray reflected = r.refractOnSurface(plane, 1.0, true, MissedSurfaceStrategy.STOP, null);

        assertNull(reflected);
        assertEquals(0.0, r.direction().x, EPS);
        assertEquals(1.0, r.direction().z, EPS);
        assertEquals(0.0, r.position().z, EPS);
        assertEquals(0.001, r.position().x, EPS);
        assertEquals(0.05, r.pathLength(), EPS);
        assertEquals(1, r.refractions());
        assertEquals(1.0, r.energy(), 0.0);
    }

    @Test
    public void testSnellsLaw() {
        double a = Math.toRadians(30.0);
        Ray r = ray(0, 0, -0.01, Math.sin(a), 0, Math.cos(a));
        r.refractOnSurface(plane, 1.5, true, MissedSurfaceStrategy.STOP, null);

        assertEquals(Math.sin(a) / 1.5, r.direction().x, 1e-12);
        assertEquals(1.5, r.refractiveIndex(), 0.0);
    }

    @Test
    public void testFresnelReflectionCreatesBouncedRay() {
        plane.setCoating(FresnelCoating.INSTANCE);
        Ray r = ray(0, 0, -0.01, 0, 0, 1);
        Ray reflected = r.refractOnSurface(plane, 1.5, true, MissedSurfaceStrategy.STOP, null);

        assertNotNull(reflected);
        assertEquals(0.04, reflected.energy(), 1e-12);
        assertEquals(0.96, r.energy(), 1e-12);
        assertEquals(1, reflected.bounces());
        assertEquals(0, r.bounces());
        assertEquals(-1.0, reflected.direction().z, EPS);
        assertEquals(1.0, reflected.refractiveIndex(), 0.0);
    }

    @Test
    public void testTotalInternalReflection() {
        double a = Math.toRadians(60.0);
        Ray r = ray(0, 0, -0.01, Math.sin(a), 0, Math.cos(a));
        r.setRefractiveIndex(1.5);
        Ray reflected = r.refractOnSurface(plane, 1.0, true, MissedSurfaceStrategy.STOP, null);

        assertNull(reflected);
        assertEquals(1, r.bounces());
        assertEquals(0, r.refractions());
        assertEquals(-Math.cos(a), r.direction().z, 1e-12);
        assertEquals(1.0, r.energy(), 0.0);
    }

    @Test
    public void testMirrorReflection() {
        plane.setCoating(new ConstantReflectivity(0.9));
        Ray r = ray(0, 0, -0.01, 0, 0, 1);
        Ray reflected = r.refractOnSurface(plane, 1.0, false, MissedSurfaceStrategy.STOP, null);

        assertNull(reflected);
        assertEquals(-1.0, r.direction().z, EPS);
        assertEquals(0.9, r.energy(), 1e-12);
    }

    @Test
    public void testMissedSurfaceStrategies() {
        Ray stop = ray(0, 0, -0.01, 1, 0, 0);
        stop.refractOnSurface(plane, 1.5, true, MissedSurfaceStrategy.STOP, null);
        assertFalse(stop.isValid());

        Ray ignore = ray(0, 0, -0.01, 1, 0, 0);
        ignore.refractOnSurface(plane, 1.5, true, MissedSurfaceStrategy.IGNORE, null);
        assertTrue(ignore.isValid());
        assertEquals(-0.01, ignore.position().z, 0.0);
    }

    @Test
    public void testHitIsRecorded() {
        UUID bundle = UUID.randomUUID();
        Ray r = ray(0.002, -0.001, -0.01, 0, 0, 1);
        r.passThrough(plane, MissedSurfaceStrategy.STOP, bundle);

        assertEquals(1, plane.hitMap().size());
        assertEquals(0.002, plane.hitMap().get(0, bundle).points().get(0).x(), EPS);
        assertEquals(1.0, plane.hitMap().get(0, bundle).totalEnergy(), 0.0);
    }

    @Test
    public void testPropagateTracksOpticalPath() {
        Ray r = ray(0, 0, 0, 0, 0, 1);
        r.setRefractiveIndex(1.5);
        r.propagate(0.1);

        assertEquals(0.1, r.position().z, EPS);
        assertEquals(0.15, r.pathLength(), EPS);
        assertEquals(2, r.positionHistory().size());
    }

    @Test
    public void testSplit() {
        Ray r = ray(0, 0, 0, 0, 0, 1);
        Ray rest = r.split(0.3);
        assertEquals(0.3, r.energy(), EPS);
        assertEquals(0.7, rest.energy(), EPS);
    }

    @Test(expected = OpticException.class)
    public void testInvalidSplitRatio() {
        ray(0, 0, 0, 0, 0, 1).split(1.2);
    }

    @Test(expected = OpticException.class)
    public void testZeroDirectionRejected() {
        ray(0, 0, 0, 0, 0, 0);
    }

    @Test(expected = OpticException.class)
    public void testNegativeEnergyRejected() {
        new Ray(new Point3d(), new Vector3d(0, 0, 1), 1e-6, -1.0);
    }
}
