package com.optics.osg.surface.hitmap;

import java.util.ArrayList;
import java.util.List;

import javax.vecmath.Point3d;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;
import com.optics.osg.geom.Pose;
import com.optics.osg.ray.MissedSurfaceStrategy;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.ray.RayBundles;
import com.optics.osg.ray.distribution.EnergyDistribution;
import com.optics.osg.ray.distribution.Grid;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

public class FluenceEstimatorTest {

    private static final double MM = 1e-3;

    /** Regular 0.1 mm grid clipped to a disc of 5.9 mm, Gaussian weights of sigma 1.5 mm. */
    private static List<HitPoint> gaussianDisc() {
        EnergyDistribution gauss = EnergyDistribution.gaussian(1.5 * MM);
        List<HitPoint> points = new ArrayList<>();
        for (Point3d p : Grid.square(12 * MM, 120).generate())
            if (Math.hypot(p.x, p.y) < 5.9 * MM)
                points.add(HitPoint.ofEnergy(p.x, p.y, 1e-3 * gauss.weight(p)));
        return points;
    }

    private static List<HitPoint> uniformSquare(int n, double side, double energyPerPoint) {
        List<HitPoint> points = new ArrayList<>();
        for (Point3d p : Grid.square(side, n).generate())
            points.add(HitPoint.ofEnergy(p.x, p.y, energyPerPoint));
        return points;
    }

    @Test
    public void testVoronoiAndBinningAgreeOnGaussianBeam() {
        List<HitPoint> points = gaussianDisc();
        assertTrue(points.size() >= 10_000);

        double voronoi = FluenceEstimator.VORONOI.average(points);
        AxisRange range = new AxisRange(-6 * MM, 6 * MM);
        double binning = BinningEstimator.average(points, range, range, 60, 60);

        assertTrue(voronoi > 0.0);
        assertEquals(1.0, binning / voronoi, 0.01);
    }

    @Test
    public void testVoronoiOnRegularGrid() {
        // 100 x 100 co-circular sites on 10 mm, 1 µJ each
        List<HitPoint> points = uniformSquare(100, 10 * MM, 1e-6);
        double expected = 1e-2 / (100 * MM * MM);

        assertEquals(expected, FluenceEstimator.VORONOI.average(points), expected * 0.01);
        FluenceData map = FluenceEstimator.VORONOI.map(points, null, null, 21, 21);
        assertEquals(expected, map.value(10, 10), expected * 1e-6);
    }

    @Test
    public void testUniformFluence() {
        // 20 x 20 points on 2 mm, 1 µJ each: 400 µJ over 4 mm²
        List<HitPoint> points = uniformSquare(20, 2 * MM, 1e-6);
        double expected = 400e-6 / (4 * MM * MM);

        AxisRange range = new AxisRange(-1 * MM, 1 * MM);
        FluenceData binned = BinningEstimator.map(points, range, range, 10, 10);
        assertEquals(expected, binned.peak(), expected * 1e-9);
        assertEquals(expected, binned.average(), expected * 1e-9);
        assertEquals(400e-6, binned.totalEnergy(), 1e-12);

        // interior Voronoi cells are the grid cells
        assertEquals(expected, FluenceEstimator.VORONOI.average(points), expected * 0.05);
    }

    @Test
    public void testKdeProducesSmoothMap() {
        List<HitPoint> points = uniformSquare(15, 2 * MM, 1e-6);
        FluenceData map = FluenceEstimator.KDE.map(points, null, null, 31, 31);
        assertEquals(31, map.rows());
        assertEquals(31, map.columns());
        assertTrue(map.peak() > 0.0);
        assertTrue(FluenceEstimator.KDE.average(points) > 0.0);
    }

    @Test
    public void testHelperRaysCarryFluence() {
        RayBundle b = RayBundles.collimatedWithHelpers(1064e-9, 1.0, Grid.square(2 * MM, 10),
                EnergyDistribution.uniform());
        OpticSurface s = new OpticSurface("det", Plane.INSTANCE);
        s.placeWithin(Pose.translation(0, 0, 0.01));
        b.passThrough(s, MissedSurfaceStrategy.STOP, true);

        RaysHitMap hits = s.hitMap().get(0, b.id());
        assertNotNull(hits);
        assertEquals(100, hits.size());
        assertTrue(hits.carriesFluence());

        double expected = 1.0 / (4 * MM * MM);
        assertEquals(expected, hits.averageFluence(FluenceEstimator.HELPER_RAYS), expected * 1e-6);
        assertEquals(expected, hits.peakFluence(FluenceEstimator.HELPER_RAYS), expected * 1e-6);
        // energy-based estimators fall back to the carried fluence
        assertEquals(expected, hits.averageFluence(FluenceEstimator.VORONOI), expected * 1e-6);
    }

    @Test
    public void testTooFewPoints() {
        List<HitPoint> points = List.of(HitPoint.ofEnergy(0, 0, 1.0), HitPoint.ofEnergy(1e-3, 0, 1.0));
        try {
            FluenceEstimator.VORONOI.average(points);
            fail("two points cannot be tessellated");
        } catch (OpticException e) {
            assertEquals(OpticException.Kind.OTHER, e.kind());
            assertTrue(e.getMessage().contains("Too few points"));
        }
    }

    @Test(expected = OpticException.class)
    public void testCollinearPointsRejected() {
        List<HitPoint> points = List.of(HitPoint.ofEnergy(0, 0, 1.0), HitPoint.ofEnergy(1e-3, 0, 1.0),
                HitPoint.ofEnergy(2e-3, 0, 1.0));
        FluenceEstimator.VORONOI.average(points);
    }

    @Test(expected = OpticException.class)
    public void testEmptyBinningRejected() {
        BinningEstimator.map(List.of(), null, null, 10, 10);
    }
}
