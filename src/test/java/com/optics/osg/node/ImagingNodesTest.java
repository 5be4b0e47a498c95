package com.optics.osg.node;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticNode;
import com.optics.osg.engine.RayTraceAnalyzer;
import com.optics.osg.geom.Pose;
import com.optics.osg.light.GeometricData;
import com.optics.osg.ray.MissedSurfaceStrategy;
import com.optics.osg.ray.Ray;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.ray.RayBundles;
import com.optics.osg.ray.distribution.EnergyDistribution;
import com.optics.osg.ray.distribution.Hexapolar;
import com.optics.osg.refraction.ConstantIndex;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

public class ImagingNodesTest {
    private static final double WAVELENGTH = 1054e-9;
    /** Thick lens, n = 1.5, R = ±0.1 m, 5 mm thick: f = 100.84 mm, measured from the rear vertex. */
    private static final double BACK_FOCAL_LENGTH = 0.09916;

    private static RayBundle beam() {
        return RayBundles.collimated(WAVELENGTH, 1e-3, new Hexapolar(1e-3, 3), EnergyDistribution.uniform());
    }

    private static NodeGroup line(OpticNode... nodes) {
        NodeGroup scene = new NodeGroup("line");
        for (OpticNode n : nodes)
            scene.addNode(n);
        for (int i = 0; i + 1 < nodes.length; i++)
            scene.connect(nodes[i].id(), OpticPorts.OUTPUT_1, nodes[i + 1].id(), OpticPorts.INPUT_1, 0.1);
        return scene;
    }

    @Test
    public void testBiconvexLensFocuses() {
        Source src = Source.ofRays("src", beam());
        Lens lens = new Lens("lens", 0.1, -0.1, 5e-3, new ConstantIndex(1.5));
        SpotDiagram spot = new SpotDiagram("spot");
        NodeGroup scene = new NodeGroup("focus");
        scene.addNode(src);
        scene.addNode(lens);
        scene.addNode(spot);
        scene.connect(src.id(), OpticPorts.OUTPUT_1, lens.id(), OpticPorts.INPUT_1, 0.05);
        scene.connect(lens.id(), OpticPorts.OUTPUT_1, spot.id(), OpticPorts.INPUT_1, BACK_FOCAL_LENGTH);

        new RayTraceAnalyzer().analyze(scene);

        assertEquals(37, spot.spots().size());
        assertTrue("rms " + spot.rmsRadius(), spot.rmsRadius() < 1e-6);
        assertEquals(2, lens.surfaces().size());
    }

    @Test
    public void testCylindricLensFocusesInXOnly() {
        Source src = Source.ofRays("src", beam());
        CylindricLens lens = new CylindricLens("cyl", 0.1, -0.1, 5e-3, new ConstantIndex(1.5));
        SpotDiagram spot = new SpotDiagram("spot");
        NodeGroup scene = new NodeGroup("line focus");
        scene.addNode(src);
        scene.addNode(lens);
        scene.addNode(spot);
        scene.connect(src.id(), OpticPorts.OUTPUT_1, lens.id(), OpticPorts.INPUT_1, 0.05);
        scene.connect(lens.id(), OpticPorts.OUTPUT_1, spot.id(), OpticPorts.INPUT_1, BACK_FOCAL_LENGTH);

        new RayTraceAnalyzer().analyze(scene);

        double maxX = 0.0, maxY = 0.0;
        for (Point3d p : spot.spots()) {
            maxX = Math.max(maxX, Math.abs(p.x));
            maxY = Math.max(maxY, Math.abs(p.y));
        }
        assertEquals(37, spot.spots().size());
        assertTrue("x extent " + maxX, maxX < 2e-6);
        assertTrue("y extent " + maxY, maxY > 0.8e-3);
    }

    @Test
    public void testFlatMirrorSendsLightBack() {
        Source src = Source.ofRays("src", beam());
        ThinMirror mirror = new ThinMirror("mirror");
        Detector det = new Detector("det");

        new RayTraceAnalyzer().analyze(line(src, mirror, det));

        RayBundle seen = ((GeometricData) det.lastSeen()).rays();
        assertEquals(37, seen.nrOfValidRays());
        assertEquals(1e-3, seen.totalEnergy(), 1e-12);
        for (Ray r : seen) {
            assertEquals(-1.0, r.direction().z, 1e-12);
            assertEquals(0.0, r.position().z, 1e-9);
            // mirrors do not count as ghost bounces
            assertEquals(0, r.bounces());
        }
        assertEquals(-1.0, det.pose().transformVector(new Vector3d(0, 0, 1)).z, 1e-12);
    }

    @Test
    public void testGratingFirstOrder() {
        Source src = Source.ofRays("src", beam());
        ReflectiveGrating grating = new ReflectiveGrating("grating", 600e3, 1);
        Detector det = new Detector("det");

        new RayTraceAnalyzer().analyze(line(src, grating, det));

        RayBundle seen = ((GeometricData) det.lastSeen()).rays();
        assertEquals(37, seen.nrOfValidRays());
        for (Ray r : seen) {
            Vector3d d = r.direction();
            assertEquals(WAVELENGTH * 600e3, Math.hypot(d.x, d.y), 1e-9);
            assertTrue(d.z < 0.0);
        }
    }

    @Test
    public void testEvanescentOrderIsLost() {
        OpticSurface s = new OpticSurface("grating", Plane.INSTANCE);
        s.placeWithin(Pose.translation(0, 0, 0.01));
        Ray r = new Ray(new Point3d(), new Vector3d(0, 0, 1), WAVELENGTH, 1.0);
        r.diffractOnGrating(s, 600e3, 2, MissedSurfaceStrategy.STOP, null);
        assertFalse(r.isValid());
    }

    @Test
    public void testParabolicMirrorFocuses() {
        Source src = Source.ofRays("src", beam());
        ParabolicMirror mirror = new ParabolicMirror("oap", 0.1);
        SpotDiagram spot = new SpotDiagram("spot");

        NodeGroup scene = new NodeGroup("parabola");
        scene.addNode(src);
        scene.addNode(mirror);
        scene.addNode(spot);
        scene.connect(src.id(), OpticPorts.OUTPUT_1, mirror.id(), OpticPorts.INPUT_1, 0.05);
        scene.connect(mirror.id(), OpticPorts.OUTPUT_1, spot.id(), OpticPorts.INPUT_1, 0.1);

        new RayTraceAnalyzer().analyze(scene);

        assertEquals(37, spot.spots().size());
        assertTrue("rms " + spot.rmsRadius(), spot.rmsRadius() < 1e-6);
    }
}
