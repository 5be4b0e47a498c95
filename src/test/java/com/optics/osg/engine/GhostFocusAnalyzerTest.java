package com.optics.osg.engine;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;
import com.optics.osg.coating.ConstantReflectivity;
import com.optics.osg.node.Detector;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.node.OpticPorts;
import com.optics.osg.node.Source;
import com.optics.osg.node.Wedge;
import com.optics.osg.ray.Ray;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.ray.RayBundles;
import com.optics.osg.ray.distribution.EnergyDistribution;
import com.optics.osg.ray.distribution.Hexapolar;
import com.optics.osg.refraction.ConstantIndex;
import com.optics.osg.surface.OpticSurface;

public class GhostFocusAnalyzerTest {

    /** Source, two partially reflecting plates and a detector on one axis. */
    private static final class TwoPlates {
        final NodeGroup scene = new NodeGroup("two plates");
        final Source src;
        final Detector det = new Detector("det");

        TwoPlates() {
            src = Source.ofRays("src", RayBundles.collimated(1064e-9, 1e-3, new Hexapolar(1e-3, 1),
                    EnergyDistribution.uniform()));
            Wedge p1 = plate("p1");
            Wedge p2 = plate("p2");
            scene.addNode(src);
            scene.addNode(p1);
            scene.addNode(p2);
            scene.addNode(det);
            scene.connect(src.id(), OpticPorts.OUTPUT_1, p1.id(), OpticPorts.INPUT_1, 0.1);
            scene.connect(p1.id(), OpticPorts.OUTPUT_1, p2.id(), OpticPorts.INPUT_1, 0.1);
            scene.connect(p2.id(), OpticPorts.OUTPUT_1, det.id(), OpticPorts.INPUT_1, 0.1);
        }

        private static Wedge plate(String name) {
            Wedge w = new Wedge(name, 5e-3, 0.0, new ConstantIndex(1.5));
            for (OpticSurface s : w.surfaces())
                s.setCoating(new ConstantReflectivity(0.1));
            return w;
        }

        AnalysisRun run(int maxBounces) {
            return new GhostFocusAnalyzer(new GhostFocusConfig(maxBounces)).analyze(scene);
        }

        List<Integer> detectorBounceLevels() {
            return det.plane().hitMap().bounceLevels();
        }
    }

    private static int maxBounces(List<RayBundle> bundles) {
        int max = 0;
        for (RayBundle b : bundles)
            for (Ray r : b)
                max = Math.max(max, r.bounces());
        return max;
    }

    @Test
    public void testZeroBouncesGivesDirectPathOnly() {
        TwoPlates bench = new TwoPlates();
        AnalysisRun run = bench.run(0);

        assertEquals(AnalyzerType.GHOST_FOCUS, run.mode());
        assertFalse(run.rayCollection().isEmpty());
        assertEquals(0, maxBounces(run.rayCollection()));
        assertEquals(List.of(0), bench.detectorBounceLevels());
    }

    @Test
    public void testOneBounceReachesTheSource() {
        TwoPlates bench = new TwoPlates();
        AnalysisRun run = bench.run(1);

        assertEquals(1, maxBounces(run.rayCollection()));
        // single reflections travel backwards and never reach the detector
        assertEquals(List.of(0), bench.detectorBounceLevels());
    }

    @Test
    public void testTwoBouncesReachTheDetector() {
        TwoPlates bench = new TwoPlates();
        AnalysisRun run = bench.run(2);

        assertTrue(maxBounces(run.rayCollection()) <= 2);
        List<Integer> levels = bench.detectorBounceLevels();
        assertTrue(levels.contains(0));
        assertTrue(levels.contains(2));
        assertFalse(levels.contains(1));
        for (int level : levels)
            assertTrue(level <= 2);
    }

    @Test
    public void testBounceLimitHoldsForAllLimits() {
        for (int b = 0; b <= 3; b++) {
            TwoPlates bench = new TwoPlates();
            AnalysisRun run = bench.run(b);
            assertTrue("limit " + b, maxBounces(run.rayCollection()) <= b);
            for (int level : bench.detectorBounceLevels())
                assertTrue("limit " + b, level <= b);
        }
    }

    @Test
    public void testCachesAreEmptyAfterRun() {
        TwoPlates bench = new TwoPlates();
        bench.run(2);
        for (OpticSurface s : bench.scene.surfaces()) {
            assertTrue(s.drainCache(true).isEmpty());
            assertTrue(s.drainCache(false).isEmpty());
        }
    }

    @Test(expected = OpticException.class)
    public void testNegativeLimitRejected() {
        new GhostFocusConfig(-1);
    }
}
