package com.optics.osg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.optics.osg.dsl.SceneBuilder;
import com.optics.osg.engine.AnalysisRun;
import com.optics.osg.engine.EnergyAnalyzer;
import com.optics.osg.engine.RayTraceAnalyzer;
import com.optics.osg.io.AnalysisReport;
import com.optics.osg.io.NodeReport;
import com.optics.osg.node.Detector;
import com.optics.osg.node.Wedge;
import com.optics.osg.ray.RayBundles;
import com.optics.osg.ray.distribution.EnergyDistribution;
import com.optics.osg.ray.distribution.Hexapolar;
import com.optics.osg.refraction.ConstantIndex;
import com.optics.osg.spectrum.Spectra;
import com.optics.osg.util.AnalysisStatsListener;

public class OpticSceneryTest {

    /** 1 mJ on a 1 mm radius beam hitting a plate whose front surface has a 1 J/m² threshold. */
    private static OpticScenery damagedPlate() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.source("laser", RayBundles.collimated(1064e-9, 1e-3, new Hexapolar(1e-3, 3), EnergyDistribution.uniform()));
        Wedge plate = b.add(new Wedge("plate", 5e-3, 0.0, new ConstantIndex(1.5)));
        plate.front().setLidt(1.0);
        b.add(new Detector("det"));
        b.chain(0.05, "laser", "plate", "det");
        return new OpticScenery(b.build());
    }

    private static NodeReport child(NodeReport parent, String name) {
        for (NodeReport r : parent.getChildren())
            if (r.getName().equals(name))
                return r;
        throw new AssertionError("no child " + name);
    }

    @Test
    public void testCriticalFluenceIsReported() {
        OpticScenery scenery = damagedPlate();
        AnalysisRun run = scenery.analyze(new RayTraceAnalyzer());

        List<AnalysisReport.DamageEntry> damage = scenery.criticalFluences();
        assertFalse(damage.isEmpty());
        for (AnalysisReport.DamageEntry e : damage) {
            assertEquals("plate", e.getNode());
            assertEquals("front", e.getSurface());
            assertEquals(1.0, e.getLidt(), 0.0);
            assertTrue(e.getPeakFluence() > 1.0);
            assertEquals(0, e.getBounce());
        }

        AnalysisReport report = scenery.report(run);
        assertEquals("bench", report.getScene());
        assertEquals("RAY_TRACE", report.getAnalyzer());
        assertEquals(damage, report.getCriticalFluences());
        assertEquals(3, report.getNodes().get(0).getChildren().size());
    }

    @Test
    public void testRerunDoesNotAccumulate() {
        OpticScenery scenery = damagedPlate();
        scenery.analyze(new RayTraceAnalyzer());
        int first = scenery.criticalFluences().size();
        scenery.analyze(new RayTraceAnalyzer());
        assertEquals(first, scenery.criticalFluences().size());
        scenery.resetData();
        assertTrue(scenery.criticalFluences().isEmpty());
    }

    @Test
    public void testEnergyReport() throws IOException {
        SceneBuilder b = SceneBuilder.create("meter bench");
        b.source("laser", Spectra.heNe(1.0));
        b.energyMeter("meter");
        b.chain(0.1, "laser", "meter");
        AnalysisStatsListener stats = new AnalysisStatsListener();
        OpticScenery scenery = new OpticScenery(b.build()).setListener(stats);

        AnalysisRun run = scenery.analyze(new EnergyAnalyzer());
        assertEquals(2, stats.nodeStats().size());

        JsonNode json = new ObjectMapper().readTree(scenery.reportJson(run));
        assertEquals("ENERGY", json.get("analyzer").asText());
        JsonNode meter = null;
        for (JsonNode c : json.get("nodes").get(0).get("children"))
            if (c.get("name").asText().equals("meter"))
                meter = c;
        assertNotNull(meter);
        assertEquals(1.0, meter.get("results").get("total energy").asDouble(), 1e-12);
        assertNull(json.get("criticalFluences"));

        NodeReport scene = scenery.report(run).getNodes().get(0);
        assertEquals("energy meter", child(scene, "meter").getType());
    }

    @Test
    public void testWriteReport() throws IOException {
        OpticScenery scenery = damagedPlate();
        AnalysisRun run = scenery.analyze(new RayTraceAnalyzer());
        Path f = Files.createTempFile("scenery", ".json");
        try {
            scenery.writeReport(run, f);
            JsonNode json = new ObjectMapper().readTree(Files.readString(f));
            assertEquals("bench", json.get("scene").asText());
            assertTrue(json.get("criticalFluences").size() > 0);
        } finally {
            Files.delete(f);
        }
    }
}
