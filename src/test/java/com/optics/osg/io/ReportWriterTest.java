package com.optics.osg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.optics.osg.properties.PropertyStore;
import com.optics.osg.ray.MissedSurfaceStrategy;

public class ReportWriterTest {
    private final ReportWriter writer = new ReportWriter();

    private static AnalysisReport sample() {
        PropertyStore props = new PropertyStore();
        props.create("ratio", "splitting ratio", 0.3);
        props.create("strategy", "missed surface", MissedSurfaceStrategy.STOP);

        NodeReport bs = new NodeReport("bs", "beam splitter", "1").withProperties(props);
        NodeReport meter = new NodeReport("m1", "energy meter", "2").withResult("totalEnergy", 0.3);
        NodeReport root = new NodeReport("scene", "group", "0");
        root.setChildren(List.of(bs, meter));

        AnalysisReport.DamageEntry damage = new AnalysisReport.DamageEntry();
        damage.setNode("plate");
        damage.setSurface("front");
        damage.setBounce(0);
        damage.setPeakFluence(2.5e4);
        damage.setLidt(1e4);

        AnalysisReport r = new AnalysisReport();
        r.setScene("scene");
        r.setAnalyzer("RAY_TRACE");
        r.setDurationMillis(12.5);
        r.getNodes().add(root);
        r.getCriticalFluences().add(damage);
        return r;
    }

    @Test
    public void testJsonLayout() throws IOException {
        JsonNode json = new ObjectMapper().readTree(writer.toJson(sample()));
        assertEquals("RAY_TRACE", json.get("analyzer").asText());
        JsonNode children = json.get("nodes").get(0).get("children");
        assertEquals(2, children.size());
        assertEquals(0.3, children.get(0).get("properties").get("ratio").asDouble(), 0.0);
        assertEquals("STOP", children.get(0).get("properties").get("strategy").asText());
        assertEquals(0.3, children.get(1).get("results").get("totalEnergy").asDouble(), 0.0);
        assertEquals("front", json.get("criticalFluences").get(0).get("surface").asText());
    }

    @Test
    public void testReadBack() throws IOException {
        AnalysisReport r = sample();
        AnalysisReport back = writer.readAnalysisReport(writer.toJson(r));
        assertEquals(r.getScene(), back.getScene());
        assertEquals(12.5, back.getDurationMillis(), 0.0);
        assertEquals(r.getCriticalFluences(), back.getCriticalFluences());
        assertEquals("m1", back.getNodes().get(0).getChildren().get(1).getName());
    }

    @Test
    public void testWrite() throws IOException {
        Path f = Files.createTempFile("report", ".json");
        try {
            writer.write(sample(), f);
            assertEquals("scene", writer.readAnalysisReport(Files.readString(f)).getScene());
        } finally {
            Files.delete(f);
        }
    }
}
