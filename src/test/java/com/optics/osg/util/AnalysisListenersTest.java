package com.optics.osg.util;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.engine.EnergyAnalyzer;
import com.optics.osg.engine.SceneryResources;
import com.optics.osg.node.EnergyMeter;
import com.optics.osg.node.IdealFilter;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.node.OpticPorts;
import com.optics.osg.node.Source;
import com.optics.osg.spectrum.Spectra;

public class AnalysisListenersTest {

    /** Records callbacks as text. */
    private static final class Recorder implements AnalysisListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onAnalysisStart(int pass, String groupName) {
            events.add("start " + groupName);
        }

        @Override
        public void onNodeAnalyzed(int pass, String nodeName, String nodeType, long durationNanos) {
            events.add("node " + nodeName);
        }

        @Override
        public void onNodeError(int pass, String nodeName, String nodeType, Throwable error) {
            events.add("error " + nodeName);
        }

        @Override
        public void onAnalysisEnd(int pass, String groupName, int nodesAnalyzed) {
            events.add("end " + groupName + " " + nodesAnalyzed);
        }
    }

    private static NodeGroup nestedScene() {
        NodeGroup inner = new NodeGroup("inner");
        IdealFilter f = new IdealFilter("f", 0.5);
        inner.addNode(f);
        inner.mapInputPort("in", f.id(), OpticPorts.INPUT_1);
        inner.mapOutputPort("out", f.id(), OpticPorts.OUTPUT_1);

        NodeGroup scene = new NodeGroup("scene");
        Source src = Source.ofSpectrum("src", Spectra.heNe(1.0));
        EnergyMeter meter = new EnergyMeter("meter");
        scene.addNode(src);
        scene.addNode(inner);
        scene.addNode(meter);
        scene.connect(src.id(), OpticPorts.OUTPUT_1, inner.id(), "in", 0.1);
        scene.connect(inner.id(), "out", meter.id(), OpticPorts.INPUT_1, 0.1);
        return scene;
    }

    @Test
    public void testCompositeForwardsInOrder() {
        Recorder first = new Recorder();
        Recorder second = new Recorder();
        CompositeAnalysisListener composite = new CompositeAnalysisListener().add(first).add(second);
        assertEquals(2, composite.size());

        new EnergyAnalyzer().analyze(nestedScene(), SceneryResources.defaults(), composite);

        assertEquals(List.of("start scene", "node src", "start inner", "node f", "end inner 1", "node inner",
                "node meter", "end scene 3"), first.events);
        assertEquals(first.events, second.events);
    }

    @Test
    public void testStatsCountNestedGroups() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        new EnergyAnalyzer().analyze(nestedScene(), SceneryResources.defaults(), stats);

        assertEquals(2, stats.groupWalks());
        assertEquals(Integer.valueOf(4), stats.nodesPerPass().get(0));
        assertEquals(4, stats.nodeStats().size());
        assertTrue(stats.errors().isEmpty());
        for (AnalysisStatsListener.NodeStats s : stats.nodeStats())
            assertEquals(1, s.count());
        assertTrue(stats.dump().contains("meter"));

        stats.reset();
        assertEquals(0, stats.groupWalks());
        assertTrue(stats.nodeStats().isEmpty());
    }

    @Test
    public void testStatsRecordErrors() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        stats.onNodeError(3, "plate", "wedge", new IllegalStateException("boom"));
        assertEquals(List.of("pass 3: node 'plate' (wedge) failed: boom"), stats.errors());
    }

    @Test
    public void testNodeStatsTiming() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        stats.onNodeAnalyzed(0, "a", "dummy", 1000);
        stats.onNodeAnalyzed(1, "a", "dummy", 3000);
        AnalysisStatsListener.NodeStats s = stats.nodeStats().get(0);
        assertEquals(2, s.count());
        assertEquals(2.0, s.avgMicros(), 1e-12);
        assertEquals(1000, s.minNanos());
        assertEquals(3000, s.maxNanos());
    }
}
