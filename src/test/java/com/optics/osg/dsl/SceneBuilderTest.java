package com.optics.osg.dsl;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;
import com.optics.osg.engine.EnergyAnalyzer;
import com.optics.osg.node.EnergyMeter;
import com.optics.osg.node.IdealFilter;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.node.OpticPorts;
import com.optics.osg.spectrum.Spectra;

public class SceneBuilderTest {

    @Test
    public void testChainAndSplit() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.source("laser", Spectra.heNe(1.0));
        b.dummy("d");
        b.beamSplitter("bs", 0.8);
        EnergyMeter trans = b.energyMeter("trans");
        EnergyMeter refl = b.energyMeter("refl");
        b.chain(0.1, "laser", "d", "bs");
        b.connect("bs", OpticPorts.OUT1_TRANS1_REFL2, "trans", OpticPorts.INPUT_1, 0.1);
        b.connect("bs", OpticPorts.OUT2_TRANS2_REFL1, "refl", OpticPorts.INPUT_1, 0.1);
        NodeGroup scene = b.build();

        assertEquals(5, scene.graph().nodeCount());
        new EnergyAnalyzer().analyze(scene);
        assertEquals(0.8, trans.totalEnergy(), 1e-12);
        assertEquals(0.2, refl.totalEnergy(), 1e-12);
    }

    @Test
    public void testGroupPorts() {
        SceneBuilder b = SceneBuilder.create("filter group");
        b.add(new IdealFilter("f", 0.5));
        b.mapInput("in", "f", OpticPorts.INPUT_1);
        b.mapOutput("out", "f", OpticPorts.OUTPUT_1);
        NodeGroup group = b.build();
        assertEquals(1, group.inputPorts().size());
        assertEquals("in", group.inputPorts().get(0));
        assertEquals("out", group.outputPorts().get(0));
    }

    @Test
    public void testInvert() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.dummy("d");
        b.invert("d");
        assertTrue(b.node("d").isInverted());
    }

    @Test
    public void testDuplicateName() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.dummy("d");
        try {
            b.energyMeter("d");
            fail("duplicate names must be rejected");
        } catch (OpticException e) {
            assertEquals(OpticException.Kind.GRAPH_STRUCTURE, e.kind());
        }
    }

    @Test
    public void testUnknownName() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.dummy("d");
        try {
            b.chain(0.1, "d", "missing");
            fail("unknown node");
        } catch (OpticException e) {
            assertEquals(OpticException.Kind.GRAPH_STRUCTURE, e.kind());
            assertTrue(e.getMessage().contains("missing"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testCannotModifyAfterBuild() {
        SceneBuilder b = SceneBuilder.create("bench");
        b.dummy("d");
        b.build();
        b.dummy("e");
    }
}
