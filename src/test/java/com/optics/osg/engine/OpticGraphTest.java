package com.optics.osg.engine;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.node.BeamSplitter;
import com.optics.osg.node.Dummy;
import com.optics.osg.node.OpticPorts;
import com.optics.osg.node.Source;
import com.optics.osg.spectrum.Spectra;

public class OpticGraphTest {

    private OpticGraph graph;
    private Dummy d1, d2, d3;

    @Before
    public void setUp() {
        graph = new OpticGraph();
        d1 = new Dummy("d1");
        d2 = new Dummy("d2");
        d3 = new Dummy("d3");
        graph.addNode(d1);
        graph.addNode(d2);
        graph.addNode(d3);
    }

    private static OpticException.Kind kindOf(Runnable r) {
        try {
            r.run();
        } catch (OpticException e) {
            return e.kind();
        }
        fail("expected an OpticException");
        return null;
    }

    @Test
    public void testConnectionDefinesExecutionOrder() {
        // registered d1, d2, d3; wired d3 -> d2 -> d1
        graph.connect(d3.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.1);
        graph.connect(d2.id(), OpticPorts.OUTPUT_1, d1.id(), OpticPorts.INPUT_1, 0.2);

        List<OpticNode> sorted = graph.topologicallySorted();
        assertEquals(List.of(d3, d2, d1), sorted);
        assertEquals(0.2, graph.connectionDistance(d2.id(), OpticPorts.OUTPUT_1), 0.0);
    }

    @Test
    public void testConnectUnknownPort() {
        try {
            graph.connect(d1.id(), "output_7", d2.id(), OpticPorts.INPUT_1, 0.0);
            fail("unknown port must be rejected");
        } catch (OpticException e) {
            assertEquals(OpticException.Kind.GRAPH_STRUCTURE, e.kind());
            assertTrue(e.getMessage().contains("Valid names"));
        }
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), "input_9", 0.0)));
    }

    @Test
    public void testConnectUnknownNode() {
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect("nope", OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0)));
    }

    @Test
    public void testPortsConnectOnlyOnce() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0);
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d1.id(), OpticPorts.OUTPUT_1, d3.id(), OpticPorts.INPUT_1, 0.0)));
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d3.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0)));
    }

    @Test
    public void testLoopRejected() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0);
        graph.connect(d2.id(), OpticPorts.OUTPUT_1, d3.id(), OpticPorts.INPUT_1, 0.0);
        try {
            graph.connect(d3.id(), OpticPorts.OUTPUT_1, d1.id(), OpticPorts.INPUT_1, 0.0);
            fail("loop must be rejected");
        } catch (OpticException e) {
            assertTrue(e.getMessage().contains("would create a loop"));
        }
        assertEquals(2, graph.edges().size());
    }

    @Test
    public void testSelfConnectionRejected() {
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d1.id(), OpticPorts.OUTPUT_1, d1.id(), OpticPorts.INPUT_1, 0.0)));
    }

    @Test
    public void testInvalidDistance() {
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, -1.0)));
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE, kindOf(
                () -> graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, Double.NaN)));
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    public void testInvertedNodeUsesSwappedPorts() {
        d2.setInverted(true);
        // an inverted node is entered through its declared output
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.OUTPUT_1, 0.0);
        graph.connect(d2.id(), OpticPorts.INPUT_1, d3.id(), OpticPorts.INPUT_1, 0.0);
        assertEquals(List.of(d1, d2, d3), graph.topologicallySorted());
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d2.id(), OpticPorts.OUTPUT_1, d3.id(), OpticPorts.INPUT_1, 0.0)));
    }

    @Test
    public void testInvertTwiceRestoresGraph() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.1);
        graph.connect(d2.id(), OpticPorts.OUTPUT_1, d3.id(), OpticPorts.INPUT_1, 0.2);
        graph.mapInputPort("in", d1.id(), OpticPorts.INPUT_1);
        graph.mapOutputPort("out", d3.id(), OpticPorts.OUTPUT_1);
        List<OpticEdge> edgesBefore = new ArrayList<>(graph.edges());
        List<OpticNode> orderBefore = graph.topologicallySorted();

        graph.invertGraph();
        assertTrue(graph.isInverted());
        assertTrue(d1.isInverted() && d2.isInverted() && d3.isInverted());
        assertEquals(List.of(d3, d2, d1), graph.topologicallySorted());
        assertEquals(edgesBefore, graph.edges());

        graph.invertGraph();
        assertFalse(graph.isInverted());
        assertFalse(d1.isInverted() || d2.isInverted() || d3.isInverted());
        assertEquals(orderBefore, graph.topologicallySorted());
        assertEquals(edgesBefore, graph.edges());
        assertEquals(new PortRef(d1.id(), OpticPorts.INPUT_1), graph.inputPortMap().get("in"));
        assertEquals(new PortRef(d3.id(), OpticPorts.OUTPUT_1), graph.outputPortMap().get("out"));
    }

    @Test
    public void testConnectInInvertedGraphRejected() {
        graph.invertGraph();
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.connect(d1.id(), OpticPorts.INPUT_1, d2.id(), OpticPorts.OUTPUT_1, 0.0)));
    }

    @Test
    public void testGraphWithSourceCannotBeInverted() {
        Source src = Source.ofSpectrum("src", Spectra.heNe(1.0));
        graph.addNode(src);
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE, kindOf(graph::invertGraph));
        assertFalse(graph.isInverted());
        assertFalse(d1.isInverted());
    }

    @Test
    public void testPortMapping() {
        BeamSplitter bs = new BeamSplitter("bs", 0.5);
        graph.addNode(bs);
        graph.mapInputPort("in", bs.id(), OpticPorts.INPUT_2);
        graph.mapOutputPort("out", bs.id(), OpticPorts.OUT1_TRANS1_REFL2);

        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.mapInputPort("in", bs.id(), OpticPorts.INPUT_1)));
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.mapInputPort("x", bs.id(), OpticPorts.OUT2_TRANS2_REFL1)));

        // connecting a mapped port internally drops the mapping
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, bs.id(), OpticPorts.INPUT_2, 0.0);
        assertFalse(graph.inputPortMap().containsKey("in"));

        graph.unmapOutputPort("out");
        assertTrue(graph.outputPortMap().isEmpty());
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE, kindOf(() -> graph.unmapOutputPort("out")));
    }

    @Test
    public void testMappingConnectedPortRejected() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0);
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE,
                kindOf(() -> graph.mapInputPort("in", d2.id(), OpticPorts.INPUT_1)));
    }

    @Test
    public void testStaleNodesAndSubTrees() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0);
        assertFalse(graph.isStaleNode(d1.id()));
        assertTrue(graph.isStaleNode(d3.id()));
        assertFalse(graph.isSingleTree());

        graph.mapInputPort("in", d3.id(), OpticPorts.INPUT_1);
        assertFalse(graph.isStaleNode(d3.id()));

        graph.connect(d2.id(), OpticPorts.OUTPUT_1, d3.id(), OpticPorts.INPUT_1, 0.0);
        assertTrue(graph.isSingleTree());
    }

    @Test
    public void testDisconnectAndUpdateDistance() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.1);
        graph.updateConnectionDistance(d1.id(), OpticPorts.OUTPUT_1, 0.5);
        assertEquals(0.5, graph.connectionDistance(d1.id(), OpticPorts.OUTPUT_1), 0.0);

        graph.disconnect(d1.id(), OpticPorts.OUTPUT_1);
        assertTrue(graph.edges().isEmpty());
        assertEquals(OpticException.Kind.GRAPH_STRUCTURE, kindOf(() -> graph.disconnect(d1.id(), OpticPorts.OUTPUT_1)));
    }

    @Test(expected = OpticException.class)
    public void testDuplicateNodeRejected() {
        graph.addNode(d1);
    }

    @Test
    public void testReversedTraversalDoesNotTouchEdges() {
        graph.connect(d1.id(), OpticPorts.OUTPUT_1, d2.id(), OpticPorts.INPUT_1, 0.0);
        TopologicalOrder backward = graph.traversal(true);
        assertTrue(backward.topoIndex(d2.id()) < backward.topoIndex(d1.id()));
        assertEquals(d1.id(), graph.edges().get(0).sourceId());
        assertFalse(graph.isInverted());
    }
}
