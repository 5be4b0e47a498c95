package com.optics.osg.engine;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.ray.RayBundle;

/**
 * The node arena of one group: nodes, the edges between their ports and the
 * port maps exposing internal ports to the enclosing group.
 *
 * <p>
 * Connections are always declared from an effective output to an effective
 * input in the non-inverted state of the graph. {@link #invertGraph()} does
 * not touch the stored edges: it toggles every node and a graph flag, and the
 * traversal then reads every edge from target to source. Backward ghost passes
 * use the same reversed reading without inverting anything.
 */
public final class OpticGraph {
    private static final Logger log = LogManager.getLogger(OpticGraph.class);

    private final Map<String, OpticNode> nodes = new LinkedHashMap<>();
    private final List<OpticEdge> edges = new ArrayList<>();
    private final Map<String, PortRef> inputMap = new LinkedHashMap<>();
    private final Map<String, PortRef> outputMap = new LinkedHashMap<>();
    private boolean inverted;

    // [0] forward reading, [1] reversed reading; null until requested
    private final TopologicalOrder[] traversals = new TopologicalOrder[2];

    /** Adds a node under its own id and returns that id. */
    public String addNode(OpticNode node) {
        if (nodes.containsKey(node.id()))
            throw OpticException.graphStructure("node with id " + node.id() + " already exists in the graph");
        nodes.put(node.id(), node);
        invalidate();
        return node.id();
    }

    public OpticNode node(String id) {
        OpticNode node = nodes.get(id);
        if (node == null)
            throw OpticException.graphStructure("node with id " + id + " not found");
        return node;
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public List<OpticNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<OpticEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public boolean isInverted() {
        return inverted;
    }

    /**
     * Connects an output port of {@code sourceId} to an input port of
     * {@code targetId}.
     *
     * @param distance free-space distance in metres, finite and not negative
     */
    public void connect(String sourceId, String sourcePort, String targetId, String targetPort, double distance) {
        if (inverted)
            throw OpticException.graphStructure("cannot connect nodes in an inverted graph");
        OpticNode source = node(sourceId);
        OpticNode target = node(targetId);
        List<String> outputs = effectiveOutputs(source);
        if (!outputs.contains(sourcePort))
            throw OpticException.graphStructure("source node '" + source.name() + "' (" + source.nodeType()
                    + ") does not have an output port named '" + sourcePort + "'. Valid names: " + outputs);
        List<String> inputs = effectiveInputs(target);
        if (!inputs.contains(targetPort))
            throw OpticException.graphStructure("target node '" + target.name() + "' (" + target.nodeType()
                    + ") does not have an input port named '" + targetPort + "'. Valid names: " + inputs);
        if (findEdgeFrom(sourceId, sourcePort) != null)
            throw OpticException.graphStructure("output port '" + sourcePort + "' of node '" + source.name()
                    + "' is already connected");
        if (findEdgeTo(targetId, targetPort) != null)
            throw OpticException.graphStructure("input port '" + targetPort + "' of node '" + target.name()
                    + "' is already connected");
        if (sourceId.equals(targetId) || reachable(targetId, sourceId))
            throw OpticException.graphStructure("connecting '" + source.name() + "' to '" + target.name()
                    + "' would create a loop in the scenery");
        checkDistance(distance);
        edges.add(new OpticEdge(sourceId, sourcePort, targetId, targetPort, distance));
        removeMapEntries(inputMap, targetId, targetPort);
        removeMapEntries(outputMap, sourceId, sourcePort);
        invalidate();
    }

    /** Removes the edge leaving {@code sourcePort} of {@code sourceId}. */
    public void disconnect(String sourceId, String sourcePort) {
        OpticEdge edge = findEdgeFrom(sourceId, sourcePort);
        if (edge == null)
            throw OpticException.graphStructure("no connection leaves port '" + sourcePort + "' of node " + sourceId);
        edges.remove(edge);
        invalidate();
    }

    public void updateConnectionDistance(String sourceId, String sourcePort, double distance) {
        OpticEdge edge = findEdgeFrom(sourceId, sourcePort);
        if (edge == null)
            throw OpticException.graphStructure("no connection leaves port '" + sourcePort + "' of node " + sourceId);
        checkDistance(distance);
        edge.setDistance(distance);
    }

    /** Distance of the edge leaving the given port. */
    public double connectionDistance(String sourceId, String sourcePort) {
        OpticEdge edge = findEdgeFrom(sourceId, sourcePort);
        if (edge == null)
            throw OpticException.graphStructure("no connection leaves port '" + sourcePort + "' of node " + sourceId);
        return edge.distance();
    }

    public void mapInputPort(String externalName, String nodeId, String internalPort) {
        mapPort(inputMap, "input", externalName, nodeId, internalPort, true);
    }

    public void mapOutputPort(String externalName, String nodeId, String internalPort) {
        mapPort(outputMap, "output", externalName, nodeId, internalPort, false);
    }

    public void unmapInputPort(String externalName) {
        if (inputMap.remove(externalName) == null)
            throw OpticException.graphStructure("input port '" + externalName + "' is not mapped");
    }

    public void unmapOutputPort(String externalName) {
        if (outputMap.remove(externalName) == null)
            throw OpticException.graphStructure("output port '" + externalName + "' is not mapped");
    }

    public Map<String, PortRef> inputPortMap() {
        return Collections.unmodifiableMap(inputMap);
    }

    public Map<String, PortRef> outputPortMap() {
        return Collections.unmodifiableMap(outputMap);
    }

    private void mapPort(Map<String, PortRef> map, String direction, String externalName, String nodeId,
            String internalPort, boolean input) {
        if (map.containsKey(externalName))
            throw OpticException.graphStructure(direction + " port name '" + externalName + "' already assigned");
        OpticNode node = node(nodeId);
        // in an inverted graph the maps keep the roles they had before inversion
        boolean flipped = node.isInverted() ^ inverted;
        List<String> ports = input ^ flipped ? node.inputPorts() : node.outputPorts();
        if (!ports.contains(internalPort))
            throw OpticException.graphStructure("node '" + node.name() + "' (" + node.nodeType()
                    + ") does not have an " + direction + " port named '" + internalPort + "'. Valid names: "
                    + ports);
        boolean connected = input ? findEdgeTo(nodeId, internalPort) != null
                : findEdgeFrom(nodeId, internalPort) != null;
        if (connected)
            throw OpticException.graphStructure("port '" + internalPort + "' of node '" + node.name()
                    + "' is already internally connected");
        map.put(externalName, new PortRef(nodeId, internalPort));
    }

    /**
     * Inverts the whole graph: every node is inverted and every edge is read
     * from its target to its source. Applying it twice restores the graph.
     */
    public void invertGraph() {
        for (OpticNode node : nodes.values())
            if (!node.isInvertible())
                throw OpticException.graphStructure("node '" + node.name() + "' (" + node.nodeType()
                        + ") cannot be inverted");
        for (OpticNode node : nodes.values())
            node.setInverted(!node.isInverted());
        inverted = !inverted;
        invalidate();
    }

    /** Nodes sorted for the current direction of the graph. */
    public List<OpticNode> topologicallySorted() {
        return traversal(inverted).nodes();
    }

    /**
     * Execution order with edges read forward, or from target to source when
     * {@code reversed}. Cached until the graph changes.
     */
    public TopologicalOrder traversal(boolean reversed) {
        int slot = reversed ? 1 : 0;
        if (traversals[slot] == null) {
            TopologicalOrder.Builder builder = TopologicalOrder.builder();
            for (OpticNode node : nodes.values())
                builder.addNode(node);
            for (OpticEdge e : edges)
                builder.addEdge(e.fromId(reversed), e.toId(reversed));
            traversals[slot] = builder.build();
        }
        return traversals[slot];
    }

    /** True if the nodes form at most one weakly connected component. */
    public boolean isSingleTree() {
        if (nodes.size() <= 1)
            return true;
        Map<String, String> parent = new HashMap<>();
        for (String id : nodes.keySet())
            parent.put(id, id);
        int components = nodes.size();
        for (OpticEdge e : edges) {
            String a = find(parent, e.sourceId());
            String b = find(parent, e.targetId());
            if (!a.equals(b)) {
                parent.put(a, b);
                components--;
            }
        }
        return components <= 1;
    }

    private static String find(Map<String, String> parent, String id) {
        String root = id;
        while (!parent.get(root).equals(root))
            root = parent.get(root);
        parent.put(id, root);
        return root;
    }

    /** A node without any edge that is not referenced by a port map either. */
    public boolean isStaleNode(String id) {
        node(id);
        for (OpticEdge e : edges)
            if (e.sourceId().equals(id) || e.targetId().equals(id))
                return false;
        for (PortRef ref : inputMap.values())
            if (ref.nodeId().equals(id))
                return false;
        for (PortRef ref : outputMap.values())
            if (ref.nodeId().equals(id))
                return false;
        return true;
    }

    // ---- analysis support -------------------------------------------------

    void clearLight() {
        for (OpticEdge e : edges)
            e.setLight(null);
    }

    /**
     * Collects the light arriving at a node: external inputs routed through the
     * entry port map, plus the light on the incoming edges listed by
     * {@code order}. Edge light is handed over as a copy; while positioning,
     * rays are propagated along the edge.
     *
     * @param order {@link #traversal(boolean)} for {@code reversed}
     * @param ti    topological index of the node in {@code order}
     */
    LightResult incoming(TopologicalOrder order, int ti, LightResult external, boolean reversed,
            AnalysisContext ctx) {
        OpticNode node = order.node(ti);
        LightResult in = LightResult.empty();
        Map<String, PortRef> entry = reversed ? outputMap : inputMap;
        for (Map.Entry<String, PortRef> m : entry.entrySet()) {
            PortRef ref = m.getValue();
            LightData data = external.get(m.getKey());
            if (data != null && ref.nodeId().equals(node.id()))
                in.put(ref.port(), data.copy());
        }
        for (int i = 0; i < order.parentCount(ti); i++) {
            OpticEdge e = edges.get(order.parentEdge(ti, i));
            if (e.light() == null)
                continue;
            LightData data = e.light().copy();
            if (ctx.isPositioning() && data instanceof GeometricData g)
                g.rays().propagate(e.distance());
            in.put(e.toPort(reversed), data);
        }
        return in;
    }

    /**
     * Hands a node's output on: onto the edge leaving the port, to the group's
     * exit port map, or, for ghost bundles, into the run's ray collection.
     */
    void distribute(TopologicalOrder order, int ti, LightResult outputs, boolean reversed, LightResult external,
            AnalysisContext ctx) {
        OpticNode node = order.node(ti);
        Map<String, PortRef> exit = reversed ? inputMap : outputMap;
        for (Map.Entry<String, LightData> out : outputs.asMap().entrySet()) {
            String port = out.getKey();
            OpticEdge edge = outgoingEdge(order, ti, port, reversed);
            if (edge != null) {
                edge.setLight(out.getValue());
                continue;
            }
            String externalName = externalName(exit, node.id(), port);
            if (externalName != null) {
                external.put(externalName, out.getValue());
            } else if (out.getValue() instanceof GhostFocusData g) {
                for (RayBundle b : g.bundles())
                    if (!b.isEmpty())
                        ctx.collect(b);
            } else if (out.getValue() instanceof GeometricData && ctx.isPositioning()) {
                log.debug("alignment ray leaves the scenery at port '{}' of node '{}'", port, node.name());
            } else {
                log.debug("light at unconnected port '{}' of node '{}' dropped", port, node.name());
            }
        }
    }

    private OpticEdge outgoingEdge(TopologicalOrder order, int ti, String port, boolean reversed) {
        for (int i = 0; i < order.childCount(ti); i++) {
            OpticEdge e = edges.get(order.childEdge(ti, i));
            if (e.fromPort(reversed).equals(port))
                return e;
        }
        return null;
    }

    /** Effective input ports of a node in the non-inverted graph. */
    static List<String> effectiveInputs(OpticNode node) {
        return node.isInverted() ? node.outputPorts() : node.inputPorts();
    }

    static List<String> effectiveOutputs(OpticNode node) {
        return node.isInverted() ? node.inputPorts() : node.outputPorts();
    }

    private static String externalName(Map<String, PortRef> map, String nodeId, String port) {
        for (Map.Entry<String, PortRef> m : map.entrySet())
            if (m.getValue().nodeId().equals(nodeId) && m.getValue().port().equals(port))
                return m.getKey();
        return null;
    }

    private OpticEdge findEdgeFrom(String nodeId, String port) {
        for (OpticEdge e : edges)
            if (e.sourceId().equals(nodeId) && e.sourcePort().equals(port))
                return e;
        return null;
    }

    private OpticEdge findEdgeTo(String nodeId, String port) {
        for (OpticEdge e : edges)
            if (e.targetId().equals(nodeId) && e.targetPort().equals(port))
                return e;
        return null;
    }

    /** Depth-first search along stored edges. */
    private boolean reachable(String fromId, String toId) {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(fromId);
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (id.equals(toId))
                return true;
            if (!seen.add(id))
                continue;
            for (OpticEdge e : edges)
                if (e.sourceId().equals(id))
                    stack.push(e.targetId());
        }
        return false;
    }

    private static void removeMapEntries(Map<String, PortRef> map, String nodeId, String port) {
        map.values().removeIf(ref -> ref.nodeId().equals(nodeId) && ref.port().equals(port));
    }

    private static void checkDistance(double distance) {
        if (!Double.isFinite(distance) || distance < 0.0)
            throw OpticException.graphStructure("distance must be a positive and finite number, got " + distance);
    }

    private void invalidate() {
        traversals[0] = null;
        traversals[1] = null;
    }
}
