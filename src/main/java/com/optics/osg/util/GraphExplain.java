package com.optics.osg.util;

import java.util.Map;

import com.optics.osg.api.OpticNode;
import com.optics.osg.engine.OpticEdge;
import com.optics.osg.engine.OpticGraph;
import com.optics.osg.engine.PortRef;
import com.optics.osg.engine.TopologicalOrder;
import com.optics.osg.node.NodeGroup;

/**
 * Human-readable views of a scene graph: a text dump of the execution order
 * and a Mermaid flowchart. Intended for debugging and logs.
 */
public final class GraphExplain {
    private final OpticGraph graph;

    public GraphExplain(OpticGraph graph) {
        this.graph = graph;
    }

    public GraphExplain(NodeGroup group) {
        this(group.graph());
    }

    /** Dumps one node: type, ports, placement and its connections. */
    public String explainNode(String nodeId) {
        OpticNode node = graph.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.name()).append(" (").append(node.nodeType()).append(")\n")
                .append("  Id: ").append(node.id()).append('\n')
                .append("  Inputs: ").append(node.inputPorts()).append('\n')
                .append("  Outputs: ").append(node.outputPorts()).append('\n')
                .append("  Inverted: ").append(node.isInverted()).append('\n')
                .append("  Pose: ").append(node.pose()).append('\n')
                .append("  Stale: ").append(graph.isStaleNode(nodeId)).append('\n');
        for (OpticEdge e : graph.edges()) {
            if (e.sourceId().equals(nodeId))
                sb.append("  ").append(e.sourcePort()).append(" -> ").append(graph.node(e.targetId()).name())
                        .append(':').append(e.targetPort()).append(" (").append(e.distance()).append(" m)\n");
            if (e.targetId().equals(nodeId))
                sb.append("  ").append(e.targetPort()).append(" <- ").append(graph.node(e.sourceId()).name())
                        .append(':').append(e.sourcePort()).append('\n');
        }
        return sb.toString();
    }

    /** Dumps the nodes in execution order with their successors. */
    public String dumpTopology() {
        TopologicalOrder topology = graph.traversal(graph.isInverted());
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(topology.nodeCount()).append(" nodes")
                .append(graph.isInverted() ? ", inverted" : "").append("):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            OpticNode node = topology.node(i);
            sb.append("  [").append(i).append("] ").append(node.name()).append(" (").append(node.nodeType())
                    .append(')');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        appendPortMap(sb, "input", graph.inputPortMap());
        appendPortMap(sb, "output", graph.outputPortMap());
        return sb.toString();
    }

    private void appendPortMap(StringBuilder sb, String direction, Map<String, PortRef> map) {
        for (Map.Entry<String, PortRef> e : map.entrySet())
            sb.append("  ").append(direction).append(" '").append(e.getKey()).append("' = ")
                    .append(graph.node(e.getValue().nodeId()).name()).append(':').append(e.getValue().port())
                    .append('\n');
    }

    /** Mermaid flowchart, edges labelled with ports and distance. */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph LR;\n");
        for (OpticNode node : graph.nodes())
            sb.append("  ").append(sanitize(node.id())).append("[\"").append(node.name()).append("<br/><i>")
                    .append(node.nodeType()).append("</i>\"];\n");
        for (OpticEdge e : graph.edges())
            sb.append("  ").append(sanitize(e.sourceId())).append(" -- \"").append(e.sourcePort()).append(" / ")
                    .append(e.targetPort()).append(" (").append(e.distance()).append(" m)\" --> ")
                    .append(sanitize(e.targetId())).append(";\n");
        return sb.toString();
    }

    private static String sanitize(String id) {
        return "n_" + id.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
