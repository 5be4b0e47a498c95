package com.optics.osg.node;

import java.util.ArrayList;
import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.OpticNode;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.engine.GraphAnalysisEngine;
import com.optics.osg.engine.OpticGraph;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.LightResult;
import com.optics.osg.surface.OpticSurface;

/**
 * A node containing a graph of its own. Its ports are the external names of
 * the graph's port maps; inverting the group inverts the graph. The top-level
 * scene is a group as well.
 */
public final class NodeGroup extends AbstractOpticNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private final OpticGraph graph = new OpticGraph();

    public NodeGroup(String name) {
        super("group", name, List.of(), List.of());
    }

    public OpticGraph graph() {
        return graph;
    }

    public String addNode(OpticNode node) {
        return graph.addNode(node);
    }

    public void connect(String sourceId, String sourcePort, String targetId, String targetPort, double distance) {
        graph.connect(sourceId, sourcePort, targetId, targetPort, distance);
    }

    public void mapInputPort(String externalName, String nodeId, String internalPort) {
        graph.mapInputPort(externalName, nodeId, internalPort);
    }

    public void mapOutputPort(String externalName, String nodeId, String internalPort) {
        graph.mapOutputPort(externalName, nodeId, internalPort);
    }

    @Override
    public List<String> inputPorts() {
        return List.copyOf(graph.inputPortMap().keySet());
    }

    @Override
    public List<String> outputPorts() {
        return List.copyOf(graph.outputPortMap().keySet());
    }

    @Override
    public boolean isInverted() {
        return graph.isInverted();
    }

    @Override
    public void setInverted(boolean inverted) {
        if (inverted != graph.isInverted())
            graph.invertGraph();
    }

    @Override
    public boolean isInvertible() {
        for (OpticNode node : graph.nodes())
            if (!node.isInvertible())
                return false;
        return true;
    }

    @Override
    public boolean isPositionable() {
        return false;
    }

    /** Surfaces of all nodes in this group and its sub-groups. */
    @Override
    public List<OpticSurface> surfaces() {
        List<OpticSurface> all = new ArrayList<>();
        for (OpticNode node : graph.nodes())
            all.addAll(node.surfaces());
        return all;
    }

    @Override
    public LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx) {
        return run(inputs, ctx);
    }

    @Override
    public LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx) {
        return run(inputs, ctx);
    }

    @Override
    public LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx) {
        return run(inputs, ctx);
    }

    private LightResult run(LightResult inputs, AnalysisContext ctx) {
        return GraphAnalysisEngine.run(graph, name(), inputs, graph.isInverted() ^ ctx.isBackward(), ctx);
    }

    @Override
    public void resetData() {
        for (OpticNode node : graph.nodes())
            node.resetData();
    }

    @Override
    protected void addResults(NodeReport report) {
        List<NodeReport> children = new ArrayList<>();
        for (OpticNode node : graph.nodes())
            children.add(node.report());
        report.setChildren(children);
    }
}
