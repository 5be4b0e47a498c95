package com.optics.osg.dsl;

import java.util.HashMap;
import java.util.Map;

import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.light.LightData;
import com.optics.osg.node.BeamSplitter;
import com.optics.osg.node.Dummy;
import com.optics.osg.node.EnergyMeter;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.node.OpticPorts;
import com.optics.osg.node.Source;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;

/**
 * Scene builder, the fluent way to assemble an optical scene.
 *
 * Nodes are registered under their (unique) name and connected by name:
 *
 * <pre>
 * SceneBuilder b = SceneBuilder.create("bench");
 * b.source("laser", Spectra.heNe(1.0));
 * b.add(new Lens("l1", 0.1, -0.1, 0.005, new ConstantIndex(1.5)));
 * b.energyMeter("meter");
 * b.chain(0.1, "laser", "l1", "meter");
 * NodeGroup scene = b.build();
 * </pre>
 */
public final class SceneBuilder {
    private final NodeGroup group;
    private final Map<String, OpticNode> nodesByName = new HashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private SceneBuilder(String name) {
        this.group = new NodeGroup(name);
    }

    public static SceneBuilder create(String name) {
        return new SceneBuilder(name);
    }

    // ── Nodes ───────────────────────────────────────────────────

    /**
     * Registers a node.
     *
     * @throws OpticException of kind GRAPH_STRUCTURE if the name is taken
     */
    public <T extends OpticNode> T add(T node) {
        checkNotBuilt();
        if (nodesByName.containsKey(node.name()))
            throw OpticException.graphStructure("duplicate node name: " + node.name());
        group.addNode(node);
        nodesByName.put(node.name(), node);
        return node;
    }

    public Source source(String name, LightData light) {
        return add(new Source(name, light));
    }

    public Source source(String name, Spectrum spectrum) {
        return add(Source.ofSpectrum(name, spectrum));
    }

    public Source source(String name, RayBundle rays) {
        return add(Source.ofRays(name, rays));
    }

    public Dummy dummy(String name) {
        return add(new Dummy(name));
    }

    public EnergyMeter energyMeter(String name) {
        return add(new EnergyMeter(name));
    }

    public BeamSplitter beamSplitter(String name, double transmittedRatio) {
        return add(new BeamSplitter(name, transmittedRatio));
    }

    public NodeGroup group(String name) {
        return add(new NodeGroup(name));
    }

    /** Looks up a registered node by name. */
    public OpticNode node(String name) {
        OpticNode node = nodesByName.get(name);
        if (node == null)
            throw OpticException.graphStructure("no node named '" + name + "'");
        return node;
    }

    // ── Connections ─────────────────────────────────────────────

    public SceneBuilder connect(String from, String fromPort, String to, String toPort, double distance) {
        checkNotBuilt();
        group.connect(node(from).id(), fromPort, node(to).id(), toPort, distance);
        return this;
    }

    /**
     * Connects single-path nodes in sequence, {@code output_1} to
     * {@code input_1}, all at the same distance.
     */
    public SceneBuilder chain(double distance, String... names) {
        for (int i = 0; i + 1 < names.length; i++)
            connect(names[i], OpticPorts.OUTPUT_1, names[i + 1], OpticPorts.INPUT_1, distance);
        return this;
    }

    public SceneBuilder mapInput(String externalName, String node, String port) {
        checkNotBuilt();
        group.mapInputPort(externalName, node(node).id(), port);
        return this;
    }

    public SceneBuilder mapOutput(String externalName, String node, String port) {
        checkNotBuilt();
        group.mapOutputPort(externalName, node(node).id(), port);
        return this;
    }

    public SceneBuilder invert(String name) {
        checkNotBuilt();
        node(name).setInverted(true);
        return this;
    }

    // ── Build ───────────────────────────────────────────────────

    /**
     * Finishes the scene. The builder cannot be used afterwards.
     */
    public NodeGroup build() {
        checkNotBuilt();
        built = true;
        return group;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("SceneBuilder '" + group.name() + "' already built");
    }
}
