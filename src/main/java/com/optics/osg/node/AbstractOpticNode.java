package com.optics.osg.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.geom.Pose;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.properties.PropertyStore;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.hitmap.CriticalFluence;
import com.optics.osg.surface.hitmap.FluenceEstimator;
import com.optics.osg.surface.hitmap.RaysHitMap;

/**
 * Shared state and plumbing of the node catalogue: identity, ports, inversion,
 * placement, surfaces and the dispatch from the analysis mode to the
 * capability interfaces a node implements.
 */
public abstract class AbstractOpticNode implements OpticNode {
    private static final Logger log = LogManager.getLogger(AbstractOpticNode.class);

    private final String id = UUID.randomUUID().toString();
    private final String nodeType;
    private final List<String> inputPorts;
    private final List<String> outputPorts;
    private final PropertyStore properties = new PropertyStore();
    private final List<OpticSurface> surfaces = new ArrayList<>();
    private String name;
    private boolean inverted;
    private Pose pose;
    private boolean fixedPose;
    private Pose alignmentOffset = Pose.identity();

    protected AbstractOpticNode(String nodeType, String name, List<String> inputPorts, List<String> outputPorts) {
        this.nodeType = nodeType;
        this.name = name;
        this.inputPorts = List.copyOf(inputPorts);
        this.outputPorts = List.copyOf(outputPorts);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void setName(String name) {
        if (name == null || name.isEmpty())
            throw OpticException.properties("node name must not be empty");
        this.name = name;
    }

    @Override
    public String nodeType() {
        return nodeType;
    }

    @Override
    public List<String> inputPorts() {
        return inputPorts;
    }

    @Override
    public List<String> outputPorts() {
        return outputPorts;
    }

    @Override
    public boolean isInverted() {
        return inverted;
    }

    @Override
    public void setInverted(boolean inverted) {
        if (inverted && !isInvertible())
            throw OpticException.graphStructure("node '" + name + "' (" + nodeType + ") cannot be inverted");
        this.inverted = inverted;
    }

    @Override
    public PropertyStore properties() {
        return properties;
    }

    @Override
    public Pose pose() {
        return pose;
    }

    @Override
    public void setPose(Pose pose) {
        this.pose = pose;
        for (OpticSurface s : surfaces)
            s.placeWithin(pose);
    }

    /**
     * Places the node explicitly. The positioning pass leaves nodes placed this
     * way where they are.
     */
    public void fixPose(Pose pose) {
        setPose(pose);
        fixedPose = true;
    }

    @Override
    public boolean isPositionable() {
        return !fixedPose;
    }

    @Override
    public Pose alignmentOffset() {
        return alignmentOffset;
    }

    @Override
    public void setAlignmentOffset(Pose offset) {
        this.alignmentOffset = offset;
    }

    @Override
    public List<OpticSurface> surfaces() {
        return Collections.unmodifiableList(surfaces);
    }

    /** Re-places the surfaces after a change of their local poses. */
    protected void placeSurfaces() {
        Pose nodePose = pose != null ? pose : Pose.identity();
        for (OpticSurface s : surfaces)
            s.placeWithin(nodePose);
    }

    protected OpticSurface addSurface(OpticSurface surface) {
        surfaces.add(surface);
        surface.placeWithin(pose != null ? pose : Pose.identity());
        return surface;
    }

    @Override
    public LightResult analyze(LightResult inputs, AnalysisContext ctx) {
        switch (ctx.mode()) {
            case ENERGY:
                if (this instanceof EnergyAnalyzable e)
                    return e.analyzeEnergy(inputs, ctx);
                break;
            case RAY_TRACE:
                if (this instanceof RayTraceAnalyzable r)
                    return r.analyzeRayTrace(inputs, ctx);
                break;
            case GHOST_FOCUS:
                if (this instanceof GhostFocusAnalyzable g)
                    return g.analyzeGhostFocus(inputs, ctx);
                break;
            default:
                break;
        }
        log.warn("node '{}' ({}) does not support {} analysis. Skipping.", name, nodeType, ctx.mode());
        return LightResult.empty();
    }

    @Override
    public void resetData() {
        for (OpticSurface s : surfaces)
            s.resetData();
        resetRecordedData();
    }

    /** Clears what a detector keeps between runs. */
    protected void resetRecordedData() {
    }

    @Override
    public NodeReport report() {
        NodeReport report = new NodeReport(name, nodeType, id).withProperties(properties);
        report.setInverted(isInverted());
        addResults(report);
        return report;
    }

    /** Adds recorded results to the report. */
    protected void addResults(NodeReport report) {
    }

    /** Whether light currently enters through the declared output ports. */
    protected boolean isReversed(AnalysisContext ctx) {
        return isInverted() ^ ctx.isBackward();
    }

    protected List<String> entryPorts(AnalysisContext ctx) {
        return isReversed(ctx) ? outputPorts() : inputPorts();
    }

    protected List<String> exitPorts(AnalysisContext ctx) {
        return isReversed(ctx) ? inputPorts() : outputPorts();
    }

    protected static EnergyData energyData(LightData data, String port) {
        if (data instanceof EnergyData e)
            return e;
        throw mismatch(data, port, LightData.Kind.ENERGY);
    }

    protected static GeometricData geometricData(LightData data, String port) {
        if (data instanceof GeometricData g)
            return g;
        throw mismatch(data, port, LightData.Kind.GEOMETRIC);
    }

    protected static GhostFocusData ghostFocusData(LightData data, String port) {
        if (data instanceof GhostFocusData g)
            return g;
        throw mismatch(data, port, LightData.Kind.GHOST_FOCUS);
    }

    private static OpticException mismatch(LightData data, String port, LightData.Kind expected) {
        return OpticException.analysis("expected " + expected + " data at port '" + port + "', got " + data.kind());
    }

    /**
     * Compares the peak fluence a bundle left on a surface with the surface's
     * damage threshold and records a critical-fluence event if it is exceeded.
     */
    protected void checkFluence(OpticSurface surface, RayBundle bundle, AnalysisContext ctx) {
        if (!ctx.recordsHits())
            return;
        FluenceEstimator estimator = ctx.resources().getFluenceEstimator();
        for (int bounce : surface.hitMap().bounceLevels()) {
            RaysHitMap hits = surface.hitMap().get(bounce, bundle.id());
            if (hits == null || hits.size() < 3)
                continue;
            double peak;
            try {
                peak = hits.peakFluence(estimator);
            } catch (OpticException e) {
                log.warn("fluence on surface '{}' of node '{}' could not be estimated: {}", surface.name(), name,
                        e.getMessage());
                continue;
            }
            if (peak <= surface.lidt())
                continue;
            CriticalFluence event = new CriticalFluence(bundle.id(), bounce, peak, surface.lidt());
            if (surface.hitMap().addCriticalFluence(event))
                log.warn("fluence {} J/m² on surface '{}' of node '{}' exceeds the LIDT of {} J/m²", peak,
                        surface.name(), name, surface.lidt());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + (isInverted() ? ", inverted" : "") + "]";
    }
}
