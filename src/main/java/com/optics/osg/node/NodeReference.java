package com.optics.osg.node;

import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.LightResult;
import com.optics.osg.surface.OpticSurface;

/**
 * Stands for another node a second time in the graph, e.g. a lens passed twice
 * in a double-pass setup. The light goes through the referenced node's
 * surfaces at the referenced node's position; only the inversion flag is the
 * reference's own.
 */
public final class NodeReference extends AbstractOpticNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private final OpticNode referent;

    public NodeReference(String name, OpticNode referent) {
        super("reference", name, referent.inputPorts(), referent.outputPorts());
        if (referent instanceof NodeReference)
            throw OpticException.graphStructure("a reference cannot point to another reference");
        this.referent = referent;
    }

    public OpticNode referent() {
        return referent;
    }

    @Override
    public boolean isInvertible() {
        return referent.isInvertible();
    }

    @Override
    public boolean isPositionable() {
        return false;
    }

    /** The surfaces belong to the referenced node and are reported there. */
    @Override
    public List<OpticSurface> surfaces() {
        return List.of();
    }

    @Override
    public LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx) {
        return delegate(inputs, ctx);
    }

    @Override
    public LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx) {
        return delegate(inputs, ctx);
    }

    @Override
    public LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx) {
        return delegate(inputs, ctx);
    }

    private LightResult delegate(LightResult inputs, AnalysisContext ctx) {
        boolean saved = referent.isInverted();
        if (saved == isInverted())
            return referent.analyze(inputs, ctx);
        referent.setInverted(isInverted());
        try {
            return referent.analyze(inputs, ctx);
        } finally {
            referent.setInverted(saved);
        }
    }

    @Override
    protected void addResults(NodeReport report) {
        report.withResult("referenced node", referent.name());
    }
}
