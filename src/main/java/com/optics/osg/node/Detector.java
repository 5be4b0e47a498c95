package com.optics.osg.node;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.LightData;

/** Keeps a copy of whatever light passed through it last. */
public final class Detector extends PlaneNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private LightData lastSeen;

    public Detector(String name) {
        super("detector", name);
    }

    /** Light of the last pass, null if nothing arrived yet. */
    public LightData lastSeen() {
        return lastSeen;
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        lastSeen = outgoing.copy();
    }

    @Override
    protected void resetRecordedData() {
        lastSeen = null;
    }

    @Override
    protected void addResults(NodeReport report) {
        if (lastSeen != null)
            report.withResult("light data", lastSeen.kind());
    }
}
