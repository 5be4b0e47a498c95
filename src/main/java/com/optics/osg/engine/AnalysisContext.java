package com.optics.osg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.ray.MissedSurfaceStrategy;
import com.optics.osg.ray.RayBundle;

/**
 * Immutable snapshot of everything a node needs to know about the run it takes
 * part in: the analysis mode, the scene resources, mode specific settings and
 * the current pass. The only shared mutable part is the ray collection that
 * gathers bundles leaving the scene during ghost-focus analysis.
 */
public final class AnalysisContext {
    private final AnalyzerType mode;
    private final SceneryResources resources;
    private final RayTraceConfig rayTraceConfig;
    private final GhostFocusConfig ghostFocusConfig;
    private final boolean positioning;
    private final boolean backward;
    private final int pass;
    private final AnalysisListener listener;
    private final List<RayBundle> rayCollection;

    private AnalysisContext(AnalyzerType mode, SceneryResources resources, RayTraceConfig rayTraceConfig,
            GhostFocusConfig ghostFocusConfig, boolean positioning, boolean backward, int pass,
            AnalysisListener listener, List<RayBundle> rayCollection) {
        this.mode = mode;
        this.resources = resources;
        this.rayTraceConfig = rayTraceConfig;
        this.ghostFocusConfig = ghostFocusConfig;
        this.positioning = positioning;
        this.backward = backward;
        this.pass = pass;
        this.listener = listener != null ? listener : AnalysisListener.NONE;
        this.rayCollection = rayCollection;
    }

    public static AnalysisContext energy(SceneryResources resources, AnalysisListener listener) {
        return new AnalysisContext(AnalyzerType.ENERGY, resources, RayTraceConfig.defaults(),
                GhostFocusConfig.defaults(), false, false, 0, listener, new ArrayList<>());
    }

    public static AnalysisContext rayTrace(SceneryResources resources, RayTraceConfig config,
            AnalysisListener listener) {
        return new AnalysisContext(AnalyzerType.RAY_TRACE, resources, config, GhostFocusConfig.defaults(), false,
                false, 0, listener, new ArrayList<>());
    }

    public static AnalysisContext ghostFocus(SceneryResources resources, GhostFocusConfig config,
            RayTraceConfig rayTraceConfig, AnalysisListener listener) {
        return new AnalysisContext(AnalyzerType.GHOST_FOCUS, resources, rayTraceConfig, config, false, false, 0,
                listener, new ArrayList<>());
    }

    /**
     * Context of the positioning pass: ray-trace mode with a single alignment ray
     * per source, no hit recording and no energy threshold.
     */
    public AnalysisContext forPositioning() {
        return new AnalysisContext(AnalyzerType.RAY_TRACE, resources, rayTraceConfig, ghostFocusConfig, true, false,
                -1, listener, rayCollection);
    }

    /** Same run, another pass; {@code backward} passes walk the reversed traversal. */
    public AnalysisContext forPass(int pass, boolean backward) {
        return new AnalysisContext(mode, resources, rayTraceConfig, ghostFocusConfig, false, backward, pass,
                listener, rayCollection);
    }

    public AnalyzerType mode() {
        return mode;
    }

    public SceneryResources resources() {
        return resources;
    }

    public RayTraceConfig rayTraceConfig() {
        return rayTraceConfig;
    }

    public GhostFocusConfig ghostFocusConfig() {
        return ghostFocusConfig;
    }

    public boolean isPositioning() {
        return positioning;
    }

    public boolean isBackward() {
        return backward;
    }

    public int pass() {
        return pass;
    }

    public AnalysisListener listener() {
        return listener;
    }

    public MissedSurfaceStrategy missedSurfaceStrategy() {
        return rayTraceConfig.missedSurface();
    }

    /** Energy threshold below which rays are dropped; 0 while positioning. */
    public double minEnergyPerRay() {
        return positioning ? 0.0 : rayTraceConfig.minEnergyPerRay();
    }

    /** Whether surfaces record hits (and check fluence) in this pass. */
    public boolean recordsHits() {
        return !positioning;
    }

    /** Whether reflected bundles are kept for a later pass. */
    public boolean tracksGhosts() {
        return mode == AnalyzerType.GHOST_FOCUS && !positioning;
    }

    public void collect(RayBundle bundle) {
        rayCollection.add(bundle);
    }

    public List<RayBundle> rayCollection() {
        return Collections.unmodifiableList(rayCollection);
    }

    @Override
    public String toString() {
        return "AnalysisContext[" + mode + (positioning ? ", positioning" : "") + ", pass=" + pass
                + (backward ? ", backward" : "") + "]";
    }
}
