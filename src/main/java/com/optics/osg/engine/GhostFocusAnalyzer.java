package com.optics.osg.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.light.LightResult;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.surface.OpticSurface;

/**
 * Ghost-focus analysis: tracks the light reflected back and forth between
 * partially reflecting surfaces.
 *
 * <p>
 * Pass 0 runs forward from the sources. Every partially reflecting surface
 * parks the bundles it reflects. Pass {@code k} runs over the reversed
 * traversal for odd {@code k}, forward for even {@code k}, and releases the
 * parked bundles of the previous pass at their surface. After
 * {@code maxBounces + 1} passes every reflection order up to the limit has
 * been followed; bundles leaving the scene are gathered in the run's ray
 * collection.
 */
public final class GhostFocusAnalyzer implements Analyzer {
    private static final Logger log = LogManager.getLogger(GhostFocusAnalyzer.class);

    private final GhostFocusConfig config;
    private final RayTraceConfig rayTraceConfig;

    public GhostFocusAnalyzer() {
        this(GhostFocusConfig.defaults());
    }

    public GhostFocusAnalyzer(GhostFocusConfig config) {
        this(config, RayTraceConfig.defaults());
    }

    public GhostFocusAnalyzer(GhostFocusConfig config, RayTraceConfig rayTraceConfig) {
        this.config = config;
        this.rayTraceConfig = rayTraceConfig;
    }

    public GhostFocusConfig config() {
        return config;
    }

    @Override
    public AnalyzerType type() {
        return AnalyzerType.GHOST_FOCUS;
    }

    @Override
    public AnalysisRun analyze(NodeGroup scene, SceneryResources resources, AnalysisListener listener) {
        log.info("Performing ghost-focus analysis of '{}' up to {} bounces", scene.name(), config.maxBounces());
        long start = System.nanoTime();
        AnalysisContext ctx = AnalysisContext.ghostFocus(resources, config, rayTraceConfig, listener);
        log.info("Calculating node positions of '{}'", scene.name());
        scene.analyze(LightResult.empty(), ctx.forPositioning());
        for (OpticSurface s : scene.surfaces())
            s.clearCaches();

        LightResult out = LightResult.empty();
        for (int pass = 0; pass <= config.maxBounces(); pass++) {
            boolean backward = pass % 2 == 1;
            log.info("Ghost-focus pass {} ({})", pass, backward ? "backward" : "forward");
            out = scene.analyze(LightResult.empty(), ctx.forPass(pass, backward));
        }
        for (OpticSurface s : scene.surfaces())
            s.clearCaches();
        long duration = System.nanoTime() - start;
        log.info("Ghost-focus analysis of '{}' done in {} ms, {} bundles collected", scene.name(),
                duration / 1_000_000, ctx.rayCollection().size());
        return new AnalysisRun(type(), out, ctx.rayCollection(), duration);
    }
}
