package com.optics.osg.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.light.LightResult;
import com.optics.osg.node.NodeGroup;

/**
 * Sequential ray tracing: a positioning pass with one alignment ray per
 * source, then one analysis pass with the configured bundles.
 */
public final class RayTraceAnalyzer implements Analyzer {
    private static final Logger log = LogManager.getLogger(RayTraceAnalyzer.class);

    private final RayTraceConfig config;

    public RayTraceAnalyzer() {
        this(RayTraceConfig.defaults());
    }

    public RayTraceAnalyzer(RayTraceConfig config) {
        this.config = config;
    }

    public RayTraceConfig config() {
        return config;
    }

    @Override
    public AnalyzerType type() {
        return AnalyzerType.RAY_TRACE;
    }

    @Override
    public AnalysisRun analyze(NodeGroup scene, SceneryResources resources, AnalysisListener listener) {
        log.info("Performing ray-tracing analysis of '{}' ({})", scene.name(), config);
        long start = System.nanoTime();
        AnalysisContext ctx = AnalysisContext.rayTrace(resources, config, listener);
        log.info("Calculating node positions of '{}'", scene.name());
        scene.analyze(LightResult.empty(), ctx.forPositioning());
        LightResult out = scene.analyze(LightResult.empty(), ctx);
        long duration = System.nanoTime() - start;
        log.info("Ray-tracing analysis of '{}' done in {} ms", scene.name(), duration / 1_000_000);
        return new AnalysisRun(type(), out, ctx.rayCollection(), duration);
    }
}
