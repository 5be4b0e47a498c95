package com.optics.osg.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.light.LightResult;
import com.optics.osg.node.NodeGroup;

/** Propagates spectra only; geometry and apertures are ignored. */
public final class EnergyAnalyzer implements Analyzer {
    private static final Logger log = LogManager.getLogger(EnergyAnalyzer.class);

    @Override
    public AnalyzerType type() {
        return AnalyzerType.ENERGY;
    }

    @Override
    public AnalysisRun analyze(NodeGroup scene, SceneryResources resources, AnalysisListener listener) {
        log.info("Performing energy analysis of '{}'", scene.name());
        long start = System.nanoTime();
        AnalysisContext ctx = AnalysisContext.energy(resources, listener);
        LightResult out = scene.analyze(LightResult.empty(), ctx);
        long duration = System.nanoTime() - start;
        log.info("Energy analysis of '{}' done in {} ms", scene.name(), duration / 1_000_000);
        return new AnalysisRun(type(), out, ctx.rayCollection(), duration);
    }
}
