package com.optics.osg.engine;

import java.util.List;

import com.optics.osg.light.LightResult;
import com.optics.osg.ray.RayBundle;

/**
 * Outcome of an analyzer run.
 *
 * @param output        light at the scene's exit ports after the last pass
 * @param rayCollection bundles that left the scene through unconnected ports
 *                      (ghost-focus analysis only)
 */
public record AnalysisRun(AnalyzerType mode, LightResult output, List<RayBundle> rayCollection, long durationNanos) {

    public double durationMillis() {
        return durationNanos / 1e6;
    }
}
