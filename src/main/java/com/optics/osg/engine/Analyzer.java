package com.optics.osg.engine;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.node.NodeGroup;

/** One analysis strategy over a whole scene. */
public interface Analyzer {

    AnalyzerType type();

    /**
     * Analyzes the scene rooted at {@code scene}.
     *
     * @throws com.optics.osg.api.OpticException of kind ANALYSIS naming the
     *                                           failing node
     */
    AnalysisRun analyze(NodeGroup scene, SceneryResources resources, AnalysisListener listener);

    default AnalysisRun analyze(NodeGroup scene) {
        return analyze(scene, SceneryResources.defaults(), AnalysisListener.NONE);
    }
}
