package com.optics.osg.api;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.light.LightResult;

/** Node capability: ghost-focus analysis tracking partial reflections. */
public interface GhostFocusAnalyzable {

    LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx);
}
