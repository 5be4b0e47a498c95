package com.optics.osg.api;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.light.LightResult;

/** Node capability: geometric ray tracing. Also used by the positioning pass. */
public interface RayTraceAnalyzable {

    LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx);
}
