package com.optics.osg.api;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.light.LightResult;

/** Node capability: spectral energy analysis. */
public interface EnergyAnalyzable {

    LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx);
}
