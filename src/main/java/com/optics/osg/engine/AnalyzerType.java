package com.optics.osg.engine;

/** Available analysis strategies. */
public enum AnalyzerType {
    ENERGY,
    RAY_TRACE,
    GHOST_FOCUS
}
