package com.optics.osg.light;

/**
 * Payload travelling along an edge during an analysis run. Which variant is
 * carried depends on the analyzer.
 */
public interface LightData {

    enum Kind {
        ENERGY,
        GEOMETRIC,
        GHOST_FOCUS,
        FOURIER
    }

    Kind kind();

    /** Deep copy; data is never shared between two nodes. */
    LightData copy();
}
