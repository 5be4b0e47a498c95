package com.optics.osg.engine;

import com.optics.osg.api.OpticException;

/**
 * Ghost-focus settings.
 *
 * @param maxBounces highest number of reflections tracked; 0 traces only the
 *                   direct path
 */
public record GhostFocusConfig(int maxBounces) {

    public static final int DEFAULT_MAX_BOUNCES = 1;

    public GhostFocusConfig {
        if (maxBounces < 0)
            throw OpticException.other("maximum number of bounces must not be negative");
    }

    public static GhostFocusConfig defaults() {
        return new GhostFocusConfig(DEFAULT_MAX_BOUNCES);
    }
}
