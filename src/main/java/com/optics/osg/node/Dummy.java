package com.optics.osg.node;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;

/** Does nothing to the light; rays are moved onto its plane. */
public final class Dummy extends PlaneNode implements EnergyAnalyzable, RayTraceAnalyzable, GhostFocusAnalyzable {

    public Dummy(String name) {
        super("dummy", name);
    }
}
