package com.optics.osg.light;

import java.util.ArrayList;
import java.util.List;

import com.optics.osg.ray.RayBundle;

/** Several ray bundles of possibly different bounce levels, used by ghost-focus analysis. */
public record GhostFocusData(List<RayBundle> bundles) implements LightData {

    @Override
    public Kind kind() {
        return Kind.GHOST_FOCUS;
    }

    @Override
    public GhostFocusData copy() {
        List<RayBundle> copied = new ArrayList<>(bundles.size());
        for (RayBundle b : bundles)
            copied.add(b.copy());
        return new GhostFocusData(copied);
    }
}
