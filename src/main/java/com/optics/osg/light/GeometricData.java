package com.optics.osg.light;

import com.optics.osg.ray.RayBundle;

/** A single ray bundle, used by ray-trace analysis. */
public record GeometricData(RayBundle rays) implements LightData {

    @Override
    public Kind kind() {
        return Kind.GEOMETRIC;
    }

    @Override
    public GeometricData copy() {
        return new GeometricData(rays.copy());
    }
}
