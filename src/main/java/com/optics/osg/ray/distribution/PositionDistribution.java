package com.optics.osg.ray.distribution;

import java.util.List;

import javax.vecmath.Point3d;

/** Ray start points in the x/y plane (z = 0). */
public interface PositionDistribution {

    List<Point3d> generate();

    /** Beam area covered by the distribution. */
    double area();

    /** Area each generated point stands for. */
    default double cellArea() {
        return area() / generate().size();
    }
}
