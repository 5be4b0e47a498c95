package com.optics.osg.ray.distribution;

import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.OpticException;

/** Distributes a total energy over ray start points. */
public interface EnergyDistribution {

    /** Per-point weights, not necessarily normalized. */
    double weight(Point3d point);

    /** Energies proportional to {@link #weight}, summing up to {@code totalEnergy}. */
    default double[] apply(List<Point3d> points, double totalEnergy) {
        if (!Double.isFinite(totalEnergy) || totalEnergy < 0.0)
            throw OpticException.other("energy must be positive and finite");
        double[] e = new double[points.size()];
        double sum = 0.0;
        for (int i = 0; i < e.length; i++) {
            e[i] = weight(points.get(i));
            sum += e[i];
        }
        if (!(sum > 0.0))
            throw OpticException.other("energy distribution has no weight on the given points");
        for (int i = 0; i < e.length; i++)
            e[i] *= totalEnergy / sum;
        return e;
    }

    static EnergyDistribution uniform() {
        return p -> 1.0;
    }

    /** Circular Gaussian of standard deviation {@code sigma} centred on the origin. */
    static EnergyDistribution gaussian(double sigma) {
        if (!Double.isFinite(sigma) || sigma <= 0.0)
            throw OpticException.other("sigma must be positive and finite");
        return p -> Math.exp(-(p.x * p.x + p.y * p.y) / (2.0 * sigma * sigma));
    }
}
