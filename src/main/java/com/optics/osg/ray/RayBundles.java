package com.optics.osg.ray;

import java.util.List;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import com.optics.osg.api.OpticException;
import com.optics.osg.ray.distribution.EnergyDistribution;
import com.optics.osg.ray.distribution.Hexapolar;
import com.optics.osg.ray.distribution.PositionDistribution;

/** Factory methods for ray bundles starting in the x/y plane and travelling along +z. */
public final class RayBundles {
    private RayBundles() {
        // Utility class
    }

    public static RayBundle singleRay(double wavelength, double energy) {
        RayBundle b = new RayBundle();
        b.add(new Ray(new Point3d(), new Vector3d(0, 0, 1), wavelength, energy));
        return b;
    }

    /** Parallel rays along +z. */
    public static RayBundle collimated(double wavelength, double totalEnergy, PositionDistribution positions,
            EnergyDistribution energies) {
        List<Point3d> points = positions.generate();
        double[] e = energies.apply(points, totalEnergy);
        RayBundle b = new RayBundle();
        for (int i = 0; i < points.size(); i++)
            b.add(new Ray(points.get(i), new Vector3d(0, 0, 1), wavelength, e[i]));
        return b;
    }

    /** Collimated bundle whose rays carry helper rays for fluence estimation. */
    public static RayBundle collimatedWithHelpers(double wavelength, double totalEnergy,
            PositionDistribution positions, EnergyDistribution energies) {
        RayBundle b = collimated(wavelength, totalEnergy, positions, energies);
        b.attachHelperRays(positions.cellArea());
        return b;
    }

    /**
     * Rays diverging from the origin into a cone of full opening angle
     * {@code coneAngle}, directions arranged hexapolar.
     */
    public static RayBundle pointSource(double wavelength, double totalEnergy, double coneAngle, int rings) {
        if (!Double.isFinite(coneAngle) || coneAngle < 0.0 || coneAngle >= Math.PI)
            throw OpticException.other("cone angle must be within [0, 180°)");
        List<Point3d> dirs = new Hexapolar(Math.tan(coneAngle / 2.0), rings).generate();
        double[] e = EnergyDistribution.uniform().apply(dirs, totalEnergy);
        RayBundle b = new RayBundle();
        for (int i = 0; i < dirs.size(); i++) {
            Point3d d = dirs.get(i);
            b.add(new Ray(new Point3d(), new Vector3d(d.x, d.y, 1.0), wavelength, e[i]));
        }
        return b;
    }
}
