package com.optics.osg.engine;

import com.optics.osg.api.OpticException;
import com.optics.osg.geom.Units;
import com.optics.osg.ray.MissedSurfaceStrategy;

/**
 * Ray-trace settings.
 *
 * @param minEnergyPerRay rays below this energy (J) are invalidated
 * @param maxBounces      rays with more reflections are invalidated
 * @param maxRefractions  rays with more refractions are invalidated
 * @param missedSurface   treatment of rays missing a surface
 */
public record RayTraceConfig(double minEnergyPerRay, int maxBounces, int maxRefractions,
        MissedSurfaceStrategy missedSurface) {

    public static final double DEFAULT_MIN_ENERGY_PER_RAY = Units.PICOJOULE;
    public static final int DEFAULT_MAX_BOUNCES = 1000;
    public static final int DEFAULT_MAX_REFRACTIONS = 1000;

    public RayTraceConfig {
        if (!Double.isFinite(minEnergyPerRay) || minEnergyPerRay < 0.0)
            throw OpticException.other("minimum energy per ray must be >= 0.0 and finite");
        if (maxBounces < 0 || maxRefractions < 0)
            throw OpticException.other("maximum number of bounces and refractions must not be negative");
        if (missedSurface == null)
            throw OpticException.other("missed surface strategy must be given");
    }

    public static RayTraceConfig defaults() {
        return new RayTraceConfig(DEFAULT_MIN_ENERGY_PER_RAY, DEFAULT_MAX_BOUNCES, DEFAULT_MAX_REFRACTIONS,
                MissedSurfaceStrategy.STOP);
    }

    public RayTraceConfig withMinEnergyPerRay(double minEnergyPerRay) {
        return new RayTraceConfig(minEnergyPerRay, maxBounces, maxRefractions, missedSurface);
    }

    public RayTraceConfig withMaxBounces(int maxBounces) {
        return new RayTraceConfig(minEnergyPerRay, maxBounces, maxRefractions, missedSurface);
    }

    public RayTraceConfig withMaxRefractions(int maxRefractions) {
        return new RayTraceConfig(minEnergyPerRay, maxBounces, maxRefractions, missedSurface);
    }

    public RayTraceConfig withMissedSurface(MissedSurfaceStrategy missedSurface) {
        return new RayTraceConfig(minEnergyPerRay, maxBounces, maxRefractions, missedSurface);
    }
}
