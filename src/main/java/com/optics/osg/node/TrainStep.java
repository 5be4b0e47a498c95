package com.optics.osg.node;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.OpticSurface;

/**
 * One surface of a node's optical train with the media on both of its sides,
 * in forward travel order.
 */
record TrainStep(OpticSurface surface, RefractiveIndex before, RefractiveIndex after, Interaction interaction) {

    /** What the surface does to a bundle. */
    @FunctionalInterface
    interface Interaction {
        /**
         * @param next medium the bundle enters at the surface
         * @return bundle reflected by the coating, or null
         */
        RayBundle apply(RayBundle bundle, OpticSurface surface, RefractiveIndex next, AnalysisContext ctx);
    }

    static TrainStep refract(OpticSurface surface, RefractiveIndex before, RefractiveIndex after) {
        return new TrainStep(surface, before, after, (b, s, next, ctx) -> {
            RayBundle reflected = b.refractOnSurface(s, next, true, ctx.missedSurfaceStrategy(), ctx.recordsHits());
            b.apodize(s);
            // the alignment ray keeps going whatever the coating takes
            if (!ctx.isPositioning())
                b.invalidateByThreshold(ctx.minEnergyPerRay());
            return reflected;
        });
    }

    static TrainStep reflect(OpticSurface surface, RefractiveIndex medium) {
        return new TrainStep(surface, medium, medium, (b, s, next, ctx) -> {
            b.refractOnSurface(s, next, false, ctx.missedSurfaceStrategy(), ctx.recordsHits());
            b.apodize(s);
            return null;
        });
    }

    /** Rays are moved onto the surface and recorded, nothing else. */
    static TrainStep detect(OpticSurface surface, RefractiveIndex medium) {
        return new TrainStep(surface, medium, medium, (b, s, next, ctx) -> {
            b.passThrough(s, ctx.missedSurfaceStrategy(), ctx.recordsHits());
            b.apodize(s);
            return null;
        });
    }

    RefractiveIndex next(boolean reversed) {
        return reversed ? before : after;
    }
}
