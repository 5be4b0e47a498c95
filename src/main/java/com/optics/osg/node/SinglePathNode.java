package com.optics.osg.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;
import com.optics.osg.surface.GeoSurface;
import com.optics.osg.surface.Plane;
import com.optics.osg.surface.Sphere;

/**
 * A node with one input and one output whose effect on rays is a sequence of
 * surface interactions, its optical train. The train is walked backwards when
 * the node is effectively reversed.
 *
 * <p>
 * In ghost-focus analysis every bundle reflected by a partially reflecting
 * surface is parked at that surface for the next pass, and the bundles parked
 * there by the previous pass join the light right after the surface.
 *
 * <p>
 * The analysis methods are public but the capability interfaces are declared by
 * the concrete nodes, so each node states which modes it supports.
 */
public abstract class SinglePathNode extends AbstractOpticNode {

    protected SinglePathNode(String nodeType, String name) {
        super(nodeType, name, OpticPorts.SINGLE_INPUT, OpticPorts.SINGLE_OUTPUT);
    }

    /** Surfaces and interactions in forward order, built from the current properties. */
    protected abstract List<TrainStep> opticalTrain(AnalysisContext ctx);

    /** A sphere of the given radius, or a plane for an infinite radius. */
    protected static GeoSurface sphereOrPlane(double radius) {
        return Double.isInfinite(radius) ? Plane.INSTANCE : new Sphere(radius);
    }

    /** Energy mode: lossless pass-through unless overridden. */
    protected Spectrum transformSpectrum(Spectrum spectrum, AnalysisContext ctx) {
        return spectrum;
    }

    /** Hook for detectors: called with the outgoing light of a pass. */
    protected void record(LightData outgoing, AnalysisContext ctx) {
    }

    protected String entryPort(AnalysisContext ctx) {
        return isReversed(ctx) ? OpticPorts.OUTPUT_1 : OpticPorts.INPUT_1;
    }

    protected String exitPort(AnalysisContext ctx) {
        return isReversed(ctx) ? OpticPorts.INPUT_1 : OpticPorts.OUTPUT_1;
    }

    public LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx) {
        String port = entryPort(ctx);
        LightData data = inputs.get(port);
        if (data == null)
            return LightResult.empty();
        EnergyData out = new EnergyData(transformSpectrum(energyData(data, port).spectrum(), ctx));
        record(out, ctx);
        return LightResult.of(exitPort(ctx), out);
    }

    public LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx) {
        String port = entryPort(ctx);
        LightData data = inputs.get(port);
        if (data == null)
            return LightResult.empty();
        RayBundle bundle = geometricData(data, port).rays();
        for (TrainStep step : train(ctx)) {
            step.interaction().apply(bundle, step.surface(), step.next(isReversed(ctx)), ctx);
            checkFluence(step.surface(), bundle, ctx);
        }
        transformRays(bundle, ctx);
        GeometricData out = new GeometricData(bundle);
        if (!ctx.isPositioning())
            record(out, ctx);
        return LightResult.of(exitPort(ctx), out);
    }

    public LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx) {
        String port = entryPort(ctx);
        LightData data = inputs.get(port);
        List<RayBundle> bundles = new ArrayList<>();
        if (data != null)
            bundles.addAll(ghostFocusData(data, port).bundles());
        int maxBounces = ctx.ghostFocusConfig().maxBounces();
        boolean reversed = isReversed(ctx);
        for (TrainStep step : train(ctx)) {
            for (RayBundle bundle : bundles) {
                RayBundle reflected = step.interaction().apply(bundle, step.surface(), step.next(reversed), ctx);
                checkFluence(step.surface(), bundle, ctx);
                if (reflected != null && reflected.bounceLevel() <= maxBounces) {
                    reflected.removeByNrOfBounces(maxBounces);
                    if (reflected.nrOfValidRays() > 0)
                        step.surface().addToCache(reflected, !ctx.isBackward());
                }
            }
            bundles.addAll(step.surface().drainCache(ctx.isBackward()));
        }
        for (RayBundle bundle : bundles)
            transformRays(bundle, ctx);
        if (bundles.isEmpty())
            return LightResult.empty();
        GhostFocusData out = new GhostFocusData(bundles);
        record(out, ctx);
        return LightResult.of(exitPort(ctx), out);
    }

    /** Ray-level effect applied after the train, e.g. an attenuating filter. */
    protected void transformRays(RayBundle bundle, AnalysisContext ctx) {
    }

    private List<TrainStep> train(AnalysisContext ctx) {
        List<TrainStep> train = new ArrayList<>(opticalTrain(ctx));
        if (isReversed(ctx))
            Collections.reverse(train);
        return train;
    }
}
