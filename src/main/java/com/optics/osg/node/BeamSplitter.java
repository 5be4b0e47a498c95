package com.optics.osg.node;

import java.util.ArrayList;
import java.util.List;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectrum;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.Plane;

/**
 * Ideal beam splitter with two inputs and two outputs. The light of each input
 * is split into a transmitted share (the ratio) and a reflected share; output
 * 1 carries transmitted 1 plus reflected 2, output 2 carries transmitted 2
 * plus reflected 1. Rays keep their direction; the split is in energy only.
 */
public final class BeamSplitter extends AbstractOpticNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    public static final String SPLITTER = "splitter config";

    private final OpticSurface plane;

    public BeamSplitter(String name, SplittingConfig config) {
        super("beam splitter", name, List.of(OpticPorts.INPUT_1, OpticPorts.INPUT_2),
                List.of(OpticPorts.OUT1_TRANS1_REFL2, OpticPorts.OUT2_TRANS2_REFL1));
        properties().create(SPLITTER, "split ratio (transmitted share)", SplittingConfig.class, config);
        this.plane = addSurface(new OpticSurface("splitter", Plane.INSTANCE));
    }

    public BeamSplitter(String name, double ratio) {
        this(name, SplittingConfig.ratio(ratio));
    }

    public SplittingConfig splittingConfig() {
        return properties().get(SPLITTER, SplittingConfig.class);
    }

    @Override
    public LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx) {
        List<String> in = entryPorts(ctx);
        List<String> out = exitPorts(ctx);
        SplittingConfig cfg = splittingConfig();
        Spectrum out1 = null, out2 = null;
        LightData d1 = inputs.get(in.get(0));
        if (d1 != null) {
            Spectrum trans1 = energyData(d1, in.get(0)).spectrum();
            out2 = cfg.split(trans1);
            out1 = trans1;
        }
        LightData d2 = inputs.get(in.get(1));
        if (d2 != null) {
            Spectrum trans2 = energyData(d2, in.get(1)).spectrum();
            Spectrum refl2 = cfg.split(trans2);
            out1 = out1 == null ? refl2 : out1.merge(refl2);
            out2 = out2 == null ? trans2 : out2.merge(trans2);
        }
        LightResult result = LightResult.empty();
        if (out1 != null)
            result.put(out.get(0), new EnergyData(out1));
        if (out2 != null)
            result.put(out.get(1), new EnergyData(out2));
        return result;
    }

    @Override
    public LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx) {
        List<String> in = entryPorts(ctx);
        List<String> out = exitPorts(ctx);
        RayBundle out1 = null, out2 = null;
        LightData d1 = inputs.get(in.get(0));
        if (d1 != null) {
            RayBundle trans1 = onPlane(geometricData(d1, in.get(0)).rays(), ctx);
            out2 = splittingConfig().split(trans1);
            out1 = trans1;
        }
        LightData d2 = inputs.get(in.get(1));
        if (d2 != null) {
            RayBundle trans2 = onPlane(geometricData(d2, in.get(1)).rays(), ctx);
            RayBundle refl2 = splittingConfig().split(trans2);
            out1 = merged(out1, refl2);
            out2 = merged(out2, trans2);
        }
        LightResult result = LightResult.empty();
        if (out1 != null)
            result.put(out.get(0), new GeometricData(out1));
        if (out2 != null)
            result.put(out.get(1), new GeometricData(out2));
        return result;
    }

    @Override
    public LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx) {
        List<String> in = entryPorts(ctx);
        List<String> out = exitPorts(ctx);
        List<RayBundle> out1 = new ArrayList<>(), out2 = new ArrayList<>();
        LightData d1 = inputs.get(in.get(0));
        if (d1 != null)
            for (RayBundle b : ghostFocusData(d1, in.get(0)).bundles()) {
                RayBundle trans1 = onPlane(b, ctx);
                out2.add(splittingConfig().split(trans1));
                out1.add(trans1);
            }
        LightData d2 = inputs.get(in.get(1));
        if (d2 != null)
            for (RayBundle b : ghostFocusData(d2, in.get(1)).bundles()) {
                RayBundle trans2 = onPlane(b, ctx);
                out1.add(splittingConfig().split(trans2));
                out2.add(trans2);
            }
        LightResult result = LightResult.empty();
        if (!out1.isEmpty())
            result.put(out.get(0), new GhostFocusData(out1));
        if (!out2.isEmpty())
            result.put(out.get(1), new GhostFocusData(out2));
        return result;
    }

    private RayBundle onPlane(RayBundle bundle, AnalysisContext ctx) {
        bundle.passThrough(plane, ctx.missedSurfaceStrategy(), ctx.recordsHits());
        bundle.apodize(plane);
        checkFluence(plane, bundle, ctx);
        return bundle;
    }

    private static RayBundle merged(RayBundle a, RayBundle b) {
        if (a == null)
            return b;
        a.merge(b);
        return a;
    }
}
