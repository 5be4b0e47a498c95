package com.optics.osg.node;

import java.util.ArrayList;
import java.util.List;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.OpticException;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.geom.Pose;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.ray.Ray;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectra;
import com.optics.osg.spectrum.Spectrum;

/**
 * Emits its configured light: a spectrum for energy analysis, a ray bundle for
 * ray tracing. Bundles are defined in the source's own frame (travelling
 * along +z from the origin) and moved by the source's pose.
 *
 * <p>
 * A source cannot be inverted. In backward ghost-focus passes it absorbs the
 * light coming back and adds it to the run's ray collection.
 */
public final class Source extends AbstractOpticNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private static final Logger log = LogManager.getLogger(Source.class);
    public static final String LIGHT_DATA = "light data";

    public Source(String name, LightData light) {
        super("source", name, List.of(), OpticPorts.SINGLE_OUTPUT);
        if (!(light instanceof EnergyData) && !(light instanceof GeometricData))
            throw OpticException.properties("a source emits energy or geometric data, not " + light.kind());
        properties().create(LIGHT_DATA, "data emitted by this source", LightData.class, light);
    }

    public static Source ofSpectrum(String name, Spectrum spectrum) {
        return new Source(name, new EnergyData(spectrum));
    }

    public static Source ofRays(String name, RayBundle rays) {
        return new Source(name, new GeometricData(rays));
    }

    public LightData light() {
        return properties().get(LIGHT_DATA, LightData.class);
    }

    public void setLight(LightData light) {
        properties().set(LIGHT_DATA, light);
    }

    @Override
    public boolean isInvertible() {
        return false;
    }

    @Override
    public boolean isPositionable() {
        return false;
    }

    @Override
    public LightResult analyzeEnergy(LightResult inputs, AnalysisContext ctx) {
        if (isReversed(ctx))
            return LightResult.empty();
        Spectrum spectrum = light() instanceof GeometricData g ? g.rays().toSpectrum(Spectra.DEFAULT_RESOLUTION)
                : energyData(light(), OpticPorts.OUTPUT_1).spectrum().copy();
        return LightResult.of(OpticPorts.OUTPUT_1, new EnergyData(spectrum));
    }

    @Override
    public LightResult analyzeRayTrace(LightResult inputs, AnalysisContext ctx) {
        if (isReversed(ctx))
            return LightResult.empty();
        RayBundle bundle = ctx.isPositioning() ? alignmentRay(ctx) : emittedRays();
        Pose pose = pose() != null ? pose() : Pose.identity();
        bundle.transform(pose);
        for (Ray r : bundle)
            r.setRefractiveIndex(ctx.resources().ambientIndexAt(r.wavelength()));
        return LightResult.of(OpticPorts.OUTPUT_1, new GeometricData(bundle));
    }

    @Override
    public LightResult analyzeGhostFocus(LightResult inputs, AnalysisContext ctx) {
        if (isReversed(ctx)) {
            LightData back = inputs.get(OpticPorts.OUTPUT_1);
            if (back != null) {
                for (RayBundle b : ghostFocusData(back, OpticPorts.OUTPUT_1).bundles())
                    ctx.collect(b);
            }
            return LightResult.empty();
        }
        if (ctx.pass() != 0)
            return LightResult.empty();
        RayBundle bundle = emittedRays();
        bundle.transform(pose() != null ? pose() : Pose.identity());
        for (Ray r : bundle)
            r.setRefractiveIndex(ctx.resources().ambientIndexAt(r.wavelength()));
        return LightResult.of(OpticPorts.OUTPUT_1, new GhostFocusData(new ArrayList<>(List.of(bundle))));
    }

    private RayBundle emittedRays() {
        LightData light = light();
        if (light instanceof GeometricData g)
            return g.rays().copy();
        throw OpticException.analysis("source '" + name() + "' emits " + light.kind()
                + " data, ray tracing needs a ray bundle");
    }

    /** One ray along the source axis at the alignment wavelength. */
    private RayBundle alignmentRay(AnalysisContext ctx) {
        RayBundle bundle = new RayBundle();
        bundle.add(new Ray(new Point3d(), new Vector3d(0, 0, 1), ctx.resources().getAlignmentWavelength(), 1.0));
        log.debug("source '{}' emits alignment ray", name());
        return bundle;
    }

    @Override
    protected void addResults(NodeReport report) {
        LightData light = light();
        if (light instanceof EnergyData e)
            report.withResult("total energy", e.spectrum().totalEnergy());
        else if (light instanceof GeometricData g) {
            report.withResult("total energy", g.rays().totalEnergy());
            report.withResult("rays", g.rays().size());
        }
    }
}
