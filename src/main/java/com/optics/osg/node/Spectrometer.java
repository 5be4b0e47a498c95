package com.optics.osg.node;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.spectrum.Spectra;
import com.optics.osg.spectrum.Spectrum;

/** Records the spectrum of the light passing through it. */
public final class Spectrometer extends PlaneNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private static final Logger log = LogManager.getLogger(Spectrometer.class);
    public static final String RESOLUTION = "resolution";

    private Spectrum spectrum;

    public Spectrometer(String name) {
        super("spectrometer", name);
        properties().create(RESOLUTION, "resolution in metres used for ray data", Spectra.DEFAULT_RESOLUTION,
                PropertyValidator.positive(), PropertyValidator.finite());
    }

    /** Spectrum seen in the last pass, null if no light arrived yet. */
    public Spectrum spectrum() {
        return spectrum;
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        double resolution = properties().getDouble(RESOLUTION);
        if (outgoing instanceof EnergyData e) {
            spectrum = e.spectrum().copy();
        } else if (outgoing instanceof GeometricData g) {
            spectrum = g.rays().nrOfValidRays() > 0 ? g.rays().toSpectrum(resolution) : null;
        } else if (outgoing instanceof GhostFocusData gf) {
            Spectrum merged = null;
            for (RayBundle b : gf.bundles()) {
                if (b.nrOfValidRays() == 0)
                    continue;
                Spectrum s = b.toSpectrum(resolution);
                merged = merged == null ? s : merged.merge(s);
            }
            spectrum = merged;
        }
        if (spectrum != null)
            log.debug("spectrometer '{}' recorded {}", name(), spectrum);
    }

    @Override
    protected void resetRecordedData() {
        spectrum = null;
    }

    @Override
    protected void addResults(NodeReport report) {
        if (spectrum == null)
            return;
        report.withResult("total energy", spectrum.totalEnergy());
        report.withResult("center wavelength", spectrum.centerWavelength());
    }
}
