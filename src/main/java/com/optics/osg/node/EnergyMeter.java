package com.optics.osg.node;

import com.optics.osg.api.EnergyAnalyzable;
import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.EnergyData;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.ray.RayBundle;

/** Records the total energy passing through it. */
public final class EnergyMeter extends PlaneNode implements EnergyAnalyzable, RayTraceAnalyzable,
        GhostFocusAnalyzable {
    private Double totalEnergy;

    public EnergyMeter(String name) {
        super("energy meter", name);
    }

    /** Energy seen in the last pass, null if no light arrived yet. */
    public Double totalEnergy() {
        return totalEnergy;
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        if (outgoing instanceof EnergyData e) {
            totalEnergy = e.spectrum().totalEnergy();
        } else if (outgoing instanceof GeometricData g) {
            totalEnergy = g.rays().totalEnergy();
        } else if (outgoing instanceof GhostFocusData gf) {
            double sum = 0.0;
            for (RayBundle b : gf.bundles())
                sum += b.totalEnergy();
            totalEnergy = sum;
        }
    }

    @Override
    protected void resetRecordedData() {
        totalEnergy = null;
    }

    @Override
    protected void addResults(NodeReport report) {
        if (totalEnergy != null)
            report.withResult("total energy", totalEnergy);
    }
}
