package com.optics.osg.node;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.OpticException;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.properties.PropertyValidator;
import com.optics.osg.ray.RayBundle;
import com.optics.osg.surface.hitmap.FluenceData;
import com.optics.osg.surface.hitmap.FluenceEstimator;
import com.optics.osg.surface.hitmap.RaysHitMap;

/**
 * Computes the fluence distribution of the light crossing its plane from the
 * hits recorded there, with a configurable estimator.
 */
public final class FluenceDetector extends PlaneNode implements RayTraceAnalyzable, GhostFocusAnalyzable {
    private static final Logger log = LogManager.getLogger(FluenceDetector.class);
    public static final String ESTIMATOR = "fluence estimator";
    public static final String GRID_SIZE = "grid size";

    private final List<UUID> bundleIds = new ArrayList<>();

    public FluenceDetector(String name) {
        this(name, FluenceEstimator.VORONOI);
    }

    public FluenceDetector(String name, FluenceEstimator estimator) {
        super("fluence detector", name);
        properties().create(ESTIMATOR, "estimator used for the fluence map", FluenceEstimator.class, estimator);
        properties().create(GRID_SIZE, "number of map cells per axis", 101, PropertyValidator.positive());
    }

    public FluenceEstimator estimator() {
        return properties().get(ESTIMATOR, FluenceEstimator.class);
    }

    /** All hits of the last pass's bundles on the detector plane. */
    public RaysHitMap hits() {
        RaysHitMap merged = new RaysHitMap();
        for (int bounce : plane().hitMap().bounceLevels())
            for (UUID id : bundleIds) {
                RaysHitMap m = plane().hitMap().get(bounce, id);
                if (m != null)
                    merged.merge(m);
            }
        return merged;
    }

    /**
     * Fluence map of the recorded hits.
     *
     * @throws OpticException of kind ANALYSIS if too few rays were recorded
     */
    public FluenceData fluenceData() {
        RaysHitMap hits = hits();
        if (hits.isEmpty())
            throw OpticException.analysis("fluence detector '" + name() + "' has no recorded hits");
        int n = properties().getInt(GRID_SIZE);
        return hits.fluenceMap(estimator(), n, n);
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        if (!ctx.recordsHits())
            return;
        bundleIds.clear();
        if (outgoing instanceof GeometricData g) {
            bundleIds.add(g.rays().id());
        } else if (outgoing instanceof GhostFocusData gf) {
            for (RayBundle b : gf.bundles())
                bundleIds.add(b.id());
        }
    }

    @Override
    protected void resetRecordedData() {
        bundleIds.clear();
    }

    @Override
    protected void addResults(NodeReport report) {
        RaysHitMap hits = hits();
        if (hits.size() < 3)
            return;
        report.withResult("total energy", hits.totalEnergy());
        try {
            FluenceData data = fluenceData();
            report.withResult("peak fluence", data.peak());
            report.withResult("average fluence", data.average());
        } catch (OpticException e) {
            log.warn("no fluence map for detector '{}': {}", name(), e.getMessage());
            report.withResult("fluence error", e.getMessage());
        }
    }
}
