package com.optics.osg.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.GhostFocusAnalyzable;
import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.ray.Ray;
import com.optics.osg.ray.RayBundle;

/**
 * Records where the rays cross its plane. Positions are kept in the plane's
 * local frame.
 */
public final class SpotDiagram extends PlaneNode implements RayTraceAnalyzable, GhostFocusAnalyzable {
    private final List<Point3d> spots = new ArrayList<>();

    public SpotDiagram(String name) {
        super("spot diagram", name);
    }

    /** Local positions of the valid rays seen in the last pass. */
    public List<Point3d> spots() {
        return Collections.unmodifiableList(spots);
    }

    /** Root mean square distance of the spots from their centroid. */
    public double rmsRadius() {
        if (spots.isEmpty())
            return 0.0;
        double cx = 0.0, cy = 0.0;
        for (Point3d p : spots) {
            cx += p.x;
            cy += p.y;
        }
        cx /= spots.size();
        cy /= spots.size();
        double sum = 0.0;
        for (Point3d p : spots)
            sum += (p.x - cx) * (p.x - cx) + (p.y - cy) * (p.y - cy);
        return Math.sqrt(sum / spots.size());
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        spots.clear();
        if (outgoing instanceof GeometricData g) {
            addSpots(g.rays());
        } else if (outgoing instanceof GhostFocusData gf) {
            for (RayBundle b : gf.bundles())
                addSpots(b);
        }
    }

    private void addSpots(RayBundle bundle) {
        for (Ray r : bundle)
            if (r.isValid())
                spots.add(plane().toLocal(r.position()));
    }

    @Override
    protected void resetRecordedData() {
        spots.clear();
    }

    @Override
    protected void addResults(NodeReport report) {
        report.withResult("spots", spots.size());
        if (!spots.isEmpty())
            report.withResult("rms radius", rmsRadius());
    }
}
