package com.optics.osg.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.vecmath.Point3d;

import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.LightData;
import com.optics.osg.ray.Ray;

/** Records the position history of every ray reaching it, for plotting ray paths. */
public final class RayPropagationVisualizer extends PlaneNode implements RayTraceAnalyzable {
    private final List<List<Point3d>> paths = new ArrayList<>();

    public RayPropagationVisualizer(String name) {
        super("ray propagation", name);
    }

    /** World positions of each ray, source first. */
    public List<List<Point3d>> paths() {
        return Collections.unmodifiableList(paths);
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        if (!(outgoing instanceof GeometricData g))
            return;
        paths.clear();
        for (Ray r : g.rays())
            paths.add(List.copyOf(r.positionHistory()));
    }

    @Override
    protected void resetRecordedData() {
        paths.clear();
    }

    @Override
    protected void addResults(NodeReport report) {
        report.withResult("rays", paths.size());
    }
}
