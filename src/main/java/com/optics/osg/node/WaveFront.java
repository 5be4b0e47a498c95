package com.optics.osg.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.optics.osg.api.RayTraceAnalyzable;
import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.LightData;

/**
 * Records the wavefront error of the bundle crossing its plane: per ray the
 * optical path difference to the chief ray, in waves.
 */
public final class WaveFront extends PlaneNode implements RayTraceAnalyzable {
    private final List<double[]> opd = new ArrayList<>();

    public WaveFront(String name) {
        super("wavefront monitor", name);
    }

    /** One {x, y, opd} entry per valid ray of the last pass. */
    public List<double[]> wavefrontError() {
        return Collections.unmodifiableList(opd);
    }

    /** Peak-to-valley optical path difference in waves. */
    public double peakToValley() {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double[] e : opd) {
            min = Math.min(min, e[2]);
            max = Math.max(max, e[2]);
        }
        return opd.isEmpty() ? 0.0 : max - min;
    }

    /** Root mean square optical path difference about its mean, in waves. */
    public double rms() {
        if (opd.isEmpty())
            return 0.0;
        double mean = 0.0;
        for (double[] e : opd)
            mean += e[2];
        mean /= opd.size();
        double sum = 0.0;
        for (double[] e : opd)
            sum += (e[2] - mean) * (e[2] - mean);
        return Math.sqrt(sum / opd.size());
    }

    @Override
    protected void record(LightData outgoing, AnalysisContext ctx) {
        if (outgoing instanceof GeometricData g) {
            opd.clear();
            opd.addAll(g.rays().wavefrontError(plane()));
        }
    }

    @Override
    protected void resetRecordedData() {
        opd.clear();
    }

    @Override
    protected void addResults(NodeReport report) {
        if (opd.isEmpty())
            return;
        report.withResult("peak to valley", peakToValley());
        report.withResult("rms", rms());
    }
}
