package com.optics.osg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.api.OpticNode;
import com.optics.osg.engine.AnalysisRun;
import com.optics.osg.engine.Analyzer;
import com.optics.osg.engine.SceneryResources;
import com.optics.osg.io.AnalysisReport;
import com.optics.osg.io.ReportWriter;
import com.optics.osg.node.NodeGroup;
import com.optics.osg.surface.OpticSurface;
import com.optics.osg.surface.hitmap.CriticalFluence;

/**
 * Top level entry point: a scene, the resources it is analyzed with and an
 * optional listener.
 *
 * <pre>
 * OpticScenery scenery = new OpticScenery(scene);
 * AnalysisRun run = scenery.analyze(new RayTraceAnalyzer());
 * scenery.writeReport(run, Path.of("report.json"));
 * </pre>
 */
@Log4j2
public final class OpticScenery {
    private final NodeGroup scene;
    private SceneryResources resources = SceneryResources.defaults();
    private AnalysisListener listener = AnalysisListener.NONE;
    private final ReportWriter writer = new ReportWriter();

    public OpticScenery(NodeGroup scene) {
        this.scene = scene;
    }

    public NodeGroup scene() {
        return scene;
    }

    public SceneryResources resources() {
        return resources;
    }

    public OpticScenery setResources(SceneryResources resources) {
        this.resources = resources;
        return this;
    }

    public OpticScenery setListener(AnalysisListener listener) {
        this.listener = listener != null ? listener : AnalysisListener.NONE;
        return this;
    }

    /**
     * Clears the data of a previous run, then runs {@code analyzer} over the
     * scene.
     */
    public AnalysisRun analyze(Analyzer analyzer) {
        resetData();
        AnalysisRun run = analyzer.analyze(scene, resources, listener);
        int damaged = criticalFluences().size();
        if (damaged > 0)
            log.warn("{} critical fluence event(s) found in '{}'", damaged, scene.name());
        return run;
    }

    public void resetData() {
        scene.resetData();
    }

    /** Summary of a run: node reports and damage events. */
    public AnalysisReport report(AnalysisRun run) {
        AnalysisReport report = new AnalysisReport();
        report.setScene(scene.name());
        report.setAnalyzer(run.mode().name());
        report.setDurationMillis(run.durationMillis());
        report.setCollectedBundles(run.rayCollection().size());
        report.getNodes().add(scene.report());
        report.setCriticalFluences(criticalFluences());
        return report;
    }

    public String reportJson(AnalysisRun run) {
        return writer.toJson(report(run));
    }

    public void writeReport(AnalysisRun run, Path path) throws IOException {
        writer.write(report(run), path);
    }

    /** Every critical-fluence event recorded on the scene's surfaces. */
    public List<AnalysisReport.DamageEntry> criticalFluences() {
        List<AnalysisReport.DamageEntry> entries = new ArrayList<>();
        collect(scene, entries);
        return entries;
    }

    private static void collect(OpticNode node, List<AnalysisReport.DamageEntry> entries) {
        if (node instanceof NodeGroup group) {
            for (OpticNode child : group.graph().nodes())
                collect(child, entries);
            return;
        }
        for (OpticSurface surface : node.surfaces())
            for (CriticalFluence cf : surface.hitMap().criticalFluences()) {
                AnalysisReport.DamageEntry e = new AnalysisReport.DamageEntry();
                e.setNode(node.name());
                e.setSurface(surface.name());
                e.setBundleId(cf.bundleId().toString());
                e.setBounce(cf.bounce());
                e.setPeakFluence(cf.peakFluence());
                e.setLidt(cf.lidt());
                entries.add(e);
            }
    }
}
