package com.optics.osg.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.AnalysisListener;

/**
 * Collects timing per node and per pass, and the errors reported during a run.
 * Statistics accumulate over runs until {@link #reset()}.
 */
public final class AnalysisStatsListener implements AnalysisListener {
    private static final Logger log = LogManager.getLogger(AnalysisStatsListener.class);

    /** Timing of one node over all passes it took part in. */
    public static final class NodeStats {
        private final String name, type;
        private long count, totalNanos;
        private long minNanos = Long.MAX_VALUE, maxNanos = Long.MIN_VALUE;

        NodeStats(String name, String type) {
            this.name = name;
            this.type = type;
        }

        void update(long duration) {
            count++;
            totalNanos += duration;
            minNanos = Math.min(minNanos, duration);
            maxNanos = Math.max(maxNanos, duration);
        }

        public String name() {
            return name;
        }

        public String type() {
            return type;
        }

        public long count() {
            return count;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalNanos / (double) count / 1000.0;
        }

        public long minNanos() {
            return count == 0 ? 0 : minNanos;
        }

        public long maxNanos() {
            return count == 0 ? 0 : maxNanos;
        }
    }

    private final Map<String, NodeStats> nodes = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<Integer, Integer> nodesPerPass = new LinkedHashMap<>();
    private int groupWalks;

    @Override
    public void onAnalysisStart(int pass, String groupName) {
        groupWalks++;
    }

    @Override
    public void onNodeAnalyzed(int pass, String nodeName, String nodeType, long durationNanos) {
        nodes.computeIfAbsent(nodeName + " (" + nodeType + ")", k -> new NodeStats(nodeName, nodeType))
                .update(durationNanos);
    }

    @Override
    public void onNodeError(int pass, String nodeName, String nodeType, Throwable error) {
        String message = String.format("pass %d: node '%s' (%s) failed: %s", pass, nodeName, nodeType,
                error.getMessage());
        errors.add(message);
        log.error(message);
    }

    @Override
    public void onAnalysisEnd(int pass, String groupName, int nodesAnalyzed) {
        nodesPerPass.merge(pass, nodesAnalyzed, Integer::sum);
    }

    public List<NodeStats> nodeStats() {
        return List.copyOf(nodes.values());
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Nodes analyzed per pass number, nested groups included; -1 is the positioning pass. */
    public Map<Integer, Integer> nodesPerPass() {
        return Collections.unmodifiableMap(nodesPerPass);
    }

    public int groupWalks() {
        return groupWalks;
    }

    public void reset() {
        nodes.clear();
        errors.clear();
        nodesPerPass.clear();
        groupWalks = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %-18s | %6s | %10s | %10s | %10s%n", "Node", "Type", "Count", "Avg (us)",
                "Min (us)", "Max (us)"));
        sb.append("-".repeat(100)).append(System.lineSeparator());
        for (NodeStats s : nodes.values())
            sb.append(String.format("%-30s | %-18s | %6d | %10.2f | %10.2f | %10.2f%n", s.name(), s.type(), s.count(),
                    s.avgMicros(), s.minNanos() / 1000.0, s.maxNanos() / 1000.0));
        return sb.toString();
    }
}
