package com.optics.osg.api;

/**
 * Observability interface for analysis runs.
 *
 * Implementations registered with an analyzer receive callbacks for every pass
 * of the engine over a node group: positioning, the analysis pass and, for
 * ghost-focus analysis, every bounce pass. Nested groups report their own
 * nodes through the same listener.
 *
 * Callbacks run inside the analysis loop; keep them cheap.
 */
public interface AnalysisListener {

    /**
     * Called before the engine walks a group.
     *
     * @param pass      pass number, 0 for the first (or only) analysis pass, -1
     *                  for positioning
     * @param groupName name of the group being walked
     */
    void onAnalysisStart(int pass, String groupName);

    /**
     * Called after a node has been analyzed.
     *
     * @param pass          current pass
     * @param nodeName      human readable node name
     * @param nodeType      node type
     * @param durationNanos time spent in the node
     */
    void onNodeAnalyzed(int pass, String nodeName, String nodeType, long durationNanos);

    /**
     * Called when a node fails. The run is aborted right after.
     */
    void onNodeError(int pass, String nodeName, String nodeType, Throwable error);

    /**
     * Called when the engine is done with a group, also after a failure.
     *
     * @param nodesAnalyzed number of nodes analyzed in this group
     */
    void onAnalysisEnd(int pass, String groupName, int nodesAnalyzed);

    /** Listener ignoring every callback. */
    AnalysisListener NONE = new AnalysisListener() {
        @Override
        public void onAnalysisStart(int pass, String groupName) {
        }

        @Override
        public void onNodeAnalyzed(int pass, String nodeName, String nodeType, long durationNanos) {
        }

        @Override
        public void onNodeError(int pass, String nodeName, String nodeType, Throwable error) {
        }

        @Override
        public void onAnalysisEnd(int pass, String groupName, int nodesAnalyzed) {
        }
    };
}
