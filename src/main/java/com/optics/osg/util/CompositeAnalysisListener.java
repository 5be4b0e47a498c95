package com.optics.osg.util;

import java.util.Arrays;

import com.optics.osg.api.AnalysisListener;

/** Forwards every callback to several {@link AnalysisListener}s, in registration order. */
public class CompositeAnalysisListener implements AnalysisListener {
    private AnalysisListener[] listeners = new AnalysisListener[0];

    public CompositeAnalysisListener add(AnalysisListener listener) {
        AnalysisListener[] old = listeners;
        AnalysisListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onAnalysisStart(int pass, String groupName) {
        for (AnalysisListener l : listeners)
            l.onAnalysisStart(pass, groupName);
    }

    @Override
    public void onNodeAnalyzed(int pass, String nodeName, String nodeType, long durationNanos) {
        for (AnalysisListener l : listeners)
            l.onNodeAnalyzed(pass, nodeName, nodeType, durationNanos);
    }

    @Override
    public void onNodeError(int pass, String nodeName, String nodeType, Throwable error) {
        for (AnalysisListener l : listeners)
            l.onNodeError(pass, nodeName, nodeType, error);
    }

    @Override
    public void onAnalysisEnd(int pass, String groupName, int nodesAnalyzed) {
        for (AnalysisListener l : listeners)
            l.onAnalysisEnd(pass, groupName, nodesAnalyzed);
    }
}
