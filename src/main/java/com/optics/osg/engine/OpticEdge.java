package com.optics.osg.engine;

import com.optics.osg.light.LightData;

/**
 * Directed connection from an output port of one node to an input port of
 * another, with the free-space distance between them. The light currently on
 * the edge is transient analysis state.
 */
public final class OpticEdge {
    private final String sourceId;
    private final String sourcePort;
    private final String targetId;
    private final String targetPort;
    private double distance;
    private LightData light;

    OpticEdge(String sourceId, String sourcePort, String targetId, String targetPort, double distance) {
        this.sourceId = sourceId;
        this.sourcePort = sourcePort;
        this.targetId = targetId;
        this.targetPort = targetPort;
        this.distance = distance;
    }

    public String sourceId() {
        return sourceId;
    }

    public String sourcePort() {
        return sourcePort;
    }

    public String targetId() {
        return targetId;
    }

    public String targetPort() {
        return targetPort;
    }

    /** Propagation distance in metres. */
    public double distance() {
        return distance;
    }

    void setDistance(double distance) {
        this.distance = distance;
    }

    LightData light() {
        return light;
    }

    void setLight(LightData light) {
        this.light = light;
    }

    /** Node id at the upstream end for the given travel direction. */
    String fromId(boolean reversed) {
        return reversed ? targetId : sourceId;
    }

    String fromPort(boolean reversed) {
        return reversed ? targetPort : sourcePort;
    }

    String toId(boolean reversed) {
        return reversed ? sourceId : targetId;
    }

    String toPort(boolean reversed) {
        return reversed ? sourcePort : targetPort;
    }

    @Override
    public String toString() {
        return sourceId + ":" + sourcePort + " -> " + targetId + ":" + targetPort + " (" + distance + " m)";
    }
}
