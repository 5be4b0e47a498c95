package com.optics.osg.engine;

/** A port of a node inside a group, target of a port-map entry. */
public record PortRef(String nodeId, String port) {
}
