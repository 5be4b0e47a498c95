package com.optics.osg.api;

import java.util.List;

import com.optics.osg.engine.AnalysisContext;
import com.optics.osg.geom.Pose;
import com.optics.osg.io.NodeReport;
import com.optics.osg.light.LightResult;
import com.optics.osg.properties.PropertyStore;
import com.optics.osg.surface.OpticSurface;

/**
 * A node of the optical scene graph.
 *
 * <p>
 * Nodes declare named input and output ports. An inverted node swaps the roles
 * of its ports: light enters through the declared output ports and leaves
 * through the declared input ports, traversing the node's surfaces in reverse
 * order. The analysis modes a node supports are expressed by implementing
 * {@link EnergyAnalyzable}, {@link RayTraceAnalyzable} and
 * {@link GhostFocusAnalyzable}.
 */
public interface OpticNode {

    /** Stable identifier (UUID string). */
    String id();

    String name();

    void setName(String name);

    /** Kind of the node, e.g. "lens". */
    String nodeType();

    List<String> inputPorts();

    List<String> outputPorts();

    boolean isInverted();

    /**
     * @throws OpticException of kind GRAPH_STRUCTURE if the node cannot be
     *                        inverted
     */
    void setInverted(boolean inverted);

    default boolean isInvertible() {
        return true;
    }

    PropertyStore properties();

    /** World placement; null until the node has been positioned. */
    Pose pose();

    void setPose(Pose pose);

    /** Placement relative to the aligned position (decenter and tilt). */
    Pose alignmentOffset();

    void setAlignmentOffset(Pose offset);

    /** Whether the positioning pass places this node from its incoming light. */
    default boolean isPositionable() {
        return true;
    }

    /** Distance between entry and exit plane along the optical axis. */
    default double axialLength() {
        return 0.0;
    }

    /** Surfaces owned by this node, in light travel order when not inverted. */
    List<OpticSurface> surfaces();

    /**
     * Analyzes the light arriving at the node's ports and returns the light
     * leaving it. Modes the node does not support yield an empty result.
     */
    LightResult analyze(LightResult inputs, AnalysisContext ctx);

    /** Clears hit maps, caches and recorded detector data. */
    void resetData();

    NodeReport report();
}
