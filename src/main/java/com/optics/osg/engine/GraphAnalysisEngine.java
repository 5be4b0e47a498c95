package com.optics.osg.engine;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.optics.osg.api.AnalysisListener;
import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;
import com.optics.osg.geom.Pose;
import com.optics.osg.light.GeometricData;
import com.optics.osg.light.GhostFocusData;
import com.optics.osg.light.LightData;
import com.optics.osg.light.LightResult;
import com.optics.osg.ray.Ray;
import com.optics.osg.ray.RayBundle;

/**
 * Walks one {@link OpticGraph} in topological order and lets every node turn
 * its incoming light into outgoing light.
 *
 * <p>
 * One call of {@link #run} is one pass over one group: collect the light at the
 * node's ports, position the node (positioning pass only), analyze it, apply
 * the per-mode ray filters and hand the result on. Nested groups call back into
 * the engine for their own graph, so a pass over a scene is a depth-first walk
 * over all groups.
 *
 * <p>
 * Fail fast: the first node that throws stops the pass. The error is reported
 * to the listener and rethrown as an ANALYSIS error naming the node; the end
 * callback fires in any case.
 */
public final class GraphAnalysisEngine {
    private static final Logger log = LogManager.getLogger(GraphAnalysisEngine.class);
    private static final Vector3d UP = new Vector3d(0, 1, 0);
    private static final double POSE_TOLERANCE = 1e-9;

    private GraphAnalysisEngine() {
        // Utility class
    }

    /**
     * Runs one pass over {@code graph}.
     *
     * @param groupName name reported to the listener
     * @param external  light at the group's external entry ports
     * @param reversed  read the edges from target to source
     * @return light at the group's external exit ports
     */
    public static LightResult run(OpticGraph graph, String groupName, LightResult external, boolean reversed,
            AnalysisContext ctx) {
        TopologicalOrder order = graph.traversal(reversed);
        AnalysisListener l = ctx.listener();
        LightResult exits = LightResult.empty();
        int analyzed = 0;
        Throwable failure = null;
        OpticNode failedNode = null;

        if (!graph.isSingleTree())
            log.warn("group '{}' contains unconnected sub-trees. Analysis might not be complete.", groupName);
        graph.clearLight();
        l.onAnalysisStart(ctx.pass(), groupName);
        try {
            for (int ti = 0; ti < order.nodeCount(); ti++) {
                OpticNode node = order.node(ti);
                if (graph.isStaleNode(node.id())) {
                    log.warn("graph contains stale (completely unconnected) node '{}'. Skipping.", node.name());
                    continue;
                }
                long start = System.nanoTime();
                try {
                    LightResult in = graph.incoming(order, ti, external, reversed, ctx);
                    if (ctx.isPositioning() && node.isPositionable())
                        position(node, in, ctx);
                    LightResult out = node.analyze(in, ctx);
                    filterRays(out, ctx);
                    graph.distribute(order, ti, out, reversed, exits, ctx);
                } catch (RuntimeException e) {
                    failure = e;
                    failedNode = node;
                    l.onNodeError(ctx.pass(), node.name(), node.nodeType(), e);
                    break;
                }
                analyzed++;
                l.onNodeAnalyzed(ctx.pass(), node.name(), node.nodeType(), System.nanoTime() - start);
                log.debug("pass {}: analyzed node '{}' ({})", ctx.pass(), node.name(), node.nodeType());
            }
        } finally {
            l.onAnalysisEnd(ctx.pass(), groupName, analyzed);
        }

        if (failure != null)
            throw OpticException.analysis("analysis of node '" + failedNode.name() + "' (" + failedNode.nodeType()
                    + ") failed: " + failure.getMessage(), failure);
        return exits;
    }

    /**
     * Places a node on the axis of the first valid alignment ray reaching it. An
     * effectively reversed node is entered through its exit plane, so its
     * origin lies one axial length further down the beam, facing back.
     */
    static void position(OpticNode node, LightResult in, AnalysisContext ctx) {
        Pose placed = null;
        for (LightData data : in.asMap().values()) {
            if (!(data instanceof GeometricData g))
                continue;
            Ray axis = firstValid(g.rays());
            if (axis == null)
                continue;
            Pose pose = alignedPose(node, axis, ctx);
            if (placed == null)
                placed = pose;
            else if (!placed.approxEquals(pose, POSE_TOLERANCE))
                log.warn("node '{}' receives inconsistent alignment rays on its inputs, keeping the first",
                        node.name());
        }
        if (placed == null)
            return;
        node.setPose(placed);
        log.debug("positioned node '{}' at {}", node.name(), placed);
    }

    private static Pose alignedPose(OpticNode node, Ray axis, AnalysisContext ctx) {
        Point3d position = axis.position();
        Vector3d direction = axis.direction();
        boolean reversed = node.isInverted() ^ ctx.isBackward();
        Pose aligned;
        if (reversed) {
            position.scaleAdd(node.axialLength(), direction, position);
            Vector3d back = new Vector3d(direction);
            back.negate();
            aligned = Pose.fromView(position, back, UP);
        } else {
            aligned = Pose.fromView(position, direction, UP);
        }
        return aligned.append(node.alignmentOffset());
    }

    private static Ray firstValid(RayBundle bundle) {
        for (Ray r : bundle)
            if (r.isValid())
                return r;
        return null;
    }

    /** Mode specific limits applied to everything a node emits. */
    private static void filterRays(LightResult out, AnalysisContext ctx) {
        RayTraceConfig cfg = ctx.rayTraceConfig();
        for (LightData data : out.asMap().values()) {
            if (data instanceof GeometricData g) {
                if (ctx.isPositioning())
                    continue;
                g.rays().invalidateByThreshold(ctx.minEnergyPerRay());
                g.rays().filterByNrOfBounces(cfg.maxBounces());
                g.rays().filterByNrOfRefractions(cfg.maxRefractions());
            } else if (data instanceof GhostFocusData gf) {
                int max = ctx.ghostFocusConfig().maxBounces();
                for (RayBundle b : gf.bundles()) {
                    b.removeByNrOfBounces(max);
                    b.invalidateByThreshold(ctx.minEnergyPerRay());
                }
            }
        }
    }
}
