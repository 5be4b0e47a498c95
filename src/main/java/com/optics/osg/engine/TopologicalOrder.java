package com.optics.osg.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.optics.osg.api.OpticException;
import com.optics.osg.api.OpticNode;

/**
 * Immutable, CSR-encoded execution order of one node group.
 *
 * <p>
 * Nodes are stored sorted topologically: iterating {@code 0..nodeCount()}
 * visits every node after all nodes feeding it. The successors of the node at
 * topological index {@code i} are stored in one flattened int array, from
 * {@code childrenOffset[i]} inclusive to {@code childrenOffset[i + 1]}
 * exclusive; predecessors are stored the same way. Every slot also carries the
 * ordinal of the edge it came from (the order of {@link Builder#addEdge}
 * calls), so parallel edges between the same pair of nodes (both outputs of a
 * beam splitter feeding one node) stay apart.
 *
 * <p>
 * An order is built for one travel direction. The backward order of a group is
 * built from the same edges with source and target swapped.
 */
public final class TopologicalOrder {
    private final OpticNode[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] childrenEdge;
    private final int[] parentsOffset;
    private final int[] parentsList;
    private final int[] parentsEdge;
    private final Map<String, Integer> idToIndex;

    private TopologicalOrder(OpticNode[] topoOrder, int[] childrenOffset, int[] childrenList, int[] childrenEdge,
            int[] parentsOffset, int[] parentsList, int[] parentsEdge, Map<String, Integer> idToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.childrenEdge = childrenEdge;
        this.parentsOffset = parentsOffset;
        this.parentsList = parentsList;
        this.parentsEdge = parentsEdge;
        this.idToIndex = idToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    public OpticNode node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node id to its topological index. */
    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw OpticException.graphStructure("node with id " + id + " not found");
        return idx;
    }

    public List<OpticNode> nodes() {
        return List.of(topoOrder);
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    /** Ordinal of the edge leading to {@link #child(int, int)}. */
    public int childEdge(int ti, int i) {
        return childrenEdge[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentsOffset[ti + 1] - parentsOffset[ti];
    }

    public int parent(int ti, int i) {
        return parentsList[parentsOffset[ti] + i];
    }

    /** Ordinal of the edge coming from {@link #parent(int, int)}. */
    public int parentEdge(int ti, int i) {
        return parentsEdge[parentsOffset[ti] + i];
    }

    /** Nodes without incoming edges start the traversal. */
    public boolean isEntry(int ti) {
        return parentCount(ti) == 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Collects nodes and edges; {@link #build()} sorts and detects cycles. */
    public static final class Builder {
        private final List<OpticNode> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        // per node: {child index, edge ordinal}
        private final List<List<int[]>> forwardEdges = new ArrayList<>();
        private int edgeCount;

        public Builder addNode(OpticNode node) {
            if (idToIdx.containsKey(node.id()))
                throw OpticException.graphStructure("duplicate node id " + node.id());
            idToIdx.put(node.id(), nodes.size());
            nodes.add(node);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Adds the next edge; edges are numbered from 0 in call order. */
        public Builder addEdge(String fromId, String toId) {
            if (fromId.equals(toId))
                throw OpticException.graphStructure("self-edge not allowed: " + fromId);
            forwardEdges.get(requireIndex(fromId)).add(new int[] { requireIndex(toId), edgeCount++ });
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw OpticException.graphStructure("node with id " + id + " not found");
            return idx;
        }

        /**
         * Sorts the nodes with Kahn's algorithm. Nodes that become ready at the
         * same time keep their insertion order.
         *
         * @throws OpticException of kind GRAPH_STRUCTURE if the edges form a
         *                        cycle
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            for (List<int[]> children : forwardEdges)
                for (int[] child : children)
                    inDegree[child[0]]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int[] child : forwardEdges.get(curr))
                    if (--inDegree[child[0]] == 0)
                        queue[tail++] = child[0];
            }
            if (topoIdx != n)
                throw OpticException.graphStructure("cycle detected, sorted " + topoIdx + " of " + n + " nodes");

            OpticNode[] ordered = new OpticNode[n];
            Map<String, Integer> newIdToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newIdToIndex.put(ordered[ti].id(), ti);
            }

            int[] offsets = new int[n + 1];
            int[] parentOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++) {
                List<int[]> children = forwardEdges.get(reverseMap[ti]);
                offsets[ti + 1] = offsets[ti] + children.size();
                for (int[] child : children)
                    parentOffsets[topoMap[child[0]] + 1]++;
            }
            for (int ti = 0; ti < n; ti++)
                parentOffsets[ti + 1] += parentOffsets[ti];

            int[] flatChildren = new int[offsets[n]];
            int[] flatChildEdges = new int[offsets[n]];
            int[] flatParents = new int[offsets[n]];
            int[] flatParentEdges = new int[offsets[n]];
            int[] parentFill = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<int[]> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)[0]];
                    int edge = children.get(j)[1];
                    flatChildren[base + j] = childTi;
                    flatChildEdges[base + j] = edge;
                    int slot = parentOffsets[childTi] + parentFill[childTi]++;
                    flatParents[slot] = ti;
                    flatParentEdges[slot] = edge;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, flatChildEdges, parentOffsets, flatParents,
                    flatParentEdges, newIdToIndex);
        }
    }
}
