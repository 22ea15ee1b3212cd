package com.workflow.bsp.engine;

import com.workflow.bsp.error.GraphValidationException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded static DAG over node names.
 *
 * Immutable once built. The resolver builds two of these: one over control
 * edges only, which is where illegal cycles are detected, and one over the
 * full intra-superstep dependency DAG.
 *
 * Data layout:
 * - topoOrder: node names sorted topologically. Iterating 0..N visits
 * dependencies before dependents.
 * - childrenList: one flattened int array with the topological indices of the
 * children of every node.
 * - childrenOffset: childrenOffset[i] is the start of node i's children in
 * childrenList; they run up to childrenOffset[i+1] exclusive.
 */
@Log4j2
public final class TopologicalOrder {
    // Node names in topological order.
    private final String[] topoOrder;

    // CSR index into childrenList.
    private final int[] childrenOffset;

    // CSR data: flattened child indices.
    private final int[] childrenList;

    private final int[] parentCount;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node name at the given topological index. */
    public String node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** @return node names in topological order. */
    public List<String> names() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_NAME,
                        "Duplicate node name: " + name, name);
            int idx = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Adds an edge; repeated edges between the same pair are kept once. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new GraphValidationException(GraphValidationException.Kind.CONTROL_CYCLE,
                        "Self-edge on " + from, from);
            List<Integer> children = forwardEdges.get(requireIndex(from));
            int child = requireIndex(to);
            if (!children.contains(child))
                children.add(child);
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new GraphValidationException(GraphValidationException.Kind.UNKNOWN_REFERENCE,
                        "Unknown node: " + name, name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         *
         * @throws GraphValidationException CONTROL_CYCLE naming the nodes left on
         *                                  or behind a cycle
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0, in declaration order
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i));
                throw new GraphValidationException(GraphValidationException.Kind.CONTROL_CYCLE,
                        "Cycle detected! Processed " + topoIdx + " of " + n + ", unresolved nodes " + stuck);
            }

            // 4. Construct compact arrays
            String[] orderedNodes = new String[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNodes[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(orderedNodes[ti], ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            log.debug("Topological order over {} nodes and {} edges: {}", n, offsets[n], Arrays.asList(orderedNodes));
            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
