package com.workflow.bsp.engine;

import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.error.GraphValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Derives intra-superstep ordering from the graph topology.
 *
 * Node A precedes node B when B reads a channel A writes, or when a control
 * edge leads from A to B. Control edges must be acyclic; that is checked over
 * the control edges alone. Data edges are allowed to form cycles: a data
 * cycle is a loop across supersteps, so data edges inside one strongly
 * connected component of the combined graph are not ordering constraints. What
 * remains is an acyclic dependency graph, and each node's full ancestor set is
 * precomputed as a bit set over it.
 *
 * Per superstep, a {@link Round} releases nodes as their active ancestors
 * complete.
 */
@Log4j2
public final class DependencyResolver {
    private final TopologicalOrder dependencyOrder;
    // ancestors[ti] over dependencyOrder indices
    private final BitSet[] ancestors;
    private final Map<String, List<ControlEdge>> outgoing;
    private final int cyclicDataEdges;

    private DependencyResolver(TopologicalOrder dependencyOrder, BitSet[] ancestors,
            Map<String, List<ControlEdge>> outgoing, int cyclicDataEdges) {
        this.dependencyOrder = dependencyOrder;
        this.ancestors = ancestors;
        this.outgoing = outgoing;
        this.cyclicDataEdges = cyclicDataEdges;
    }

    /**
     * @throws GraphValidationException CONTROL_CYCLE if the control edges are
     *                                  cyclic, UNKNOWN_REFERENCE if an edge names
     *                                  an undeclared node
     */
    public static DependencyResolver build(List<NodeSpec> nodes, List<ControlEdge> edges) {
        // 1. Control edges alone must be acyclic
        TopologicalOrder.Builder control = TopologicalOrder.builder();
        for (NodeSpec n : nodes)
            control.addNode(n.name());
        Map<String, List<ControlEdge>> outgoing = new LinkedHashMap<>();
        for (ControlEdge e : edges) {
            for (String target : e.targets())
                control.addEdge(e.source(), target);
            outgoing.computeIfAbsent(e.source(), k -> new ArrayList<>()).add(e);
        }
        TopologicalOrder controlOrder = control.build();
        log.debug("Control order {}", controlOrder.names());

        // 2. Combined graph in declaration order
        int n = nodes.size();
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < n; i++)
            idx.put(nodes.get(i).name(), i);
        List<Set<Integer>> controlAdj = new ArrayList<>(n);
        List<Set<Integer>> dataAdj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            controlAdj.add(new LinkedHashSet<>());
            dataAdj.add(new LinkedHashSet<>());
        }
        for (ControlEdge e : edges)
            for (String target : e.targets())
                controlAdj.get(idx.get(e.source())).add(idx.get(target));
        for (int w = 0; w < n; w++)
            for (String ch : nodes.get(w).writes())
                for (int r = 0; r < n; r++)
                    if (r != w && nodes.get(r).reads().contains(ch))
                        dataAdj.get(w).add(r);

        List<Set<Integer>> combined = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Set<Integer> all = new LinkedHashSet<>(controlAdj.get(i));
            all.addAll(dataAdj.get(i));
            combined.add(all);
        }
        int[] component = new StronglyConnected(combined).components();

        // 3. Dependency DAG: control edges plus data edges crossing components
        TopologicalOrder.Builder deps = TopologicalOrder.builder();
        for (NodeSpec node : nodes)
            deps.addNode(node.name());
        int dropped = 0;
        for (int from = 0; from < n; from++) {
            for (int to : controlAdj.get(from))
                deps.addEdge(nodes.get(from).name(), nodes.get(to).name());
            for (int to : dataAdj.get(from)) {
                if (component[from] == component[to]) {
                    dropped++;
                    continue;
                }
                deps.addEdge(nodes.get(from).name(), nodes.get(to).name());
            }
        }
        TopologicalOrder dependencyOrder = deps.build();

        // 4. Ancestor closure, parents before children
        BitSet[] ancestors = new BitSet[n];
        for (int ti = 0; ti < n; ti++)
            ancestors[ti] = new BitSet(n);
        for (int ti = 0; ti < n; ti++) {
            for (int ci = dependencyOrder.childrenStart(ti); ci < dependencyOrder.childrenEnd(ti); ci++) {
                int child = dependencyOrder.childAt(ci);
                ancestors[child].or(ancestors[ti]);
                ancestors[child].set(ti);
            }
        }
        log.debug("Dependency order {} ({} data edges inside cycles ignored for ordering)",
                dependencyOrder.names(), dropped);
        return new DependencyResolver(dependencyOrder, ancestors, outgoing, dropped);
    }

    public TopologicalOrder dependencyOrder() {
        return dependencyOrder;
    }

    public int cyclicDataEdges() {
        return cyclicDataEdges;
    }

    /** @return true if {@code ancestor} must complete before {@code node} in a superstep where both run. */
    public boolean dependsOn(String node, String ancestor) {
        return ancestors[dependencyOrder.topoIndex(node)].get(dependencyOrder.topoIndex(ancestor));
    }

    public List<ControlEdge> outgoing(String node) {
        return outgoing.getOrDefault(node, List.of());
    }

    /**
     * Control targets a completed node activates. Runs the routers of
     * conditional edges, so it belongs on the task's own thread.
     */
    public Set<String> controlTargets(String node, NodeOutput output) {
        List<ControlEdge> edges = outgoing.get(node);
        if (edges == null)
            return Set.of();
        Set<String> targets = new LinkedHashSet<>();
        for (ControlEdge e : edges)
            targets.addAll(e.select(output));
        return targets;
    }

    public Round newRound() {
        return new Round();
    }

    /**
     * Readiness bookkeeping for one superstep. A node may run several
     * instances (one per send); it counts as completed once all of them
     * completed. Thread-safe.
     */
    public final class Round {
        private final BitSet active = new BitSet();
        private final BitSet started = new BitSet();
        private final BitSet completed = new BitSet();
        private final int[] outstanding = new int[dependencyOrder.nodeCount()];

        private Round() {
        }

        /**
         * Adds instances of a node to this superstep.
         *
         * @return false if the node already started, in which case nothing
         *         changes
         */
        public synchronized boolean activate(String node, int instances) {
            int ti = dependencyOrder.topoIndex(node);
            if (started.get(ti))
                return false;
            active.set(ti);
            outstanding[ti] += instances;
            return true;
        }

        public synchronized boolean isActive(String node) {
            return active.get(dependencyOrder.topoIndex(node));
        }

        /**
         * Marks every active node whose active ancestors all completed as
         * started.
         *
         * @return the newly started nodes, in dependency order
         */
        public synchronized List<String> drainReady() {
            BitSet unfinished = (BitSet) active.clone();
            unfinished.andNot(completed);
            List<String> ready = new ArrayList<>();
            for (int ti = active.nextSetBit(0); ti >= 0; ti = active.nextSetBit(ti + 1)) {
                if (started.get(ti) || ancestors[ti].intersects(unfinished))
                    continue;
                started.set(ti);
                ready.add(dependencyOrder.node(ti));
            }
            return ready;
        }

        /**
         * Records completion of one instance of a node, successful or not, and
         * activates the given control targets.
         *
         * @return nodes that became ready as a consequence
         */
        public synchronized List<String> complete(String node, Collection<String> targets) {
            int ti = dependencyOrder.topoIndex(node);
            if (!started.get(ti) || completed.get(ti))
                throw new IllegalStateException("Node " + node + " is not running in this round");
            if (--outstanding[ti] == 0)
                completed.set(ti);
            for (String t : targets) {
                int target = dependencyOrder.topoIndex(t);
                if (!active.get(target))
                    activate(t, 1);
            }
            return drainReady();
        }

        public synchronized boolean isFinished() {
            return completed.equals(active);
        }

        /** @return active nodes that have not started. */
        public synchronized List<String> unresolved() {
            List<String> out = new ArrayList<>();
            for (int ti = active.nextSetBit(0); ti >= 0; ti = active.nextSetBit(ti + 1))
                if (!started.get(ti))
                    out.add(dependencyOrder.node(ti));
            return out;
        }

        /** @return active nodes with instances still outstanding. */
        public synchronized List<String> unfinished() {
            List<String> out = new ArrayList<>();
            for (int ti = active.nextSetBit(0); ti >= 0; ti = active.nextSetBit(ti + 1))
                if (!completed.get(ti))
                    out.add(dependencyOrder.node(ti));
            return out;
        }

        public synchronized List<String> activeNodes() {
            List<String> out = new ArrayList<>();
            for (int ti = active.nextSetBit(0); ti >= 0; ti = active.nextSetBit(ti + 1))
                out.add(dependencyOrder.node(ti));
            return out;
        }

        /** @return true if {@code ancestor} is active in this round and an ancestor of {@code node}. */
        public synchronized boolean isActiveAncestor(String node, String ancestor) {
            int a = dependencyOrder.topoIndex(ancestor);
            return active.get(a) && ancestors[dependencyOrder.topoIndex(node)].get(a);
        }

        @Override
        public synchronized String toString() {
            return "Round[active=" + activeNodes() + ", unfinished=" + Arrays.toString(outstanding) + "]";
        }
    }

    /** Tarjan's algorithm over adjacency sets. */
    private static final class StronglyConnected {
        private final List<Set<Integer>> adj;
        private final int[] index, low, component;
        private final boolean[] onStack;
        private final int[] stack;
        private int sp, counter, components;

        StronglyConnected(List<Set<Integer>> adj) {
            int n = adj.size();
            this.adj = adj;
            this.index = new int[n];
            this.low = new int[n];
            this.component = new int[n];
            this.onStack = new boolean[n];
            this.stack = new int[n];
            Arrays.fill(index, -1);
        }

        int[] components() {
            for (int v = 0; v < adj.size(); v++)
                if (index[v] < 0)
                    visit(v);
            return component;
        }

        private void visit(int v) {
            index[v] = low[v] = counter++;
            stack[sp++] = v;
            onStack[v] = true;
            for (int w : adj.get(v)) {
                if (index[w] < 0) {
                    visit(w);
                    low[v] = Math.min(low[v], low[w]);
                } else if (onStack[w]) {
                    low[v] = Math.min(low[v], index[w]);
                }
            }
            if (low[v] == index[v]) {
                int w;
                do {
                    w = stack[--sp];
                    onStack[w] = false;
                    component[w] = components;
                } while (w != v);
                components++;
            }
        }
    }
}
