package com.workflow.bsp.util;

import com.workflow.bsp.engine.CompiledGraph;
import com.workflow.bsp.engine.ControlEdge;
import com.workflow.bsp.engine.NodeSpec;
import com.workflow.bsp.engine.TopologicalOrder;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting a compiled graph.
 *
 * <p>
 * Generates human-readable text for the structure of the graph: nodes with
 * their channels, the derived dependency order, and a Mermaid diagram.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics.
 */
public final class GraphExplain {
    private final CompiledGraph graph;
    private final TopologicalOrder topology;

    public GraphExplain(CompiledGraph graph) {
        this.graph = graph;
        this.topology = graph.resolver().dependencyOrder();
    }

    /**
     * Dumps the declaration of a single node and its place in the order.
     */
    public String explainNode(String nodeName) {
        NodeSpec node = graph.node(nodeName);
        int idx = topology.topoIndex(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Unit: ").append(node.unit().getClass().getSimpleName()).append('\n')
                .append("  Reads: ").append(node.reads()).append('\n')
                .append("  Writes: ").append(node.writes()).append('\n')
                .append("  Priority: ").append(node.priority()).append('\n');
        if (node.deadline() != null)
            sb.append("  Deadline: ").append(node.deadline().toMillis()).append("ms\n");
        if (node.retry().maxAttempts() > 1)
            sb.append("  Retry: ").append(node.retry().maxAttempts()).append(" attempts, ")
                    .append(node.retry().backoff().toMillis()).append("ms backoff\n");
        int cc = topology.childCount(idx);
        sb.append("  Runs before (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.node(topology.child(idx, i)));
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the dependency order in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(topology.nodeCount()).append(" nodes, ")
                .append(graph.channels().size()).append(" channels):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            String name = topology.node(i);
            sb.append("  [").append(i).append("] ").append(name);
            if (graph.entries().contains(name))
                sb.append(" (ENTRY)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram. Control edges are solid,
     * conditional edges thick, and data edges dotted and labelled with their
     * channels.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in dependency order
        for (int i = 0; i < topology.nodeCount(); i++) {
            String name = topology.node(i);
            sb.append("  ").append(sanitize(name)).append("[\"").append(name);
            if (graph.entries().contains(name))
                sb.append(" (entry)");
            sb.append("\"];\n");
        }

        // 2. Control edges
        for (ControlEdge e : graph.edges()) {
            for (String t : e.targets()) {
                sb.append("  ").append(sanitize(e.source()))
                        .append(e.isConditional() ? " ==> " : " --> ")
                        .append(sanitize(t)).append(";\n");
            }
        }

        // 3. Data edges, grouped per node pair
        Map<String, Set<String>> labels = new LinkedHashMap<>();
        for (NodeSpec writer : graph.nodes().values()) {
            for (String ch : writer.writes()) {
                for (String reader : graph.readersOf(ch)) {
                    if (reader.equals(writer.name()))
                        continue;
                    labels.computeIfAbsent(sanitize(writer.name()) + "|" + sanitize(reader),
                            k -> new LinkedHashSet<>()).add(ch);
                }
            }
        }
        for (Map.Entry<String, Set<String>> e : labels.entrySet()) {
            String[] pair = e.getKey().split("\\|");
            sb.append("  ").append(pair[0]).append(" -. \"").append(String.join(", ", e.getValue()))
                    .append("\" .-> ").append(pair[1]).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
