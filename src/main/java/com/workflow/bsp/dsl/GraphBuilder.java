package com.workflow.bsp.dsl;

import com.workflow.bsp.api.ComputeUnit;
import com.workflow.bsp.api.EdgeRouter;
import com.workflow.bsp.channel.ChannelSpec;
import com.workflow.bsp.engine.CompiledGraph;
import com.workflow.bsp.engine.ControlEdge;
import com.workflow.bsp.engine.DependencyResolver;
import com.workflow.bsp.engine.NodeSpec;
import com.workflow.bsp.error.GraphValidationException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Builder -- the API for declaring a graph.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("my_graph");
 * 2. Declare channels: g.channel(ChannelSpec.binaryOperator("sum", Integer.class, Reducers.intSum(), 0));
 * 3. Declare nodes with their read and write sets: g.node("add", Set.of(), Set.of("sum"), unit);
 * 4. Wire control edges and entry points: g.edge("start", "add").entry("start");
 * 5. Compile: CompiledGraph graph = g.compile();
 *
 * Compilation validates the whole declaration before anything can run: unique
 * node and channel names, read, write, edge and entry references, at most one
 * declared writer per non-reducing channel, and acyclic control edges.
 */
@Log4j2
public final class GraphBuilder {
    private final String graphName;

    private final Map<String, ChannelSpec> channels = new LinkedHashMap<>();
    private final Map<String, NodeSpec> nodes = new LinkedHashMap<>();
    private final List<ControlEdge> edges = new ArrayList<>();
    private final List<String> entries = new ArrayList<>();

    // Flag to prevent modification after compiling
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Channels ────────────────────────────────────────────────

    /**
     * @throws GraphValidationException DUPLICATE_NAME if a channel of that name
     *                                  was declared
     */
    public GraphBuilder channel(ChannelSpec spec) {
        checkNotBuilt();
        if (channels.putIfAbsent(spec.name(), spec) != null)
            throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_NAME,
                    "Duplicate channel name: " + spec.name());
        return this;
    }

    // ── Nodes ───────────────────────────────────────────────────

    public GraphBuilder node(String name, Collection<String> reads, Collection<String> writes, ComputeUnit unit) {
        return node(NodeSpec.builder(name, unit).reads(reads).writes(writes).build());
    }

    /**
     * @throws GraphValidationException DUPLICATE_NAME if a node of that name was
     *                                  declared
     */
    public GraphBuilder node(NodeSpec node) {
        checkNotBuilt();
        if (nodes.putIfAbsent(node.name(), node) != null)
            throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_NAME,
                    "Duplicate node name: " + node.name(), node.name());
        return this;
    }

    // ── Control edges ───────────────────────────────────────────

    public GraphBuilder edge(String from, String to) {
        checkNotBuilt();
        edges.add(ControlEdge.direct(from, to));
        return this;
    }

    /**
     * Adds a conditional edge. The router picks among {@code targets} from the
     * source's output each time the source completes.
     */
    public GraphBuilder conditionalEdge(String from, Collection<String> targets, EdgeRouter router) {
        checkNotBuilt();
        edges.add(ControlEdge.conditional(from, targets, router));
        return this;
    }

    /** Marks nodes to run in the first superstep of every execution. */
    public GraphBuilder entry(String... nodeNames) {
        checkNotBuilt();
        for (String n : nodeNames)
            if (!entries.contains(n))
                entries.add(n);
        return this;
    }

    /**
     * Validates the declaration and compiles it.
     *
     * This process involves:
     * <ol>
     * <li>Reference checks for reads, writes, edges and entries.</li>
     * <li>Writer checks for non-reducing channels.</li>
     * <li>Cycle detection over control edges and derivation of the dependency
     * order.</li>
     * </ol>
     *
     * @return The immutable compiled graph.
     * @throws GraphValidationException on the first problem found
     */
    public CompiledGraph compile() {
        checkNotBuilt();
        built = true;

        Map<String, String> declaredWriter = new HashMap<>();
        for (NodeSpec n : nodes.values()) {
            for (String ch : n.reads())
                requireChannel(n.name(), ch);
            for (String ch : n.writes()) {
                ChannelSpec spec = requireChannel(n.name(), ch);
                if (spec.kind().isReducing())
                    continue;
                String other = declaredWriter.putIfAbsent(ch, n.name());
                if (other != null)
                    throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_WRITER,
                            "Nodes '" + other + "' and '" + n.name() + "' both write non-reducing "
                                    + spec.kind() + " channel '" + ch + "'",
                            n.name());
            }
        }
        for (ControlEdge e : edges) {
            requireNode(e.source());
            for (String t : e.targets())
                requireNode(t);
        }
        for (String entry : entries)
            requireNode(entry);

        DependencyResolver resolver = DependencyResolver.build(new ArrayList<>(nodes.values()), edges);
        CompiledGraph graph = new CompiledGraph(graphName, nodes, channels, entries, edges, resolver);
        log.info("Compiled graph '{}': {} nodes, {} channels, {} control edges, entries {}",
                graphName, nodes.size(), channels.size(), edges.size(), entries);
        return graph;
    }

    private ChannelSpec requireChannel(String node, String channel) {
        ChannelSpec spec = channels.get(channel);
        if (spec == null)
            throw new GraphValidationException(GraphValidationException.Kind.UNKNOWN_REFERENCE,
                    "Node '" + node + "' refers to undeclared channel '" + channel + "'", node);
        return spec;
    }

    private void requireNode(String name) {
        if (!nodes.containsKey(name))
            throw new GraphValidationException(GraphValidationException.Kind.UNKNOWN_REFERENCE,
                    "Undeclared node '" + name + "'", name);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}
