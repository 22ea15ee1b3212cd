package com.workflow.bsp.engine;

import com.workflow.bsp.channel.ChannelKind;
import com.workflow.bsp.channel.ChannelRegistry;
import com.workflow.bsp.channel.ChannelSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated, immutable graph definition, returned by the GraphBuilder.
 *
 * Holds the node and channel declarations, the entry nodes, the control edges
 * and the dependency resolver derived from them. It carries no execution
 * state: every coordinator creates its own channel registry from the channel
 * specs through {@link #newRegistry()}, so one compiled graph can back any
 * number of executions.
 */
public final class CompiledGraph {
    private final String name;
    private final Map<String, NodeSpec> nodes;
    private final Map<String, ChannelSpec> channels;
    private final List<String> entries;
    private final List<ControlEdge> edges;
    private final DependencyResolver resolver;
    private final Map<String, Set<String>> readers;

    public CompiledGraph(String name, Map<String, NodeSpec> nodes, Map<String, ChannelSpec> channels,
            List<String> entries, List<ControlEdge> edges, DependencyResolver resolver) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        this.entries = List.copyOf(entries);
        this.edges = List.copyOf(edges);
        this.resolver = resolver;
        Map<String, Set<String>> byChannel = new LinkedHashMap<>();
        for (NodeSpec n : nodes.values())
            for (String ch : n.reads())
                byChannel.computeIfAbsent(ch, k -> new LinkedHashSet<>()).add(n.name());
        this.readers = byChannel;
    }

    public String name() {
        return name;
    }

    public Map<String, NodeSpec> nodes() {
        return nodes;
    }

    /**
     * @throws IllegalArgumentException if no node has that name
     */
    public NodeSpec node(String name) {
        NodeSpec n = nodes.get(name);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return n;
    }

    public boolean hasNode(String name) {
        return nodes.containsKey(name);
    }

    public Map<String, ChannelSpec> channels() {
        return channels;
    }

    public ChannelKind channelKind(String channel) {
        return channels.get(channel).kind();
    }

    public List<String> entries() {
        return entries;
    }

    public List<ControlEdge> edges() {
        return edges;
    }

    public DependencyResolver resolver() {
        return resolver;
    }

    /** @return nodes that declare a read of the channel. */
    public Set<String> readersOf(String channel) {
        return readers.getOrDefault(channel, Set.of());
    }

    /** Creates fresh channels for one execution. */
    public ChannelRegistry newRegistry() {
        return ChannelRegistry.of(new ArrayList<>(channels.values()));
    }

    @Override
    public String toString() {
        return "CompiledGraph[" + name + ", " + nodes.size() + " nodes, " + channels.size() + " channels]";
    }
}
