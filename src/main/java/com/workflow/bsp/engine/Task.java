package com.workflow.bsp.engine;

import com.workflow.bsp.api.NodeOutput;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One execution of a node within a superstep. A node runs one task per send
 * addressed to it plus at most one plain task. Discarded once the superstep's
 * writes were applied.
 */
public final class Task {
    private final NodeSpec node;
    private final int instance;
    private final long superstep;
    private final Object payload;
    private final int dependencies;

    // Writes of completed upstream tasks per read channel, in completion order
    private final Map<String, List<Object>> upstreamWrites;
    private final Map<String, Integer> includedWriters;

    // Results, written by the worker before its completion is published under the run lock
    private NodeOutput output;
    private Set<String> controlTargets = Set.of();
    private int attempts;

    Task(NodeSpec node, int instance, long superstep, Object payload, int dependencies,
            Map<String, List<Object>> upstreamWrites, Map<String, Integer> includedWriters) {
        this.node = node;
        this.instance = instance;
        this.superstep = superstep;
        this.payload = payload;
        this.dependencies = dependencies;
        this.upstreamWrites = upstreamWrites;
        this.includedWriters = includedWriters;
    }

    public String nodeName() {
        return node.name();
    }

    public NodeSpec node() {
        return node;
    }

    public int instance() {
        return instance;
    }

    public long superstep() {
        return superstep;
    }

    public Object payload() {
        return payload;
    }

    public Set<String> reads() {
        return node.reads();
    }

    public Set<String> writes() {
        return node.writes();
    }

    /** @return active upstream nodes this task waited for. */
    public int dependencies() {
        return dependencies;
    }

    public NodeOutput output() {
        return output;
    }

    public int attempts() {
        return attempts;
    }

    Map<String, List<Object>> upstreamWrites() {
        return upstreamWrites;
    }

    /** @return number of upstream tasks whose writes to the channel this task saw. */
    int includedWriters(String channel) {
        return includedWriters.getOrDefault(channel, 0);
    }

    Set<String> controlTargets() {
        return controlTargets;
    }

    void succeeded(NodeOutput output, Set<String> controlTargets) {
        this.output = output;
        this.controlTargets = controlTargets;
    }

    void attempt(int attempts) {
        this.attempts = attempts;
    }

    int writeCount() {
        if (output == null)
            return 0;
        int n = 0;
        for (List<Object> values : output.writes().values())
            n += values.size();
        return n;
    }

    @Override
    public String toString() {
        return node.name() + "#" + instance + "@" + superstep;
    }
}
