package com.workflow.bsp.api;

import com.workflow.bsp.error.EmptyChannelException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a task's declared input channels, settled for the current
 * superstep. Channels that hold nothing readable (never written, expired, or
 * an unsatisfied barrier) are absent.
 */
public final class NodeInput {
    private final String nodeName;
    private final long superstep;
    private final Set<String> readSet;
    private final Map<String, Object> values;
    private final Object payload;

    public NodeInput(String nodeName, long superstep, Set<String> readSet, Map<String, Object> values,
            Object payload) {
        this.nodeName = nodeName;
        this.superstep = superstep;
        this.readSet = Collections.unmodifiableSet(readSet);
        this.values = Collections.unmodifiableMap(values);
        this.payload = payload;
    }

    public String nodeName() {
        return nodeName;
    }

    public long superstep() {
        return superstep;
    }

    public Set<String> readSet() {
        return readSet;
    }

    public boolean has(String channel) {
        return values.containsKey(channel);
    }

    /**
     * @throws IllegalArgumentException if the channel is not in the read set
     * @throws EmptyChannelException    if the channel holds nothing readable
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String channel) {
        requireDeclared(channel);
        Object v = values.get(channel);
        if (v == null)
            throw new EmptyChannelException(channel);
        return (T) v;
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String channel, T fallback) {
        requireDeclared(channel);
        Object v = values.get(channel);
        return v == null ? fallback : (T) v;
    }

    /** @return the payload of the send that spawned this task, or null. */
    @SuppressWarnings("unchecked")
    public <T> T payload() {
        return (T) payload;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private void requireDeclared(String channel) {
        if (!readSet.contains(channel))
            throw new IllegalArgumentException("Node '" + nodeName + "' does not read channel '" + channel + "'");
    }

    @Override
    public String toString() {
        return "NodeInput[" + nodeName + "@" + superstep + " " + values + "]";
    }
}
