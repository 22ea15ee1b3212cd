package com.workflow.bsp.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one compute unit invocation: per-channel updates, nodes to run in
 * the next superstep, and sends (one extra task per send, carrying a payload).
 */
public final class NodeOutput {
    private static final NodeOutput EMPTY = new NodeOutput(Map.of(), List.of(), List.of());

    /** Request to run {@code node} next superstep with {@code payload} as its input payload. */
    public record Send(String node, Object payload) {
    }

    private final Map<String, List<Object>> writes;
    private final List<String> next;
    private final List<Send> sends;

    private NodeOutput(Map<String, List<Object>> writes, List<String> next, List<Send> sends) {
        this.writes = writes;
        this.next = next;
        this.sends = sends;
    }

    public static NodeOutput empty() {
        return EMPTY;
    }

    /** Shorthand for an output with a single write. */
    public static NodeOutput write(String channel, Object value) {
        return builder().write(channel, value).build();
    }

    public static NodeOutput goTo(String... nodes) {
        return builder().goTo(nodes).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<Object>> writes() {
        return writes;
    }

    public List<String> next() {
        return next;
    }

    public List<Send> sends() {
        return sends;
    }

    public boolean isEmpty() {
        return writes.isEmpty() && next.isEmpty() && sends.isEmpty();
    }

    @Override
    public String toString() {
        return "NodeOutput[writes=" + writes + ", next=" + next + ", sends=" + sends.size() + "]";
    }

    public static final class Builder {
        private final Map<String, List<Object>> writes = new LinkedHashMap<>();
        private final List<String> next = new ArrayList<>();
        private final List<Send> sends = new ArrayList<>();

        private Builder() {
        }

        public Builder write(String channel, Object value) {
            writes.computeIfAbsent(channel, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder writeAll(String channel, Collection<?> values) {
            writes.computeIfAbsent(channel, k -> new ArrayList<>()).addAll(values);
            return this;
        }

        public Builder goTo(String... nodes) {
            Collections.addAll(next, nodes);
            return this;
        }

        public Builder send(String node, Object payload) {
            sends.add(new Send(node, payload));
            return this;
        }

        public NodeOutput build() {
            Map<String, List<Object>> w = new LinkedHashMap<>();
            writes.forEach((k, v) -> w.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
            return new NodeOutput(Collections.unmodifiableMap(w), List.copyOf(next), List.copyOf(sends));
        }
    }
}
