package com.workflow.bsp.channel;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * Declaration of one channel in a graph schema. A spec is immutable and can
 * create any number of fresh, empty instances of its channel.
 */
public final class ChannelSpec {
    /** Default topic history, matching the bound used for message logs. */
    public static final int DEFAULT_TOPIC_CAPACITY = 100;

    private final String name;
    private final ChannelKind kind;
    private final Supplier<Channel<?, ?, ?>> factory;

    private ChannelSpec(String name, ChannelKind kind, Supplier<Channel<?, ?, ?>> factory) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.factory = factory;
    }

    public String name() {
        return name;
    }

    public ChannelKind kind() {
        return kind;
    }

    /** @return a new channel instance in its initial state. */
    public Channel<?, ?, ?> create() {
        return factory.get();
    }

    // ── Value channels ──────────────────────────────────────────

    public static ChannelSpec lastValue(String name, Class<?> type) {
        return lastValue(name, type, null);
    }

    public static <V> ChannelSpec lastValue(String name, Class<?> type, V defaultValue) {
        return new ChannelSpec(name, ChannelKind.LAST_VALUE,
                () -> new LastValueChannel<>(name, type, defaultValue));
    }

    public static ChannelSpec untracked(String name, Class<?> type) {
        return new ChannelSpec(name, ChannelKind.UNTRACKED_VALUE,
                () -> new UntrackedValueChannel<>(name, type, null));
    }

    public static ChannelSpec ephemeral(String name, Class<?> type) {
        return ephemeral(name, type, false);
    }

    public static ChannelSpec ephemeral(String name, Class<?> type, boolean clearOnRead) {
        return new ChannelSpec(name, ChannelKind.EPHEMERAL_VALUE,
                () -> new EphemeralValueChannel<>(name, type, clearOnRead));
    }

    public static ChannelSpec anyValue(String name) {
        return new ChannelSpec(name, ChannelKind.ANY_VALUE, () -> new AnyValueChannel(name));
    }

    // ── Reducing channels ───────────────────────────────────────

    /**
     * @param seed initial value, or null to start empty
     */
    public static <V> ChannelSpec binaryOperator(String name, Class<?> type, BinaryOperator<V> reducer, V seed) {
        Objects.requireNonNull(reducer, "reducer");
        return new ChannelSpec(name, ChannelKind.BINARY_OPERATOR,
                () -> new BinaryOperatorChannel<>(name, type, reducer, seed));
    }

    public static ChannelSpec topic(String name, Class<?> type) {
        return topic(name, type, DEFAULT_TOPIC_CAPACITY, null, DeliveryMode.AT_MOST_ONCE);
    }

    /**
     * @param ttl null or zero for entries that never expire
     */
    public static ChannelSpec topic(String name, Class<?> type, int capacity, Duration ttl, DeliveryMode mode) {
        return topic(name, type, capacity, ttl, mode, Clock.systemUTC());
    }

    public static ChannelSpec topic(String name, Class<?> type, int capacity, Duration ttl, DeliveryMode mode,
            Clock clock) {
        return new ChannelSpec(name, ChannelKind.TOPIC,
                () -> new TopicChannel<>(name, type, capacity, ttl, mode, clock));
    }

    public static ChannelSpec namedBarrier(String name, Set<String> participants) {
        return namedBarrier(name, participants, false);
    }

    public static ChannelSpec namedBarrier(String name, Set<String> participants, boolean resetOnSatisfied) {
        Set<String> copy = Set.copyOf(participants);
        return new ChannelSpec(name, ChannelKind.NAMED_BARRIER,
                () -> new NamedBarrierChannel(name, copy, resetOnSatisfied));
    }

    public static ChannelSpec dynamicBarrier(String name) {
        return dynamicBarrier(name, false);
    }

    public static ChannelSpec dynamicBarrier(String name, boolean resetOnSatisfied) {
        return new ChannelSpec(name, ChannelKind.DYNAMIC_BARRIER,
                () -> new DynamicBarrierChannel(name, resetOnSatisfied));
    }

    @Override
    public String toString() {
        return kind + "(" + name + ")";
    }
}
