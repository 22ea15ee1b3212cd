package com.workflow.bsp.channel;

import com.workflow.bsp.error.GraphValidationException;
import com.workflow.bsp.error.InvalidOperationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The named channel instances of one execution.
 *
 * The registry is the arena owned by the coordinator. Compute units never see
 * it; they receive read-only snapshots. Variant-specific operations dispatch on
 * {@link ChannelKind} and fail with {@link InvalidOperationException} when the
 * channel is of the wrong variant.
 */
public final class ChannelRegistry {
    private final Map<String, ChannelSpec> specs;
    private final Map<String, Channel<?, ?, ?>> channels;

    private ChannelRegistry(Map<String, ChannelSpec> specs) {
        this.specs = specs;
        this.channels = new LinkedHashMap<>(specs.size() * 2);
        for (ChannelSpec spec : specs.values())
            channels.put(spec.name(), spec.create());
    }

    /**
     * @throws GraphValidationException if two specs share a name
     */
    public static ChannelRegistry of(Collection<ChannelSpec> specs) {
        Map<String, ChannelSpec> byName = new LinkedHashMap<>();
        for (ChannelSpec spec : specs) {
            if (byName.putIfAbsent(spec.name(), spec) != null)
                throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_NAME,
                        "Duplicate channel name: " + spec.name());
        }
        return new ChannelRegistry(byName);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    public boolean contains(String name) {
        return channels.containsKey(name);
    }

    public Channel<?, ?, ?> channel(String name) {
        Channel<?, ?, ?> ch = channels.get(name);
        if (ch == null)
            throw new IllegalArgumentException("Unknown channel: " + name);
        return ch;
    }

    public ChannelKind kind(String name) {
        return channel(name).kind();
    }

    // ── Reads ───────────────────────────────────────────────────

    public Object value(String name) {
        return channel(name).get();
    }

    /** @return the value, or null if the channel is not available. */
    public Object valueOrNull(String name) {
        Channel<?, ?, ?> ch = channel(name);
        return ch.isAvailable() ? ch.get() : null;
    }

    public boolean isAvailable(String name) {
        return channel(name).isAvailable();
    }

    /** @return values of every available channel, in declaration order. */
    public Map<String, Object> values() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Channel<?, ?, ?> ch : channels.values())
            if (ch.isAvailable())
                out.put(ch.name(), ch.get());
        return out;
    }

    // ── Writes (coordinator only) ───────────────────────────────

    public boolean apply(String name, List<?> updates) {
        return channel(name).updateUnchecked(updates);
    }

    public boolean consume(String name) {
        return channel(name).consume();
    }

    public boolean finish(String name) {
        return channel(name).finish();
    }

    // ── Checkpointing ───────────────────────────────────────────

    public Object checkpoint(String name) {
        return channel(name).checkpoint();
    }

    /** @return checkpoints of all tracked channels, in declaration order. */
    public Map<String, Object> checkpointAll() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Channel<?, ?, ?> ch : channels.values())
            if (ch.tracked())
                out.put(ch.name(), ch.checkpoint());
        return out;
    }

    public void restore(String name, Object checkpoint) {
        channel(name).restoreUnchecked(checkpoint);
    }

    /**
     * Creates a detached copy of a channel carrying its current state. Updates
     * applied to the copy never reach the registry, and topic copies have no
     * subscribers.
     */
    public Channel<?, ?, ?> scratchCopy(String name) {
        Channel<?, ?, ?> live = channel(name);
        Channel<?, ?, ?> copy = specs.get(name).create();
        copy.restoreUnchecked(live.checkpoint());
        return copy;
    }

    // ── Variant-specific operations ─────────────────────────────

    @SuppressWarnings("unchecked")
    public <V> TopicSubscription subscribe(String topic, String subscriberId, Consumer<? super V> consumer) {
        Channel<?, ?, ?> ch = channel(topic);
        switch (ch.kind()) {
            case TOPIC:
                return ((TopicChannel<V>) ch).subscribe(subscriberId, consumer);
            default:
                throw new InvalidOperationException(topic, "subscribe is only supported on topics, not " + ch.kind());
        }
    }

    public boolean barrierSatisfied(String name) {
        Channel<?, ?, ?> ch = channel(name);
        switch (ch.kind()) {
            case NAMED_BARRIER:
                return ((NamedBarrierChannel) ch).isSatisfied();
            case DYNAMIC_BARRIER:
                return ((DynamicBarrierChannel) ch).isSatisfied();
            default:
                throw new InvalidOperationException(name, "barrier query on a " + ch.kind() + " channel");
        }
    }

    /** Sets the participant count of a dynamic barrier. */
    public boolean expectParticipants(String name, int participants) {
        Channel<?, ?, ?> ch = channel(name);
        switch (ch.kind()) {
            case DYNAMIC_BARRIER:
                return ((DynamicBarrierChannel) ch).expect(participants);
            case NAMED_BARRIER:
                throw new InvalidOperationException(name, "named barrier participants are fixed at construction");
            default:
                throw new InvalidOperationException(name, "participant count on a " + ch.kind() + " channel");
        }
    }

    /**
     * Delivers values committed to topics since the last call.
     *
     * @return number of successful deliveries across all topics
     */
    public int deliverPending() {
        int delivered = 0;
        for (Channel<?, ?, ?> ch : channels.values())
            if (ch.kind() == ChannelKind.TOPIC)
                delivered += ((TopicChannel<?>) ch).deliverPending();
        return delivered;
    }
}
