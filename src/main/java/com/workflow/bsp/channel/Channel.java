package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.InvalidUpdateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Channel -- a named, typed unit of graph state with variant-specific merge
 * semantics.
 *
 * A channel has three types: the Value type {@code V} returned by
 * {@link #get()}, the Update type {@code U} accepted by {@link #update(List)},
 * and the Checkpoint type {@code C} produced by {@link #checkpoint()}.
 *
 * The set of variants is closed: constructors are package-private and every
 * subclass reports its {@link ChannelKind}. Channels are not thread-safe. During
 * the execute phase they are only read; they are mutated exclusively by the
 * coordinator during the write phase.
 *
 * Reading never mutates a channel. Variant behaviour that depends on reads
 * (ephemeral clear-on-read, barrier reset) runs in {@link #consume()}, which the
 * coordinator calls for every channel read in a superstep.
 */
public abstract class Channel<V, U, C> {
    private final String name;
    private final Class<?> updateType;

    Channel(String name, Class<?> updateType) {
        this.name = Objects.requireNonNull(name, "name");
        this.updateType = Objects.requireNonNull(updateType, "updateType");
    }

    public final String name() {
        return name;
    }

    public abstract ChannelKind kind();

    /**
     * @return the current value
     * @throws com.workflow.bsp.error.EmptyChannelException if the channel holds
     *                                                      nothing readable
     */
    public abstract V get();

    /** @return true if {@link #get()} would return a value. */
    public abstract boolean isAvailable();

    /**
     * Applies an ordered batch of updates.
     *
     * @return true if the channel state changed
     */
    public abstract boolean update(List<U> updates);

    /** @return a snapshot that is independent of later mutations of this channel. */
    public abstract C checkpoint();

    /** Replaces the state of this channel with the given snapshot. */
    public abstract void restore(C checkpoint);

    /** Jackson type of the checkpoint, used to decode persisted snapshots. */
    public abstract JavaType checkpointType(TypeFactory types);

    /** Called after a superstep in which the channel was read. */
    public boolean consume() {
        return false;
    }

    /** Called once when the execution reaches quiescence. */
    public boolean finish() {
        return false;
    }

    /** @return false if the channel is excluded from registry checkpoints. */
    public boolean tracked() {
        return true;
    }

    /**
     * Type-checks an untyped batch and applies it. Used by the registry, where
     * writes arrive from compute units as plain objects.
     */
    @SuppressWarnings("unchecked")
    public final boolean updateUnchecked(List<?> raw) {
        List<U> typed = new ArrayList<>(raw.size());
        for (Object value : raw) {
            if (value == null)
                throw new InvalidUpdateException(name, "null updates are not accepted");
            if (!updateType.isInstance(value))
                throw new InvalidUpdateException(name, "expected " + updateType.getSimpleName()
                        + " but got " + value.getClass().getSimpleName());
            typed.add((U) value);
        }
        return update(typed);
    }

    @SuppressWarnings("unchecked")
    public final void restoreUnchecked(Object checkpoint) {
        restore((C) checkpoint);
    }

    @Override
    public String toString() {
        return kind() + "(" + name + ")";
    }
}
