package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.EmptyChannelException;

import java.util.List;

/**
 * Holds a value for one superstep.
 *
 * An empty update batch clears the value; the coordinator sends one to every
 * ephemeral channel that was not written in a superstep, so a value survives
 * until the next superstep boundary. With {@code clearOnRead} the value is
 * instead dropped right after the first superstep that read it.
 */
public final class EphemeralValueChannel<V> extends Channel<V, V, V> {
    private final Class<?> valueType;
    private final boolean clearOnRead;
    private V value;

    EphemeralValueChannel(String name, Class<?> valueType, boolean clearOnRead) {
        super(name, valueType);
        this.valueType = valueType;
        this.clearOnRead = clearOnRead;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EPHEMERAL_VALUE;
    }

    @Override
    public V get() {
        if (value == null)
            throw new EmptyChannelException(name());
        return value;
    }

    @Override
    public boolean isAvailable() {
        return value != null;
    }

    @Override
    public boolean update(List<V> updates) {
        if (updates.isEmpty())
            return clear();
        value = updates.get(updates.size() - 1);
        return true;
    }

    @Override
    public boolean consume() {
        return clearOnRead && clear();
    }

    @Override
    public boolean finish() {
        return clear();
    }

    private boolean clear() {
        if (value == null)
            return false;
        value = null;
        return true;
    }

    public boolean clearOnRead() {
        return clearOnRead;
    }

    @Override
    public V checkpoint() {
        return value;
    }

    @Override
    public void restore(V checkpoint) {
        this.value = checkpoint;
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        return types.constructType(valueType);
    }
}
