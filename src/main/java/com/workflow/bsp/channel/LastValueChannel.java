package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.EmptyChannelException;

import java.util.List;

/**
 * Keeps only the final element of each update batch.
 */
public class LastValueChannel<V> extends Channel<V, V, V> {
    private final Class<?> valueType;
    private final V defaultValue;
    private V value;

    LastValueChannel(String name, Class<?> valueType, V defaultValue) {
        super(name, valueType);
        this.valueType = valueType;
        this.defaultValue = defaultValue;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.LAST_VALUE;
    }

    @Override
    public V get() {
        if (value != null)
            return value;
        if (defaultValue != null)
            return defaultValue;
        throw new EmptyChannelException(name());
    }

    @Override
    public boolean isAvailable() {
        return value != null || defaultValue != null;
    }

    @Override
    public boolean update(List<V> updates) {
        if (updates.isEmpty())
            return false;
        value = updates.get(updates.size() - 1);
        return true;
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
