package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.ChannelSerializationException;
import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.util.Jsons;

import java.util.List;

/**
 * Type-erased container. Accepts payloads of any type and keeps the last one.
 * The checkpoint records the runtime class so a decoded snapshot comes back as
 * the same type.
 */
public final class AnyValueChannel extends Channel<Object, Object, AnyValueChannel.Snapshot> {

    /** Checkpoint form: runtime class name plus the value itself. */
    public record Snapshot(String type, Object value) {
    }

    private Object value;

    AnyValueChannel(String name) {
        super(name, Object.class);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.ANY_VALUE;
    }

    @Override
    public Object get() {
        if (value == null)
            throw new EmptyChannelException(name());
        return value;
    }

    @Override
    public boolean isAvailable() {
        return value != null;
    }

    @Override
    public boolean update(List<Object> updates) {
        if (updates.isEmpty())
            return false;
        value = updates.get(updates.size() - 1);
        return true;
    }

    @Override
    public Snapshot checkpoint() {
        return value == null ? null : new Snapshot(value.getClass().getName(), value);
    }

    @Override
    public void restore(Snapshot checkpoint) {
        if (checkpoint == null || checkpoint.value() == null) {
            value = null;
            return;
        }
        try {
            Class<?> type = Class.forName(checkpoint.type());
            value = type.isInstance(checkpoint.value())
                    ? checkpoint.value()
                    : Jsons.mapper().convertValue(checkpoint.value(), type);
        } catch (ClassNotFoundException | IllegalArgumentException e) {
            throw new ChannelSerializationException(name(), "cannot restore value of type " + checkpoint.type(), e);
        }
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        return types.constructType(Snapshot.class);
    }
}
