package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.error.InvalidUpdateException;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Folds every update into the current value with an associative reducer.
 *
 * Several tasks may write in the same superstep; their writes are folded in
 * completion order. The result only ignores that order if the reducer is also
 * commutative, which callers must guarantee.
 */
public final class BinaryOperatorChannel<V> extends Channel<V, V, V> {
    private final Class<?> valueType;
    private final BinaryOperator<V> reducer;
    private final V seed;
    private V value;

    BinaryOperatorChannel(String name, Class<?> valueType, BinaryOperator<V> reducer, V seed) {
        super(name, valueType);
        this.valueType = valueType;
        this.reducer = reducer;
        this.seed = seed;
        this.value = seed;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.BINARY_OPERATOR;
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
            return false;
        V acc = value;
        for (V u : updates) {
            try {
                acc = acc == null ? u : reducer.apply(acc, u);
            } catch (RuntimeException e) {
                throw new InvalidUpdateException(name(), "reducer failed on " + u, e);
            }
            if (acc == null)
                throw new InvalidUpdateException(name(), "reducer returned null");
        }
        value = acc;
        return true;
    }

    @Override
    public V checkpoint() {
        return value;
    }

    @Override
    public void restore(V checkpoint) {
        this.value = checkpoint != null ? checkpoint : seed;
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        return types.constructType(valueType);
    }
}
