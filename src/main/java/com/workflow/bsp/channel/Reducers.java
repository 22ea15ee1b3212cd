package com.workflow.bsp.channel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * Stock reducers for {@link ChannelSpec#binaryOperator}. All of them are
 * associative; all except {@link #append()}, {@link #merge()} and
 * {@link #replace()} are also commutative.
 */
public final class Reducers {

    private Reducers() {
    }

    public static BinaryOperator<Integer> intSum() {
        return Integer::sum;
    }

    public static BinaryOperator<Long> longSum() {
        return Long::sum;
    }

    public static BinaryOperator<Double> doubleSum() {
        return Double::sum;
    }

    public static <T extends Comparable<? super T>> BinaryOperator<T> max() {
        return max(Comparator.naturalOrder());
    }

    public static <T> BinaryOperator<T> max(Comparator<? super T> order) {
        return (a, b) -> order.compare(a, b) >= 0 ? a : b;
    }

    public static <T extends Comparable<? super T>> BinaryOperator<T> min() {
        return min(Comparator.naturalOrder());
    }

    public static <T> BinaryOperator<T> min(Comparator<? super T> order) {
        return (a, b) -> order.compare(a, b) <= 0 ? a : b;
    }

    /** Concatenates lists; the result is a new immutable list. */
    public static <T> BinaryOperator<List<T>> append() {
        return (a, b) -> {
            List<T> out = new ArrayList<>(a.size() + b.size());
            out.addAll(a);
            out.addAll(b);
            return Collections.unmodifiableList(out);
        };
    }

    /** Shallow map merge; keys of the right operand win. */
    public static <K, V> BinaryOperator<Map<K, V>> merge() {
        return (a, b) -> {
            Map<K, V> out = new LinkedHashMap<>(a);
            out.putAll(b);
            return Collections.unmodifiableMap(out);
        };
    }

    public static <T> BinaryOperator<T> replace() {
        return (a, b) -> b;
    }
}
