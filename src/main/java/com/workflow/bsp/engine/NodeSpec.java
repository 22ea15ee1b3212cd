package com.workflow.bsp.engine;

import com.workflow.bsp.api.ComputeUnit;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Declaration of a graph node: its compute unit, the channels it reads and
 * writes, and its scheduling hints.
 */
public final class NodeSpec {
    private final String name;
    private final ComputeUnit unit;
    private final Set<String> reads;
    private final Set<String> writes;
    private final int priority;
    private final Duration deadline;
    private final RetryPolicy retry;
    private final CircuitBreakerPolicy circuitBreaker;

    private NodeSpec(Builder b) {
        this.name = b.name;
        this.unit = b.unit;
        this.reads = Collections.unmodifiableSet(new LinkedHashSet<>(b.reads));
        this.writes = Collections.unmodifiableSet(new LinkedHashSet<>(b.writes));
        this.priority = b.priority;
        this.deadline = b.deadline;
        this.retry = b.retry;
        this.circuitBreaker = b.circuitBreaker;
    }

    public static Builder builder(String name, ComputeUnit unit) {
        return new Builder(name, unit);
    }

    public String name() {
        return name;
    }

    public ComputeUnit unit() {
        return unit;
    }

    public Set<String> reads() {
        return reads;
    }

    public Set<String> writes() {
        return writes;
    }

    public int priority() {
        return priority;
    }

    /** @return deadline relative to the start of the superstep, or null. */
    public Duration deadline() {
        return deadline;
    }

    public RetryPolicy retry() {
        return retry;
    }

    /** @return the breaker settings, or null when the node has no breaker. */
    public CircuitBreakerPolicy circuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public String toString() {
        return name + " reads=" + reads + " writes=" + writes;
    }

    public static final class Builder {
        private final String name;
        private final ComputeUnit unit;
        private final Set<String> reads = new LinkedHashSet<>();
        private final Set<String> writes = new LinkedHashSet<>();
        private int priority;
        private Duration deadline;
        private RetryPolicy retry = RetryPolicy.NONE;
        private CircuitBreakerPolicy circuitBreaker;

        private Builder(String name, ComputeUnit unit) {
            this.name = Objects.requireNonNull(name, "name");
            this.unit = Objects.requireNonNull(unit, "unit");
        }

        public Builder reads(String... channels) {
            Collections.addAll(reads, channels);
            return this;
        }

        public Builder reads(Collection<String> channels) {
            reads.addAll(channels);
            return this;
        }

        public Builder writes(String... channels) {
            Collections.addAll(writes, channels);
            return this;
        }

        public Builder writes(Collection<String> channels) {
            writes.addAll(channels);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = Objects.requireNonNull(retry, "retry");
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerPolicy circuitBreaker) {
            this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
            return this;
        }

        public NodeSpec build() {
            return new NodeSpec(this);
        }
    }
}
