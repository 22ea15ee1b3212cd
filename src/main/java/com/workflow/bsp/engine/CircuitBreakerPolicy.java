package com.workflow.bsp.engine;

import java.time.Duration;

/**
 * Per-node circuit breaker settings. Once {@code failureThreshold} failures
 * fall inside {@code failureWindow} the breaker opens and the node's compute
 * unit is not called for {@code openDuration}. After that the breaker is
 * half-open: {@code successThreshold} consecutive successes close it again,
 * a single failure reopens it.
 */
public record CircuitBreakerPolicy(int failureThreshold, Duration failureWindow, Duration openDuration,
        int successThreshold) {

    public CircuitBreakerPolicy {
        if (failureThreshold < 1)
            throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
        if (successThreshold < 1)
            throw new IllegalArgumentException("successThreshold must be at least 1: " + successThreshold);
        if (failureWindow == null || failureWindow.isNegative() || failureWindow.isZero())
            throw new IllegalArgumentException("failureWindow must be positive");
        if (openDuration == null || openDuration.isNegative())
            throw new IllegalArgumentException("openDuration must be a non-negative duration");
    }

    /** 5 failures within 60s open the breaker for 30s; 3 successes close it. */
    public static CircuitBreakerPolicy defaults() {
        return new CircuitBreakerPolicy(5, Duration.ofSeconds(60), Duration.ofSeconds(30), 3);
    }
}
