package com.workflow.bsp.engine;

import java.time.Duration;

/**
 * Per-node retry of a failing compute unit inside its task. A cancelled task
 * is never retried.
 *
 * @param maxAttempts total attempts, at least 1
 * @param backoff     pause between attempts
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        if (backoff == null || backoff.isNegative())
            throw new IllegalArgumentException("backoff must be a non-negative duration");
    }

    public static RetryPolicy of(int maxAttempts, Duration backoff) {
        return new RetryPolicy(maxAttempts, backoff);
    }
}
