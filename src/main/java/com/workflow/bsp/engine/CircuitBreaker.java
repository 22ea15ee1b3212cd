package com.workflow.bsp.engine;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

import lombok.extern.log4j.Log4j2;

/**
 * Circuit breaker guarding one node's compute unit for the lifetime of an
 * execution. Tasks of the node may run on several workers at once, so every
 * transition happens under the breaker's monitor.
 */
@Log4j2
public final class CircuitBreaker {

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final String nodeName;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;

    private State state = State.CLOSED;
    private long stateChangedAt;
    private final Deque<Long> failureTimes = new ArrayDeque<>();
    private int halfOpenSuccesses;
    private long rejected;

    public CircuitBreaker(String nodeName, CircuitBreakerPolicy policy, Clock clock) {
        this.nodeName = nodeName;
        this.policy = policy;
        this.clock = clock;
        this.stateChangedAt = clock.millis();
    }

    /**
     * @return whether a call may go through. An open breaker whose open period
     *         has elapsed moves to half-open and lets the call through.
     */
    public synchronized boolean tryAcquire() {
        if (state == State.OPEN) {
            if (clock.millis() - stateChangedAt < policy.openDuration().toMillis()) {
                rejected++;
                return false;
            }
            transition(State.HALF_OPEN);
        }
        return true;
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN && ++halfOpenSuccesses >= policy.successThreshold())
            transition(State.CLOSED);
    }

    public synchronized void recordFailure() {
        long now = clock.millis();
        failureTimes.addLast(now);
        long windowStart = now - policy.failureWindow().toMillis();
        while (!failureTimes.isEmpty() && failureTimes.peekFirst() <= windowStart)
            failureTimes.removeFirst();
        if (state == State.HALF_OPEN
                || (state == State.CLOSED && failureTimes.size() >= policy.failureThreshold()))
            transition(State.OPEN);
    }

    public synchronized State state() {
        return state;
    }

    /** @return calls refused while open. */
    public synchronized long rejectedCount() {
        return rejected;
    }

    /** @return failures currently inside the failure window. */
    public synchronized int recentFailures() {
        return failureTimes.size();
    }

    public String nodeName() {
        return nodeName;
    }

    // Caller holds the monitor
    private void transition(State next) {
        State previous = state;
        state = next;
        stateChangedAt = clock.millis();
        halfOpenSuccesses = 0;
        if (next == State.CLOSED)
            failureTimes.clear();
        if (next == State.OPEN)
            log.warn("Circuit breaker of node '{}' opened ({} -> OPEN, {} recent failure(s))",
                    nodeName, previous, failureTimes.size());
        else
            log.info("Circuit breaker of node '{}' {} -> {}", nodeName, previous, next);
    }
}
