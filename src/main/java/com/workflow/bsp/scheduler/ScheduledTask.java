package com.workflow.bsp.scheduler;

import com.workflow.bsp.api.CancellationSignal;
import com.workflow.bsp.api.TaskContext;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * A unit of work for the scheduler: a body, its priority and deadline, the
 * cancellation signal it observes, and a completion callback that receives
 * its {@link TaskOutcome} on the worker thread.
 */
public final class ScheduledTask {
    public static final long NO_DEADLINE = Long.MAX_VALUE;

    private static final int QUEUED = 0, RUNNING = 1, DONE = 2;

    /** The work itself. The returned value becomes {@link TaskOutcome#value()}. */
    @FunctionalInterface
    public interface Body {
        Object run(TaskContext context) throws Exception;
    }

    private final String name;
    private final long superstep;
    private final int basePriority;
    private final long deadlineNanos;
    private final CancellationSignal cancellation;
    private final Body body;
    private final Consumer<TaskOutcome> onComplete;

    private final AtomicInteger state = new AtomicInteger(QUEUED);
    private long sequence;
    private Thread runner;

    private ScheduledTask(Builder b) {
        this.name = b.name;
        this.superstep = b.superstep;
        this.basePriority = b.basePriority;
        this.deadlineNanos = b.deadlineNanos;
        this.cancellation = b.cancellation != null ? b.cancellation : new CancellationSignal();
        this.body = b.body;
        this.onComplete = b.onComplete != null ? b.onComplete : outcome -> {
        };
    }

    public static Builder builder(String name, Body body) {
        return new Builder(name, body);
    }

    public String name() {
        return name;
    }

    public long superstep() {
        return superstep;
    }

    public int basePriority() {
        return basePriority;
    }

    public long deadlineNanos() {
        return deadlineNanos;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    /** Insertion sequence, assigned on submission. */
    public long sequence() {
        return sequence;
    }

    Body body() {
        return body;
    }

    void assignSequence(long seq) {
        this.sequence = seq;
    }

    boolean markRunning() {
        return state.compareAndSet(QUEUED, RUNNING);
    }

    boolean markDone() {
        return state.getAndSet(DONE) != DONE;
    }

    void complete(TaskOutcome outcome) {
        onComplete.accept(outcome);
    }

    synchronized void attachRunner(Thread thread) {
        this.runner = thread;
    }

    synchronized void detachRunner() {
        this.runner = null;
    }

    synchronized void interruptRunner() {
        if (runner != null)
            runner.interrupt();
    }

    @Override
    public String toString() {
        return name + "#" + sequence + "@" + superstep;
    }

    public static final class Builder {
        private final String name;
        private final Body body;
        private long superstep;
        private int basePriority;
        private long deadlineNanos = NO_DEADLINE;
        private CancellationSignal cancellation;
        private Consumer<TaskOutcome> onComplete;

        private Builder(String name, Body body) {
            this.name = Objects.requireNonNull(name, "name");
            this.body = Objects.requireNonNull(body, "body");
        }

        public Builder superstep(long superstep) {
            this.superstep = superstep;
            return this;
        }

        public Builder priority(int basePriority) {
            this.basePriority = basePriority;
            return this;
        }

        /** @param deadlineNanos absolute {@link System#nanoTime()} deadline */
        public Builder deadlineNanos(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder onComplete(Consumer<TaskOutcome> onComplete) {
            this.onComplete = onComplete;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(this);
        }
    }
}
