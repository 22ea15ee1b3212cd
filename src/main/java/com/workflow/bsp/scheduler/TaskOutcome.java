package com.workflow.bsp.scheduler;

/**
 * What became of one scheduled task. Every task submitted to the scheduler
 * produces exactly one outcome, including tasks cancelled before they ran.
 *
 * @param worker index of the worker that ran the task, or -1 if it never ran
 */
public record TaskOutcome(ScheduledTask task, Status status, Object value, Throwable error, int worker,
        long durationNanos) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    static TaskOutcome cancelled(ScheduledTask task, int worker) {
        return new TaskOutcome(task, Status.CANCELLED, null, null, worker, 0);
    }
}
