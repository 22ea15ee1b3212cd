package com.workflow.bsp.scheduler;

/** What a failed task does to the rest of its superstep. */
public enum FailurePolicy {
    /** The first failure cancels the outstanding tasks and aborts the execution. */
    FAIL_FAST,
    /** Failures are recorded; the other tasks continue and their writes apply. */
    BEST_EFFORT
}
