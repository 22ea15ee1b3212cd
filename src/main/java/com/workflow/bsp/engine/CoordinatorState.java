package com.workflow.bsp.engine;

/** Lifecycle of a {@link SuperstepCoordinator}. */
public enum CoordinatorState {
    IDLE,
    READ_PHASE,
    EXECUTE_PHASE,
    WRITE_PHASE,
    CHECKPOINT_PHASE,
    PAUSED,
    TERMINATED,
    ABORTED;

    /** @return true if no superstep is in flight. */
    public boolean isAtRest() {
        return this == IDLE || this == PAUSED || this == TERMINATED || this == ABORTED;
    }

    public boolean isFinal() {
        return this == TERMINATED || this == ABORTED;
    }
}
