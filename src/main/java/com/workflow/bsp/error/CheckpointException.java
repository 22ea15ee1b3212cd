package com.workflow.bsp.error;

/**
 * Wraps a failure of the checkpoint collaborator. Reported separately from the
 * execution outcome: a failed save never rolls back applied writes.
 */
public class CheckpointException extends BspException {
    public CheckpointException(String message, Throwable cause) {
        super(message, NO_SUPERSTEP, null, cause);
    }

    public CheckpointException(String message, long superstep, Throwable cause) {
        super(message, superstep, null, cause);
    }
}
