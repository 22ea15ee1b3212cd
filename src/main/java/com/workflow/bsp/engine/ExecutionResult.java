package com.workflow.bsp.engine;

import com.workflow.bsp.error.CheckpointException;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@code invoke} or {@code resume}.
 *
 * @param executionId        the execution
 * @param status             COMPLETED on quiescence, INTERRUPTED when paused
 * @param supersteps         number of the last executed superstep
 * @param values             channel values at the end, available channels only
 * @param failures           task failures recorded under best effort
 * @param checkpointFailures saves that failed; the writes they cover were kept
 * @param lastCheckpointId   id of the last saved checkpoint, or null
 */
public record ExecutionResult(String executionId, Status status, long supersteps, Map<String, Object> values,
        List<TaskFailure> failures, List<CheckpointException> checkpointFailures, String lastCheckpointId) {

    public enum Status {
        COMPLETED,
        INTERRUPTED
    }

    public boolean isInterrupted() {
        return status == Status.INTERRUPTED;
    }

    @SuppressWarnings("unchecked")
    public <T> T value(String channel) {
        return (T) values.get(channel);
    }
}
