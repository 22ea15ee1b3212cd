package com.workflow.bsp.engine;

import java.util.List;
import java.util.Map;

/**
 * State of an execution between supersteps.
 *
 * @param executionId the execution
 * @param state       coordinator state when the snapshot was taken
 * @param superstep   last executed superstep
 * @param values      values of the available channels
 * @param nextNodes   nodes scheduled for the next superstep by goTo, send or entry
 */
public record ExecutionSnapshot(String executionId, CoordinatorState state, long superstep,
        Map<String, Object> values, List<String> nextNodes) {
}
