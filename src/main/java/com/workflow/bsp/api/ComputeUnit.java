package com.workflow.bsp.api;

/**
 * The user-supplied computation behind a graph node.
 *
 * A compute unit receives a read-only snapshot of its declared input channels
 * and returns the updates it wants applied plus the nodes it wants scheduled
 * next. It must not keep references to its input beyond the call, and it is
 * invoked concurrently with other compute units of the same superstep.
 *
 * Throwing marks the task as failed. Whether that aborts the superstep depends
 * on the execution's failure policy.
 */
@FunctionalInterface
public interface ComputeUnit {
    NodeOutput compute(NodeInput input, TaskContext context) throws Exception;
}
