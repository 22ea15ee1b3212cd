package com.workflow.bsp.api;

import java.util.concurrent.CompletionStage;

/**
 * Runtime handle passed to a compute unit for the duration of one task.
 */
public interface TaskContext {

    String nodeName();

    long superstep();

    CancellationSignal cancellation();

    default boolean isCancelled() {
        return cancellation().isCancelled();
    }

    default void checkCancelled() {
        cancellation().throwIfCancelled();
    }

    /**
     * Waits for an external operation (a tool call, a collaborator call)
     * without holding an execution slot. The slot is handed back to the
     * scheduler for the duration of the wait and re-acquired afterwards.
     *
     * @throws java.util.concurrent.CancellationException if the task is
     *                                                    cancelled while waiting
     * @throws Exception                                  the failure of the
     *                                                    external operation
     */
    <T> T awaitExternal(CompletionStage<T> pending) throws Exception;
}
