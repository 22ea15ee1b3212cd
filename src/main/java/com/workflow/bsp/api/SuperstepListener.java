package com.workflow.bsp.api;

/**
 * Observability hooks for the superstep loop.
 *
 * Implementations can be registered with the coordinator to receive callbacks
 * during execution: profiling task durations, tracing which nodes ran in a
 * superstep, counting failures.
 *
 * Threading:
 * {@link #onSuperstepStart} and {@link #onSuperstepEnd} run on the coordinator
 * thread. Task callbacks run on scheduler worker threads, possibly
 * concurrently, and must be thread-safe and cheap: they sit on the task
 * completion path.
 */
public interface SuperstepListener {

    /**
     * Called after the read phase, before any task of the superstep runs.
     *
     * @param superstep   The superstep sequence number.
     * @param activeNodes Number of nodes activated by the read phase.
     */
    void onSuperstepStart(long superstep, int activeNodes);

    /**
     * Called when a task finished successfully.
     *
     * @param superstep     Current superstep.
     * @param nodeName      The node the task ran.
     * @param writes        Number of update values the task produced.
     * @param durationNanos Wall time of the compute unit, retries included.
     */
    void onTaskCompleted(long superstep, String nodeName, int writes, long durationNanos);

    /**
     * Called when a task failed, whatever the failure policy.
     */
    void onTaskFailed(long superstep, String nodeName, Throwable error);

    /**
     * Called after the write phase of a superstep was applied.
     *
     * @param superstep       Current superstep.
     * @param tasksCompleted  Tasks whose writes were applied.
     * @param channelsChanged Channels whose state changed.
     */
    void onSuperstepEnd(long superstep, int tasksCompleted, int channelsChanged);
}
