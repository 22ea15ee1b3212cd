package com.workflow.bsp.scheduler;

import lombok.Data;

/**
 * Tuning knobs for {@link WorkStealingScheduler}.
 */
@Data
public class SchedulerConfig {
    /** Number of worker threads, each owning one queue. */
    private int workers = Runtime.getRuntime().availableProcessors();

    /**
     * Size of the admission gate: tasks allowed to execute at the same time
     * across all workers. Zero or less means one per worker.
     */
    private int maxConcurrentTasks = 0;

    /** Capacity of each worker queue. */
    private int queueCapacity = 1024;

    /** Remaining time below which the deadline boost grows steeply. */
    private long shortDeadlineMillis = 10;

    /** Remaining time below which a deadline starts to boost priority. */
    private long longDeadlineMillis = 100;

    /** Upper bound on how long an idle worker sleeps before rescanning queues. */
    private long idleWaitMillis = 50;

    private String threadNamePrefix = "bsp-worker";

    public int effectiveMaxConcurrentTasks() {
        return maxConcurrentTasks > 0 ? maxConcurrentTasks : workers;
    }
}
