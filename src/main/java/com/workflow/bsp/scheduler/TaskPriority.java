package com.workflow.bsp.scheduler;

/**
 * Effective priority of a queued task: its base priority plus an urgency boost
 * derived from its deadline.
 *
 * Boost curve, by remaining time until the deadline:
 * - no deadline, or at least the long threshold left: 0
 * - between the long and short thresholds: rises linearly to {@link #LONG_BOOST}
 * - below the short threshold: rises linearly from {@link #LONG_BOOST} to
 *   {@link #SHORT_BOOST}
 * - deadline passed: {@link #MAX_BOOST}
 */
public final class TaskPriority {
    public static final double LONG_BOOST = 10;
    public static final double SHORT_BOOST = 100;
    public static final double MAX_BOOST = 1000;

    private final long shortNanos;
    private final long longNanos;

    public TaskPriority(long shortThresholdMillis, long longThresholdMillis) {
        if (shortThresholdMillis <= 0 || longThresholdMillis <= shortThresholdMillis)
            throw new IllegalArgumentException("Need 0 < short < long thresholds, got short="
                    + shortThresholdMillis + "ms long=" + longThresholdMillis + "ms");
        this.shortNanos = shortThresholdMillis * 1_000_000;
        this.longNanos = longThresholdMillis * 1_000_000;
    }

    public static TaskPriority from(SchedulerConfig config) {
        return new TaskPriority(config.getShortDeadlineMillis(), config.getLongDeadlineMillis());
    }

    public double urgencyBoost(long deadlineNanos, long nowNanos) {
        if (deadlineNanos == ScheduledTask.NO_DEADLINE)
            return 0;
        long remaining = deadlineNanos - nowNanos;
        if (remaining <= 0)
            return MAX_BOOST;
        if (remaining >= longNanos)
            return 0;
        if (remaining >= shortNanos)
            return LONG_BOOST * (longNanos - remaining) / (double) (longNanos - shortNanos);
        return LONG_BOOST + (SHORT_BOOST - LONG_BOOST) * (shortNanos - remaining) / (double) shortNanos;
    }

    public double effective(ScheduledTask task, long nowNanos) {
        return task.basePriority() + urgencyBoost(task.deadlineNanos(), nowNanos);
    }
}
