package com.workflow.bsp.util;

import com.workflow.bsp.api.SuperstepListener;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates task duration and failure statistics per node to identify bottlenecks. */
public class NodeProfileListener implements SuperstepListener {

    public static class NodeStats {
        public final String name;
        public long count;
        public long failures;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void failed() {
            failures++;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Task callbacks arrive on worker threads
    private final Map<String, NodeStats> stats = new ConcurrentHashMap<>();

    /** @return stats of one node, or null if it never ran. */
    public NodeStats stats(String nodeName) {
        return stats.get(nodeName);
    }

    @Override
    public void onSuperstepStart(long superstep, int activeNodes) {
        // No-op
    }

    @Override
    public void onTaskCompleted(long superstep, String nodeName, int writes, long durationNanos) {
        stats.computeIfAbsent(nodeName, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onTaskFailed(long superstep, String nodeName, Throwable error) {
        stats.computeIfAbsent(nodeName, NodeStats::new).failed();
    }

    @Override
    public void onSuperstepEnd(long superstep, int tasksCompleted, int channelsChanged) {
        // No-op
    }

    /** Resets all collected statistics. */
    public void reset() {
        stats.clear();
    }

    /**
     * Returns a formatted table of node statistics, slowest total first.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %8s | %10s | %10s | %10s | %10s%n", "Node Name", "Count", "Failed",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append(
                "-------------------------------------------------------------------------------------------------------------\n");

        NodeStats[] validStats = stats.values().stream()
                .filter(s -> s.count > 0 || s.failures > 0)
                .toArray(NodeStats[]::new);

        Arrays.sort(validStats, (s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : validStats) {
            synchronized (s) {
                sb.append(String.format("%-30s | %10d | %8d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                        truncate(s.name, 30),
                        s.count,
                        s.failures,
                        s.lastDurationNanos / 1000.0,
                        s.avgMicros(),
                        s.count == 0 ? 0 : s.minDurationNanos / 1000.0,
                        s.count == 0 ? 0 : s.maxDurationNanos / 1000.0));
            }
        }

        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
