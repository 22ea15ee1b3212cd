package com.workflow.bsp.util;

import com.workflow.bsp.api.SuperstepListener;

import java.util.Arrays;

/**
 * Aggregates multiple {@link SuperstepListener} instances with
 * allocation-free iteration. Registration copies the array, so listeners may
 * be added while worker threads are notifying.
 */
public class CompositeSuperstepListener implements SuperstepListener {
    private volatile SuperstepListener[] listeners = new SuperstepListener[0];

    public synchronized void addForComposite(SuperstepListener listener) {
        SuperstepListener[] old = listeners;
        SuperstepListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onSuperstepStart(long superstep, int activeNodes) {
        for (SuperstepListener l : listeners)
            l.onSuperstepStart(superstep, activeNodes);
    }

    @Override
    public void onTaskCompleted(long superstep, String nodeName, int writes, long durationNanos) {
        for (SuperstepListener l : listeners)
            l.onTaskCompleted(superstep, nodeName, writes, durationNanos);
    }

    @Override
    public void onTaskFailed(long superstep, String nodeName, Throwable error) {
        for (SuperstepListener l : listeners)
            l.onTaskFailed(superstep, nodeName, error);
    }

    @Override
    public void onSuperstepEnd(long superstep, int tasksCompleted, int channelsChanged) {
        for (SuperstepListener l : listeners)
            l.onSuperstepEnd(superstep, tasksCompleted, channelsChanged);
    }
}
