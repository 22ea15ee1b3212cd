package com.workflow.bsp.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Task deque owned by one worker.
 *
 * The owner takes the highest effective priority, newest first among equals
 * (LIFO, keeps recently spawned follow-up work hot). A thief takes the highest
 * effective priority, oldest first among equals (FIFO), and only when the
 * victim holds more than one task. The lock is per queue; there is no lock
 * shared by all queues on the dispatch path.
 */
final class WorkerQueue {
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<ScheduledTask> deque = new ArrayDeque<>();
    private final int capacity;
    private final TaskPriority priority;

    WorkerQueue(int capacity, TaskPriority priority) {
        this.capacity = capacity;
        this.priority = priority;
    }

    /** @return false if the queue is at capacity. */
    boolean offer(ScheduledTask task) {
        lock.lock();
        try {
            if (deque.size() >= capacity)
                return false;
            deque.addLast(task);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Owner side. */
    ScheduledTask pop(long nowNanos) {
        lock.lock();
        try {
            if (deque.isEmpty())
                return null;
            ScheduledTask best = best(deque.descendingIterator(), nowNanos);
            deque.removeLastOccurrence(best);
            return best;
        } finally {
            lock.unlock();
        }
    }

    /** Thief side. */
    ScheduledTask steal(long nowNanos) {
        lock.lock();
        try {
            if (deque.size() <= 1)
                return null;
            ScheduledTask best = best(deque.iterator(), nowNanos);
            deque.removeFirstOccurrence(best);
            return best;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return deque.size();
        } finally {
            lock.unlock();
        }
    }

    List<ScheduledTask> drain() {
        lock.lock();
        try {
            List<ScheduledTask> out = new ArrayList<>(deque);
            deque.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    // First strictly-greater wins, so ties go to the end the iterator starts from.
    private ScheduledTask best(Iterator<ScheduledTask> it, long nowNanos) {
        ScheduledTask best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        while (it.hasNext()) {
            ScheduledTask t = it.next();
            double score = priority.effective(t, nowNanos);
            if (best == null || score > bestScore) {
                best = t;
                bestScore = score;
            }
        }
        return best;
    }
}
