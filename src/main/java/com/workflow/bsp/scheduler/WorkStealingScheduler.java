package com.workflow.bsp.scheduler;

import com.workflow.bsp.api.CancellationSignal;
import com.workflow.bsp.api.TaskContext;
import com.workflow.bsp.error.SchedulerException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.log4j.Log4j2;

/**
 * Work-stealing task scheduler.
 *
 * Each worker thread owns a {@link WorkerQueue}. A task submitted from a worker
 * thread (a follow-up promoted by a completing task) goes onto that worker's
 * own queue; a task submitted from outside goes to the least-loaded queue,
 * scanning from a round-robin cursor. A worker drains its own queue first and
 * then steals from the others. Idle workers park on a shared readiness
 * condition that every submission signals.
 *
 * Independently of the worker count, an admission gate (a counting semaphore)
 * caps how many tasks execute at once. A task waiting on external I/O through
 * {@link TaskContext#awaitExternal} gives its slot back while it waits.
 *
 * Every task produces exactly one {@link TaskOutcome}, delivered to its
 * completion callback: failures are captured, never dropped. Cancelling a
 * task's {@link CancellationSignal} skips it if still queued and interrupts it
 * if running.
 */
@Log4j2
public final class WorkStealingScheduler implements AutoCloseable {
    private static final ThreadLocal<Worker> CURRENT = new ThreadLocal<>();

    private final SchedulerConfig config;
    private final WorkerQueue[] queues;
    private final Worker[] workers;
    private final Semaphore admission;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger cursor = new AtomicInteger();

    // Readiness notification: only idle workers take this lock.
    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition workAvailable = idleLock.newCondition();
    private final AtomicInteger idleWorkers = new AtomicInteger();

    private volatile boolean running = true;

    public WorkStealingScheduler(SchedulerConfig config) {
        if (config.getWorkers() <= 0)
            throw new IllegalArgumentException("Worker count must be positive: " + config.getWorkers());
        this.config = config;
        int n = config.getWorkers();
        TaskPriority priority = TaskPriority.from(config);
        this.queues = new WorkerQueue[n];
        this.workers = new Worker[n];
        this.admission = new Semaphore(config.effectiveMaxConcurrentTasks(), true);
        for (int i = 0; i < n; i++)
            queues[i] = new WorkerQueue(config.getQueueCapacity(), priority);
        for (int i = 0; i < n; i++) {
            workers[i] = new Worker(i);
            Thread t = new Thread(workers[i], config.getThreadNamePrefix() + "-" + i);
            t.setDaemon(true);
            workers[i].thread = t;
        }
        for (Worker w : workers)
            w.thread.start();
        log.info("Work-stealing scheduler started: {} workers, {} execution slots, queue capacity {}",
                n, config.effectiveMaxConcurrentTasks(), config.getQueueCapacity());
    }

    /**
     * Queues a task for execution.
     *
     * @throws SchedulerException    QUEUE_FULL if every worker queue is at
     *                               capacity
     * @throws IllegalStateException if the scheduler was closed
     */
    public void submit(ScheduledTask task) {
        if (!running)
            throw new IllegalStateException("Scheduler is shut down");
        task.assignSequence(sequence.incrementAndGet());

        Worker self = CURRENT.get();
        if (self != null && self.owner() == this && queues[self.index].offer(task)) {
            signalWork();
            return;
        }

        int n = queues.length;
        int start = Math.floorMod(cursor.getAndIncrement(), n);
        int target = start;
        int targetSize = Integer.MAX_VALUE;
        for (int i = 0; i < n; i++) {
            int q = (start + i) % n;
            int size = queues[q].size();
            if (size < targetSize) {
                target = q;
                targetSize = size;
            }
        }
        if (!queues[target].offer(task) && !offerAnywhere(task, start))
            throw new SchedulerException(SchedulerException.Kind.QUEUE_FULL,
                    "All " + n + " worker queues are full (capacity " + config.getQueueCapacity() + ")",
                    task.superstep(), task.name(), null);
        signalWork();
    }

    private boolean offerAnywhere(ScheduledTask task, int start) {
        for (int i = 0; i < queues.length; i++)
            if (queues[(start + i) % queues.length].offer(task))
                return true;
        return false;
    }

    private void signalWork() {
        if (idleWorkers.get() == 0)
            return;
        idleLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            idleLock.unlock();
        }
    }

    public int workerCount() {
        return workers.length;
    }

    /** @return tasks run by each worker since start, indexed by worker. */
    public long[] processedCounts() {
        long[] out = new long[workers.length];
        for (int i = 0; i < workers.length; i++)
            out[i] = workers[i].processed.get();
        return out;
    }

    /** @return tasks each worker took from another worker's queue. */
    public long[] stolenCounts() {
        long[] out = new long[workers.length];
        for (int i = 0; i < workers.length; i++)
            out[i] = workers[i].stolen.get();
        return out;
    }

    public int queuedTasks() {
        int total = 0;
        for (WorkerQueue q : queues)
            total += q.size();
        return total;
    }

    public int availableSlots() {
        return admission.availablePermits();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops the workers. Tasks still queued complete as CANCELLED.
     */
    @Override
    public void close() {
        if (!running)
            return;
        running = false;
        idleLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            idleLock.unlock();
        }
        for (Worker w : workers)
            w.thread.interrupt();
        for (Worker w : workers) {
            try {
                w.thread.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int dropped = 0;
        for (WorkerQueue q : queues) {
            for (ScheduledTask t : q.drain()) {
                if (t.markDone()) {
                    t.complete(TaskOutcome.cancelled(t, -1));
                    dropped++;
                }
            }
        }
        log.info("Work-stealing scheduler stopped, {} queued task(s) cancelled", dropped);
    }

    private final class Worker implements Runnable {
        private final int index;
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong stolen = new AtomicLong();
        private Thread thread;

        Worker(int index) {
            this.index = index;
        }

        WorkStealingScheduler owner() {
            return WorkStealingScheduler.this;
        }

        @Override
        public void run() {
            CURRENT.set(this);
            try {
                while (running) {
                    ScheduledTask task = queues[index].pop(System.nanoTime());
                    if (task == null)
                        task = steal();
                    if (task == null) {
                        awaitWork();
                        continue;
                    }
                    execute(task);
                }
            } finally {
                CURRENT.remove();
            }
        }

        private ScheduledTask steal() {
            int n = queues.length;
            long now = System.nanoTime();
            for (int i = 1; i < n; i++) {
                ScheduledTask t = queues[(index + i) % n].steal(now);
                if (t != null) {
                    stolen.incrementAndGet();
                    return t;
                }
            }
            return null;
        }

        private boolean anyQueued() {
            for (WorkerQueue q : queues)
                if (q.size() > 0)
                    return true;
            return false;
        }

        private void awaitWork() {
            idleLock.lock();
            idleWorkers.incrementAndGet();
            try {
                if (running && !anyQueued())
                    workAvailable.await(config.getIdleWaitMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // close() interrupts idle workers; the loop re-checks running
                log.debug("Worker {} interrupted while idle, running={}", index, running);
            } finally {
                idleWorkers.decrementAndGet();
                idleLock.unlock();
            }
        }

        private void execute(ScheduledTask task) {
            if (!task.markRunning())
                return;
            CancellationSignal signal = task.cancellation();
            if (signal.isCancelled()) {
                finish(task, TaskOutcome.cancelled(task, index));
                return;
            }
            // Registered before the admission wait so a cancel interrupts a parked task too
            task.attachRunner(Thread.currentThread());
            CancellationSignal.Registration reg = signal.onCancel(task::interruptRunner);
            boolean admitted = false;
            try {
                admission.acquire();
                admitted = true;
            } catch (InterruptedException e) {
                log.debug("Task {} interrupted while waiting for admission", task);
            }
            if (!admitted || signal.isCancelled()) {
                reg.remove();
                task.detachRunner();
                if (admitted)
                    admission.release();
                Thread.interrupted();
                finish(task, TaskOutcome.cancelled(task, index));
                return;
            }

            WorkerContext ctx = new WorkerContext(task);
            long start = System.nanoTime();
            TaskOutcome outcome;
            try {
                Object value = task.body().run(ctx);
                outcome = signal.isCancelled()
                        ? TaskOutcome.cancelled(task, index)
                        : new TaskOutcome(task, TaskOutcome.Status.SUCCEEDED, value, null, index,
                                System.nanoTime() - start);
            } catch (Throwable e) {
                outcome = signal.isCancelled()
                        ? TaskOutcome.cancelled(task, index)
                        : new TaskOutcome(task, TaskOutcome.Status.FAILED, null, e, index,
                                System.nanoTime() - start);
            } finally {
                reg.remove();
                task.detachRunner();
                if (ctx.holdsSlot)
                    admission.release();
                // Drop an interrupt aimed at the task so it cannot leak into the next one
                Thread.interrupted();
            }
            processed.incrementAndGet();
            finish(task, outcome);
        }

        private void finish(ScheduledTask task, TaskOutcome outcome) {
            if (!task.markDone())
                return;
            try {
                task.complete(outcome);
            } catch (RuntimeException e) {
                log.error("Completion callback of task {} failed", task, e);
            }
        }
    }

    private final class WorkerContext implements TaskContext {
        private final ScheduledTask task;
        private boolean holdsSlot = true;

        WorkerContext(ScheduledTask task) {
            this.task = task;
        }

        @Override
        public String nodeName() {
            return task.name();
        }

        @Override
        public long superstep() {
            return task.superstep();
        }

        @Override
        public CancellationSignal cancellation() {
            return task.cancellation();
        }

        @Override
        public <T> T awaitExternal(CompletionStage<T> pending) throws Exception {
            checkCancelled();
            CompletableFuture<T> future = pending.toCompletableFuture();
            admission.release();
            holdsSlot = false;
            try {
                return future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex)
                    throw ex;
                throw e;
            } catch (InterruptedException e) {
                if (isCancelled())
                    throw new CancellationException(task.cancellation().reason());
                throw e;
            } finally {
                admission.acquireUninterruptibly();
                holdsSlot = true;
            }
        }
    }
}
