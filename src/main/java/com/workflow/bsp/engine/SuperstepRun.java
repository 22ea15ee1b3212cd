package com.workflow.bsp.engine;

import com.workflow.bsp.api.CancellationSignal;
import com.workflow.bsp.api.NodeInput;
import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.api.SuperstepListener;
import com.workflow.bsp.api.TaskContext;
import com.workflow.bsp.channel.Channel;
import com.workflow.bsp.channel.ChannelRegistry;
import com.workflow.bsp.error.CircuitOpenException;
import com.workflow.bsp.error.InvalidUpdateException;
import com.workflow.bsp.error.SchedulerException;
import com.workflow.bsp.scheduler.FailurePolicy;
import com.workflow.bsp.scheduler.ScheduledTask;
import com.workflow.bsp.scheduler.TaskOutcome;
import com.workflow.bsp.scheduler.WorkStealingScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.log4j.Log4j2;

/**
 * The execute phase of one superstep.
 *
 * Tasks are submitted as the dependency round releases their nodes. Each
 * completion callback runs on the worker that ran the task and, under the run
 * lock, records the outcome and submits whatever became ready. A task's input
 * is its settled view: committed channel values plus the writes of the
 * upstream tasks that completed before it, merged on scratch copies of the
 * channels. The registry itself is only read here.
 */
@Log4j2
final class SuperstepRun {
    private static final long CANCEL_GRACE_NANOS = TimeUnit.SECONDS.toNanos(1);

    /** Why a node runs: a plain activation or a send carrying a payload. */
    record Activation(Object payload, boolean send) {
        static final Activation PLAIN = new Activation(null, false);

        static Activation send(Object payload) {
            return new Activation(payload, true);
        }
    }

    /**
     * @param completed  successful tasks, in completion order
     * @param executed   every task that ran to an outcome, failed ones included
     * @param failures   failures recorded under best effort
     * @param fatal      what stopped the phase early, or null
     * @param timedOut   whether the phase ran out of time
     * @param unfinished nodes that had not completed when the phase ended
     */
    record Result(List<Task> completed, List<Task> executed, List<TaskFailure> failures, Throwable fatal,
            boolean timedOut, List<String> unfinished) {
    }

    private final CompiledGraph graph;
    private final ChannelRegistry registry;
    private final WorkStealingScheduler scheduler;
    private final ExecutionConfig config;
    private final SuperstepListener listener;
    private final Map<String, CircuitBreaker> breakers;
    private final long superstep;
    private final Map<String, List<Activation>> plan;
    private final DependencyResolver.Round round;
    private final CancellationSignal signal = new CancellationSignal();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition progress = lock.newCondition();

    // Guarded by lock
    private final List<Task> completed = new ArrayList<>();
    private final List<Task> executed = new ArrayList<>();
    private final List<TaskFailure> failures = new ArrayList<>();
    private Throwable fatal;
    private int inFlight;
    private boolean stopping;

    private long startNanos;

    SuperstepRun(CompiledGraph graph, ChannelRegistry registry, WorkStealingScheduler scheduler,
            ExecutionConfig config, SuperstepListener listener, Map<String, CircuitBreaker> breakers, long superstep,
            Map<String, List<Activation>> plan) {
        this.graph = graph;
        this.registry = registry;
        this.scheduler = scheduler;
        this.config = config;
        this.listener = listener;
        this.breakers = breakers;
        this.superstep = superstep;
        this.plan = plan;
        this.round = graph.resolver().newRound();
    }

    /**
     * Runs the phase to completion, to the first fatal failure, or to the
     * timeout. Called on the coordinator thread.
     */
    Result execute() {
        startNanos = System.nanoTime();
        Duration timeout = config.getSuperstepTimeout();
        boolean timedOut = false;
        lock.lock();
        try {
            for (Map.Entry<String, List<Activation>> e : plan.entrySet())
                round.activate(e.getKey(), e.getValue().size());
            dispatch(round.drainReady());

            long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
            while (fatal == null && !round.isFinished()) {
                if (timeout == null) {
                    progress.await();
                } else if (remaining <= 0) {
                    timedOut = true;
                    break;
                } else {
                    remaining = progress.awaitNanos(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (fatal == null)
                fatal = new CancellationException("Coordinator thread interrupted in superstep " + superstep);
        } finally {
            try {
                if (fatal != null || timedOut)
                    stop(timedOut ? "superstep " + superstep + " timed out" : "superstep " + superstep + " failed");
            } finally {
                lock.unlock();
            }
        }
        lock.lock();
        try {
            return new Result(List.copyOf(completed), List.copyOf(executed), List.copyOf(failures), fatal, timedOut,
                    round.unfinished());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void stop(String reason) {
        stopping = true;
        signal.cancel(reason);
        long remaining = CANCEL_GRACE_NANOS;
        try {
            while (inFlight > 0 && remaining > 0)
                remaining = progress.awaitNanos(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (inFlight > 0)
            log.warn("{} task(s) of superstep {} still running after cancellation; their results are discarded",
                    inFlight, superstep);
    }

    // Caller holds the lock
    private void dispatch(List<String> ready) {
        for (String name : ready) {
            NodeSpec spec = graph.node(name);
            List<Activation> activations = plan.getOrDefault(name, List.of(Activation.PLAIN));

            Map<String, List<Object>> upstream = new HashMap<>();
            Map<String, Integer> included = new HashMap<>();
            for (Task done : completed) {
                if (!graph.resolver().dependsOn(name, done.nodeName()))
                    continue;
                for (Map.Entry<String, List<Object>> w : done.output().writes().entrySet()) {
                    if (!spec.reads().contains(w.getKey()))
                        continue;
                    upstream.computeIfAbsent(w.getKey(), k -> new ArrayList<>()).addAll(w.getValue());
                    included.merge(w.getKey(), 1, Integer::sum);
                }
            }
            int dependencies = 0;
            for (String other : round.activeNodes())
                if (round.isActiveAncestor(name, other))
                    dependencies++;
            long deadline = spec.deadline() == null
                    ? ScheduledTask.NO_DEADLINE
                    : startNanos + spec.deadline().toNanos();

            for (int i = 0; i < activations.size(); i++) {
                Task task = new Task(spec, i, superstep, activations.get(i).payload(), dependencies,
                        upstream, included);
                log.debug("Submitting {} after {} active upstream node(s)", task, task.dependencies());
                ScheduledTask scheduled = ScheduledTask.builder(name, ctx -> run(task, ctx))
                        .superstep(superstep)
                        .priority(spec.priority())
                        .deadlineNanos(deadline)
                        .cancellation(signal)
                        .onComplete(outcome -> onComplete(task, outcome))
                        .build();
                inFlight++;
                try {
                    scheduler.submit(scheduled);
                } catch (RuntimeException e) {
                    inFlight--;
                    if (fatal == null)
                        fatal = e;
                    return;
                }
            }
        }
    }

    // Worker thread, outside the lock
    private Object run(Task task, TaskContext ctx) throws Exception {
        NodeInput input = settledInput(task);
        NodeOutput output = computeWithRetry(task, input, ctx);
        if (output == null)
            output = NodeOutput.empty();
        checkOutput(task, output);
        task.succeeded(output, graph.resolver().controlTargets(task.nodeName(), output));
        return output;
    }

    private NodeInput settledInput(Task task) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String channel : task.reads()) {
            List<Object> pending = task.upstreamWrites().get(channel);
            Object value;
            if (pending == null) {
                value = registry.valueOrNull(channel);
            } else {
                Channel<?, ?, ?> view = registry.scratchCopy(channel);
                view.updateUnchecked(pending);
                value = view.isAvailable() ? view.get() : null;
            }
            if (value != null)
                values.put(channel, value);
        }
        return new NodeInput(task.nodeName(), superstep, task.reads(), values, task.payload());
    }

    private NodeOutput computeWithRetry(Task task, NodeInput input, TaskContext ctx) throws Exception {
        RetryPolicy retry = task.node().retry();
        CircuitBreaker breaker = breakers.get(task.nodeName());
        for (int attempt = 1;; attempt++) {
            task.attempt(attempt);
            if (breaker != null && !breaker.tryAcquire())
                throw new CircuitOpenException(task.nodeName(), superstep);
            NodeOutput output;
            try {
                output = task.node().unit().compute(input, ctx);
            } catch (Exception e) {
                boolean cancelled = ctx.isCancelled()
                        || e instanceof InterruptedException || e instanceof CancellationException;
                if (breaker != null && !cancelled)
                    breaker.recordFailure();
                if (attempt >= retry.maxAttempts() || cancelled)
                    throw e;
                log.debug("Task {} failed on attempt {}/{}, retrying in {}ms: {}",
                        task, attempt, retry.maxAttempts(), retry.backoff().toMillis(), e.toString());
                if (!retry.backoff().isZero())
                    Thread.sleep(retry.backoff().toMillis());
                continue;
            }
            if (breaker != null)
                breaker.recordSuccess();
            return output;
        }
    }

    private void checkOutput(Task task, NodeOutput output) {
        for (String channel : output.writes().keySet())
            if (!task.writes().contains(channel))
                throw new InvalidUpdateException(channel, "node '" + task.nodeName()
                        + "' does not declare a write to this channel");
        for (String next : output.next())
            if (!graph.hasNode(next))
                throw new IllegalArgumentException("Node '" + task.nodeName() + "' routed to unknown node '"
                        + next + "'");
        for (NodeOutput.Send send : output.sends())
            if (!graph.hasNode(send.node()))
                throw new IllegalArgumentException("Node '" + task.nodeName() + "' sent to unknown node '"
                        + send.node() + "'");
    }

    // Worker thread
    private void onComplete(Task task, TaskOutcome outcome) {
        lock.lock();
        try {
            inFlight--;
            if (stopping)
                return;
            List<String> ready;
            switch (outcome.status()) {
                case SUCCEEDED:
                    executed.add(task);
                    completed.add(task);
                    notifyCompleted(task, outcome.durationNanos());
                    ready = round.complete(task.nodeName(), task.controlTargets());
                    break;
                case FAILED:
                    executed.add(task);
                    notifyFailed(task, outcome.error());
                    if (config.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                        fatal = new SchedulerException(SchedulerException.Kind.TASK_PANIC,
                                "Task " + task + " failed: " + outcome.error(), superstep, task.nodeName(),
                                outcome.error());
                        return;
                    }
                    failures.add(new TaskFailure(task.nodeName(), superstep, task.attempts(), outcome.error()));
                    log.warn("Task {} failed after {} attempt(s), continuing: {}",
                            task, task.attempts(), outcome.error().toString());
                    ready = round.complete(task.nodeName(), Set.of());
                    break;
                default:
                    ready = round.complete(task.nodeName(), Set.of());
                    break;
            }
            dispatch(ready);
        } catch (RuntimeException e) {
            if (fatal == null)
                fatal = e;
        } finally {
            progress.signalAll();
            lock.unlock();
        }
    }

    private void notifyCompleted(Task task, long durationNanos) {
        try {
            listener.onTaskCompleted(superstep, task.nodeName(), task.writeCount(), durationNanos);
        } catch (RuntimeException e) {
            log.warn("Listener failed on completion of {}", task, e);
        }
    }

    private void notifyFailed(Task task, Throwable error) {
        try {
            listener.onTaskFailed(superstep, task.nodeName(), error);
        } catch (RuntimeException e) {
            log.warn("Listener failed on failure of {}", task, e);
        }
    }
}
