package com.workflow.bsp.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.api.StreamConsumer;
import com.workflow.bsp.api.SuperstepListener;
import com.workflow.bsp.channel.ChannelKind;
import com.workflow.bsp.channel.ChannelRegistry;
import com.workflow.bsp.channel.TopicSubscription;
import com.workflow.bsp.checkpoint.ChannelCheckpointCodec;
import com.workflow.bsp.checkpoint.CheckpointMetadata;
import com.workflow.bsp.checkpoint.CheckpointRecord;
import com.workflow.bsp.checkpoint.Checkpointer;
import com.workflow.bsp.checkpoint.PendingSend;
import com.workflow.bsp.disruptor.StreamPublisher;
import com.workflow.bsp.error.BspException;
import com.workflow.bsp.error.ChannelException;
import com.workflow.bsp.error.CheckpointException;
import com.workflow.bsp.error.CoordinatorException;
import com.workflow.bsp.error.InvalidUpdateException;
import com.workflow.bsp.error.SchedulerException;
import com.workflow.bsp.scheduler.WorkStealingScheduler;
import com.workflow.bsp.util.CompositeSuperstepListener;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one execution of a compiled graph through bulk-synchronous
 * supersteps.
 *
 * Each superstep runs four phases:
 *
 * 1. Read: decide which nodes run. Entry nodes run in the first superstep,
 * goTo and send targets of the previous superstep run next, and a node is
 * triggered when one of its read channels holds a value newer than the
 * version the node last saw. Nothing to run means quiescence: the finish
 * hooks of the channels run and the execution terminates.
 *
 * 2. Execute: the tasks go to the work-stealing scheduler in dependency order
 * (see {@link SuperstepRun}). Tasks never touch the channels; they return
 * write intents.
 *
 * 3. Write: the intents are applied per channel in completion order, with one
 * update call per channel. A channel failure restores every channel touched
 * in the phase and aborts, so a superstep applies all of its writes or none.
 * Changed channels get a new version.
 *
 * 4. Checkpoint: tracked channel state plus trigger bookkeeping go to the
 * {@link Checkpointer}, if one is configured. A failed save is reported in the
 * result; it never undoes the writes.
 *
 * Between supersteps the coordinator can pause on an interrupt and later
 * resume, on the same instance or on a fresh one from the last checkpoint.
 *
 * Circuit Breaker / Fail Fast:
 * A coordinator drives exactly one execution. Once it terminated or aborted,
 * it refuses further work; misuse throws {@link IllegalStateException}.
 */
public final class SuperstepCoordinator {
    private static final Logger log = LogManager.getLogger(SuperstepCoordinator.class);

    private final CompiledGraph graph;
    private final WorkStealingScheduler scheduler;
    private final ExecutionConfig config;
    private final Checkpointer checkpointer;
    private final ChannelRegistry registry;
    private final ChannelCheckpointCodec codec = new ChannelCheckpointCodec();
    private final CompositeSuperstepListener listeners = new CompositeSuperstepListener();
    private final Set<String> interruptRequests = ConcurrentHashMap.newKeySet();
    // Per execution, not checkpointed
    private final Map<String, CircuitBreaker> breakers = new HashMap<>();

    private volatile CoordinatorState state = CoordinatorState.IDLE;
    private volatile long superstep;
    private String executionId;
    private StreamConsumer streamConsumer;

    // Trigger bookkeeping, coordinator thread only
    private final Map<String, Long> versions = new HashMap<>();
    private final Map<String, Map<String, Long>> versionsSeen = new HashMap<>();
    private final List<String> pendingNext = new ArrayList<>();
    private final List<NodeOutput.Send> pendingSends = new ArrayList<>();
    private boolean entryPending;

    private long generation;
    private String lastCheckpointId;
    private final List<TaskFailure> failures = new ArrayList<>();
    private final List<CheckpointException> checkpointFailures = new ArrayList<>();

    public SuperstepCoordinator(CompiledGraph graph, WorkStealingScheduler scheduler, ExecutionConfig config) {
        this(graph, scheduler, config, null);
    }

    /**
     * @param checkpointer where checkpoints go, or null for none
     */
    public SuperstepCoordinator(CompiledGraph graph, WorkStealingScheduler scheduler, ExecutionConfig config,
            Checkpointer checkpointer) {
        // Unknown interrupt targets fail here rather than never firing
        for (String n : config.getInterruptAfter())
            graph.node(n);
        this.graph = graph;
        this.scheduler = scheduler;
        this.config = config;
        this.checkpointer = checkpointer;
        this.registry = graph.newRegistry();
        for (NodeSpec node : graph.nodes().values())
            if (node.circuitBreaker() != null)
                breakers.put(node.name(), new CircuitBreaker(node.name(), node.circuitBreaker(), Clock.systemUTC()));
    }

    public void addListener(SuperstepListener listener) {
        listeners.addForComposite(listener);
    }

    /** Sets the consumer of stream events. Takes effect on the next invoke or resume. */
    public void setStreamConsumer(StreamConsumer consumer) {
        this.streamConsumer = consumer;
    }

    /** Subscribes to a topic channel of this execution. */
    public <V> TopicSubscription subscribe(String topic, String subscriberId, Consumer<? super V> consumer) {
        return registry.subscribe(topic, subscriberId, consumer);
    }

    public CoordinatorState state() {
        return state;
    }

    /** @return number of the last superstep whose writes were applied. */
    public long superstep() {
        return superstep;
    }

    public CompiledGraph graph() {
        return graph;
    }

    /** @return the node's circuit breaker, or null when it declares none. */
    public CircuitBreaker circuitBreaker(String nodeName) {
        graph.node(nodeName);
        return breakers.get(nodeName);
    }

    /**
     * Runs an execution from the beginning. The input is applied as the writes
     * of superstep 0, one update per channel.
     *
     * @throws CoordinatorException  LIMIT_EXCEEDED or ABORTED
     * @throws IllegalStateException if this coordinator already started an
     *                               execution
     */
    public ExecutionResult invoke(String executionId, Map<String, ?> input) {
        Objects.requireNonNull(executionId, "executionId");
        if (state != CoordinatorState.IDLE)
            throw new IllegalStateException("Coordinator already drove execution " + this.executionId
                    + " and is " + state);
        for (String channel : input.keySet())
            registry.channel(channel);
        this.executionId = executionId;
        log.info("Starting execution {} of graph '{}'", executionId, graph.name());

        entryPending = true;
        state = CoordinatorState.WRITE_PHASE;
        Map<String, List<Object>> batches = new LinkedHashMap<>();
        input.forEach((channel, value) -> {
            List<Object> batch = new ArrayList<>(1);
            batch.add(value);
            batches.put(channel, batch);
        });
        try {
            bump(commit(batches, Set.of(), false));
        } catch (ChannelException e) {
            throw abort(e, 0);
        }
        registry.deliverPending();
        if (checkpointer != null && config.isCheckpointEveryStep()) {
            state = CoordinatorState.CHECKPOINT_PHASE;
            saveCheckpoint(CheckpointMetadata.Source.INPUT);
        }
        return loop();
    }

    /**
     * Continues an execution from its latest state: the paused state of this
     * coordinator, or the latest checkpoint when this coordinator is fresh.
     */
    public ExecutionResult resume(String executionId) {
        return resume(executionId, null);
    }

    /**
     * Continues an execution from a checkpoint. With a null id a paused
     * coordinator continues from memory and a fresh one from the latest
     * checkpoint; with an id the named checkpoint is loaded either way.
     *
     * @throws IllegalStateException if the coordinator is neither fresh nor
     *                               paused, or there is nothing to resume from
     */
    public ExecutionResult resume(String executionId, String checkpointId) {
        Objects.requireNonNull(executionId, "executionId");
        if (state == CoordinatorState.PAUSED) {
            if (!executionId.equals(this.executionId))
                throw new IllegalArgumentException("Coordinator is paused on execution " + this.executionId
                        + ", not " + executionId);
            if (checkpointId != null)
                restore(load(executionId, checkpointId));
        } else if (state == CoordinatorState.IDLE) {
            this.executionId = executionId;
            restore(load(executionId, checkpointId));
        } else {
            throw new IllegalStateException("Cannot resume execution " + executionId + " while " + state);
        }
        log.info("Resuming execution {} after superstep {}", executionId, superstep);
        return loop();
    }

    /**
     * Arms a one-shot interrupt: the execution pauses after the next superstep
     * in which the node runs, once that superstep's writes were applied.
     */
    public void requestInterrupt(String nodeName) {
        graph.node(nodeName);
        interruptRequests.add(nodeName);
        log.debug("Interrupt requested after node {}", nodeName);
    }

    /**
     * @throws IllegalStateException while a superstep is in flight or before
     *                               the execution started
     */
    public ExecutionSnapshot getSnapshot(String executionId) {
        CoordinatorState s = state;
        if (s == CoordinatorState.IDLE || !s.isAtRest())
            throw new IllegalStateException("No snapshot available while " + s);
        if (!executionId.equals(this.executionId))
            throw new IllegalArgumentException("Coordinator drives execution " + this.executionId + ", not "
                    + executionId);
        return new ExecutionSnapshot(executionId, s, superstep, registry.values(), new ArrayList<>(plan().keySet()));
    }

    // ── Superstep loop ──────────────────────────────────────────

    private ExecutionResult loop() {
        StreamPublisher publisher = streamConsumer == null
                ? null
                : new StreamPublisher(streamConsumer, config.getStreamBufferSize());
        try {
            return run(publisher);
        } finally {
            if (publisher != null)
                publisher.close();
        }
    }

    private ExecutionResult run(StreamPublisher publisher) {
        while (true) {
            state = CoordinatorState.READ_PHASE;
            Map<String, List<SuperstepRun.Activation>> plan = plan();
            if (plan.isEmpty()) {
                Set<String> finished = finishChannels();
                if (!finished.isEmpty()) {
                    bump(finished);
                    continue;
                }
                state = CoordinatorState.TERMINATED;
                log.info("Execution {} completed after {} superstep(s)", executionId, superstep);
                return result(ExecutionResult.Status.COMPLETED);
            }

            long step = superstep + 1;
            if (step > config.getMaxSupersteps()) {
                state = CoordinatorState.ABORTED;
                CoordinatorException e = new CoordinatorException(CoordinatorException.Kind.LIMIT_EXCEEDED,
                        "Execution " + executionId + " needs more than " + config.getMaxSupersteps()
                                + " supersteps, pending " + plan.keySet(),
                        step, null, null);
                log.error(e.getMessage());
                throw e;
            }
            log.debug("Superstep {} of {}: {}", step, executionId, plan.keySet());
            listeners.onSuperstepStart(step, plan.size());

            state = CoordinatorState.EXECUTE_PHASE;
            SuperstepRun.Result r = execute(step, plan);

            state = CoordinatorState.WRITE_PHASE;
            int changed = write(step, r);
            superstep = step;

            int delivered = registry.deliverPending();
            if (publisher != null)
                for (Task t : r.completed())
                    publisher.publish(t.nodeName(), t.output().writes(), step);
            listeners.onSuperstepEnd(step, r.completed().size(), changed);
            log.debug("Superstep {} applied: {} task(s), {} channel(s) changed, {} topic deliveries",
                    step, r.completed().size(), changed, delivered);

            boolean pausing = shouldPause(r);
            if (checkpointer != null && (config.isCheckpointEveryStep() || pausing)) {
                state = CoordinatorState.CHECKPOINT_PHASE;
                saveCheckpoint(pausing ? CheckpointMetadata.Source.INTERRUPT : CheckpointMetadata.Source.LOOP);
            }
            if (pausing) {
                state = CoordinatorState.PAUSED;
                log.info("Execution {} paused after superstep {}", executionId, step);
                return result(ExecutionResult.Status.INTERRUPTED);
            }
        }
    }

    private SuperstepRun.Result execute(long step, Map<String, List<SuperstepRun.Activation>> plan) {
        for (int attempt = 0;; attempt++) {
            SuperstepRun.Result r = new SuperstepRun(graph, registry, scheduler, config, listeners, breakers, step,
                    plan).execute();
            if (r.fatal() != null)
                throw abort(r.fatal(), step);
            if (!r.timedOut())
                return r;
            SchedulerException timeout = new SchedulerException(SchedulerException.Kind.TASK_TIMEOUT,
                    "Execute phase exceeded " + config.getSuperstepTimeout().toMillis() + "ms, unfinished "
                            + r.unfinished(),
                    step, r.unfinished().size() == 1 ? r.unfinished().get(0) : null, null);
            if (attempt >= config.getSuperstepRetries())
                throw abort(timeout, step);
            log.warn("{}; re-executing superstep ({}/{})", timeout.getMessage(), attempt + 1,
                    config.getSuperstepRetries());
        }
    }

    private CoordinatorException abort(Throwable cause, long step) {
        state = CoordinatorState.ABORTED;
        String node = cause instanceof BspException ? ((BspException) cause).nodeName() : null;
        log.error("Execution {} aborted in superstep {}", executionId, step, cause);
        return new CoordinatorException(CoordinatorException.Kind.ABORTED,
                "Superstep " + step + " of execution " + executionId + " aborted: " + cause.getMessage(),
                step, node, cause);
    }

    // ── Read phase ──────────────────────────────────────────────

    private Map<String, List<SuperstepRun.Activation>> plan() {
        Map<String, List<SuperstepRun.Activation>> plan = new LinkedHashMap<>();
        if (entryPending)
            for (String entry : graph.entries())
                addPlain(plan, entry);
        for (String next : pendingNext)
            addPlain(plan, next);
        for (NodeOutput.Send send : pendingSends)
            plan.computeIfAbsent(send.node(), k -> new ArrayList<>())
                    .add(SuperstepRun.Activation.send(send.payload()));
        for (NodeSpec node : graph.nodes().values())
            if (triggered(node))
                addPlain(plan, node.name());
        return plan;
    }

    private static void addPlain(Map<String, List<SuperstepRun.Activation>> plan, String node) {
        List<SuperstepRun.Activation> list = plan.computeIfAbsent(node, k -> new ArrayList<>());
        for (SuperstepRun.Activation a : list)
            if (!a.send())
                return;
        list.add(0, SuperstepRun.Activation.PLAIN);
    }

    private boolean triggered(NodeSpec node) {
        Map<String, Long> seen = versionsSeen.getOrDefault(node.name(), Map.of());
        for (String channel : node.reads())
            if (version(channel) > seen.getOrDefault(channel, 0L) && registry.isAvailable(channel))
                return true;
        return false;
    }

    private long version(String channel) {
        return versions.getOrDefault(channel, 0L);
    }

    private void bump(Set<String> changed) {
        for (String channel : changed)
            versions.merge(channel, 1L, Long::sum);
    }

    // ── Write phase ─────────────────────────────────────────────

    private int write(long step, SuperstepRun.Result r) {
        Map<String, List<Object>> batches = new LinkedHashMap<>();
        Map<String, Integer> writers = new HashMap<>();
        Set<String> read = new LinkedHashSet<>();
        for (Task t : r.completed()) {
            read.addAll(t.reads());
            for (Map.Entry<String, List<Object>> w : t.output().writes().entrySet()) {
                batches.computeIfAbsent(w.getKey(), k -> new ArrayList<>()).addAll(w.getValue());
                writers.merge(w.getKey(), 1, Integer::sum);
            }
        }

        Map<String, Long> before = new HashMap<>(versions);
        Set<String> changed;
        try {
            for (Map.Entry<String, Integer> e : writers.entrySet())
                if (e.getValue() > 1 && !registry.kind(e.getKey()).isReducing())
                    throw new InvalidUpdateException(e.getKey(), "written by " + e.getValue()
                            + " tasks in one superstep, only reducing channels accept concurrent writes");
            changed = commit(batches, read, true);
        } catch (ChannelException e) {
            throw abort(e, step);
        }
        bump(changed);

        // A node has seen a new version only if its input included every write behind it
        Map<String, Map<String, Long>> seenThisStep = new HashMap<>();
        for (Task t : r.executed()) {
            Map<String, Long> seen = seenThisStep.computeIfAbsent(t.nodeName(), k -> new HashMap<>());
            for (String channel : t.reads()) {
                long after = version(channel);
                long prior = before.getOrDefault(channel, 0L);
                long v = after == prior || t.includedWriters(channel) >= writers.getOrDefault(channel, 0)
                        ? after
                        : prior;
                seen.merge(channel, v, Math::min);
            }
        }
        seenThisStep.forEach((node, seen) -> versionsSeen.computeIfAbsent(node, k -> new HashMap<>()).putAll(seen));

        entryPending = false;
        pendingNext.clear();
        pendingSends.clear();
        for (Task t : r.completed()) {
            for (String next : t.output().next())
                if (!pendingNext.contains(next))
                    pendingNext.add(next);
            pendingSends.addAll(t.output().sends());
        }
        failures.addAll(r.failures());
        return changed.size();
    }

    /**
     * Applies one superstep's worth of channel operations: consume hooks of the
     * read channels, then the batches, then clearing of ephemeral channels that
     * were not written. All or nothing.
     *
     * @return channels whose state changed
     */
    private Set<String> commit(Map<String, List<Object>> batches, Set<String> read, boolean clearUnwritten) {
        Set<String> touched = new LinkedHashSet<>(read);
        touched.addAll(batches.keySet());
        if (clearUnwritten)
            for (String channel : registry.names())
                if (registry.kind(channel) == ChannelKind.EPHEMERAL_VALUE)
                    touched.add(channel);
        Map<String, Object> saved = new HashMap<>();
        for (String channel : touched)
            saved.put(channel, registry.checkpoint(channel));

        Set<String> changed = new LinkedHashSet<>();
        try {
            for (String channel : read)
                if (registry.consume(channel))
                    changed.add(channel);
            for (Map.Entry<String, List<Object>> e : batches.entrySet())
                if (registry.apply(e.getKey(), e.getValue()))
                    changed.add(e.getKey());
            if (clearUnwritten)
                for (String channel : touched)
                    if (registry.kind(channel) == ChannelKind.EPHEMERAL_VALUE && !batches.containsKey(channel)
                            && registry.apply(channel, List.of()))
                        changed.add(channel);
        } catch (ChannelException e) {
            for (String channel : touched)
                registry.restore(channel, saved.get(channel));
            log.warn("Write to channel '{}' failed, restored {} channel(s)", e.channelName(), touched.size());
            throw e;
        }
        return changed;
    }

    private Set<String> finishChannels() {
        Set<String> changed = new LinkedHashSet<>();
        for (String channel : registry.names())
            if (registry.finish(channel))
                changed.add(channel);
        return changed;
    }

    private boolean shouldPause(SuperstepRun.Result r) {
        boolean pause = false;
        for (Task t : r.executed()) {
            if (interruptRequests.remove(t.nodeName()))
                pause = true;
            if (config.getInterruptAfter().contains(t.nodeName()))
                pause = true;
        }
        return pause;
    }

    // ── Checkpointing ───────────────────────────────────────────

    private void saveCheckpoint(CheckpointMetadata.Source source) {
        try {
            CheckpointMetadata metadata = new CheckpointMetadata();
            metadata.setExecutionId(executionId);
            metadata.setParentId(lastCheckpointId);
            metadata.setGeneration(generation + 1);
            metadata.setSuperstep(superstep);
            metadata.setSource(source);
            metadata.setChannelVersions(new LinkedHashMap<>(versions));
            Map<String, Map<String, Long>> seen = new LinkedHashMap<>();
            versionsSeen.forEach((node, v) -> seen.put(node, new LinkedHashMap<>(v)));
            metadata.setVersionsSeen(seen);
            metadata.setPendingNext(new ArrayList<>(pendingNext));
            List<PendingSend> sends = new ArrayList<>();
            for (NodeOutput.Send s : pendingSends)
                sends.add(codec.encodeSend(s.node(), s.payload()));
            metadata.setPendingSends(sends);
            metadata.setEntryPending(entryPending);

            Map<String, JsonNode> channels = codec.encode(registry);
            String id = checkpointer.save(executionId, generation + 1, channels, metadata);
            generation++;
            lastCheckpointId = id;
            log.debug("Checkpoint {} saved for superstep {} ({})", id, superstep, source);
        } catch (CheckpointException e) {
            recordCheckpointFailure(e);
        } catch (RuntimeException e) {
            recordCheckpointFailure(new CheckpointException("Checkpoint of superstep " + superstep + " failed: "
                    + e.getMessage(), superstep, e));
        }
    }

    private void recordCheckpointFailure(CheckpointException e) {
        checkpointFailures.add(e);
        log.warn("Checkpoint of execution {} at superstep {} not saved, execution continues", executionId,
                superstep, e);
    }

    private CheckpointRecord load(String executionId, String checkpointId) {
        if (checkpointer == null)
            throw new IllegalStateException("No checkpointer configured, nothing to resume " + executionId + " from");
        Optional<CheckpointRecord> record;
        try {
            record = checkpointer.load(executionId, checkpointId);
        } catch (CheckpointException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CheckpointException("Loading checkpoint of " + executionId + " failed", e);
        }
        return record.orElseThrow(() -> new IllegalStateException("No checkpoint "
                + (checkpointId == null ? "" : checkpointId + " ") + "for execution " + executionId));
    }

    private void restore(CheckpointRecord record) {
        CheckpointMetadata m = record.metadata();
        try {
            codec.decode(registry, record.channels());
        } catch (ChannelException e) {
            throw new CheckpointException("Checkpoint " + record.id() + " does not fit graph '" + graph.name() + "'",
                    m.getSuperstep(), e);
        }
        versions.clear();
        versions.putAll(m.getChannelVersions());
        versionsSeen.clear();
        m.getVersionsSeen().forEach((node, seen) -> versionsSeen.put(node, new HashMap<>(seen)));
        pendingNext.clear();
        pendingNext.addAll(m.getPendingNext());
        pendingSends.clear();
        for (PendingSend s : m.getPendingSends())
            pendingSends.add(new NodeOutput.Send(s.node(), codec.decodeSend(s)));
        entryPending = m.isEntryPending();
        superstep = m.getSuperstep();
        generation = m.getGeneration();
        lastCheckpointId = record.id();
        log.info("Restored execution {} from checkpoint {} (generation {}, superstep {})",
                executionId, record.id(), generation, superstep);
    }

    private ExecutionResult result(ExecutionResult.Status status) {
        return new ExecutionResult(executionId, status, superstep, registry.values(), List.copyOf(failures),
                List.copyOf(checkpointFailures), lastCheckpointId);
    }
}
