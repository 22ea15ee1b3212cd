package com.workflow.bsp.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.channel.ChannelSpec;
import com.workflow.bsp.channel.Reducers;
import com.workflow.bsp.checkpoint.CheckpointMetadata;
import com.workflow.bsp.checkpoint.CheckpointRecord;
import com.workflow.bsp.checkpoint.Checkpointer;
import com.workflow.bsp.dsl.GraphBuilder;
import com.workflow.bsp.error.CheckpointException;
import com.workflow.bsp.error.CircuitOpenException;
import com.workflow.bsp.error.CoordinatorException;
import com.workflow.bsp.error.InvalidUpdateException;
import com.workflow.bsp.error.SchedulerException;
import com.workflow.bsp.scheduler.FailurePolicy;
import com.workflow.bsp.scheduler.SchedulerConfig;
import com.workflow.bsp.scheduler.WorkStealingScheduler;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class CoordinatorFailureTest {

    private WorkStealingScheduler scheduler;

    @Before
    public void setUp() {
        SchedulerConfig config = new SchedulerConfig();
        config.setWorkers(2);
        scheduler = new WorkStealingScheduler(config);
    }

    @After
    public void tearDown() {
        scheduler.close();
    }

    // "good" writes a, "bad" throws; both are entries
    private CompiledGraph goodAndBad() {
        return GraphBuilder.create("mixed")
                .channel(ChannelSpec.lastValue("a", String.class))
                .node("good", Set.of(), Set.of("a"), (in, ctx) -> NodeOutput.write("a", "ok"))
                .node("bad", Set.of(), Set.of(), (in, ctx) -> {
                    throw new IllegalStateException("broken");
                })
                .entry("good", "bad")
                .compile();
    }

    @Test
    public void testFailFastAbortsWithoutApplyingWrites() {
        SuperstepCoordinator coordinator = new SuperstepCoordinator(goodAndBad(), scheduler, new ExecutionConfig());
        try {
            coordinator.invoke("run-1", Map.of());
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertEquals(CoordinatorException.Kind.ABORTED, e.kind());
            assertEquals(1, e.superstep());
            assertTrue(e.getCause() instanceof SchedulerException);
            assertEquals(SchedulerException.Kind.TASK_PANIC, ((SchedulerException) e.getCause()).kind());
            assertEquals("bad", e.nodeName());
        }
        assertEquals(CoordinatorState.ABORTED, coordinator.state());
        ExecutionSnapshot snapshot = coordinator.getSnapshot("run-1");
        assertFalse(snapshot.values().containsKey("a"));
        assertEquals(0, snapshot.superstep());
    }

    @Test
    public void testBestEffortRecordsFailureAndContinues() {
        ExecutionConfig config = new ExecutionConfig();
        config.setFailurePolicy(FailurePolicy.BEST_EFFORT);
        ExecutionResult r = new SuperstepCoordinator(goodAndBad(), scheduler, config).invoke("run-1", Map.of());

        assertEquals(ExecutionResult.Status.COMPLETED, r.status());
        assertEquals("ok", r.value("a"));
        assertEquals(1, r.failures().size());
        TaskFailure failure = r.failures().get(0);
        assertEquals("bad", failure.nodeName());
        assertEquals(1, failure.superstep());
        assertEquals(1, failure.attempts());
        assertTrue(failure.error() instanceof IllegalStateException);
    }

    @Test
    public void testRetryPolicyRecoversTransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        CompiledGraph graph = GraphBuilder.create("flaky")
                .channel(ChannelSpec.lastValue("out", Integer.class))
                .node(NodeSpec.builder("flaky", (in, ctx) -> {
                    if (calls.incrementAndGet() < 3)
                        throw new IllegalStateException("transient");
                    return NodeOutput.write("out", calls.get());
                }).writes("out").retry(RetryPolicy.of(3, Duration.ofMillis(1))).build())
                .entry("flaky")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
        assertEquals(Integer.valueOf(3), r.value("out"));
        assertTrue(r.failures().isEmpty());
    }

    @Test
    public void testOpenCircuitStopsRetries() {
        AtomicInteger calls = new AtomicInteger();
        CompiledGraph graph = GraphBuilder.create("fragile")
                .channel(ChannelSpec.lastValue("out", Integer.class))
                .node(NodeSpec.builder("fragile", (in, ctx) -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("downstream unavailable");
                }).writes("out")
                        .retry(RetryPolicy.of(3, Duration.ZERO))
                        .circuitBreaker(new CircuitBreakerPolicy(1, Duration.ofMinutes(1), Duration.ofHours(1), 1))
                        .build())
                .entry("fragile")
                .compile();

        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig());
        assertEquals(CircuitBreaker.State.CLOSED, coordinator.circuitBreaker("fragile").state());
        try {
            coordinator.invoke("run-1", Map.of());
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertEquals(CoordinatorException.Kind.ABORTED, e.kind());
            SchedulerException panic = (SchedulerException) e.getCause();
            assertEquals(SchedulerException.Kind.TASK_PANIC, panic.kind());
            assertTrue(panic.getCause() instanceof CircuitOpenException);
            assertEquals("fragile", ((CircuitOpenException) panic.getCause()).nodeName());
        }
        assertEquals(1, calls.get());
        CircuitBreaker breaker = coordinator.circuitBreaker("fragile");
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        assertEquals(1, breaker.rejectedCount());
    }

    @Test
    public void testBestEffortRecordsOpenCircuit() {
        ExecutionConfig config = new ExecutionConfig();
        config.setFailurePolicy(FailurePolicy.BEST_EFFORT);
        CompiledGraph graph = GraphBuilder.create("fragile")
                .node(NodeSpec.builder("fragile", (in, ctx) -> {
                    throw new IllegalStateException("downstream unavailable");
                }).retry(RetryPolicy.of(2, Duration.ZERO))
                        .circuitBreaker(new CircuitBreakerPolicy(1, Duration.ofMinutes(1), Duration.ofHours(1), 1))
                        .build())
                .entry("fragile")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, config).invoke("run-1", Map.of());
        assertEquals(ExecutionResult.Status.COMPLETED, r.status());
        assertEquals(1, r.failures().size());
        assertEquals(2, r.failures().get(0).attempts());
        assertTrue(r.failures().get(0).error() instanceof CircuitOpenException);
    }

    @Test
    public void testTimeoutAbortsAndKeepsCommittedState() {
        CompiledGraph graph = GraphBuilder.create("slow")
                .channel(ChannelSpec.lastValue("in", Integer.class))
                .channel(ChannelSpec.lastValue("out", Integer.class))
                .node("slow", Set.of("in"), Set.of("out"), (in, ctx) -> {
                    Thread.sleep(500);
                    return NodeOutput.write("out", 1);
                })
                .compile();
        ExecutionConfig config = new ExecutionConfig();
        config.setSuperstepTimeout(Duration.ofMillis(50));
        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, config);

        try {
            coordinator.invoke("run-1", Map.of("in", 7));
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertEquals(CoordinatorException.Kind.ABORTED, e.kind());
            SchedulerException cause = (SchedulerException) e.getCause();
            assertEquals(SchedulerException.Kind.TASK_TIMEOUT, cause.kind());
            assertEquals("slow", cause.nodeName());
        }
        ExecutionSnapshot snapshot = coordinator.getSnapshot("run-1");
        assertEquals(Map.of("in", 7), snapshot.values());
    }

    @Test
    public void testTimedOutSuperstepIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        CompiledGraph graph = GraphBuilder.create("slow_once")
                .channel(ChannelSpec.lastValue("out", Integer.class))
                .node("slow", Set.of(), Set.of("out"), (in, ctx) -> {
                    if (calls.incrementAndGet() == 1)
                        Thread.sleep(2_000);
                    return NodeOutput.write("out", calls.get());
                })
                .entry("slow")
                .compile();
        ExecutionConfig config = new ExecutionConfig();
        config.setSuperstepTimeout(Duration.ofMillis(100));
        config.setSuperstepRetries(1);

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, config).invoke("run-1", Map.of());
        assertEquals(Integer.valueOf(2), r.value("out"));
        assertEquals(1, r.supersteps());
    }

    @Test
    public void testSuperstepLimit() {
        CompiledGraph graph = GraphBuilder.create("endless")
                .channel(ChannelSpec.lastValue("n", Integer.class))
                .node("tick", Set.of("n"), Set.of("n"), (in, ctx) -> NodeOutput.write("n", in.<Integer>get("n") + 1))
                .compile();
        ExecutionConfig config = new ExecutionConfig();
        config.setMaxSupersteps(3);
        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, config);
        try {
            coordinator.invoke("run-1", Map.of("n", 0));
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertEquals(CoordinatorException.Kind.LIMIT_EXCEEDED, e.kind());
            assertEquals(4, e.superstep());
        }
        assertEquals(3, coordinator.superstep());
        assertEquals(3, coordinator.getSnapshot("run-1").values().get("n"));
    }

    @Test
    public void testConcurrentWritesToLastValueAbort() {
        CompiledGraph graph = GraphBuilder.create("race")
                .channel(ChannelSpec.lastValue("last", Integer.class))
                .node("start", Set.of(), Set.of(), (in, ctx) -> NodeOutput.builder()
                        .send("writer", 1).send("writer", 2).build())
                .node("writer", Set.of(), Set.of("last"), (in, ctx) -> NodeOutput.write("last", in.payload()))
                .entry("start")
                .compile();
        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig());
        try {
            coordinator.invoke("run-1", Map.of());
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertEquals(2, e.superstep());
            assertTrue(e.getCause() instanceof InvalidUpdateException);
            assertEquals("last", ((InvalidUpdateException) e.getCause()).channelName());
        }
        assertFalse(coordinator.getSnapshot("run-1").values().containsKey("last"));
    }

    @Test
    public void testFailedWriteRestoresEveryChannel() {
        // total is applied before the barrier rejects its update
        CompiledGraph graph = GraphBuilder.create("rollback")
                .channel(ChannelSpec.binaryOperator("total", Integer.class, Reducers.intSum(), 0))
                .channel(ChannelSpec.namedBarrier("join", Set.of("a", "b")))
                .node("node", Set.of(), Set.of("total", "join"), (in, ctx) -> NodeOutput.builder()
                        .write("total", 5).write("join", "stranger").build())
                .entry("node")
                .compile();
        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig());
        try {
            coordinator.invoke("run-1", Map.of());
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            assertTrue(e.getCause() instanceof InvalidUpdateException);
        }
        assertEquals(0, coordinator.getSnapshot("run-1").values().get("total"));
    }

    @Test
    public void testUndeclaredWriteFailsTask() {
        CompiledGraph graph = GraphBuilder.create("sneaky")
                .channel(ChannelSpec.lastValue("mine", String.class))
                .channel(ChannelSpec.lastValue("theirs", String.class))
                .node("sneaky", Set.of(), Set.of("mine"), (in, ctx) -> NodeOutput.write("theirs", "x"))
                .entry("sneaky")
                .compile();
        try {
            new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
            fail("Expected CoordinatorException");
        } catch (CoordinatorException e) {
            Throwable panic = e.getCause();
            assertTrue(panic.getCause() instanceof InvalidUpdateException);
        }
    }

    @Test
    public void testCheckpointFailureDoesNotStopExecution() {
        Checkpointer broken = new Checkpointer() {
            @Override
            public String save(String executionId, long generation, Map<String, JsonNode> channels,
                    CheckpointMetadata metadata) {
                throw new CheckpointException("disk full", null);
            }

            @Override
            public Optional<CheckpointRecord> load(String executionId, String checkpointId) {
                return Optional.empty();
            }

            @Override
            public List<CheckpointMetadata> list(String executionId, int limit) {
                return List.of();
            }

            @Override
            public void delete(String executionId, String checkpointId) {
            }

            @Override
            public void deleteExecution(String executionId) {
            }
        };
        CompiledGraph graph = GraphBuilder.create("plain")
                .channel(ChannelSpec.lastValue("out", String.class))
                .node("only", Set.of(), Set.of("out"), (in, ctx) -> NodeOutput.write("out", "done"))
                .entry("only")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig(), broken)
                .invoke("run-1", Map.of());
        assertEquals(ExecutionResult.Status.COMPLETED, r.status());
        assertEquals("done", r.value("out"));
        // Input checkpoint plus one per superstep
        assertEquals(2, r.checkpointFailures().size());
        assertNull(r.lastCheckpointId());
    }
}
