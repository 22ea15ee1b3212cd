package com.workflow.bsp.engine;

import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.api.StreamEvent;
import com.workflow.bsp.api.SuperstepListener;
import com.workflow.bsp.channel.ChannelSpec;
import com.workflow.bsp.channel.Reducers;
import com.workflow.bsp.checkpoint.CheckpointMetadata;
import com.workflow.bsp.checkpoint.InMemoryCheckpointer;
import com.workflow.bsp.dsl.GraphBuilder;
import com.workflow.bsp.scheduler.SchedulerConfig;
import com.workflow.bsp.scheduler.WorkStealingScheduler;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class SuperstepCoordinatorTest {

    private WorkStealingScheduler scheduler;

    @Before
    public void setUp() {
        SchedulerConfig config = new SchedulerConfig();
        config.setWorkers(4);
        scheduler = new WorkStealingScheduler(config);
    }

    @After
    public void tearDown() {
        scheduler.close();
    }

    // start -(5 sends)-> increment -> end
    private CompiledGraph fanOutGraph() {
        return GraphBuilder.create("fan_out")
                .channel(ChannelSpec.binaryOperator("sum", Integer.class, Reducers.intSum(), 0))
                .channel(ChannelSpec.lastValue("result", Integer.class))
                .node("start", Set.of(), Set.of(), (in, ctx) -> {
                    NodeOutput.Builder out = NodeOutput.builder();
                    for (int i = 0; i < 5; i++)
                        out.send("increment", i);
                    return out.build();
                })
                .node("increment", Set.of(), Set.of("sum"), (in, ctx) -> NodeOutput.write("sum", 1))
                .node("end", Set.of("sum"), Set.of("result"),
                        (in, ctx) -> NodeOutput.write("result", in.<Integer>get("sum")))
                .edge("increment", "end")
                .entry("start")
                .compile();
    }

    // Counts up by one per superstep and stops below 5
    private CompiledGraph counterGraph() {
        return GraphBuilder.create("counter")
                .channel(ChannelSpec.lastValue("count", Integer.class))
                .node("increment", Set.of("count"), Set.of("count"), (in, ctx) -> {
                    int next = in.<Integer>get("count") + 1;
                    return next < 5 ? NodeOutput.write("count", next) : NodeOutput.empty();
                })
                .entry("increment")
                .compile();
    }

    @Test
    public void testSendFanOutIsFoldedAndSeenDownstream() {
        SuperstepCoordinator coordinator = new SuperstepCoordinator(fanOutGraph(), scheduler, new ExecutionConfig());
        ExecutionResult result = coordinator.invoke("run-1", Map.of());

        assertEquals(ExecutionResult.Status.COMPLETED, result.status());
        assertEquals(2, result.supersteps());
        assertEquals(Integer.valueOf(5), result.value("sum"));
        assertEquals(Integer.valueOf(5), result.value("result"));
        assertEquals(CoordinatorState.TERMINATED, coordinator.state());
    }

    @Test
    public void testLoopRunsUntilQuiescence() {
        SuperstepCoordinator coordinator = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig());
        ExecutionResult result = coordinator.invoke("run-1", Map.of("count", 0));

        assertEquals(5, result.supersteps());
        assertEquals(Integer.valueOf(4), result.value("count"));
        assertTrue(result.failures().isEmpty());
    }

    @Test
    public void testInterruptAndResumeFromCheckpoint() {
        InMemoryCheckpointer checkpointer = new InMemoryCheckpointer();
        SuperstepCoordinator first = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig(),
                checkpointer);
        first.addListener(new SuperstepListener() {
            @Override
            public void onSuperstepStart(long superstep, int activeNodes) {
                if (superstep == 2)
                    first.requestInterrupt("increment");
            }

            @Override
            public void onTaskCompleted(long superstep, String nodeName, int writes, long durationNanos) {
            }

            @Override
            public void onTaskFailed(long superstep, String nodeName, Throwable error) {
            }

            @Override
            public void onSuperstepEnd(long superstep, int tasksCompleted, int channelsChanged) {
            }
        });

        ExecutionResult paused = first.invoke("run-1", Map.of("count", 0));
        assertTrue(paused.isInterrupted());
        assertEquals(2, paused.supersteps());
        assertEquals(Integer.valueOf(2), paused.value("count"));
        assertEquals(CoordinatorState.PAUSED, first.state());

        ExecutionSnapshot snapshot = first.getSnapshot("run-1");
        assertEquals(Collections.singletonList("increment"), snapshot.nextNodes());

        List<CheckpointMetadata> history = checkpointer.list("run-1", 1);
        assertEquals(CheckpointMetadata.Source.INTERRUPT, history.get(0).getSource());
        assertEquals(paused.lastCheckpointId(), history.get(0).getCheckpointId());

        // A fresh coordinator continues from the latest checkpoint
        SuperstepCoordinator second = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig(),
                checkpointer);
        ExecutionResult resumed = second.resume("run-1");

        SuperstepCoordinator straight = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig());
        ExecutionResult uninterrupted = straight.invoke("run-2", Map.of("count", 0));

        assertEquals(ExecutionResult.Status.COMPLETED, resumed.status());
        assertEquals(uninterrupted.supersteps(), resumed.supersteps());
        assertEquals(uninterrupted.values(), resumed.values());
    }

    @Test
    public void testInterruptAfterPausesEverySuperstep() {
        ExecutionConfig config = new ExecutionConfig();
        config.getInterruptAfter().add("increment");
        SuperstepCoordinator coordinator = new SuperstepCoordinator(counterGraph(), scheduler, config);

        ExecutionResult r = coordinator.invoke("run-1", Map.of("count", 0));
        assertTrue(r.isInterrupted());
        assertEquals(1, r.supersteps());

        r = coordinator.resume("run-1");
        assertTrue(r.isInterrupted());
        assertEquals(2, r.supersteps());
        assertEquals(Integer.valueOf(2), r.value("count"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInterruptAfterUnknownNode() {
        ExecutionConfig config = new ExecutionConfig();
        config.getInterruptAfter().add("missing");
        new SuperstepCoordinator(counterGraph(), scheduler, config);
    }

    @Test
    public void testResumeFromNamedCheckpoint() {
        InMemoryCheckpointer checkpointer = new InMemoryCheckpointer();
        SuperstepCoordinator coordinator = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig(),
                checkpointer);
        coordinator.invoke("run-1", Map.of("count", 0));

        // Newest first: input, then one per superstep
        List<CheckpointMetadata> history = checkpointer.list("run-1", 10);
        assertEquals(6, history.size());
        CheckpointMetadata afterFirst = history.get(4);
        assertEquals(1, afterFirst.getSuperstep());
        assertEquals(CheckpointMetadata.Source.INPUT, history.get(5).getSource());

        SuperstepCoordinator replay = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig(),
                checkpointer);
        ExecutionResult r = replay.resume("run-1", afterFirst.getCheckpointId());
        assertEquals(5, r.supersteps());
        assertEquals(Integer.valueOf(4), r.value("count"));
    }

    @Test
    public void testUpstreamWritesVisibleInSameSuperstep() {
        // a writes x, b runs after a by control edge and reads x
        CompiledGraph graph = GraphBuilder.create("settled")
                .channel(ChannelSpec.lastValue("x", Integer.class))
                .channel(ChannelSpec.lastValue("y", Integer.class))
                .node("a", Set.of(), Set.of("x"), (in, ctx) -> NodeOutput.write("x", 1))
                .node("b", Set.of("x"), Set.of("y"),
                        (in, ctx) -> NodeOutput.write("y", in.<Integer>getOrDefault("x", 0) * 10))
                .edge("a", "b")
                .entry("a")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
        assertEquals(Integer.valueOf(10), r.value("y"));
        // b already saw x, so nothing runs again
        assertEquals(1, r.supersteps());
    }

    @Test
    public void testGoToSchedulesNextSuperstep() {
        List<String> ran = new CopyOnWriteArrayList<>();
        CompiledGraph graph = GraphBuilder.create("goto")
                .channel(ChannelSpec.lastValue("out", String.class))
                .node("router", Set.of(), Set.of(), (in, ctx) -> {
                    ran.add("router");
                    return NodeOutput.goTo("left");
                })
                .node("left", Set.of(), Set.of("out"), (in, ctx) -> {
                    ran.add("left");
                    return NodeOutput.write("out", "left");
                })
                .node("right", Set.of(), Set.of("out2"), (in, ctx) -> NodeOutput.empty())
                .channel(ChannelSpec.lastValue("out2", String.class))
                .entry("router")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
        assertEquals(2, r.supersteps());
        assertEquals("left", r.value("out"));
        assertEquals(List.of("router", "left"), ran);
    }

    @Test
    public void testConditionalEdgeRunsInSameSuperstep() {
        CompiledGraph graph = GraphBuilder.create("branch")
                .channel(ChannelSpec.lastValue("verdict", String.class))
                .node("check", Set.of(), Set.of(), (in, ctx) -> NodeOutput.empty())
                .node("approve", Set.of(), Set.of("verdict"), (in, ctx) -> NodeOutput.write("verdict", "yes"))
                .node("reject", Set.of(), Set.of(), (in, ctx) -> {
                    throw new AssertionError("reject must not run");
                })
                .conditionalEdge("check", List.of("approve", "reject"), out -> List.of("approve"))
                .entry("check")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
        assertEquals(1, r.supersteps());
        assertEquals("yes", r.value("verdict"));
    }

    @Test
    public void testEphemeralValueLastsOneSuperstep() {
        CompiledGraph graph = GraphBuilder.create("ephemeral")
                .channel(ChannelSpec.ephemeral("flash", String.class))
                .channel(ChannelSpec.lastValue("seen", String.class))
                .node("writer", Set.of(), Set.of("flash"), (in, ctx) -> NodeOutput.write("flash", "x"))
                .node("reader", Set.of("flash"), Set.of("seen"),
                        (in, ctx) -> NodeOutput.write("seen", in.<String>get("flash")))
                .entry("writer")
                .compile();

        ExecutionResult r = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig()).invoke("run-1", Map.of());
        assertEquals("x", r.value("seen"));
        assertFalse(r.values().containsKey("flash"));
    }

    @Test
    public void testTopicSubscribersSeeCommittedValues() {
        CompiledGraph graph = GraphBuilder.create("topic")
                .channel(ChannelSpec.topic("events", String.class))
                .node("emit", Set.of(), Set.of("events"),
                        (in, ctx) -> NodeOutput.builder().write("events", "a").write("events", "b").build())
                .entry("emit")
                .compile();
        SuperstepCoordinator coordinator = new SuperstepCoordinator(graph, scheduler, new ExecutionConfig());
        List<String> received = new ArrayList<>();
        coordinator.<String>subscribe("events", "audit", received::add);

        coordinator.invoke("run-1", Map.of());
        assertEquals(List.of("a", "b"), received);
    }

    @Test
    public void testStreamEventPerCompletedTask() {
        SuperstepCoordinator coordinator = new SuperstepCoordinator(fanOutGraph(), scheduler, new ExecutionConfig());
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        coordinator.setStreamConsumer(events::add);

        coordinator.invoke("run-1", Map.of());

        // start, five increments, end
        assertEquals(7, events.size());
        assertEquals("start", events.get(0).nodeName());
        assertEquals(1, events.get(0).superstep());
        StreamEvent last = events.get(6);
        assertEquals("end", last.nodeName());
        assertEquals(List.of(5), last.deltas().get("result"));
    }

    @Test
    public void testListenerSeesEveryTask() {
        AtomicInteger completed = new AtomicInteger();
        List<Long> ends = new CopyOnWriteArrayList<>();
        SuperstepCoordinator coordinator = new SuperstepCoordinator(fanOutGraph(), scheduler, new ExecutionConfig());
        coordinator.addListener(new SuperstepListener() {
            @Override
            public void onSuperstepStart(long superstep, int activeNodes) {
            }

            @Override
            public void onTaskCompleted(long superstep, String nodeName, int writes, long durationNanos) {
                completed.incrementAndGet();
            }

            @Override
            public void onTaskFailed(long superstep, String nodeName, Throwable error) {
            }

            @Override
            public void onSuperstepEnd(long superstep, int tasksCompleted, int channelsChanged) {
                ends.add(superstep);
            }
        });
        coordinator.invoke("run-1", Map.of());
        assertEquals(7, completed.get());
        assertEquals(List.of(1L, 2L), ends);
    }

    @Test(expected = IllegalStateException.class)
    public void testInvokeTwice() {
        SuperstepCoordinator coordinator = new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig());
        coordinator.invoke("run-1", Map.of("count", 3));
        coordinator.invoke("run-1", Map.of("count", 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInputChannel() {
        new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig()).invoke("run-1", Map.of("nope", 1));
    }

    @Test(expected = IllegalStateException.class)
    public void testSnapshotBeforeInvoke() {
        new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig()).getSnapshot("run-1");
    }

    @Test(expected = IllegalStateException.class)
    public void testResumeWithoutCheckpointer() {
        new SuperstepCoordinator(counterGraph(), scheduler, new ExecutionConfig()).resume("run-1");
    }
}
