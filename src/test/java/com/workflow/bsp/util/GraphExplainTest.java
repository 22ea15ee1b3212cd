package com.workflow.bsp.util;

import com.workflow.bsp.api.NodeOutput;
import com.workflow.bsp.channel.ChannelSpec;
import com.workflow.bsp.dsl.GraphBuilder;
import com.workflow.bsp.engine.CompiledGraph;
import com.workflow.bsp.engine.NodeSpec;
import com.workflow.bsp.engine.RetryPolicy;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class GraphExplainTest {
    private GraphExplain explain;

    @Before
    public void setUp() {
        // plan -> review ==> publish | retry, plan -. draft .-> review
        CompiledGraph graph = GraphBuilder.create("review-flow")
                .channel(ChannelSpec.lastValue("draft", String.class))
                .channel(ChannelSpec.lastValue("verdict", String.class))
                .node("plan", Set.of(), Set.of("draft"), (in, ctx) -> NodeOutput.empty())
                .node(NodeSpec.builder("review", (in, ctx) -> NodeOutput.empty())
                        .reads("draft").writes("verdict")
                        .priority(5)
                        .deadline(Duration.ofMillis(250))
                        .retry(RetryPolicy.of(3, Duration.ofMillis(10)))
                        .build())
                .node("publish", Set.of("verdict"), Set.of(), (in, ctx) -> NodeOutput.empty())
                .node("retry-step", Set.of(), Set.of(), (in, ctx) -> NodeOutput.empty())
                .edge("plan", "review")
                .conditionalEdge("review", List.of("publish", "retry-step"), out -> List.of("publish"))
                .entry("plan")
                .compile();
        explain = new GraphExplain(graph);
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode("review");
        assertTrue(text.startsWith("Node: review\n"));
        assertTrue(text.contains("Reads: [draft]"));
        assertTrue(text.contains("Writes: [verdict]"));
        assertTrue(text.contains("Priority: 5"));
        assertTrue(text.contains("Deadline: 250ms"));
        assertTrue(text.contains("Retry: 3 attempts, 10ms backoff"));
        assertTrue(text.contains("publish"));
    }

    @Test
    public void testDumpTopology() {
        String text = explain.dumpTopology();
        assertTrue(text.startsWith("Graph review-flow (4 nodes, 2 channels):"));
        assertTrue(text.contains("[0] plan (ENTRY) -> review"));
    }

    @Test
    public void testMermaid() {
        String text = explain.toMermaid();
        assertTrue(text.startsWith("graph TD;\n"));
        assertTrue(text.contains("plan[\"plan (entry)\"];"));
        assertTrue(text.contains("plan --> review;"));
        assertTrue(text.contains("review ==> publish;"));
        assertTrue(text.contains("review ==> retry_step;"));
        assertTrue(text.contains("plan -. \"draft\" .-> review;"));
        assertTrue(text.contains("review -. \"verdict\" .-> publish;"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownNode() {
        explain.explainNode("ghost");
    }
}
