package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.workflow.bsp.channel.BarrierSignal;
import com.workflow.bsp.channel.ChannelRegistry;
import com.workflow.bsp.channel.ChannelSpec;
import com.workflow.bsp.channel.Reducers;
import com.workflow.bsp.error.ChannelSerializationException;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class ChannelCheckpointCodecTest {

    /** Payload type carried through a pending send. */
    public static class Job {
        public String id;
        public int attempt;

        public Job() {
        }

        Job(String id, int attempt) {
            this.id = id;
            this.attempt = attempt;
        }
    }

    private final ChannelCheckpointCodec codec = new ChannelCheckpointCodec();
    private List<ChannelSpec> specs;

    @Before
    public void setUp() {
        specs = Arrays.asList(
                ChannelSpec.lastValue("name", String.class),
                ChannelSpec.binaryOperator("total", Long.class, Reducers.longSum(), 0L),
                ChannelSpec.untracked("scratch", String.class),
                ChannelSpec.ephemeral("flash", String.class),
                ChannelSpec.anyValue("any"),
                ChannelSpec.topic("events", String.class),
                ChannelSpec.namedBarrier("join", Set.of("a", "b")),
                ChannelSpec.dynamicBarrier("gather"));
    }

    @Test
    public void testEveryTrackedVariantSurvivesEncoding() {
        ChannelRegistry source = ChannelRegistry.of(specs);
        source.apply("name", Collections.singletonList("alice"));
        source.apply("total", Arrays.asList(3L, 4L));
        source.apply("scratch", Collections.singletonList("tmp"));
        source.apply("flash", Collections.singletonList("now"));
        source.apply("any", Collections.singletonList(12.5));
        source.apply("events", Arrays.asList("e1", "e2"));
        source.apply("join", Collections.singletonList("a"));
        source.apply("gather", Arrays.asList(BarrierSignal.expect(2), "w1", "w2"));

        Map<String, JsonNode> encoded = codec.encode(source);
        assertFalse(encoded.containsKey("scratch"));

        ChannelRegistry target = ChannelRegistry.of(specs);
        codec.decode(target, encoded);

        assertEquals("alice", target.value("name"));
        assertEquals(7L, target.value("total"));
        assertNull(target.valueOrNull("scratch"));
        assertEquals("now", target.value("flash"));
        assertEquals(12.5, target.value("any"));
        assertEquals(Arrays.asList("e1", "e2"), target.value("events"));
        assertFalse(target.barrierSatisfied("join"));
        assertTrue(target.barrierSatisfied("gather"));
    }

    @Test
    public void testEmptyChannelsStayEmpty() {
        ChannelRegistry source = ChannelRegistry.of(specs);
        ChannelRegistry target = ChannelRegistry.of(specs);
        target.apply("name", Collections.singletonList("stale"));

        codec.decode(target, codec.encode(source));
        assertNull(target.valueOrNull("name"));
        assertEquals(0L, target.value("total"));
    }

    @Test
    public void testUnknownChannelIsSkipped() {
        ChannelRegistry target = ChannelRegistry.of(specs);
        Map<String, JsonNode> encoded = new LinkedHashMap<>();
        encoded.put("removed", TextNode.valueOf("x"));
        encoded.put("name", TextNode.valueOf("bob"));
        codec.decode(target, encoded);
        assertEquals("bob", target.value("name"));
    }

    @Test
    public void testMismatchedCheckpoint() {
        ChannelRegistry target = ChannelRegistry.of(specs);
        Map<String, JsonNode> encoded = new LinkedHashMap<>();
        encoded.put("total", TextNode.valueOf("not a number"));
        try {
            codec.decode(target, encoded);
            fail("Expected ChannelSerializationException");
        } catch (ChannelSerializationException e) {
            assertEquals("total", e.channelName());
        }
    }

    @Test
    public void testSendPayloadKeepsType() {
        PendingSend send = codec.encodeSend("worker", new Job("j-1", 2));
        assertEquals(Job.class.getName(), send.payloadType());

        Object decoded = codec.decodeSend(send);
        assertTrue(decoded instanceof Job);
        assertEquals("j-1", ((Job) decoded).id);
        assertEquals(2, ((Job) decoded).attempt);

        assertNull(codec.decodeSend(codec.encodeSend("worker", null)));
    }
}
