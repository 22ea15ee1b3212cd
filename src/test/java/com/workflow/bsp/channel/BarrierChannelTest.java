package com.workflow.bsp.channel;

import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.error.InvalidUpdateException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.Assert.*;

public class BarrierChannelTest {

    private static NamedBarrierChannel named(boolean reset, String... participants) {
        return new NamedBarrierChannel("join", new LinkedHashSet<>(Arrays.asList(participants)), reset);
    }

    @Test
    public void testNamedBarrierSatisfiedWhenAllArrive() {
        NamedBarrierChannel b = named(false, "a", "b", "c");
        b.update(Arrays.asList("a", "b"));
        assertFalse(b.isAvailable());
        assertEquals(Collections.singleton("c"), b.missing());
        b.update(Collections.singletonList("c"));
        assertTrue(b.isSatisfied());
        assertEquals(Boolean.TRUE, b.get());
    }

    @Test(expected = EmptyChannelException.class)
    public void testNamedBarrierGetBeforeSatisfied() {
        NamedBarrierChannel b = named(false, "a", "b");
        b.update(Collections.singletonList("a"));
        b.get();
    }

    @Test
    public void testNamedBarrierRejectsStranger() {
        NamedBarrierChannel b = named(false, "a", "b");
        try {
            b.update(Arrays.asList("a", "zed"));
            fail("Expected InvalidUpdateException");
        } catch (InvalidUpdateException e) {
            assertTrue(e.getMessage().contains("zed"));
        }
        // Batch is validated before it is applied
        assertEquals(2, b.missing().size());
    }

    @Test
    public void testNamedBarrierDuplicateArrivalIsNoChange() {
        NamedBarrierChannel b = named(false, "a", "b");
        assertTrue(b.update(Collections.singletonList("a")));
        assertFalse(b.update(Collections.singletonList("a")));
    }

    @Test
    public void testNamedBarrierResetOnConsume() {
        NamedBarrierChannel b = named(true, "a", "b");
        b.update(Arrays.asList("a", "b"));
        assertTrue(b.consume());
        assertFalse(b.isSatisfied());
        assertFalse(b.consume());
    }

    @Test
    public void testNamedBarrierWithoutResetStaysSatisfied() {
        NamedBarrierChannel b = named(false, "a");
        b.update(Collections.singletonList("a"));
        assertFalse(b.consume());
        assertTrue(b.isSatisfied());
    }

    @Test
    public void testNamedBarrierCheckpointIsSorted() {
        NamedBarrierChannel b = named(false, "x", "a", "m");
        b.update(Arrays.asList("x", "a"));
        List<String> snap = b.checkpoint();
        assertEquals(Arrays.asList("a", "x"), snap);

        NamedBarrierChannel copy = named(false, "x", "a", "m");
        copy.restore(snap);
        assertEquals(Collections.singleton("m"), copy.missing());
    }

    @Test
    public void testDynamicBarrierArrivalsBeforeCount() {
        DynamicBarrierChannel b = new DynamicBarrierChannel("gather", false);
        b.update(Arrays.asList("w1", "w2"));
        assertFalse(b.isSatisfied());
        assertNull(b.expected());
        b.update(Collections.singletonList(BarrierSignal.expect(2)));
        assertTrue(b.isSatisfied());
        assertEquals(Boolean.TRUE, b.get());
    }

    @Test
    public void testDynamicBarrierSignals() {
        DynamicBarrierChannel b = new DynamicBarrierChannel("gather", false);
        assertTrue(b.expect(3));
        assertFalse(b.expect(3));
        b.update(Arrays.asList(BarrierSignal.arrive("w1"), "w2", BarrierSignal.arrive("w1")));
        assertEquals(2, b.arrivedCount());
        assertFalse(b.isAvailable());
        b.update(Collections.singletonList("w3"));
        assertTrue(b.isAvailable());
    }

    @Test(expected = InvalidUpdateException.class)
    public void testDynamicBarrierRejectsNonPositiveCount() {
        new DynamicBarrierChannel("gather", false).update(Collections.singletonList(BarrierSignal.expect(0)));
    }

    @Test(expected = InvalidUpdateException.class)
    public void testDynamicBarrierRejectsUnknownUpdate() {
        new DynamicBarrierChannel("gather", false).update(Collections.singletonList(12));
    }

    @Test
    public void testDynamicBarrierResetKeepsCount() {
        DynamicBarrierChannel b = new DynamicBarrierChannel("gather", true);
        b.expect(1);
        b.update(Collections.singletonList("w1"));
        assertTrue(b.consume());
        assertEquals(0, b.arrivedCount());
        assertEquals(Integer.valueOf(1), b.expected());
    }

    @Test
    public void testDynamicBarrierRestore() {
        DynamicBarrierChannel b = new DynamicBarrierChannel("gather", false);
        b.restore(new DynamicBarrierChannel.Snapshot(2, Arrays.asList("w1", "w2")));
        assertTrue(b.isSatisfied());
        b.restore(null);
        assertNull(b.expected());
        assertEquals(0, b.arrivedCount());
    }
}
