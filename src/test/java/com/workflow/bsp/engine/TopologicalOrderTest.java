package com.workflow.bsp.engine;

import com.workflow.bsp.error.GraphValidationException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder().addNode("A").build();

        assertEquals(1, order.nodeCount());
        assertEquals("A", order.node(0));
        assertEquals(0, order.topoIndex("A"));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraph() {
        // A -> B -> C, declared out of order
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("C").addNode("B").addNode("A")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(Arrays.asList("A", "B", "C"), order.names());

        assertEquals(1, order.childCount(0)); // A has 1 child (B)
        assertEquals(1, order.childCount(1)); // B has 1 child (C)
        assertEquals(0, order.childCount(2));
        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(1));
        assertEquals(1, order.parentCount(2));
    }

    @Test
    public void testDiamondGraph() {
        // A
        // / \
        // B C
        // \ /
        // D
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        assertEquals(0, order.topoIndex("A"));
        int idxB = order.topoIndex("B");
        int idxC = order.topoIndex("C");
        int idxD = order.topoIndex("D");

        assertTrue(idxD > idxB);
        assertTrue(idxD > idxC);

        assertEquals(2, order.childCount(0));
        assertEquals(idxD, order.child(idxB, 0));
        assertEquals(idxD, order.child(idxC, 0));
        assertEquals(2, order.parentCount(idxD));
    }

    @Test
    public void testRepeatedEdgeKeptOnce() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(1, order.childCount(0));
        assertEquals(1, order.parentCount(1));
    }

    @Test
    public void testDisjointGraphsKeepDeclarationOrder() {
        // A -> B
        // C -> D
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("C", "D")
                .build();

        // Roots first, in declaration order
        assertEquals("A", order.node(0));
        assertEquals("C", order.node(1));
        assertTrue(order.topoIndex("B") > order.topoIndex("A"));
        assertTrue(order.topoIndex("D") > order.topoIndex("C"));
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> C -> A
        try {
            TopologicalOrder.builder()
                    .addNode("A").addNode("B").addNode("C")
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .addEdge("C", "A")
                    .build();
            fail("Expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(GraphValidationException.Kind.CONTROL_CYCLE, e.kind());
            assertTrue(e.getMessage().contains("Cycle detected"));
        }
    }

    @Test
    public void testSelfLoopDetection() {
        // A -> A
        try {
            TopologicalOrder.builder().addNode("A").addEdge("A", "A");
            fail("Expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(GraphValidationException.Kind.CONTROL_CYCLE, e.kind());
            assertEquals("A", e.nodeName());
        }
    }

    @Test
    public void testDuplicateNodeException() {
        try {
            TopologicalOrder.builder().addNode("A").addNode("A");
            fail("Expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(GraphValidationException.Kind.DUPLICATE_NAME, e.kind());
        }
    }

    @Test
    public void testUnknownEdgeTargetException() {
        try {
            TopologicalOrder.builder().addNode("A").addEdge("A", "B");
            fail("Expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(GraphValidationException.Kind.UNKNOWN_REFERENCE, e.kind());
            assertEquals("B", e.nodeName());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.builder().addNode("A").build();
        order.topoIndex("UNKNOWN");
    }
}
