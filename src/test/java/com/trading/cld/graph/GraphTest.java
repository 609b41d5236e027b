package com.trading.cld.graph;

import com.trading.cld.node.ConstantNode;
import com.trading.cld.node.VariableNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphTest {

    @Test
    public void testEmptyGraph() {
        Graph g = Graph.create();
        assertEquals(0, g.nodeCount());
        assertEquals(0, g.edgeCount());
        assertNull(g.node("A"));
    }

    @Test
    public void testAddNodeReturnsNewGraph() {
        Graph empty = Graph.create();
        Graph one = empty.addNode(new VariableNode("A"));

        assertNotSame(empty, one);
        assertEquals(0, empty.nodeCount());
        assertEquals(1, one.nodeCount());
        assertTrue(one.containsNode("A"));
        assertEquals("variable", one.node("A").type());
    }

    @Test
    public void testAddEdgeLeavesOriginalUntouched() {
        Graph nodes = Graph.create()
                .addNode(new ConstantNode("S", 1))
                .addNode(new VariableNode("A"));
        Graph wired = nodes.addEdge(new Edge("e1", "S", "delta", "A", "delta"));

        assertEquals(0, nodes.edgeCount());
        assertEquals(1, wired.edgeCount());
        assertSame(nodes.node("A"), wired.node("A"));
    }

    @Test
    public void testInsertionOrderPreserved() {
        Graph g = Graph.create()
                .addNode(new VariableNode("C"))
                .addNode(new VariableNode("A"))
                .addNode(new VariableNode("B"));

        assertEquals(List.of("C", "A", "B"), List.copyOf(g.nodes().keySet()));
    }

    @Test
    public void testDuplicateNodeRejected() {
        Graph g = Graph.create().addNode(new VariableNode("A"));
        try {
            g.addNode(new VariableNode("A", 3.0));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Node with id \"A\" already exists in graph", e.getMessage());
        }
        assertEquals(1, g.nodeCount());
    }

    @Test
    public void testAddEdgeDoesNotValidate() {
        // Dangling references are only reported by validate()
        Graph g = Graph.create().addEdge(new Edge("e1", "X", "delta", "Y", "delta"));
        assertEquals(1, g.edgeCount());
    }

    @Test
    public void testEdgeLookups() {
        Graph g = Graph.create()
                .addNode(new VariableNode("A"))
                .addNode(new VariableNode("B"))
                .addEdge(new Edge("e1", "A", "delta", "B", "delta"))
                .addEdge(new Edge("e2", "B", "delta", "A", "delta"))
                .addEdge(new Edge("e3", "A", "delta", "A", "delta"));

        assertEquals(2, g.edgesInto("A").size());
        assertEquals("e2", g.edgesInto("A").get(0).id());
        assertEquals(2, g.edgesFrom("A").size());
        assertTrue(g.edges().get(2).isSelfLoop());
        assertEquals("A.delta", g.edges().get(0).sourceKey());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNodesViewIsReadOnly() {
        Graph g = Graph.create().addNode(new VariableNode("A"));
        g.nodes().remove("A");
    }

    @Test
    public void testPortDisplayNameDefaultsToId() {
        Port p = new Port("in", null, PortKind.INPUT);
        assertEquals("in", p.displayName());
        assertEquals(PortKind.OUTPUT, Port.output("out").kind());
    }
}
