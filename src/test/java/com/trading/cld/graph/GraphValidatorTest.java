package com.trading.cld.graph;

import com.trading.cld.api.ExecutionContext;
import com.trading.cld.api.Node;
import com.trading.cld.node.ConstantNode;
import com.trading.cld.node.VariableNode;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphValidatorTest {

    // Node with caller-supplied port lists, to build malformed shapes
    private static Node<Void> shaped(String id, List<Port> inputs, List<Port> outputs) {
        return new Node<>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String type() {
                return "shaped";
            }

            @Override
            public Void defaultState() {
                return null;
            }

            @Override
            public List<Port> inputs() {
                return inputs;
            }

            @Override
            public List<Port> outputs() {
                return outputs;
            }

            @Override
            public Map<String, Object> compute(Map<String, Double> in, ExecutionContext<Void> ctx) {
                return Map.of();
            }
        };
    }

    private static String failure(Graph g) {
        try {
            g.validate();
            fail("Expected IllegalStateException");
            return null;
        } catch (IllegalStateException e) {
            return e.getMessage();
        }
    }

    @Test
    public void testValidGraphPasses() {
        Graph g = Graph.create()
                .addNode(new ConstantNode("S", 1))
                .addNode(new VariableNode("A"))
                .addEdge(new Edge("e1", "S", "delta", "A", "delta"))
                .addEdge(new Edge("e2", "A", "delta", "A", "delta"));
        g.validate();
        GraphValidator.validate(Graph.create());
    }

    @Test
    public void testWrongPortKind() {
        Graph g = Graph.create().addNode(shaped("N", List.of(Port.output("x")), List.of()));
        assertEquals("Port \"x\" on node \"N\" has kind OUTPUT, expected INPUT", failure(g));
    }

    @Test
    public void testDuplicatePortId() {
        Graph g = Graph.create()
                .addNode(shaped("N", List.of(), List.of(Port.output("p"), Port.output("p"))));
        assertEquals("Duplicate port id \"p\" in output ports of node \"N\"", failure(g));
    }

    @Test
    public void testSameIdOnInputAndOutputAllowed() {
        Graph g = Graph.create()
                .addNode(shaped("N", List.of(Port.input("p")), List.of(Port.output("p"))));
        g.validate();
    }

    @Test
    public void testMissingFromNode() {
        Graph g = Graph.create()
                .addNode(new VariableNode("A"))
                .addEdge(new Edge("e1", "X", "delta", "A", "delta"));
        assertEquals("Edge \"e1\" references missing fromNodeId \"X\"", failure(g));
    }

    @Test
    public void testMissingToNode() {
        Graph g = Graph.create()
                .addNode(new VariableNode("A"))
                .addEdge(new Edge("e1", "A", "delta", "Y", "delta"));
        assertEquals("Edge \"e1\" references missing toNodeId \"Y\"", failure(g));
    }

    @Test
    public void testMissingOutputPort() {
        Graph g = Graph.create()
                .addNode(new VariableNode("A"))
                .addNode(new VariableNode("B"))
                .addEdge(new Edge("e1", "A", "value", "B", "delta"));
        assertEquals("Edge \"e1\" references missing output port \"value\" on node \"A\"", failure(g));
    }

    @Test
    public void testMissingInputPort() {
        // Constants have no inputs at all
        Graph g = Graph.create()
                .addNode(new VariableNode("A"))
                .addNode(new ConstantNode("S", 1))
                .addEdge(new Edge("e1", "A", "delta", "S", "delta"));
        assertEquals("Edge \"e1\" references missing input port \"delta\" on node \"S\"", failure(g));
    }
}
