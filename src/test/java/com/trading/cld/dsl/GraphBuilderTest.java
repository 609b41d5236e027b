package com.trading.cld.dsl;

import com.trading.cld.CldGraph;
import com.trading.cld.engine.ExecutionResult;
import com.trading.cld.graph.Edge;
import com.trading.cld.graph.Graph;
import com.trading.cld.node.VariableNode;
import com.trading.cld.strategy.ExecutionStrategies;
import com.trading.cld.strategy.MultiPassStrategy;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testBuildPopulationLoop() {
        Graph g = CldGraph.builder("population")
                .constant("births", 10)
                .variable("population", 1000)
                .gain("growth", 0.1)
                .connect("births", "population")
                .connect("population", "growth")
                .connect("growth", "population")
                .build();

        assertEquals(3, g.nodeCount());
        assertEquals(3, g.edgeCount());
        assertEquals("e0", g.edges().get(0).id());
        assertEquals("e2", g.edges().get(2).id());
        assertEquals("delta", g.edges().get(1).fromPortId());
    }

    @Test
    public void testBuildWithEngine() {
        GraphBuilder.BuiltGraph built = GraphBuilder.create("loop")
                .constant("in", 1)
                .variable("a", 0)
                .connect("in", "a")
                .connect("a", "a")
                .buildWithEngine(ExecutionStrategies.multiPass(2));

        assertEquals("loop", built.name());
        assertTrue(built.engine().strategy() instanceof MultiPassStrategy);

        ExecutionResult result = built.engine().execute(built.graph());
        assertEquals(2, result.iterations());
        VariableNode.State a = result.stateOf("a");
        assertEquals(3.0, a.value(), 1e-9);
    }

    @Test
    public void testExplicitEdgesAndCalc() {
        Graph g = GraphBuilder.create("calc")
                .constant("c", 2)
                .calc("sq", x -> x * x)
                .edge(new Edge("custom", "c", "delta", "sq", "delta"))
                .build();

        ExecutionResult result = CldGraph.engine(ExecutionStrategies.singlePass()).execute(g);
        assertEquals(4.0, result.output("sq", "delta"), 1e-9);
        assertEquals("custom", g.edges().get(0).id());
    }

    @Test
    public void testGeneratedEdgeIdsSkipExplicitOnes() {
        Graph g = GraphBuilder.create("ids")
                .constant("s", 1)
                .variable("a", 0)
                .variable("b", 0)
                .edge(new Edge("e1", "s", "delta", "a", "delta"))
                .connect("s", "b")
                .connect("a", "b")
                .connect("b", "a")
                .build();

        assertEquals("e1", g.edges().get(0).id());
        assertEquals("e0", g.edges().get(1).id());
        assertEquals("e2", g.edges().get(2).id());
        assertEquals("e3", g.edges().get(3).id());
    }

    @Test
    public void testDuplicateExplicitEdgeIdRejected() {
        GraphBuilder b = GraphBuilder.create("dup-edge")
                .constant("s", 1)
                .variable("a", 0)
                .connect("s", "a");
        try {
            b.edge(new Edge("e0", "s", "delta", "a", "delta"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Edge with id \"e0\" already exists in graph 'dup-edge'", e.getMessage());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testBuildValidates() {
        GraphBuilder.create("broken")
                .variable("a", 0)
                .connect("a", "missing")
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNode() {
        GraphBuilder.create("dup").variable("a", 0).constant("a", 1);
    }

    @Test
    public void testCannotModifyAfterBuild() {
        GraphBuilder b = GraphBuilder.create("done").variable("a", 0);
        b.build();
        try {
            b.variable("b", 0);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("Graph 'done' already built", e.getMessage());
        }
    }
}
