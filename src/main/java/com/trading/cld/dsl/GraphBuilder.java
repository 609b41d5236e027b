package com.trading.cld.dsl;

import com.trading.cld.api.ExecutionStrategy;
import com.trading.cld.api.Node;
import com.trading.cld.engine.CldEngine;
import com.trading.cld.graph.Edge;
import com.trading.cld.graph.Graph;
import com.trading.cld.node.AbstractNode;
import com.trading.cld.node.CalcNode;
import com.trading.cld.node.ConstantNode;
import com.trading.cld.node.VariableNode;

import java.util.HashSet;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Graph Builder -- fluent API for assembling a diagram.
 *
 * Wraps the value-returning {@link Graph} operations so host code does not have
 * to thread the graph through every call, and generates edge ids.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("population");
 * 2. Add nodes: g.constant("births", 10).variable("population", 1000);
 * 3. Wire them: g.connect("births", "population");
 * 4. Build: Graph graph = g.build(); (validates)
 */
public final class GraphBuilder {
    private final String graphName;
    private Graph graph = Graph.create();
    private final Set<String> edgeIds = new HashSet<>();
    private int edgeSeq;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    public String name() {
        return graphName;
    }

    // ── Nodes ────────────────────────────────────────────────────

    /** Adds an accumulating variable starting at {@code initialValue}. */
    public GraphBuilder variable(String id, double initialValue) {
        return node(new VariableNode(id, initialValue));
    }

    /** Adds a source emitting {@code value} on every iteration. */
    public GraphBuilder constant(String id, double value) {
        return node(new ConstantNode(id, value));
    }

    /** Adds a stateless transform of the incoming delta. */
    public GraphBuilder calc(String id, DoubleUnaryOperator fn) {
        return node(new CalcNode(id, fn));
    }

    /** Adds a node that multiplies the incoming delta by {@code factor}. */
    public GraphBuilder gain(String id, double factor) {
        return node(CalcNode.gain(id, factor));
    }

    /**
     * Adds any node.
     *
     * @throws IllegalArgumentException if the id is already taken.
     */
    public GraphBuilder node(Node<?> node) {
        checkNotBuilt();
        graph = graph.addNode(node);
        return this;
    }

    // ── Edges ────────────────────────────────────────────────────

    /** Connects the "delta" output of {@code from} to the "delta" input of {@code to}. */
    public GraphBuilder connect(String from, String to) {
        return connect(from, AbstractNode.DELTA, to, AbstractNode.DELTA);
    }

    /**
     * Connects {@code from.fromPort} to {@code to.toPort} with a generated edge
     * id ("e0", "e1", ...). Ids already taken by explicit edges are skipped.
     */
    public GraphBuilder connect(String from, String fromPort, String to, String toPort) {
        checkNotBuilt();
        String id;
        do {
            id = "e" + edgeSeq++;
        } while (edgeIds.contains(id));
        return edge(new Edge(id, from, fromPort, to, toPort));
    }

    /**
     * Adds an edge with a caller-chosen id.
     *
     * @throws IllegalArgumentException if the id is already used in this builder.
     */
    public GraphBuilder edge(Edge edge) {
        checkNotBuilt();
        if (!edgeIds.add(edge.id()))
            throw new IllegalArgumentException("Edge with id \"" + edge.id() + "\" already exists in graph '"
                    + graphName + "'");
        graph = graph.addEdge(edge);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Validates and returns the graph. The builder cannot be modified afterwards.
     *
     * @throws IllegalStateException if the graph is invalid.
     */
    public Graph build() {
        checkNotBuilt();
        graph.validate();
        built = true;
        return graph;
    }

    /** Builds the graph and an engine for it in one step. */
    public BuiltGraph buildWithEngine(ExecutionStrategy strategy) {
        return new BuiltGraph(graphName, build(), new CldEngine(strategy));
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }

    /** A validated graph bundled with the engine that runs it. */
    public record BuiltGraph(String name, Graph graph, CldEngine engine) {
    }
}
