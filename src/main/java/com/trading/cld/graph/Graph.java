package com.trading.cld.graph;

import com.trading.cld.api.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable causal loop diagram: nodes keyed by id plus an ordered edge list.
 *
 * Graphs are values. {@link #addNode} and {@link #addEdge} return a new graph
 * and leave the receiver untouched, so a host editor can keep earlier versions
 * around (undo, diffing) without copying.
 *
 * Ordering:
 * Node insertion order is preserved and is significant: the topology analyzer
 * starts its depth-first search from nodes in this order, which fixes the
 * relative order of nodes inside a cycle. Edge order fixes the order in which
 * successors are explored.
 *
 * Validation:
 * Only node id uniqueness is enforced while building. Port and edge reference
 * checks are deferred to {@link #validate()}, which should be called once the
 * graph is complete.
 */
public final class Graph {
    private static final Graph EMPTY = new Graph(Collections.emptyMap(), Collections.emptyList());

    private final Map<String, Node<?>> nodes;
    private final List<Edge> edges;

    private Graph(Map<String, Node<?>> nodes, List<Edge> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    /** @return An empty graph. */
    public static Graph create() {
        return EMPTY;
    }

    /**
     * Returns a new graph containing every node of this one plus {@code node}.
     *
     * @throws IllegalArgumentException if a node with the same id already exists.
     */
    public Graph addNode(Node<?> node) {
        if (nodes.containsKey(node.id()))
            throw new IllegalArgumentException("Node with id \"" + node.id() + "\" already exists in graph");
        Map<String, Node<?>> next = new LinkedHashMap<>(nodes);
        next.put(node.id(), node);
        return new Graph(Collections.unmodifiableMap(next), edges);
    }

    /**
     * Returns a new graph with {@code edge} appended.
     * The edge's node and port references are not checked here.
     */
    public Graph addEdge(Edge edge) {
        List<Edge> next = new ArrayList<>(edges.size() + 1);
        next.addAll(edges);
        next.add(edge);
        return new Graph(nodes, Collections.unmodifiableList(next));
    }

    /** Shorthand for {@link GraphValidator#validate(Graph)}. */
    public void validate() {
        GraphValidator.validate(this);
    }

    /** @return Unmodifiable id → node map in insertion order. */
    public Map<String, Node<?>> nodes() {
        return nodes;
    }

    /** @return Unmodifiable edge list in insertion order. */
    public List<Edge> edges() {
        return edges;
    }

    /** @return The node with the given id, or null if absent. */
    public Node<?> node(String id) {
        return nodes.get(id);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Edges whose destination is {@code nodeId}, in edge order. */
    public List<Edge> edgesInto(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge e : edges)
            if (e.toNodeId().equals(nodeId))
                result.add(e);
        return result;
    }

    /** Edges whose source is {@code nodeId}, in edge order. */
    public List<Edge> edgesFrom(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge e : edges)
            if (e.fromNodeId().equals(nodeId))
                result.add(e);
        return result;
    }

    @Override
    public String toString() {
        return "Graph(" + nodes.size() + " nodes, " + edges.size() + " edges)";
    }
}
