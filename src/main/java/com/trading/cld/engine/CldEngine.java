package com.trading.cld.engine;

import com.trading.cld.api.*;
import com.trading.cld.graph.Edge;
import com.trading.cld.graph.Graph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives the evaluation of a causal loop diagram.
 *
 * The engine runs iterations until its {@link ExecutionStrategy} says stop.
 * Each iteration evaluates every node once, in the order the strategy
 * supplies, and resolves each incoming edge in one of two ways:
 *
 * 1. Forward edge: the source is scheduled before the destination. The value
 * is the source's output field {@code fromPortId} from the current iteration,
 * or 0 if the source produced no numeric value there.
 *
 * 2. Back edge: the source is scheduled at or after the destination (this
 * includes self-loops). The source has not run yet in this iteration, so the
 * value comes from the strategy's back-edge defaults under
 * {@code "fromNodeId.fromPortId"}, or 0 if there is none.
 *
 * Several edges feeding the same input port are summed.
 *
 * State:
 * Every call to {@link #execute} builds a fresh state map, seeded from the
 * caller's initial state or each node's default, and hands it back in the
 * result. The engine itself keeps nothing between calls, so one engine may run
 * many graphs. Calls are single-threaded and sequential; concurrent calls are
 * safe only if the strategy is stateless (see {@link ExecutionStrategy#reset()}).
 *
 * Fail Fast:
 * A node id the engine cannot resolve (an order entry missing from the graph
 * or listed twice, an edge endpoint missing from the graph or the order)
 * aborts the run with an IllegalStateException. A node whose compute throws aborts the run after the
 * listener has been notified. Nothing is retried.
 */
public final class CldEngine {
    private static final Logger log = LogManager.getLogger(CldEngine.class);

    private final ExecutionStrategy strategy;
    private final ExecutionListener listener;

    public CldEngine(ExecutionStrategy strategy) {
        this(strategy, null);
    }

    /**
     * @param strategy Scheduling policy, fixed for the lifetime of the engine.
     * @param listener Optional observer; may be null.
     */
    public CldEngine(ExecutionStrategy strategy, ExecutionListener listener) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.listener = listener;
    }

    public ExecutionStrategy strategy() {
        return strategy;
    }

    /** Runs the graph with every node starting from its default state. */
    public ExecutionResult execute(Graph graph) {
        return execute(graph, null);
    }

    /**
     * Runs the graph until the strategy stops.
     *
     * The graph is expected to have passed {@link Graph#validate()}; it is not
     * re-validated here.
     *
     * @param graph        The graph to run. Never modified.
     * @param initialState Optional node id → state overrides; may be null.
     * @return Final state, last iteration's outputs and iteration count.
     * @throws IllegalStateException if a node id cannot be resolved.
     * @throws RuntimeException      if a node's compute fails; the cause is the
     *                               node's exception.
     */
    public ExecutionResult execute(Graph graph, Map<String, ?> initialState) {
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;

        strategy.reset();

        // 1. Seed state
        Map<String, Object> stateMap = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (Map.Entry<String, Node<?>> entry : graph.nodes().entrySet()) {
            String nodeId = entry.getKey();
            if (initialState != null && initialState.containsKey(nodeId))
                stateMap.put(nodeId, initialState.get(nodeId));
            else
                stateMap.put(nodeId, entry.getValue().defaultState());
        }

        Map<String, List<Edge>> incoming = indexIncoming(graph);
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        Map<String, Map<String, Object>> previous = null;

        if (hasListener)
            l.onExecutionStart(graph.nodeCount());

        // 2. Iterate
        int iteration = 0;
        boolean continuing;
        do {
            iteration++;
            if (hasListener)
                l.onIterationStart(iteration);

            List<String> order = strategy.order(graph);
            Map<String, Double> backEdgeDefaults = strategy.backEdgeDefaults(iteration, previous);
            Map<String, Integer> position = positions(order);
            checkEdges(graph, position);

            Map<String, Map<String, Object>> current = new LinkedHashMap<>(order.size() * 2);
            for (int idx = 0; idx < order.size(); idx++) {
                String nodeId = order.get(idx);
                Node<?> node = graph.node(nodeId);
                if (node == null)
                    throw new IllegalStateException("Node \"" + nodeId + "\" not found in graph");

                Map<String, Double> inputs = gatherInputs(idx,
                        incoming.getOrDefault(nodeId, Collections.emptyList()), position, current, backEdgeDefaults);

                long start = hasListener ? System.nanoTime() : 0L;
                Map<String, Object> record;
                try {
                    record = invoke(node, inputs, iteration, stateMap);
                } catch (RuntimeException e) {
                    if (hasListener)
                        l.onNodeError(iteration, idx, nodeId, e);
                    throw new RuntimeException(
                            "Execution failed at node \"" + nodeId + "\" in iteration " + iteration, e);
                }
                if (hasListener)
                    l.onNodeComputed(iteration, idx, nodeId, System.nanoTime() - start);

                current.put(nodeId, record);
                outputs.put(nodeId, record);
            }

            previous = current;
            continuing = strategy.shouldContinue(iteration, current);
            if (hasListener)
                l.onIterationEnd(iteration, continuing);
        } while (continuing);

        if (hasListener)
            l.onExecutionEnd(iteration);
        log.debug("Executed {} over {} nodes in {} iteration(s)", strategy, graph.nodeCount(), iteration);

        // 3. Result
        return new ExecutionResult(stateMap, outputs, iteration);
    }

    /**
     * Resolves the input record of the node at position {@code idx}.
     */
    private static Map<String, Double> gatherInputs(int idx, List<Edge> edges,
            Map<String, Integer> position, Map<String, Map<String, Object>> current,
            Map<String, Double> backEdgeDefaults) {
        if (edges.isEmpty())
            return Collections.emptyMap();

        Map<String, Double> inputs = new HashMap<>();
        for (Edge edge : edges) {
            // Endpoints were resolved by checkEdges
            int srcIdx = position.get(edge.fromNodeId());

            double value;
            if (srcIdx < idx) {
                value = numeric(current.get(edge.fromNodeId()), edge.fromPortId());
            } else {
                Double fallback = backEdgeDefaults.get(edge.sourceKey());
                value = fallback == null ? 0.0 : fallback;
            }
            inputs.merge(edge.toPortId(), value, Double::sum);
        }
        return inputs;
    }

    private static double numeric(Map<String, Object> record, String field) {
        if (record == null)
            return 0.0;
        return record.get(field) instanceof Number num ? num.doubleValue() : 0.0;
    }

    private static <S> Map<String, Object> invoke(Node<S> node, Map<String, Double> inputs, int iteration,
            Map<String, Object> stateMap) {
        NodeExecutionContext<S> ctx = new NodeExecutionContext<>(node.id(), iteration, stateMap);
        Map<String, Object> record = node.compute(Collections.unmodifiableMap(inputs), ctx);
        return record == null ? Collections.emptyMap() : Collections.unmodifiableMap(record);
    }

    private static Map<String, List<Edge>> indexIncoming(Graph graph) {
        Map<String, List<Edge>> incoming = new HashMap<>(graph.nodeCount() * 2);
        for (Edge e : graph.edges())
            incoming.computeIfAbsent(e.toNodeId(), k -> new ArrayList<>()).add(e);
        return incoming;
    }

    /**
     * Both endpoints of every edge must be graph nodes scheduled in this
     * iteration's order.
     */
    private static void checkEdges(Graph graph, Map<String, Integer> position) {
        for (Edge edge : graph.edges()) {
            String source = edge.fromNodeId();
            String target = edge.toNodeId();
            if (!graph.containsNode(source))
                throw new IllegalStateException("Edge \"" + edge.id() + "\" into \"" + target
                        + "\" references source node \"" + source + "\" not found in graph");
            if (!graph.containsNode(target))
                throw new IllegalStateException("Edge \"" + edge.id() + "\" from \"" + source
                        + "\" references target node \"" + target + "\" not found in graph");
            if (!position.containsKey(source))
                throw new IllegalStateException("Source node \"" + source + "\" not found in execution order");
            if (!position.containsKey(target))
                throw new IllegalStateException("Target node \"" + target + "\" not found in execution order");
        }
    }

    private static Map<String, Integer> positions(List<String> order) {
        Map<String, Integer> position = new HashMap<>(order.size() * 2);
        for (int i = 0; i < order.size(); i++) {
            Integer seen = position.put(order.get(i), i);
            if (seen != null)
                throw new IllegalStateException("Node \"" + order.get(i) + "\" appears twice in execution order (at "
                        + seen + " and " + i + ")");
        }
        return position;
    }
}
