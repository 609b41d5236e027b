package com.trading.cld.disruptor;

import com.trading.cld.engine.ExecutionResult;
import com.trading.cld.graph.Graph;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A mutable request slot in the execution ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every request. The consumer clears the slot after running it so graphs and
 * results are not retained by the buffer.
 */
public final class ExecutionRequestEvent {
    private Graph graph;
    private Map<String, ?> initialState;
    private CompletableFuture<ExecutionResult> future;

    /**
     * Configures the slot for one run.
     *
     * @param graph        Graph to execute.
     * @param initialState Optional initial state; may be null.
     * @param future       Completed by the consumer with the result or failure.
     */
    public void set(Graph graph, Map<String, ?> initialState, CompletableFuture<ExecutionResult> future) {
        this.graph = graph;
        this.initialState = initialState;
        this.future = future;
    }

    public Graph graph() {
        return graph;
    }

    public Map<String, ?> initialState() {
        return initialState;
    }

    public CompletableFuture<ExecutionResult> future() {
        return future;
    }

    public void clear() {
        graph = null;
        initialState = null;
        future = null;
    }
}
