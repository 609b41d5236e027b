package com.trading.cld.api;

/**
 * Observability interface for monitoring graph execution.
 *
 * Implementations can be registered with the CldEngine to receive callbacks
 * during a run. This is the mechanism for:
 *
 * - Profiling: how long each node's compute takes.
 * - Debugging: tracing which iteration a run is in and why it stopped.
 * - Host integration: refreshing an editor view after each iteration.
 *
 * Performance Warning:
 * Callbacks run inline on the engine's evaluation loop. Keep them cheap; any
 * blocking I/O here stalls the run.
 */
public interface ExecutionListener {

    /**
     * Called once before the first iteration.
     *
     * @param nodeCount Number of nodes in the graph being executed.
     */
    void onExecutionStart(int nodeCount);

    /** Called before the nodes of an iteration are evaluated. */
    void onIterationStart(int iteration);

    /**
     * Called after a node's compute returned.
     *
     * @param iteration     Current iteration.
     * @param orderIndex    Position of the node in this iteration's order.
     * @param nodeId        Id of the node.
     * @param durationNanos Time spent in compute.
     */
    void onNodeComputed(int iteration, int orderIndex, String nodeId, long durationNanos);

    /**
     * Called when a node's compute throws. The run is aborted right after.
     */
    void onNodeError(int iteration, int orderIndex, String nodeId, Throwable error);

    /**
     * Called after the strategy decided whether to continue.
     *
     * @param continuing true if another iteration follows.
     */
    void onIterationEnd(int iteration, boolean continuing);

    /**
     * Called once when the run completes normally.
     *
     * @param iterations Total iterations executed.
     */
    void onExecutionEnd(int iterations);
}
