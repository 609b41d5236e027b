package com.trading.cld.api;

import com.trading.cld.graph.Graph;

import java.util.List;
import java.util.Map;

/**
 * Scheduling policy consulted by the engine on every iteration.
 *
 * A strategy decides:
 * - the order in which nodes are evaluated,
 * - whether another iteration runs,
 * - which values back edges carry (edges whose source is scheduled at or after
 * their destination, so the source has no output yet in the current pass).
 *
 * Output maps passed in are keyed by node id; each value is that node's output
 * record for the iteration.
 */
public interface ExecutionStrategy {

    /**
     * Evaluation order for the current iteration. Called once per iteration;
     * implementations may recompute every time.
     */
    List<String> order(Graph graph);

    /**
     * Decides whether another iteration runs.
     *
     * @param iteration      The iteration that just completed (1-based).
     * @param currentOutputs Outputs produced during that iteration.
     * @return true to run another iteration.
     */
    boolean shouldContinue(int iteration, Map<String, Map<String, Object>> currentOutputs);

    /**
     * Values for back edges in the upcoming iteration, keyed
     * {@code "sourceNodeId.sourcePortId"}. A back edge with no entry reads 0.
     *
     * @param iteration       The iteration about to run (1-based).
     * @param previousOutputs Outputs of the previous iteration, or null on the
     *                        first iteration.
     */
    Map<String, Double> backEdgeDefaults(int iteration, Map<String, Map<String, Object>> previousOutputs);

    /**
     * Clears any history kept across {@link #shouldContinue} calls. The engine
     * calls this at the start of every run.
     */
    default void reset() {
    }
}
