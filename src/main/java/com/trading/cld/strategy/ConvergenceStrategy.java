package com.trading.cld.strategy;

import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates the graph until its outputs stop moving, or until an iteration cap.
 *
 * Convergence test (applied from the second iteration on):
 * the previous and current output snapshots have the same number of nodes,
 * every node of the current snapshot exists in the previous one, and every
 * numeric field of the current snapshot exists as a number in the previous
 * snapshot with an absolute difference strictly below {@code threshold}.
 * A NaN difference never counts as converged.
 *
 * Back edges carry the previous iteration's outputs, as in
 * {@link MultiPassStrategy}.
 *
 * Thread Safety:
 * The strategy keeps the previous snapshot between calls. Do not share one
 * instance between engines running concurrently.
 */
public final class ConvergenceStrategy extends AbstractTopologicalStrategy {
    private static final Logger log = LogManager.getLogger(ConvergenceStrategy.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final double threshold;
    private final int maxIterations;

    // Output snapshot of the previous iteration; null before the first call.
    private Map<String, Map<String, Object>> previous;

    public ConvergenceStrategy(double threshold) {
        this(threshold, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param threshold     Largest change still considered stable (exclusive).
     * @param maxIterations Hard iteration cap.
     * @throws IllegalArgumentException if threshold is negative or NaN, or
     *                                  maxIterations is less than 1.
     */
    public ConvergenceStrategy(double threshold, int maxIterations) {
        if (!(threshold >= 0))
            throw new IllegalArgumentException("threshold must be non-negative, got " + threshold);
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        this.threshold = threshold;
        this.maxIterations = maxIterations;
    }

    public double threshold() {
        return threshold;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public boolean shouldContinue(int iteration, Map<String, Map<String, Object>> currentOutputs) {
        if (iteration >= maxIterations) {
            log.debug("Iteration cap {} reached without convergence check passing", maxIterations);
            return false;
        }

        if (previous == null) {
            previous = snapshot(currentOutputs);
            return true;
        }

        boolean converged = hasConverged(previous, currentOutputs);
        previous = snapshot(currentOutputs);
        if (converged)
            log.debug("Converged after {} iterations (threshold={})", iteration, threshold);
        return !converged;
    }

    @Override
    public Map<String, Double> backEdgeDefaults(int iteration, Map<String, Map<String, Object>> previousOutputs) {
        return previousNumericOutputs(iteration, previousOutputs);
    }

    @Override
    public void reset() {
        previous = null;
    }

    private boolean hasConverged(Map<String, Map<String, Object>> before, Map<String, Map<String, Object>> now) {
        for (Map.Entry<String, Map<String, Object>> node : now.entrySet()) {
            Map<String, Object> prevRecord = before.get(node.getKey());
            Map<String, Object> record = node.getValue();
            if (prevRecord == null || record == null)
                return false;

            for (Map.Entry<String, Object> field : record.entrySet()) {
                if (!(field.getValue() instanceof Number current))
                    continue;
                if (!(prevRecord.get(field.getKey()) instanceof Number prev))
                    return false;
                double change = Math.abs(current.doubleValue() - prev.doubleValue());
                if (!(change < threshold))
                    return false;
            }
        }
        return before.size() == now.size();
    }

    // Copies one level deep so nodes that reuse their output maps cannot rewrite history.
    private static Map<String, Map<String, Object>> snapshot(Map<String, Map<String, Object>> outputs) {
        Map<String, Map<String, Object>> copy = new HashMap<>(outputs.size() * 2);
        for (Map.Entry<String, Map<String, Object>> e : outputs.entrySet())
            copy.put(e.getKey(), e.getValue() == null ? null : new HashMap<>(e.getValue()));
        return copy;
    }

    @Override
    public String toString() {
        return "Convergence(" + threshold + ", " + maxIterations + ")";
    }
}
