package com.trading.cld.strategy;

import java.util.Map;

/**
 * Evaluates the graph a fixed number of times.
 *
 * From the second iteration on, back edges carry the source's output from the
 * previous iteration, so feedback loops advance by one step per iteration.
 */
public final class MultiPassStrategy extends AbstractTopologicalStrategy {
    private final int maxIterations;

    /**
     * @param maxIterations Number of iterations to run.
     * @throws IllegalArgumentException if maxIterations is less than 1.
     */
    public MultiPassStrategy(int maxIterations) {
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        this.maxIterations = maxIterations;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public boolean shouldContinue(int iteration, Map<String, Map<String, Object>> currentOutputs) {
        return iteration < maxIterations;
    }

    @Override
    public Map<String, Double> backEdgeDefaults(int iteration, Map<String, Map<String, Object>> previousOutputs) {
        return previousNumericOutputs(iteration, previousOutputs);
    }

    @Override
    public String toString() {
        return "MultiPass(" + maxIterations + ")";
    }
}
