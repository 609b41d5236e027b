package com.trading.cld.strategy;

import java.util.Collections;
import java.util.Map;

/**
 * Evaluates the graph exactly once.
 *
 * Back edges have no history to draw from, so every back-edge input reads 0.
 */
public final class SinglePassStrategy extends AbstractTopologicalStrategy {

    @Override
    public boolean shouldContinue(int iteration, Map<String, Map<String, Object>> currentOutputs) {
        return iteration < 1;
    }

    @Override
    public Map<String, Double> backEdgeDefaults(int iteration, Map<String, Map<String, Object>> previousOutputs) {
        return Collections.emptyMap();
    }

    @Override
    public String toString() {
        return "SinglePass";
    }
}
