package com.trading.cld.engine;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of one {@link CldEngine#execute} call.
 *
 * @param state      Final state of every node, keyed by node id.
 * @param outputs    Output record of every node from the last iteration.
 * @param iterations Number of iterations executed.
 */
public record ExecutionResult(Map<String, Object> state, Map<String, Map<String, Object>> outputs,
        int iterations) {

    public ExecutionResult {
        state = Collections.unmodifiableMap(state);
        outputs = Collections.unmodifiableMap(outputs);
    }

    /** Typed lookup of a node's final state. */
    @SuppressWarnings("unchecked")
    public <S> S stateOf(String nodeId) {
        return (S) state.get(nodeId);
    }

    /** @return The node's last output record, or an empty map if it produced none. */
    public Map<String, Object> outputsOf(String nodeId) {
        Map<String, Object> record = outputs.get(nodeId);
        return record == null ? Collections.emptyMap() : record;
    }

    /**
     * Numeric value of one output field of the last iteration.
     *
     * @throws IllegalArgumentException if the field is absent or not numeric.
     */
    public double output(String nodeId, String portId) {
        Object value = outputsOf(nodeId).get(portId);
        if (value instanceof Number num)
            return num.doubleValue();
        throw new IllegalArgumentException("No numeric output " + nodeId + "." + portId + " (got " + value + ")");
    }
}
