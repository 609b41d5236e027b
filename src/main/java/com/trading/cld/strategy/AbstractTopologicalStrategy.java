package com.trading.cld.strategy;

import com.trading.cld.api.ExecutionStrategy;
import com.trading.cld.engine.TopologicalOrder;
import com.trading.cld.graph.Graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for strategies that evaluate nodes in SCC-aware topological
 * order. Subclasses only decide iteration control and back-edge values.
 */
public abstract class AbstractTopologicalStrategy implements ExecutionStrategy {

    @Override
    public List<String> order(Graph graph) {
        return TopologicalOrder.of(graph).nodeIds();
    }

    /**
     * Back-edge values taken from the previous iteration.
     *
     * Every numeric field of every node's previous output record is published
     * under {@code "nodeId.fieldName"}. Output records are keyed by port id, so
     * this is the key the engine builds from {@code edge.fromNodeId} and
     * {@code edge.fromPortId}.
     *
     * @return Empty map on iteration 1 or when there is no history.
     */
    protected static Map<String, Double> previousNumericOutputs(int iteration,
            Map<String, Map<String, Object>> previousOutputs) {
        if (iteration <= 1 || previousOutputs == null)
            return Collections.emptyMap();

        Map<String, Double> values = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> node : previousOutputs.entrySet()) {
            Map<String, Object> record = node.getValue();
            if (record == null)
                continue;
            for (Map.Entry<String, Object> field : record.entrySet()) {
                if (field.getValue() instanceof Number num)
                    values.put(node.getKey() + "." + field.getKey(), num.doubleValue());
            }
        }
        return values;
    }
}
