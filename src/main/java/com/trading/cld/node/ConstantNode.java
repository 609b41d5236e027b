package com.trading.cld.node;

import com.trading.cld.api.ExecutionContext;
import com.trading.cld.graph.Port;

import java.util.List;
import java.util.Map;

/**
 * Emits the same "delta" on every iteration. Used to inject a pulse into a
 * diagram. No inputs, no state.
 */
public final class ConstantNode extends AbstractNode<Void> {
    private final double value;

    public ConstantNode(String id, double value) {
        super(id, "constant", List.of(), List.of(Port.output(DELTA)));
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public Void defaultState() {
        return null;
    }

    @Override
    public Map<String, Object> compute(Map<String, Double> inputs, ExecutionContext<Void> ctx) {
        return Map.of(DELTA, value);
    }
}
