package com.trading.cld.node;

import com.trading.cld.api.ExecutionContext;
import com.trading.cld.graph.Port;

import java.util.List;
import java.util.Map;

/**
 * Reference CLD variable: an accumulator.
 *
 * - State: {@link State} holding the current value.
 * - Input: "delta", the change arriving this iteration (0 when unconnected).
 * - Output: "delta", the same change passed through to dependents.
 *
 * Each compute adds the incoming delta to the stored value.
 */
public final class VariableNode extends AbstractNode<VariableNode.State> {

    /** Accumulated value of a variable. */
    public record State(double value) {
    }

    private final State initial;

    public VariableNode(String id) {
        this(id, 0.0);
    }

    public VariableNode(String id, double initialValue) {
        super(id, "variable", List.of(Port.input(DELTA)), List.of(Port.output(DELTA)));
        this.initial = new State(initialValue);
    }

    @Override
    public State defaultState() {
        return initial;
    }

    @Override
    public Map<String, Object> compute(Map<String, Double> inputs, ExecutionContext<State> ctx) {
        double delta = inputs.getOrDefault(DELTA, 0.0);
        State current = ctx.getState();
        double base = current == null ? 0.0 : current.value();
        ctx.setState(new State(base + delta));
        return Map.of(DELTA, delta);
    }
}
