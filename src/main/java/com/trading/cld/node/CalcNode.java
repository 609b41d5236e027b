package com.trading.cld.node;

import com.trading.cld.api.ExecutionContext;
import com.trading.cld.graph.Port;

import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Stateless transform of the incoming "delta".
 *
 * Typical use is a link weight in a feedback loop, e.g. a gain of 0.5 that
 * damps each pass until the loop converges.
 */
public final class CalcNode extends AbstractNode<Void> {
    private final DoubleUnaryOperator fn;

    public CalcNode(String id, DoubleUnaryOperator fn) {
        super(id, "calc", List.of(Port.input(DELTA)), List.of(Port.output(DELTA)));
        this.fn = fn;
    }

    /** A calc node multiplying its input by {@code factor}. */
    public static CalcNode gain(String id, double factor) {
        return new CalcNode(id, x -> x * factor);
    }

    @Override
    public Void defaultState() {
        return null;
    }

    @Override
    public Map<String, Object> compute(Map<String, Double> inputs, ExecutionContext<Void> ctx) {
        return Map.of(DELTA, fn.applyAsDouble(inputs.getOrDefault(DELTA, 0.0)));
    }
}
