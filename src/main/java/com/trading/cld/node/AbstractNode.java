package com.trading.cld.node;

import com.trading.cld.api.Node;
import com.trading.cld.graph.Port;

import java.util.List;

/**
 * Base class holding the identity and port declarations shared by the
 * reference nodes.
 *
 * @param <S> State type.
 */
public abstract class AbstractNode<S> implements Node<S> {
    /** Port id used by the reference nodes for both input and output. */
    public static final String DELTA = "delta";

    private final String id;
    private final String type;
    private final List<Port> inputs;
    private final List<Port> outputs;

    protected AbstractNode(String id, String type, List<Port> inputs, List<Port> outputs) {
        this.id = id;
        this.type = type;
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public List<Port> inputs() {
        return inputs;
    }

    @Override
    public List<Port> outputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
