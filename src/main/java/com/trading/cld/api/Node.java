package com.trading.cld.api;

import com.trading.cld.graph.Port;

import java.util.List;
import java.util.Map;

/**
 * A node in a causal loop diagram.
 *
 * This interface is the unit of computation of the CLD engine. Every node --
 * a pulse source, an accumulating variable, a stateless transform -- implements
 * it.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has an id unique within its graph. Edges refer to
 * nodes by id only, so cycles in the diagram never become cycles of object
 * references.
 *
 * 2. Shape: The declared input and output ports. Port declarations are checked
 * by {@link com.trading.cld.graph.GraphValidator}, not by the compiler.
 *
 * 3. Computation: {@link #compute} turns the resolved input record into an
 * output record. State is read and written only through the
 * {@link ExecutionContext}; apart from that the method must be pure.
 *
 * Record Contract:
 * Input records are keyed by input port id. Output records are keyed by output
 * port id; the engine resolves forward edges by looking up
 * {@code edge.fromPortId} in the source's output record, and strategies derive
 * back-edge values from the same keys. A numeric output that is not stored
 * under its port id is invisible to downstream nodes.
 *
 * @param <S> The type of the node's state.
 */
public interface Node<S> {

    /** @return Id, unique within the graph. */
    String id();

    /** @return Free-form kind tag (e.g. "variable", "constant"). */
    String type();

    /**
     * State used when the caller of {@code execute} supplies none for this node.
     * May be null for stateless nodes.
     */
    S defaultState();

    List<Port> inputs();

    List<Port> outputs();

    /**
     * Computes this node's outputs for one iteration.
     *
     * @param inputs Resolved input values keyed by input port id. Ports with no
     *               incoming edge are absent.
     * @param ctx    Access to the node id, the iteration number and this node's
     *               state slot.
     * @return Output record keyed by output port id. Null is treated as an
     *         empty record.
     */
    Map<String, Object> compute(Map<String, Double> inputs, ExecutionContext<S> ctx);
}
