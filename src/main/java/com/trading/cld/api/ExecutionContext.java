package com.trading.cld.api;

/**
 * View handed to {@link Node#compute} for one (node, iteration) pair.
 *
 * The context only reaches the state slot of the node it was created for;
 * other nodes' state is not visible.
 *
 * @param <S> The node's state type.
 */
public interface ExecutionContext<S> {

    String nodeId();

    /** Current iteration, starting at 1. */
    int iteration();

    S getState();

    void setState(S next);
}
