package com.trading.cld.engine;

import com.trading.cld.api.ExecutionContext;

import java.util.Map;

/**
 * ExecutionContext backed by the engine's per-run state map. Reads and writes
 * go to the slot of {@link #nodeId()} only.
 */
final class NodeExecutionContext<S> implements ExecutionContext<S> {
    private final String nodeId;
    private final int iteration;
    private final Map<String, Object> stateMap;

    NodeExecutionContext(String nodeId, int iteration, Map<String, Object> stateMap) {
        this.nodeId = nodeId;
        this.iteration = iteration;
        this.stateMap = stateMap;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public int iteration() {
        return iteration;
    }

    @Override
    @SuppressWarnings("unchecked")
    public S getState() {
        return (S) stateMap.get(nodeId);
    }

    @Override
    public void setState(S next) {
        stateMap.put(nodeId, next);
    }
}
