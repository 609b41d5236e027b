package com.trading.cld.graph;

import java.util.Objects;

/**
 * A directed connection from an output port to an input port.
 *
 * Values flow from {@code fromNodeId.fromPortId} to {@code toNodeId.toPortId}.
 * References are plain ids; {@link GraphValidator} checks that they resolve.
 */
public record Edge(String id, String fromNodeId, String fromPortId, String toNodeId, String toPortId) {

    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fromNodeId, "fromNodeId");
        Objects.requireNonNull(fromPortId, "fromPortId");
        Objects.requireNonNull(toNodeId, "toNodeId");
        Objects.requireNonNull(toPortId, "toPortId");
    }

    public boolean isSelfLoop() {
        return fromNodeId.equals(toNodeId);
    }

    /** Key under which strategies publish back-edge values for this edge's source. */
    public String sourceKey() {
        return fromNodeId + "." + fromPortId;
    }

    @Override
    public String toString() {
        return id + "[" + fromNodeId + "." + fromPortId + " -> " + toNodeId + "." + toPortId + "]";
    }
}
