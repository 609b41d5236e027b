package com.trading.cld.graph;

import java.util.Objects;

/**
 * Describes one input or output port of a node.
 *
 * The port id is the key used in the node's input and output records. Two
 * ports of the same node may share an id only if one is an input and the other
 * an output (the reference nodes use "delta" for both).
 *
 * @param id          Identifier, unique per node within its kind.
 * @param displayName Human-readable label, used only for diagnostics.
 * @param kind        INPUT or OUTPUT.
 */
public record Port(String id, String displayName, PortKind kind) {

    public Port {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (displayName == null)
            displayName = id;
    }

    public static Port input(String id) {
        return new Port(id, id, PortKind.INPUT);
    }

    public static Port output(String id) {
        return new Port(id, id, PortKind.OUTPUT);
    }
}
