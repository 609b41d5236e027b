package com.trading.cld.graph;

/** Direction of a port relative to the node that owns it. */
public enum PortKind {
    INPUT,
    OUTPUT
}
