package com.trading.cld.graph;

import com.trading.cld.api.Node;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks for a {@link Graph}.
 *
 * Checks, in this order, stopping at the first violation:
 * 1. Every node's input ports are of kind INPUT and its output ports of kind
 * OUTPUT.
 * 2. Port ids are unique within a node's inputs and within its outputs.
 * 3. Every edge names existing source and destination nodes.
 * 4. Every edge names an existing output port on its source and an existing
 * input port on its destination.
 *
 * Node id uniqueness is already guaranteed by {@link Graph#addNode}.
 * The execution engine does not re-run these checks.
 */
public final class GraphValidator {

    private GraphValidator() {
    }

    /**
     * @throws IllegalStateException describing the first violation found.
     */
    public static void validate(Graph graph) {
        for (Map.Entry<String, Node<?>> entry : graph.nodes().entrySet()) {
            String nodeId = entry.getKey();
            Node<?> node = entry.getValue();
            validatePorts(nodeId, PortKind.INPUT, node.inputs());
            validatePorts(nodeId, PortKind.OUTPUT, node.outputs());
        }

        for (Edge edge : graph.edges()) {
            Node<?> from = graph.node(edge.fromNodeId());
            if (from == null)
                throw new IllegalStateException(
                        "Edge \"" + edge.id() + "\" references missing fromNodeId \"" + edge.fromNodeId() + "\"");
            Node<?> to = graph.node(edge.toNodeId());
            if (to == null)
                throw new IllegalStateException(
                        "Edge \"" + edge.id() + "\" references missing toNodeId \"" + edge.toNodeId() + "\"");
            if (!hasPort(from.outputs(), edge.fromPortId()))
                throw new IllegalStateException("Edge \"" + edge.id() + "\" references missing output port \""
                        + edge.fromPortId() + "\" on node \"" + edge.fromNodeId() + "\"");
            if (!hasPort(to.inputs(), edge.toPortId()))
                throw new IllegalStateException("Edge \"" + edge.id() + "\" references missing input port \""
                        + edge.toPortId() + "\" on node \"" + edge.toNodeId() + "\"");
        }
    }

    private static void validatePorts(String nodeId, PortKind expected, List<Port> ports) {
        Set<String> seen = new HashSet<>();
        for (Port port : ports) {
            if (port.kind() != expected)
                throw new IllegalStateException("Port \"" + port.id() + "\" on node \"" + nodeId + "\" has kind "
                        + port.kind() + ", expected " + expected);
            if (!seen.add(port.id()))
                throw new IllegalStateException("Duplicate port id \"" + port.id() + "\" in "
                        + expected.name().toLowerCase() + " ports of node \"" + nodeId + "\"");
        }
    }

    private static boolean hasPort(List<Port> ports, String portId) {
        for (Port p : ports)
            if (p.id().equals(portId))
                return true;
        return false;
    }
}
