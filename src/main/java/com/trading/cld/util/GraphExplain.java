package com.trading.cld.util;

import com.trading.cld.api.Node;
import com.trading.cld.engine.ExecutionResult;
import com.trading.cld.engine.TopologicalOrder;
import com.trading.cld.graph.Edge;
import com.trading.cld.graph.Graph;
import com.trading.cld.graph.Port;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a diagram's evaluation order.
 *
 * <p>
 * Produces human-readable descriptions of the components the topology
 * analyzer found, which edges are resolved as back edges, and a Mermaid
 * rendering with each feedback loop drawn as its own subgraph.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and editor tooltips. Do
 * <b>not</b> call it inside node compute functions (allocates strings,
 * recomputes the topology).
 */
public final class GraphExplain {
    private final Graph graph;
    private final TopologicalOrder topology;

    public GraphExplain(Graph graph) {
        this.graph = graph;
        this.topology = TopologicalOrder.of(graph);
    }

    public TopologicalOrder topology() {
        return topology;
    }

    /**
     * True if {@code edge} is resolved from back-edge defaults under the
     * default topological order (source at or after destination).
     */
    public boolean isBackEdge(Edge edge) {
        return topology.topoIndex(edge.fromNodeId()) >= topology.topoIndex(edge.toNodeId());
    }

    /** Dumps one node: position, component, ports and incoming edges. */
    public String explainNode(String nodeId) {
        int idx = topology.topoIndex(nodeId);
        Node<?> node = graph.node(nodeId);
        int component = topology.componentOf(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Order index: ").append(idx).append('\n')
                .append("  Component: ").append(component)
                .append(topology.isCyclic(component) ? " (cyclic)" : "").append('\n')
                .append("  Inputs: ").append(portIds(node.inputs())).append('\n')
                .append("  Outputs: ").append(portIds(node.outputs())).append('\n');
        List<Edge> incoming = graph.edgesInto(nodeId);
        sb.append("  Incoming (").append(incoming.size()).append("):");
        for (Edge e : incoming) {
            sb.append("\n    ").append(e.fromNodeId()).append('.').append(e.fromPortId())
                    .append(" -> ").append(e.toPortId())
                    .append(isBackEdge(e) ? " [back]" : " [forward]");
        }
        return sb.append('\n').toString();
    }

    /** Dumps the evaluation order grouped by component. */
    public String dumpOrder() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Order (").append(topology.nodeCount()).append(" nodes, ")
                .append(topology.componentCount()).append(" components):\n");
        List<List<String>> components = topology.components();
        for (int c = 0; c < components.size(); c++) {
            sb.append("  #").append(c).append(topology.isCyclic(c) ? " loop " : " ")
                    .append(components.get(c)).append('\n');
        }
        return sb.toString();
    }

    /** Mermaid flowchart of the diagram; back edges are dotted. */
    public String toMermaid() {
        return toMermaid(null);
    }

    /**
     * Mermaid flowchart of the diagram. If {@code result} is given, each node
     * is labelled with its numeric outputs from the last iteration.
     */
    public String toMermaid(ExecutionResult result) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Nodes, one subgraph per feedback loop
        List<List<String>> components = topology.components();
        for (int c = 0; c < components.size(); c++) {
            boolean loop = topology.isCyclic(c);
            String indent = loop ? "    " : "  ";
            if (loop)
                sb.append("  subgraph loop").append(c).append(";\n");
            for (String nodeId : components.get(c)) {
                sb.append(indent).append(sanitize(nodeId)).append("[\"").append(nodeId);
                if (result != null)
                    appendValues(sb, result.outputsOf(nodeId));
                sb.append("\"];\n");
            }
            if (loop)
                sb.append("  end;\n");
        }

        // 2. Edges
        for (Edge e : graph.edges()) {
            if (!topology.contains(e.fromNodeId()) || !topology.contains(e.toNodeId()))
                continue;
            sb.append("  ").append(sanitize(e.fromNodeId()))
                    .append(isBackEdge(e) ? " -.-> " : " --> ")
                    .append(sanitize(e.toNodeId())).append(";\n");
        }
        return sb.toString();
    }

    private static void appendValues(StringBuilder sb, Map<String, Object> record) {
        for (Map.Entry<String, Object> field : record.entrySet()) {
            if (field.getValue() instanceof Number num)
                sb.append("<br/>").append(field.getKey()).append('=')
                        .append(String.format(Locale.ROOT, "%.4f", num.doubleValue()));
        }
    }

    private static String portIds(List<Port> ports) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < ports.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(ports.get(i).id());
        }
        return sb.append(']').toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
