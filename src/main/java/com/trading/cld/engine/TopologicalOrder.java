package com.trading.cld.engine;

import com.trading.cld.graph.Edge;
import com.trading.cld.graph.Graph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluation order for a possibly cyclic graph.
 *
 * A plain topological sort rejects cycles. Causal loop diagrams are made of
 * cycles, so instead the graph is condensed into its strongly connected
 * components (SCCs), the component graph (which is always acyclic) is sorted,
 * and the components are flattened back into a node order.
 *
 * Guarantees:
 * - If there is a path from X to Y and no path back, X precedes Y.
 * - Members of one SCC are contiguous. Inside an SCC the order is the order in
 * which the depth-first search first reached each member. It is stable for an
 * unmodified graph but callers should not rely on anything more.
 *
 * Algorithm:
 * 1. Tarjan's SCC algorithm over successors(n) = { e.to | e.from = n }. Roots
 * are tried in node insertion order, successors in edge order. The search uses
 * explicit int stacks instead of recursion, so long chains do not overflow the
 * thread stack.
 * 2. Condense: one vertex per SCC, an edge between two distinct SCCs whenever
 * an original edge crosses them. Intra-SCC edges and self-loops are dropped.
 * 3. Kahn's algorithm over the component graph. The FIFO frontier is seeded
 * with the in-degree zero components in discovery order.
 * 4. Flatten the components in emission order.
 *
 * Edges naming unknown nodes are ignored here; {@link Graph#validate()} is
 * where they are reported.
 */
@Log4j2
public final class TopologicalOrder {
    // Node ids in evaluation order.
    private final String[] order;

    // Lookup map for id resolution.
    private final Map<String, Integer> idToIndex;

    // Components in emission order, members in evaluation order.
    private final List<List<String>> components;

    // componentOfIndex[i] is the component of the node at evaluation index i.
    private final int[] componentOfIndex;

    // cyclic[c] is true if component c has more than one member or a self-loop.
    private final boolean[] cyclic;

    private TopologicalOrder(String[] order, Map<String, Integer> idToIndex, List<List<String>> components,
            int[] componentOfIndex, boolean[] cyclic) {
        this.order = order;
        this.idToIndex = idToIndex;
        this.components = components;
        this.componentOfIndex = componentOfIndex;
        this.cyclic = cyclic;
    }

    /**
     * Computes the order for {@code graph}. The graph is not modified.
     */
    public static TopologicalOrder of(Graph graph) {
        final int n = graph.nodeCount();
        String[] ids = graph.nodes().keySet().toArray(new String[0]);
        Map<String, Integer> insertionIndex = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            insertionIndex.put(ids[i], i);

        // 1. Successor lists in edge order
        List<List<Integer>> successors = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            successors.add(new ArrayList<>());
        boolean[] selfLoop = new boolean[n];
        for (Edge e : graph.edges()) {
            Integer from = insertionIndex.get(e.fromNodeId());
            Integer to = insertionIndex.get(e.toNodeId());
            if (from == null || to == null)
                continue;
            successors.get(from).add(to);
            if (from.equals(to))
                selfLoop[from] = true;
        }

        // 2. Strongly connected components in discovery order
        List<int[]> sccs = findComponents(n, successors);
        int k = sccs.size();
        int[] componentOf = new int[n];
        for (int c = 0; c < k; c++)
            for (int member : sccs.get(c))
                componentOf[member] = c;

        // 3. Condensed graph, duplicates collapsed, intra-component edges dropped
        List<Set<Integer>> componentSuccessors = new ArrayList<>(k);
        for (int c = 0; c < k; c++)
            componentSuccessors.add(new LinkedHashSet<>());
        for (int from = 0; from < n; from++)
            for (int to : successors.get(from))
                if (componentOf[from] != componentOf[to])
                    componentSuccessors.get(componentOf[from]).add(componentOf[to]);

        int[] componentOrder = sortComponents(componentSuccessors);

        // 4. Flatten
        String[] flat = new String[n];
        Map<String, Integer> idToIndex = new HashMap<>(n * 2);
        int[] componentOfIndex = new int[n];
        boolean[] cyclic = new boolean[k];
        List<List<String>> components = new ArrayList<>(k);
        int ti = 0;
        for (int pos = 0; pos < k; pos++) {
            int[] members = sccs.get(componentOrder[pos]);
            List<String> memberIds = new ArrayList<>(members.length);
            boolean loop = members.length > 1;
            for (int member : members) {
                flat[ti] = ids[member];
                idToIndex.put(ids[member], ti);
                componentOfIndex[ti] = pos;
                memberIds.add(ids[member]);
                loop |= selfLoop[member];
                ti++;
            }
            cyclic[pos] = loop;
            components.add(Collections.unmodifiableList(memberIds));
        }

        if (log.isTraceEnabled())
            log.trace("Computed order for {} nodes in {} components: {}", n, k, Arrays.toString(flat));

        return new TopologicalOrder(flat, idToIndex, Collections.unmodifiableList(components), componentOfIndex,
                cyclic);
    }

    /**
     * Iterative Tarjan. Each returned array lists one component's members in
     * ascending discovery index.
     */
    private static List<int[]> findComponents(int n, List<List<Integer>> successors) {
        int[] index = new int[n];
        int[] lowLink = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        // Tarjan's component stack
        int[] stack = new int[n];
        int sp = 0;

        // Explicit DFS call stack and per-node successor cursor
        int[] callStack = new int[n];
        int[] cursor = new int[n];
        int csp = 0;

        int counter = 0;
        List<int[]> result = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (index[root] != -1)
                continue;

            index[root] = lowLink[root] = counter++;
            stack[sp++] = root;
            onStack[root] = true;
            callStack[csp++] = root;

            while (csp > 0) {
                int v = callStack[csp - 1];
                List<Integer> succ = successors.get(v);
                if (cursor[v] < succ.size()) {
                    int w = succ.get(cursor[v]++);
                    if (index[w] == -1) {
                        // Descend
                        index[w] = lowLink[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callStack[csp++] = w;
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }

                // All successors of v explored
                csp--;
                if (lowLink[v] == index[v]) {
                    int start = sp;
                    do {
                        start--;
                        onStack[stack[start]] = false;
                    } while (stack[start] != v);
                    // The stack holds members in discovery order already
                    result.add(Arrays.copyOfRange(stack, start, sp));
                    sp = start;
                }
                if (csp > 0) {
                    int parent = callStack[csp - 1];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
            }
        }
        return result;
    }

    /** Kahn's algorithm over the condensed graph. */
    private static int[] sortComponents(List<Set<Integer>> componentSuccessors) {
        int k = componentSuccessors.size();
        int[] inDegree = new int[k];
        for (Set<Integer> succ : componentSuccessors)
            for (int c : succ)
                inDegree[c]++;

        Deque<Integer> queue = new ArrayDeque<>();
        for (int c = 0; c < k; c++)
            if (inDegree[c] == 0)
                queue.add(c);

        int[] emitted = new int[k];
        int count = 0;
        while (!queue.isEmpty()) {
            int c = queue.poll();
            emitted[count++] = c;
            for (int next : componentSuccessors.get(c))
                if (--inDegree[next] == 0)
                    queue.add(next);
        }
        if (count != k)
            throw new IllegalStateException("Component graph is not acyclic! Emitted " + count + " of " + k);
        return emitted;
    }

    public int nodeCount() {
        return order.length;
    }

    /** @return Unmodifiable list of node ids in evaluation order. */
    public List<String> nodeIds() {
        return Collections.unmodifiableList(Arrays.asList(order));
    }

    /** Returns the node id at the given evaluation index. */
    public String nodeId(int ti) {
        return order[ti];
    }

    /** Resolves a node id to its evaluation index. O(1) hash lookup. */
    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public boolean contains(String id) {
        return idToIndex.containsKey(id);
    }

    /** @return Components in evaluation order; each list is unmodifiable. */
    public List<List<String>> components() {
        return components;
    }

    public int componentCount() {
        return components.size();
    }

    /** @return Position of the node's component in {@link #components()}. */
    public int componentOf(String id) {
        return componentOfIndex[topoIndex(id)];
    }

    /** True if the component is a real cycle: several members, or one member with a self-loop. */
    public boolean isCyclic(int component) {
        return cyclic[component];
    }
}
