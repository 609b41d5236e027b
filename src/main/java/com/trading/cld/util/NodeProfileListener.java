package com.trading.cld.util;

import com.trading.cld.api.ExecutionListener;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates compute timings per node to identify slow nodes in a diagram. */
public class NodeProfileListener implements ExecutionListener {

    public static class NodeStats {
        public final String nodeId;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        public NodeStats(String nodeId) {
            this.nodeId = nodeId;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Keyed by node id; evaluation positions can change between runs.
    private final Map<String, NodeStats> stats = new LinkedHashMap<>();
    private long runs;
    private long iterations;

    /** @return Stats for one node, or null if it never ran. */
    public NodeStats stats(String nodeId) {
        return stats.get(nodeId);
    }

    public long runs() {
        return runs;
    }

    public long iterations() {
        return iterations;
    }

    @Override
    public void onExecutionStart(int nodeCount) {
        runs++;
    }

    @Override
    public void onIterationStart(int iteration) {
        iterations++;
    }

    @Override
    public void onNodeComputed(int iteration, int orderIndex, String nodeId, long durationNanos) {
        stats.computeIfAbsent(nodeId, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onNodeError(int iteration, int orderIndex, String nodeId, Throwable error) {
        stats.computeIfAbsent(nodeId, NodeStats::new).errors++;
    }

    @Override
    public void onIterationEnd(int iteration, boolean continuing) {
        // No-op
    }

    @Override
    public void onExecutionEnd(int iterations) {
        // No-op
    }

    /** Resets all collected statistics. */
    public void reset() {
        stats.clear();
        runs = 0;
        iterations = 0;
    }

    /** Returns a formatted table of node statistics, slowest total first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %8s | %10s | %10s | %10s%n", "Node", "Count", "Errors",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-------------------------------------------------------------------------------------------\n");

        List<NodeStats> sorted = new ArrayList<>(stats.values());
        sorted.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : sorted) {
            sb.append(String.format("%-30s | %10d | %8d | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.nodeId, 30),
                    s.count,
                    s.errors,
                    s.avgMicros(),
                    s.count == 0 ? 0.0 : s.minDurationNanos / 1000.0,
                    s.count == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
