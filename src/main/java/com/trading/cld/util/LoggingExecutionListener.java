package com.trading.cld.util;

import com.trading.cld.api.ExecutionListener;

import lombok.extern.log4j.Log4j2;

/**
 * Writes execution progress to Log4j. Iteration boundaries go to DEBUG, node
 * timings to TRACE and node failures to ERROR.
 */
@Log4j2
public final class LoggingExecutionListener implements ExecutionListener {
    private long runStartNanos;

    @Override
    public void onExecutionStart(int nodeCount) {
        runStartNanos = System.nanoTime();
        log.debug("Execution started over {} nodes", nodeCount);
    }

    @Override
    public void onIterationStart(int iteration) {
        log.debug("Iteration {} started", iteration);
    }

    @Override
    public void onNodeComputed(int iteration, int orderIndex, String nodeId, long durationNanos) {
        log.trace("Iteration {}: [{}] {} computed in {} ns", iteration, orderIndex, nodeId, durationNanos);
    }

    @Override
    public void onNodeError(int iteration, int orderIndex, String nodeId, Throwable error) {
        log.error("Iteration {}: node '{}' at position {} failed: {}", iteration, nodeId, orderIndex,
                error.getMessage(), error);
    }

    @Override
    public void onIterationEnd(int iteration, boolean continuing) {
        log.debug("Iteration {} finished, {}", iteration, continuing ? "continuing" : "stopping");
    }

    @Override
    public void onExecutionEnd(int iterations) {
        log.debug("Execution finished after {} iteration(s) in {} us", iterations,
                (System.nanoTime() - runStartNanos) / 1000);
    }
}
