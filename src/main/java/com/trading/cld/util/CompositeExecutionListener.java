package com.trading.cld.util;

import com.trading.cld.api.ExecutionListener;
import java.util.Arrays;

/**
 * Fans callbacks out to several {@link ExecutionListener} instances, in
 * registration order, without allocating on the evaluation loop.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private ExecutionListener[] listeners = new ExecutionListener[0];

    public CompositeExecutionListener add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onExecutionStart(int nodeCount) {
        for (ExecutionListener l : listeners)
            l.onExecutionStart(nodeCount);
    }

    @Override
    public void onIterationStart(int iteration) {
        for (ExecutionListener l : listeners)
            l.onIterationStart(iteration);
    }

    @Override
    public void onNodeComputed(int iteration, int orderIndex, String nodeId, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeComputed(iteration, orderIndex, nodeId, durationNanos);
    }

    @Override
    public void onNodeError(int iteration, int orderIndex, String nodeId, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onNodeError(iteration, orderIndex, nodeId, error);
    }

    @Override
    public void onIterationEnd(int iteration, boolean continuing) {
        for (ExecutionListener l : listeners)
            l.onIterationEnd(iteration, continuing);
    }

    @Override
    public void onExecutionEnd(int iterations) {
        for (ExecutionListener l : listeners)
            l.onExecutionEnd(iterations);
    }
}
