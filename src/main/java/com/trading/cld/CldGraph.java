package com.trading.cld;

import com.trading.cld.api.ExecutionStrategy;
import com.trading.cld.dsl.GraphBuilder;
import com.trading.cld.engine.CldEngine;

/**
 * CLD Engine -- headless execution engine for causal loop diagrams.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> are computations with declared input and output ports and a
 * private state slot.</li>
 * <li><b>Edges</b> carry numeric values from an output port to an input port.
 * Cycles are allowed; they are what makes a diagram causal.</li>
 * <li><b>Strategies</b> decide the evaluation order, how many passes run, and
 * what a feedback edge reads before its source has run.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Deterministic:</b> the same graph and initial state always produce the
 * same result.</li>
 * <li><b>Value graphs:</b> graphs are immutable, so a host editor can keep and
 * re-run earlier versions.</li>
 * <li><b>Disruptor Ready:</b> runs can be queued onto a single consumer thread,
 * see {@link com.trading.cld.disruptor.AsyncExecutionService}.</li>
 * </ul>
 */
public final class CldGraph {

    private CldGraph() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new graph builder.
     *
     * @param graphName A descriptive name for the diagram.
     * @return A new {@link GraphBuilder} instance.
     */
    public static GraphBuilder builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /** Creates an engine bound to {@code strategy}. */
    public static CldEngine engine(ExecutionStrategy strategy) {
        return new CldEngine(strategy);
    }
}
