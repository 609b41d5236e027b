package com.trading.cld.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.cld.engine.CldEngine;
import com.trading.cld.engine.ExecutionResult;
import com.trading.cld.graph.Graph;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Asynchronous front end for a {@link CldEngine}.
 *
 * Callers on any thread submit graphs; requests are published to an LMAX
 * Disruptor ring buffer and executed one at a time by a single daemon consumer
 * thread. Each submit returns a future that completes with the run's result or
 * fails with the engine's exception.
 *
 * This is a scheduling convenience only: nodes are still evaluated
 * sequentially, and a full ring buffer makes submit block until a slot frees.
 */
public final class AsyncExecutionService implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(AsyncExecutionService.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<ExecutionRequestEvent> disruptor;
    private final RingBuffer<ExecutionRequestEvent> ringBuffer;
    private final ExecutionRequestHandler handler;
    // Producers publish under the read lock; close() takes the write lock so no
    // request can be published after shutdown has drained the buffer.
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private boolean closed;

    public AsyncExecutionService(CldEngine engine) {
        this(engine, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param engine     Engine used for every request.
     * @param bufferSize Ring buffer size, a power of two.
     * @throws IllegalArgumentException if bufferSize is not a positive power of two.
     */
    public AsyncExecutionService(CldEngine engine, int bufferSize) {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2, got " + bufferSize);

        this.handler = new ExecutionRequestHandler(engine);
        this.disruptor = new Disruptor<>(
                ExecutionRequestEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.debug("Async execution service started (bufferSize={}, strategy={})", bufferSize, engine.strategy());
    }

    public CompletableFuture<ExecutionResult> submit(Graph graph) {
        return submit(graph, null);
    }

    /**
     * Queues one run.
     *
     * @throws IllegalStateException if the service has been closed.
     */
    public CompletableFuture<ExecutionResult> submit(Graph graph, Map<String, ?> initialState) {
        CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
        lifecycle.readLock().lock();
        try {
            if (closed)
                throw new IllegalStateException("AsyncExecutionService is closed");

            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).set(graph, initialState, future);
            } finally {
                ringBuffer.publish(sequence);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
        return future;
    }

    public ExecutionRequestHandler handler() {
        return handler;
    }

    /**
     * Stops accepting requests, waits for queued ones to finish, then halts the
     * consumer thread.
     */
    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed)
                return;
            closed = true;
            disruptor.shutdown();
        } finally {
            lifecycle.writeLock().unlock();
        }
        log.debug("Async execution service stopped ({} completed, {} failed)", handler.completed(),
                handler.failed());
    }
}
