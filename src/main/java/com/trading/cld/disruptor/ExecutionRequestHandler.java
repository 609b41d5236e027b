package com.trading.cld.disruptor;

import com.lmax.disruptor.EventHandler;
import com.trading.cld.engine.CldEngine;
import com.trading.cld.engine.ExecutionResult;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that runs queued execution requests.
 *
 * Runs on the single consumer thread, so runs never overlap and a stateful
 * strategy inside the engine is only ever touched by one thread.
 *
 * Failures are delivered through the request's future; the handler itself
 * never throws, which keeps the consumer thread alive for later requests.
 */
public final class ExecutionRequestHandler implements EventHandler<ExecutionRequestEvent> {
    private static final Logger log = LogManager.getLogger(ExecutionRequestHandler.class);

    private final CldEngine engine;
    private long completed;
    private long failed;

    public ExecutionRequestHandler(CldEngine engine) {
        this.engine = engine;
    }

    @Override
    public void onEvent(ExecutionRequestEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<ExecutionResult> future = event.future();
        try {
            if (future == null) {
                log.error("Received execution request without a future at sequence {}", sequence);
                return;
            }
            ExecutionResult result = engine.execute(event.graph(), event.initialState());
            completed++;
            future.complete(result);
        } catch (Throwable t) {
            // Errors included: an escaping throwable would halt the consumer thread
            failed++;
            log.error("Execution request {} failed: {}", sequence, t.getMessage(), t);
            future.completeExceptionally(t);
        } finally {
            event.clear();
        }
    }

    /** Runs completed; read from the consumer thread or after shutdown. */
    public long completed() {
        return completed;
    }

    /** Runs failed; read from the consumer thread or after shutdown. */
    public long failed() {
        return failed;
    }
}
