package com.codesmith.orchestrator.model;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative per-job cancellation signal.
 *
 * Cancelling never interrupts a thread. Workers check the token before each
 * external call, and blocking waits race against {@link #whenCancelled()}.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    /** @return true if this call cancelled the token, false if it was already cancelled */
    public boolean cancel() {
        return signal.complete(null);
    }

    public boolean isCancellationRequested() {
        return signal.isDone();
    }

    /** Completes when the token is cancelled. Callers cannot complete it themselves. */
    public CompletableFuture<Void> whenCancelled() {
        return signal.copy();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new JobCancelledException();
        }
    }
}
