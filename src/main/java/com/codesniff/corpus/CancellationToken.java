package com.codesniff.corpus;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for an indexing run, checked between embedding batches.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
