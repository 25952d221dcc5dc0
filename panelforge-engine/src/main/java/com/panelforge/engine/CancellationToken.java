package com.panelforge.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and the panel workers. Workers check it
 * between pipeline stages.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    /** True after {@link #cancel()} or when the current thread has been interrupted. */
    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new PromotionCancelledException("Promotion run cancelled");
        }
    }
}
