package io.github.jakubt4.starfix.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag scoped to a single solve. Safe to trigger from any thread.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return {@code true} if this call moved the token to the cancelled state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
