package io.github.jakubt4.starfix.engine;

import java.time.Duration;

/**
 * Soft time budget handed to the engine. The engine is expected to poll {@link #shouldStop()}
 * during its search and return early when it flips; nothing preempts it.
 */
public final class SolveBudget {

    /**
     * Longest budget representable against {@link System#nanoTime()}; longer requests are capped.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final long deadlineNanos;
    private final CancellationToken token;

    private SolveBudget(final long deadlineNanos, final CancellationToken token) {
        this.deadlineNanos = deadlineNanos;
        this.token = token;
    }

    /**
     * Budget expiring {@code timeout} from now.
     */
    public static SolveBudget startingNow(final Duration timeout, final CancellationToken token) {
        return new SolveBudget(System.nanoTime() + capped(timeout).toNanos(), token);
    }

    /**
     * @return {@code timeout}, or {@link #MAX_TIMEOUT} if it is longer
     */
    public static Duration capped(final Duration timeout) {
        return timeout.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : timeout;
    }

    public Duration remaining() {
        final var left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean shouldStop() {
        return isCancelled() || isExpired();
    }

    public CancellationToken token() {
        return token;
    }
}
