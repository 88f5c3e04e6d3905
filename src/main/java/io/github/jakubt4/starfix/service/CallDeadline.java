package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.engine.SolveBudget;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deadline the caller attached to the call itself, independent of the request body.
 *
 * <p>Parsed from a timeout header in gRPC {@code TimeoutValue} form: up to eight digits followed
 * by a unit, {@code H} hours, {@code M} minutes, {@code S} seconds, {@code m} millis,
 * {@code u} micros or {@code n} nanos, e.g. {@code 250m}.
 */
public final class CallDeadline {

    private static final Pattern TIMEOUT_VALUE = Pattern.compile("(\\d{1,8})([HMSmun])");
    private static final CallDeadline NONE = new CallDeadline(false, 0L);

    private final boolean bounded;
    private final long deadlineNanos;

    private CallDeadline(final boolean bounded, final long deadlineNanos) {
        this.bounded = bounded;
        this.deadlineNanos = deadlineNanos;
    }

    public static CallDeadline none() {
        return NONE;
    }

    public static CallDeadline after(final Duration timeout) {
        return new CallDeadline(true, System.nanoTime() + SolveBudget.capped(timeout).toNanos());
    }

    /**
     * @param header header value, {@code null} or blank for no deadline
     * @throws IllegalArgumentException if the value is not a valid timeout
     */
    public static CallDeadline fromTimeoutHeader(final String header) {
        if (header == null || header.isBlank()) {
            return NONE;
        }
        final var matcher = TIMEOUT_VALUE.matcher(header.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed timeout: " + header);
        }
        final var amount = Long.parseLong(matcher.group(1));
        final var unit = switch (matcher.group(2).charAt(0)) {
            case 'H' -> ChronoUnit.HOURS;
            case 'M' -> ChronoUnit.MINUTES;
            case 'S' -> ChronoUnit.SECONDS;
            case 'm' -> ChronoUnit.MILLIS;
            case 'u' -> ChronoUnit.MICROS;
            default -> ChronoUnit.NANOS;
        };
        return after(Duration.of(amount, unit));
    }

    /**
     * @return time left before the deadline, zero once it has passed, empty if the call is unbounded
     */
    public Optional<Duration> remaining() {
        if (!bounded) {
            return Optional.empty();
        }
        final var left = deadlineNanos - System.nanoTime();
        return Optional.of(left > 0 ? Duration.ofNanos(left) : Duration.ZERO);
    }
}
