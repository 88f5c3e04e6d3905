package io.github.jakubt4.starfix.dto;

import java.time.Duration;

/**
 * Elapsed or budgeted time split into whole seconds and a nanosecond remainder.
 *
 * @param seconds whole seconds
 * @param nanos   remainder, {@code 0..999_999_999}
 */
public record WireDuration(long seconds, int nanos) {

    public WireDuration {
        if (nanos < 0 || nanos > 999_999_999) {
            throw new IllegalArgumentException("nanos out of range: " + nanos);
        }
    }

    public static WireDuration of(final Duration duration) {
        return new WireDuration(duration.getSeconds(), duration.getNano());
    }

    public Duration toDuration() {
        return Duration.ofSeconds(seconds, nanos);
    }
}
