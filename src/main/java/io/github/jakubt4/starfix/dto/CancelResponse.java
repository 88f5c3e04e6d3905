package io.github.jakubt4.starfix.dto;

/**
 * @param cancelled {@code true} if a solve was in flight when the cancel arrived
 */
public record CancelResponse(boolean cancelled) {
}
