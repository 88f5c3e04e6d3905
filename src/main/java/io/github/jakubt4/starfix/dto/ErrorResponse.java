package io.github.jakubt4.starfix.dto;

/**
 * Body returned for call-level failures.
 *
 * @param status  {@code "REJECTED"} for malformed requests, {@code "ENGINE_FAULT"} for engine errors
 * @param message human-readable detail
 */
public record ErrorResponse(String status, String message) {
}
