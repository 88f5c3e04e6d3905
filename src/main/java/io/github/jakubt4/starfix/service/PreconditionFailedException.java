package io.github.jakubt4.starfix.service;

/**
 * Raised by {@link RequestNormalizer} when a request cannot be handed to the engine.
 */
public class PreconditionFailedException extends RuntimeException {

    public PreconditionFailedException(final String message) {
        super(message);
    }
}
