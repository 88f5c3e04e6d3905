package io.github.jakubt4.starfix.service;

/**
 * The engine threw, or returned output that breaks the adapter contract. Surfaces as a
 * call-level error rather than a {@code failureReason}.
 */
public class EngineFaultException extends RuntimeException {

    public EngineFaultException(final String message) {
        super(message);
    }

    public EngineFaultException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SolveFailure failure() {
        return SolveFailure.ENGINE_FAULT;
    }
}
