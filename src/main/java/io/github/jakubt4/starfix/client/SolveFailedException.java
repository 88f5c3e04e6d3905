package io.github.jakubt4.starfix.client;

import io.github.jakubt4.starfix.dto.SolveStatus;

/**
 * A remote solve did not produce a plate solution.
 */
public class SolveFailedException extends RuntimeException {

    private final SolveStatus status;

    public SolveFailedException(final SolveStatus status, final String message) {
        super(message);
        this.status = status;
    }

    public SolveFailedException(final SolveStatus status, final String message, final Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return the status the server reported, {@code null} if no result was received
     */
    public SolveStatus status() {
        return status;
    }
}
