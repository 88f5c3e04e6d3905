package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.SolveStatus;

/**
 * Why a solve produced no orientation. All members except {@link #ENGINE_FAULT} are reported
 * inside a normal {@link io.github.jakubt4.starfix.dto.SolveResult}.
 */
public enum SolveFailure {

    PRECONDITION_FAILED(SolveStatus.TOO_FEW),
    DEADLINE_EXCEEDED(SolveStatus.TIMEOUT),
    NO_SOLUTION(SolveStatus.NO_MATCH),
    CANCELLED(SolveStatus.CANCELLED),
    ENGINE_FAULT(null);

    private final SolveStatus status;

    SolveFailure(final SolveStatus status) {
        this.status = status;
    }

    public SolveStatus status() {
        return status;
    }
}
