package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.engine.EngineOutcome;

import java.time.Duration;

/**
 * What happened to one solve under the {@link TimeoutGovernor}.
 *
 * @param outcome          engine output; {@code null} when the engine was never started
 * @param solveTime        wall-clock time around the engine call, or time spent waiting for the
 *                         gate when the engine was never started
 * @param effectiveTimeout budget the call was given
 * @param started          whether the engine was invoked
 * @param deadlineExpired  whether the budget had run out by the time the call returned
 * @param cancelled        whether the call was cancelled
 */
public record GovernedSolve(EngineOutcome outcome,
                            Duration solveTime,
                            Duration effectiveTimeout,
                            boolean started,
                            boolean deadlineExpired,
                            boolean cancelled) {

    static GovernedSolve notStarted(final Duration waited, final Duration effectiveTimeout, final boolean cancelled) {
        return new GovernedSolve(null, waited, effectiveTimeout, false, !cancelled, cancelled);
    }

    static GovernedSolve completed(final EngineOutcome outcome, final Duration solveTime,
                                   final Duration effectiveTimeout, final boolean deadlineExpired,
                                   final boolean cancelled) {
        return new GovernedSolve(outcome, solveTime, effectiveTimeout, true, deadlineExpired, cancelled);
    }
}
