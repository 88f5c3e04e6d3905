package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.engine.CancellationToken;
import io.github.jakubt4.starfix.engine.EngineOutcome;
import io.github.jakubt4.starfix.engine.SolveBudget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs a solve through the {@link EngineGate} within the call's effective deadline.
 *
 * <p>The effective timeout is the smaller of the call deadline and the requested solve timeout,
 * or the fallback when neither is known. The same budget bounds the wait for the gate and is
 * handed to the engine, which is trusted to return once it expires. A call whose budget runs out
 * in the queue never reaches the engine.
 */
@Slf4j
@Component
public class TimeoutGovernor {

    private final EngineGate gate;
    private final Duration fallbackTimeout;

    public TimeoutGovernor(final EngineGate gate,
                           @Value("${starfix.solver.fallback-timeout:1s}") final Duration fallbackTimeout) {
        this.gate = gate;
        this.fallbackTimeout = fallbackTimeout;
    }

    Duration effectiveTimeout(final CallDeadline callDeadline, final Optional<Duration> requested) {
        final var remaining = callDeadline.remaining();
        if (remaining.isPresent() && requested.isPresent()) {
            return SolveBudget.capped(remaining.get().compareTo(requested.get()) <= 0 ? remaining.get() : requested.get());
        }
        return SolveBudget.capped(remaining.or(() -> requested).orElse(fallbackTimeout));
    }

    /**
     * @throws EngineFaultException if the engine throws
     */
    public GovernedSolve solve(final SolveParameters parameters, final CallDeadline callDeadline) {
        final var timeout = effectiveTimeout(callDeadline, parameters.options().solveTimeout());
        final var budget = SolveBudget.startingNow(timeout, new CancellationToken());
        final var queuedAt = System.nanoTime();

        final Optional<EngineGate.Permit> permit;
        try {
            permit = gate.tryAcquire(budget.remaining());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[GATE] Interrupted while waiting for the engine");
            return GovernedSolve.notStarted(since(queuedAt), timeout, true);
        }
        if (permit.isEmpty()) {
            log.warn("[GATE] Deadline of {} ms expired while queued for the engine", timeout.toMillis());
            return GovernedSolve.notStarted(since(queuedAt), timeout, false);
        }

        try (var held = permit.get()) {
            if (budget.isExpired()) {
                log.warn("[GATE] Deadline of {} ms expired on acquiring the engine", timeout.toMillis());
                return GovernedSolve.notStarted(since(queuedAt), timeout, false);
            }
            log.debug("[GATE] Engine acquired after {} ms, budget left {} ms",
                    since(queuedAt).toMillis(), budget.remaining().toMillis());

            final var startedAt = System.nanoTime();
            final EngineOutcome outcome;
            try {
                outcome = held.solve(parameters, budget);
            } catch (final RuntimeException e) {
                throw new EngineFaultException("Engine failed during solve: " + e.getMessage(), e);
            }
            final var solveTime = since(startedAt);

            if (outcome != null && outcome.engineSolveMillis() != null) {
                log.debug("[GATE] Engine reported {} ms, measured {} ms", outcome.engineSolveMillis(), solveTime.toMillis());
            }
            return GovernedSolve.completed(outcome, solveTime, timeout, budget.isExpired(), budget.isCancelled());
        }
    }

    /**
     * Cancels the solve currently executing, if any.
     *
     * @return {@code true} if a solve was in flight
     */
    public boolean cancel() {
        return gate.cancelInFlight();
    }

    private static Duration since(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
