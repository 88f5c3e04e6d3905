package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.engine.CancellationToken;
import io.github.jakubt4.starfix.engine.EngineOutcome;
import io.github.jakubt4.starfix.engine.SolveBudget;
import io.github.jakubt4.starfix.engine.SolverEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the shared {@link SolverEngine}. The engine is reachable only through a
 * {@link Permit}, and at most one permit exists at a time, so at most one solve runs in the
 * process. Waiters are served in arrival order.
 */
@Slf4j
@Component
public class EngineGate {

    private final SolverEngine engine;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Object inFlightMonitor = new Object();
    private CancellationToken inFlight;

    public EngineGate(final SolverEngine engine) {
        this.engine = engine;
    }

    /**
     * Waits up to {@code maxWait} for the gate.
     *
     * @return the permit, or empty if the wait ran out
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<Permit> tryAcquire(final Duration maxWait) throws InterruptedException {
        if (!lock.tryLock(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
            return Optional.empty();
        }
        return Optional.of(new Permit());
    }

    /**
     * Cancels the solve currently running inside the gate, if any. Queued callers are unaffected.
     *
     * @return {@code true} if a solve was in flight
     */
    public boolean cancelInFlight() {
        synchronized (inFlightMonitor) {
            if (inFlight == null) {
                return false;
            }
            if (inFlight.cancel()) {
                engine.cancel();
                log.info("[GATE] Cancellation forwarded to in-flight solve");
            }
            return true;
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    /**
     * Exclusive access to the engine. Must be closed by the thread that acquired it.
     */
    public final class Permit implements AutoCloseable {

        private boolean closed;

        private Permit() {
        }

        public EngineOutcome solve(final SolveParameters parameters, final SolveBudget budget) {
            if (closed) {
                throw new IllegalStateException("Permit already released");
            }
            synchronized (inFlightMonitor) {
                inFlight = budget.token();
            }
            try {
                return engine.solve(parameters.centroids(), parameters.imageSize(), parameters.options(), budget);
            } finally {
                synchronized (inFlightMonitor) {
                    inFlight = null;
                }
            }
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.unlock();
            }
        }
    }
}
