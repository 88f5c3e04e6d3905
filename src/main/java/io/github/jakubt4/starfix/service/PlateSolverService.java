package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.SolveRequest;
import io.github.jakubt4.starfix.dto.SolveResult;
import io.github.jakubt4.starfix.dto.TransformRequest;
import io.github.jakubt4.starfix.dto.TransformResponse;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for the solver RPCs.
 *
 * <p>Solves go normalizer, governor, marshaler; every caller shares the one engine held by the
 * {@link EngineGate}. Transforms bypass the gate and run concurrently with everything else.
 * On context shutdown (SIGINT/SIGTERM included) the in-flight solve, if any, is cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlateSolverService {

    private final RequestNormalizer requestNormalizer;
    private final TimeoutGovernor timeoutGovernor;
    private final ResultMarshaler resultMarshaler;
    private final CoordinateTransformer coordinateTransformer;

    /**
     * Solves for the orientation that explains the request's centroids. Solving failures are
     * reported through {@link SolveResult#failureReason()}.
     *
     * @param request  wire request
     * @param deadline deadline attached to the call, {@link CallDeadline#none()} if unbounded
     * @throws EngineFaultException if the engine fails or returns output inconsistent with the request
     */
    public SolveResult solveFromCentroids(final SolveRequest request, final CallDeadline deadline) {
        final SolveParameters parameters;
        try {
            parameters = requestNormalizer.normalize(request);
        } catch (final PreconditionFailedException e) {
            log.warn("[SOLVE] Rejected — {}", e.getMessage());
            return resultMarshaler.rejected(e);
        }

        final var governed = timeoutGovernor.solve(parameters, deadline);
        final var result = resultMarshaler.marshal(parameters, governed);

        if (result.isSolved()) {
            log.info("[SOLVE] Match — ra={} deg, dec={} deg, roll={} deg, fov={} deg, matches={}, t={} ms",
                    String.format("%.4f", result.imageCenterCoords().ra()),
                    String.format("%.4f", result.imageCenterCoords().dec()),
                    result.roll(), result.fov(), result.matches(), governed.solveTime().toMillis());
        } else {
            log.info("[SOLVE] No solution — {} (status={}, t={} ms)",
                    result.failureReason(), result.status(), governed.solveTime().toMillis());
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if the request geometry is invalid
     */
    public TransformResponse transformCoordinates(final TransformRequest request) {
        return coordinateTransformer.transform(request);
    }

    /**
     * Cancels the solve currently running. Calls still waiting for the engine are not affected.
     *
     * @return {@code true} if a solve was in flight
     */
    public boolean cancel() {
        final var cancelled = timeoutGovernor.cancel();
        log.info("[SOLVE] Cancel requested — {}", cancelled ? "in-flight solve signalled" : "nothing in flight");
        return cancelled;
    }

    @PreDestroy
    void cancelOnShutdown() {
        if (timeoutGovernor.cancel()) {
            log.info("[SOLVE] Shutdown — in-flight solve cancelled");
        }
    }
}
