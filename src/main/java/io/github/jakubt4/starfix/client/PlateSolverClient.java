package io.github.jakubt4.starfix.client;

import io.github.jakubt4.starfix.dto.CancelResponse;
import io.github.jakubt4.starfix.dto.SolveRequest;
import io.github.jakubt4.starfix.dto.SolveResult;
import io.github.jakubt4.starfix.dto.SolveStatus;
import io.github.jakubt4.starfix.dto.WireDuration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Client for a remote Starfix server, for callers that want a {@link PlateSolution} or an
 * exception rather than a raw {@link SolveResult}.
 *
 * <p>Connection failures are retried with growing backoff, which covers a server that is still
 * loading its pattern database. HTTP errors and non-matching results reach the caller as they
 * are. Requests without a solve timeout get the configured default.
 */
@Slf4j
@Service
public class PlateSolverClient {

    private static final String SOLVE_PATH = "/api/solver/solve-from-centroids";
    private static final String CANCEL_PATH = "/api/solver/cancel";

    private final RestClient restClient;
    private final Duration defaultSolveTimeout;

    public PlateSolverClient(final RestClient.Builder restClientBuilder,
                             @Value("${starfix.client.base-url}") final String baseUrl,
                             @Value("${starfix.client.default-solve-timeout:5s}") final Duration defaultSolveTimeout) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.defaultSolveTimeout = defaultSolveTimeout;
    }

    /**
     * @throws SolveFailedException    if the server answers with anything but {@link SolveStatus#MATCH_FOUND},
     *                                 or stays unreachable through every retry
     * @throws HttpStatusCodeException if the server answers with an HTTP error, e.g. an engine fault
     */
    @Retryable(retryFor = ResourceAccessException.class,
               notRecoverable = {SolveFailedException.class, HttpStatusCodeException.class},
               maxAttemptsExpression = "${starfix.client.retry.max-attempts:10}",
               backoff = @Backoff(delayExpression = "${starfix.client.retry.delay:100}",
                                  multiplierExpression = "${starfix.client.retry.multiplier:1.5}",
                                  maxDelayExpression = "${starfix.client.retry.max-delay:5000}"))
    public PlateSolution solve(final SolveRequest request) {
        final var outbound = request.solveTimeout() == null
                ? request.withSolveTimeout(WireDuration.of(defaultSolveTimeout))
                : request;

        final var result = restClient.post()
                .uri(SOLVE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(outbound)
                .retrieve()
                .body(SolveResult.class);

        if (result == null) {
            throw new SolveFailedException(null, "Plate solver returned an empty response");
        }
        if (result.status() != SolveStatus.MATCH_FOUND) {
            throw new SolveFailedException(result.status(),
                    "Plate solver returned status " + result.status() + ": " + result.failureReason());
        }
        return PlateSolution.from(result);
    }

    @Recover
    public PlateSolution recoverSolve(final RestClientException e, final SolveRequest request) {
        log.warn("Plate solver call failed after retries: {}", e.getMessage());
        throw new SolveFailedException(null, "Plate solver unreachable: " + e.getMessage(), e);
    }

    /**
     * Cancels whatever solve the server is running.
     *
     * @return {@code true} if the server had a solve in flight
     */
    public boolean cancel() {
        final var response = restClient.post()
                .uri(CANCEL_PATH)
                .retrieve()
                .body(CancelResponse.class);
        return response != null && response.cancelled();
    }
}
