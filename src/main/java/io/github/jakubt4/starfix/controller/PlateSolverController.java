package io.github.jakubt4.starfix.controller;

import io.github.jakubt4.starfix.dto.CancelResponse;
import io.github.jakubt4.starfix.dto.ErrorResponse;
import io.github.jakubt4.starfix.dto.SolveRequest;
import io.github.jakubt4.starfix.dto.SolveResult;
import io.github.jakubt4.starfix.dto.TransformRequest;
import io.github.jakubt4.starfix.dto.TransformResponse;
import io.github.jakubt4.starfix.service.CallDeadline;
import io.github.jakubt4.starfix.service.EngineFaultException;
import io.github.jakubt4.starfix.service.PlateSolverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * RPC surface of the plate solver.
 *
 * <p>{@code POST /api/solver/solve-from-centroids} answers {@code 200 OK} for every solving
 * outcome, failures included; clients check {@code failureReason}. Only an engine fault becomes
 * a {@code 500}. An optional {@value #TIMEOUT_HEADER} header bounds the whole call.
 */
@Slf4j
@RestController
@RequestMapping("/api/solver")
@RequiredArgsConstructor
public class PlateSolverController {

    public static final String TIMEOUT_HEADER = "X-Request-Timeout";

    private final PlateSolverService plateSolverService;

    @PostMapping("/solve-from-centroids")
    public ResponseEntity<SolveResult> solveFromCentroids(
            @RequestBody final SolveRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) final String timeout) {
        final var deadline = CallDeadline.fromTimeoutHeader(timeout);
        return ResponseEntity.ok(plateSolverService.solveFromCentroids(request, deadline));
    }

    @PostMapping("/transform-coordinates")
    public ResponseEntity<TransformResponse> transformCoordinates(@RequestBody final TransformRequest request) {
        return ResponseEntity.ok(plateSolverService.transformCoordinates(request));
    }

    @PostMapping("/cancel")
    public ResponseEntity<CancelResponse> cancel() {
        return ResponseEntity.ok(new CancelResponse(plateSolverService.cancel()));
    }

    @ExceptionHandler(EngineFaultException.class)
    public ResponseEntity<ErrorResponse> handleEngineFault(final EngineFaultException e) {
        log.error("[ENGINE] Fault — {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.failure().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(final IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("REJECTED", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(final HttpMessageNotReadableException e) {
        final var cause = e.getMostSpecificCause();
        log.warn("Unreadable request body: {}", cause.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("REJECTED", "Malformed request: " + cause.getMessage()));
    }
}
