package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.dto.SolveRequest;
import io.github.jakubt4.starfix.dto.WireDuration;
import io.github.jakubt4.starfix.engine.ImageSize;
import io.github.jakubt4.starfix.engine.PixelPosition;
import io.github.jakubt4.starfix.engine.SolveOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns a wire {@link SolveRequest} into {@link SolveParameters}.
 *
 * <p>Fields with a service-side default ({@code matchRadius}, {@code matchThreshold},
 * {@code patternCheckingStars} and the {@code return*} flags) are filled in. The rest stay
 * empty when the client omitted them so the engine applies its own default; an explicit zero
 * is passed through as zero. Empty target lists become {@link Optional#empty()}.
 */
@Slf4j
@Component
public class RequestNormalizer {

    static final int MIN_CENTROIDS = 4;
    static final double DEFAULT_MATCH_RADIUS = 0.01;
    static final double DEFAULT_MATCH_THRESHOLD = 1e-3;
    static final int DEFAULT_PATTERN_CHECKING_STARS = 8;

    /**
     * @throws PreconditionFailedException if fewer than {@value #MIN_CENTROIDS} centroids were sent,
     *                                     the image size is missing, or the solve timeout is negative
     */
    public SolveParameters normalize(final SolveRequest request) {
        final var centroidCount = request.starCentroids().size();
        if (centroidCount < MIN_CENTROIDS) {
            throw new PreconditionFailedException(String.format(
                    "Too few centroids: %d supplied, at least %d required", centroidCount, MIN_CENTROIDS));
        }
        if (request.imageWidth() == null || request.imageHeight() == null
                || request.imageWidth() <= 0 || request.imageHeight() <= 0) {
            throw new PreconditionFailedException(String.format(
                    "Image size must be positive, got width=%s height=%s", request.imageWidth(), request.imageHeight()));
        }

        final var solveTimeout = Optional.ofNullable(request.solveTimeout()).map(WireDuration::toDuration);
        if (solveTimeout.filter(Duration::isNegative).isPresent()) {
            throw new PreconditionFailedException("Solve timeout must not be negative: " + solveTimeout.get());
        }

        final var options = new SolveOptions(
                optional(request.fovEstimate()),
                optional(request.fovMaxError()),
                orDefault(request.patternCheckingStars(), DEFAULT_PATTERN_CHECKING_STARS),
                orDefault(request.matchRadius(), DEFAULT_MATCH_RADIUS),
                orDefault(request.matchThreshold(), DEFAULT_MATCH_THRESHOLD),
                optional(request.matchMaxError()),
                optional(request.distortion()),
                solveTimeout,
                nonEmpty(toEngine(request.targetPixels())),
                nonEmpty(request.targetSkyCoords()),
                Boolean.TRUE.equals(request.returnMatches()),
                Boolean.TRUE.equals(request.returnCatalog()),
                Boolean.TRUE.equals(request.returnRotationMatrix()));

        final var parameters = new SolveParameters(
                toEngine(request.starCentroids()),
                new ImageSize(request.imageHeight(), request.imageWidth()),
                options);
        log.debug("[SOLVE] Normalized request — {} centroids, {}x{}, options={}",
                centroidCount, request.imageWidth(), request.imageHeight(), options);
        return parameters;
    }

    private static List<PixelPosition> toEngine(final List<ImageCoord> coords) {
        return coords.stream().map(PixelAxes::toEngine).toList();
    }

    private static OptionalDouble optional(final Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    private static double orDefault(final Double value, final double fallback) {
        return value == null ? fallback : value;
    }

    private static int orDefault(final Integer value, final int fallback) {
        return value == null ? fallback : value;
    }

    private static <T> Optional<List<T>> nonEmpty(final List<T> values) {
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }
}
