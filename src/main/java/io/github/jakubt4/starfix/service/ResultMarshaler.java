package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.CelestialCoord;
import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.dto.MatchedStar;
import io.github.jakubt4.starfix.dto.RotationMatrix;
import io.github.jakubt4.starfix.dto.SolveResult;
import io.github.jakubt4.starfix.dto.SolveStatus;
import io.github.jakubt4.starfix.dto.WireDuration;
import io.github.jakubt4.starfix.engine.CatalogEntry;
import io.github.jakubt4.starfix.engine.EngineOutcome;
import io.github.jakubt4.starfix.engine.OneOrMany;
import io.github.jakubt4.starfix.engine.PixelPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the wire {@link SolveResult} from a {@link GovernedSolve} and assigns the failure
 * taxonomy.
 *
 * <p>Scalars are copied only when the engine produced them, on failed solves too. Per-target
 * outputs are flattened from {@link OneOrMany} before anything else looks at them, then checked
 * against the request's target count so the response always carries one entry per target.
 * Output that cannot be reconciled with the request raises {@link EngineFaultException}.
 */
@Slf4j
@Component
public class ResultMarshaler {

    static final String NO_SOLUTION_REASON = "No match found";
    static final String CANCELLED_REASON = "Solve cancelled";

    /**
     * Result for a request the normalizer refused; the engine was never invoked.
     */
    public SolveResult rejected(final PreconditionFailedException rejection) {
        return failure(SolveFailure.PRECONDITION_FAILED, rejection.getMessage(), Duration.ZERO).build();
    }

    public SolveResult marshal(final SolveParameters parameters, final GovernedSolve governed) {
        if (!governed.started()) {
            final var kind = governed.cancelled() ? SolveFailure.CANCELLED : SolveFailure.DEADLINE_EXCEEDED;
            return failure(kind, reasonFor(kind, governed), governed.solveTime()).build();
        }

        final var outcome = governed.outcome();
        if (outcome == null) {
            throw new EngineFaultException("Engine returned no outcome");
        }
        if ((outcome.ra() == null) != (outcome.dec() == null)) {
            throw new EngineFaultException("Engine returned a partial orientation: ra=" + outcome.ra()
                    + ", dec=" + outcome.dec());
        }

        if (!outcome.hasOrientation()) {
            final var kind = classify(governed, outcome);
            return withScalars(failure(kind, reasonFor(kind, governed), governed.solveTime()), outcome)
                    .build();
        }

        final var options = parameters.options();
        return withScalars(SolveResult.builder(), outcome)
                .imageCenterCoords(new CelestialCoord(outcome.ra(), outcome.dec()))
                .targetCoords(targetCoords(options.targetPixelCount(), outcome))
                .targetSkyToImageCoords(targetImageCoords(options.targetSkyCoordCount(), outcome))
                .matchedStars(matchedStars(outcome))
                .patternCentroids(toWire(outcome.patternCentroids()))
                .catalogStars(catalogStars(outcome))
                .rotationMatrix(rotationMatrix(outcome.rotationMatrix()))
                .solveTime(WireDuration.of(governed.solveTime()))
                .status(SolveStatus.MATCH_FOUND)
                .build();
    }

    /**
     * Copies every scalar the engine reported; absent ones stay {@code null}.
     */
    private static SolveResult.SolveResultBuilder withScalars(final SolveResult.SolveResultBuilder builder,
                                                              final EngineOutcome outcome) {
        return builder
                .roll(outcome.roll())
                .fov(outcome.fov())
                .distortion(outcome.distortion())
                .rmse(outcome.rmse())
                .p90Error(outcome.p90Error())
                .maxError(outcome.maxError())
                .matches(outcome.matches())
                .prob(outcome.prob())
                .epochEquinox(outcome.epochEquinox())
                .epochProperMotion(outcome.epochProperMotion())
                .cacheHitFraction(outcome.cacheHitFraction());
    }

    private static SolveFailure classify(final GovernedSolve governed, final EngineOutcome outcome) {
        if (governed.cancelled() || outcome.status() == SolveStatus.CANCELLED) {
            return SolveFailure.CANCELLED;
        }
        if (governed.deadlineExpired() || outcome.status() == SolveStatus.TIMEOUT) {
            return SolveFailure.DEADLINE_EXCEEDED;
        }
        return SolveFailure.NO_SOLUTION;
    }

    private static String reasonFor(final SolveFailure kind, final GovernedSolve governed) {
        return switch (kind) {
            case DEADLINE_EXCEEDED -> String.format("Deadline exceeded: solve budget of %d ms elapsed %s",
                    governed.effectiveTimeout().toMillis(),
                    governed.started() ? "during the solve" : "before the engine became available");
            case CANCELLED -> CANCELLED_REASON;
            default -> NO_SOLUTION_REASON;
        };
    }

    private static SolveResult.SolveResultBuilder failure(final SolveFailure kind, final String reason,
                                                          final Duration elapsed) {
        log.debug("[SOLVE] Failure {} — {}", kind, reason);
        return SolveResult.builder()
                .solveTime(WireDuration.of(elapsed))
                .failureReason(reason)
                .status(kind.status());
    }

    private static List<CelestialCoord> targetCoords(final int expected, final EngineOutcome outcome) {
        if (expected == 0) {
            return List.of();
        }
        final var ras = flatten(outcome.raTarget());
        final var decs = flatten(outcome.decTarget());
        requireCount("target RA", ras.size(), expected);
        requireCount("target Dec", decs.size(), expected);

        final var coords = new ArrayList<CelestialCoord>(expected);
        for (var i = 0; i < expected; i++) {
            if (ras.get(i) == null || decs.get(i) == null) {
                throw new EngineFaultException("Engine left target " + i + " without sky coordinates");
            }
            coords.add(new CelestialCoord(ras.get(i), decs.get(i)));
        }
        return coords;
    }

    private static List<ImageCoord> targetImageCoords(final int expected, final EngineOutcome outcome) {
        if (expected == 0) {
            return List.of();
        }
        final var positions = flatten(outcome.targetImagePositions());
        requireCount("target image position", positions.size(), expected);
        return positions.stream()
                .map(position -> position == null ? ImageCoord.unmapped() : PixelAxes.toWire(position))
                .toList();
    }

    private static List<MatchedStar> matchedStars(final EngineOutcome outcome) {
        final var stars = outcome.matchedStars();
        if (stars == null) {
            return List.of();
        }
        final var centroids = outcome.matchedCentroids();
        final var catalogIds = outcome.matchedCatalogIds();
        requireCount("matched centroid", centroids == null ? 0 : centroids.size(), stars.size());
        if (catalogIds != null) {
            requireCount("matched catalog id", catalogIds.size(), stars.size());
        }

        final var matched = new ArrayList<MatchedStar>(stars.size());
        for (var i = 0; i < stars.size(); i++) {
            final var star = stars.get(i);
            final var catId = catalogIds == null ? null : String.valueOf(catalogIds.get(i));
            matched.add(new MatchedStar(new CelestialCoord(star.ra(), star.dec()), star.magnitude(),
                    PixelAxes.toWire(centroids.get(i)), catId));
        }
        return matched;
    }

    private static List<MatchedStar> catalogStars(final EngineOutcome outcome) {
        final List<CatalogEntry> stars = outcome.catalogStars();
        if (stars == null) {
            return List.of();
        }
        final var centroids = outcome.catalogCentroids();
        requireCount("catalog centroid", centroids == null ? 0 : centroids.size(), stars.size());

        final var listed = new ArrayList<MatchedStar>(stars.size());
        for (var i = 0; i < stars.size(); i++) {
            final var star = stars.get(i);
            listed.add(new MatchedStar(new CelestialCoord(star.ra(), star.dec()), star.magnitude(),
                    PixelAxes.toWire(centroids.get(i)), null));
        }
        return listed;
    }

    private static List<ImageCoord> toWire(final List<PixelPosition> positions) {
        return positions == null ? List.of() : positions.stream().map(PixelAxes::toWire).toList();
    }

    private static RotationMatrix rotationMatrix(final List<Double> elements) {
        if (elements == null) {
            return null;
        }
        try {
            return new RotationMatrix(elements);
        } catch (final IllegalArgumentException e) {
            throw new EngineFaultException("Engine returned a malformed rotation matrix: " + e.getMessage(), e);
        }
    }

    private static <T> List<T> flatten(final OneOrMany<T> value) {
        return value == null ? List.of() : value.asList();
    }

    private static void requireCount(final String what, final int actual, final int expected) {
        if (actual != expected) {
            throw new EngineFaultException(String.format(
                    "Engine returned %d %s entries for %d inputs", actual, what, expected));
        }
    }
}
