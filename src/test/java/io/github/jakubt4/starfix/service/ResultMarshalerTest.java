package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.CelestialCoord;
import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.dto.SolveRequest;
import io.github.jakubt4.starfix.dto.SolveStatus;
import io.github.jakubt4.starfix.dto.WireDuration;
import io.github.jakubt4.starfix.engine.CatalogEntry;
import io.github.jakubt4.starfix.engine.EngineOutcome;
import io.github.jakubt4.starfix.engine.OneOrMany;
import io.github.jakubt4.starfix.engine.PixelPosition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.jakubt4.starfix.service.RequestNormalizerTest.centroids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultMarshalerTest {

    private static final Duration SOLVE_TIME = Duration.ofMillis(1234);
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final RequestNormalizer normalizer = new RequestNormalizer();
    private final ResultMarshaler marshaler = new ResultMarshaler();

    private SolveParameters parameters(final List<ImageCoord> targetPixels, final List<CelestialCoord> targetSky) {
        return normalizer.normalize(new SolveRequest(centroids(6), 1024, 768, null, null, null, null, null, null,
                null, null, targetPixels, targetSky, true, null, null));
    }

    private static EngineOutcome.EngineOutcomeBuilder solved() {
        return EngineOutcome.builder().ra(83.82).dec(-5.39).roll(12.5).fov(11.2).rmse(3.1).matches(17).prob(1e-9);
    }

    private static GovernedSolve completed(final EngineOutcome outcome) {
        return GovernedSolve.completed(outcome, SOLVE_TIME, TIMEOUT, false, false);
    }

    @Test
    void copiesOnlyScalarsTheEngineProduced() {
        final var result = marshaler.marshal(parameters(null, null), completed(solved().build()));

        assertThat(result.imageCenterCoords()).isEqualTo(new CelestialCoord(83.82, -5.39));
        assertThat(result.roll()).isEqualTo(12.5);
        assertThat(result.fov()).isEqualTo(11.2);
        assertThat(result.matches()).isEqualTo(17);
        assertThat(result.distortion()).isNull();
        assertThat(result.epochEquinox()).isNull();
        assertThat(result.cacheHitFraction()).isNull();
        assertThat(result.rotationMatrix()).isNull();
        assertThat(result.failureReason()).isNull();
        assertThat(result.status()).isEqualTo(SolveStatus.MATCH_FOUND);
        assertThat(result.solveTime()).isEqualTo(new WireDuration(1, 234_000_000));
    }

    @Test
    void wrapsLoneTargetValueIntoOneElementList() {
        final var outcome = solved().raTarget(OneOrMany.one(84.0)).decTarget(OneOrMany.one(-6.0)).build();

        final var result = marshaler.marshal(parameters(List.of(new ImageCoord(1, 2)), null), completed(outcome));

        assertThat(result.targetCoords()).containsExactly(new CelestialCoord(84.0, -6.0));
    }

    @Test
    void keepsTargetOrderForManyTargets() {
        final var outcome = solved()
                .raTarget(OneOrMany.many(List.of(1.0, 2.0, 3.0)))
                .decTarget(OneOrMany.many(List.of(-1.0, -2.0, -3.0)))
                .build();
        final var pixels = List.of(new ImageCoord(1, 1), new ImageCoord(2, 2), new ImageCoord(3, 3));

        final var result = marshaler.marshal(parameters(pixels, null), completed(outcome));

        assertThat(result.targetCoords()).containsExactly(
                new CelestialCoord(1.0, -1.0), new CelestialCoord(2.0, -2.0), new CelestialCoord(3.0, -3.0));
    }

    @Test
    void targetCountMismatchIsAnEngineFault() {
        final var outcome = solved().raTarget(OneOrMany.one(1.0)).decTarget(OneOrMany.one(2.0)).build();
        final var pixels = List.of(new ImageCoord(1, 1), new ImageCoord(2, 2));

        assertThatThrownBy(() -> marshaler.marshal(parameters(pixels, null), completed(outcome)))
                .isInstanceOf(EngineFaultException.class)
                .hasMessageContaining("1 target RA entries for 2 inputs");
    }

    @Test
    void unmappableSkyTargetsBecomeSentinelAndAxesAreSwappedBack() {
        final var outcome = solved()
                .targetImagePositions(OneOrMany.many(Arrays.asList(new PixelPosition(300.0, 500.0), null)))
                .build();
        final var sky = List.of(new CelestialCoord(84, -5), new CelestialCoord(250, 80));

        final var result = marshaler.marshal(parameters(null, sky), completed(outcome));

        assertThat(result.targetSkyToImageCoords()).containsExactly(new ImageCoord(500.0, 300.0), ImageCoord.unmapped());
    }

    @Test
    void loneUnmappableSkyTargetStillYieldsOneEntry() {
        final var outcome = solved().targetImagePositions(OneOrMany.one(null)).build();

        final var result = marshaler.marshal(parameters(null, List.of(new CelestialCoord(0, -89))), completed(outcome));

        assertThat(result.targetSkyToImageCoords()).containsExactly(new ImageCoord(-1, -1));
    }

    @Test
    void zipsMatchedStarsWithCatalogIds() {
        final var outcome = solved()
                .matchedStars(List.of(new CatalogEntry(83.0, -5.0, 2.1), new CatalogEntry(84.0, -6.0, 3.4)))
                .matchedCentroids(List.of(new PixelPosition(10.0, 20.0), new PixelPosition(30.0, 40.0)))
                .matchedCatalogIds(List.of(26727, 26311))
                .build();

        final var stars = marshaler.marshal(parameters(null, null), completed(outcome)).matchedStars();

        assertThat(stars).hasSize(2);
        assertThat(stars.get(0).celestialCoord()).isEqualTo(new CelestialCoord(83.0, -5.0));
        assertThat(stars.get(0).magnitude()).isEqualTo(2.1);
        assertThat(stars.get(0).imageCoord()).isEqualTo(new ImageCoord(20.0, 10.0));
        assertThat(stars.get(0).catId()).isEqualTo("26727");
        assertThat(stars.get(1).catId()).isEqualTo("26311");
    }

    @Test
    void omitsCatalogIdsWhenEngineSuppliesNone() {
        final var outcome = solved()
                .matchedStars(List.of(new CatalogEntry(83.0, -5.0, 2.1)))
                .matchedCentroids(List.of(new PixelPosition(10.0, 20.0)))
                .build();

        final var stars = marshaler.marshal(parameters(null, null), completed(outcome)).matchedStars();

        assertThat(stars).singleElement().satisfies(star -> assertThat(star.catId()).isNull());
    }

    @Test
    void matchedStarListsOfDifferentLengthAreAnEngineFault() {
        final var outcome = solved()
                .matchedStars(List.of(new CatalogEntry(83.0, -5.0, 2.1)))
                .matchedCentroids(Collections.emptyList())
                .build();

        assertThatThrownBy(() -> marshaler.marshal(parameters(null, null), completed(outcome)))
                .isInstanceOf(EngineFaultException.class);
    }

    @Test
    void passesThroughCatalogPatternAndRotationExtras() {
        final var outcome = solved()
                .patternCentroids(List.of(new PixelPosition(1.0, 2.0)))
                .catalogStars(List.of(new CatalogEntry(80.0, 1.0, 5.5)))
                .catalogCentroids(List.of(new PixelPosition(3.0, 4.0)))
                .rotationMatrix(List.of(1.0, 0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, 1.0))
                .p90Error(4.0)
                .maxError(6.0)
                .build();

        final var result = marshaler.marshal(parameters(null, null), completed(outcome));

        assertThat(result.patternCentroids()).containsExactly(new ImageCoord(2.0, 1.0));
        assertThat(result.catalogStars()).singleElement()
                .satisfies(star -> assertThat(star.imageCoord()).isEqualTo(new ImageCoord(4.0, 3.0)));
        assertThat(result.rotationMatrix().matrixElements()).hasSize(9);
        assertThat(result.p90Error()).isEqualTo(4.0);
        assertThat(result.maxError()).isEqualTo(6.0);
    }

    @Test
    void partialOrientationIsAnEngineFault() {
        final var outcome = EngineOutcome.builder().ra(10.0).build();

        assertThatThrownBy(() -> marshaler.marshal(parameters(null, null), completed(outcome)))
                .isInstanceOf(EngineFaultException.class)
                .hasMessageContaining("partial orientation");
    }

    @Test
    void noOrientationIsNoSolutionWithTimeAndNoCenter() {
        final var outcome = EngineOutcome.builder().status(SolveStatus.NO_MATCH).cacheHitFraction(0.5).build();

        final var result = marshaler.marshal(parameters(List.of(new ImageCoord(1, 1)), null), completed(outcome));

        assertThat(result.imageCenterCoords()).isNull();
        assertThat(result.failureReason()).isEqualTo(ResultMarshaler.NO_SOLUTION_REASON);
        assertThat(result.status()).isEqualTo(SolveStatus.NO_MATCH);
        assertThat(result.solveTime()).isEqualTo(WireDuration.of(SOLVE_TIME));
        assertThat(result.cacheHitFraction()).isEqualTo(0.5);
        assertThat(result.roll()).isNull();
        assertThat(result.targetCoords()).isEmpty();
    }

    @Test
    void failedSolveKeepsEveryScalarTheEngineReported() {
        final var outcome = EngineOutcome.builder()
                .status(SolveStatus.NO_MATCH)
                .rmse(48.0)
                .matches(3)
                .prob(0.2)
                .fov(11.1)
                .build();

        final var result = marshaler.marshal(parameters(null, null), completed(outcome));

        assertThat(result.isSolved()).isFalse();
        assertThat(result.failureReason()).isEqualTo(ResultMarshaler.NO_SOLUTION_REASON);
        assertThat(result.rmse()).isEqualTo(48.0);
        assertThat(result.matches()).isEqualTo(3);
        assertThat(result.prob()).isEqualTo(0.2);
        assertThat(result.fov()).isEqualTo(11.1);
        assertThat(result.roll()).isNull();
        assertThat(result.distortion()).isNull();
        assertThat(result.cacheHitFraction()).isNull();
    }

    @Test
    void expiredBudgetWithoutOrientationIsDeadlineExceeded() {
        final var governed = GovernedSolve.completed(EngineOutcome.builder().build(), SOLVE_TIME, TIMEOUT, true, false);

        final var result = marshaler.marshal(parameters(null, null), governed);

        assertThat(result.status()).isEqualTo(SolveStatus.TIMEOUT);
        assertThat(result.failureReason()).contains("Deadline exceeded").contains("1000 ms");
    }

    @Test
    void engineReportedTimeoutIsDeadlineExceeded() {
        final var outcome = EngineOutcome.builder().status(SolveStatus.TIMEOUT).build();

        assertThat(marshaler.marshal(parameters(null, null), completed(outcome)).status())
                .isEqualTo(SolveStatus.TIMEOUT);
    }

    @Test
    void cancelledSolveIsReportedAsCancelled() {
        final var governed = GovernedSolve.completed(EngineOutcome.builder().build(), SOLVE_TIME, TIMEOUT, false, true);

        final var result = marshaler.marshal(parameters(null, null), governed);

        assertThat(result.status()).isEqualTo(SolveStatus.CANCELLED);
        assertThat(result.failureReason()).isEqualTo(ResultMarshaler.CANCELLED_REASON);
    }

    @Test
    void solveThatNeverStartedIsDeadlineExceededWithWaitTime() {
        final var governed = GovernedSolve.notStarted(Duration.ofMillis(100), Duration.ofMillis(100), false);

        final var result = marshaler.marshal(parameters(null, null), governed);

        assertThat(result.status()).isEqualTo(SolveStatus.TIMEOUT);
        assertThat(result.failureReason()).contains("before the engine became available");
        assertThat(result.solveTime()).isEqualTo(new WireDuration(0, 100_000_000));
        assertThat(result.imageCenterCoords()).isNull();
    }

    @Test
    void rejectionIsPreconditionFailedWithZeroTime() {
        final var result = marshaler.rejected(new PreconditionFailedException("Too few centroids: 2 supplied"));

        assertThat(result.status()).isEqualTo(SolveStatus.TOO_FEW);
        assertThat(result.failureReason()).isEqualTo("Too few centroids: 2 supplied");
        assertThat(result.solveTime()).isEqualTo(new WireDuration(0, 0));
    }
}
