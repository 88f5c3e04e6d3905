package io.github.jakubt4.starfix.client;

import io.github.jakubt4.starfix.dto.CelestialCoord;
import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.dto.MatchedStar;
import io.github.jakubt4.starfix.dto.RotationMatrix;
import io.github.jakubt4.starfix.dto.SolveResult;
import io.github.jakubt4.starfix.dto.SolveStatus;

import java.time.Duration;
import java.util.List;

/**
 * A successful solve as seen by a client. Fields the server always sends with a match are
 * unboxed; the rest stay nullable.
 */
public record PlateSolution(CelestialCoord imageSkyCoord,
                            double roll,
                            double fov,
                            Double distortion,
                            double rmse,
                            Double p90Error,
                            Double maxError,
                            int numMatches,
                            double prob,
                            Double epochEquinox,
                            Double epochProperMotion,
                            Duration solveTime,
                            List<CelestialCoord> targetSkyCoords,
                            List<ImageCoord> targetPixels,
                            List<MatchedStar> matchedStars,
                            List<ImageCoord> patternCentroids,
                            List<MatchedStar> catalogStars,
                            RotationMatrix rotationMatrix) {

    /**
     * @throws SolveFailedException if the result lacks a field every match carries
     */
    static PlateSolution from(final SolveResult result) {
        return new PlateSolution(
                required(result.imageCenterCoords(), "imageCenterCoords", result),
                required(result.roll(), "roll", result),
                required(result.fov(), "fov", result),
                result.distortion(),
                required(result.rmse(), "rmse", result),
                result.p90Error(),
                result.maxError(),
                required(result.matches(), "matches", result),
                required(result.prob(), "prob", result),
                result.epochEquinox(),
                result.epochProperMotion(),
                result.solveTime() == null ? Duration.ZERO : result.solveTime().toDuration(),
                result.targetCoords(),
                result.targetSkyToImageCoords(),
                result.matchedStars(),
                result.patternCentroids(),
                result.catalogStars(),
                result.rotationMatrix());
    }

    private static <T> T required(final T value, final String field, final SolveResult result) {
        if (value == null) {
            throw new SolveFailedException(SolveStatus.MATCH_FOUND, "Solve result is missing " + field);
        }
        return value;
    }
}
