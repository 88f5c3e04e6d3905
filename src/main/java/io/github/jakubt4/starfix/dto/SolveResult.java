package io.github.jakubt4.starfix.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Plate-solve response. Scalar fields are {@code null} when the engine did not produce them;
 * {@code solveTime} is always present. {@code failureReason} is present exactly when
 * {@code imageCenterCoords} is absent.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResult(CelestialCoord imageCenterCoords,
                          Double roll,
                          Double fov,
                          Double distortion,
                          Double rmse,
                          Double p90Error,
                          Double maxError,
                          Integer matches,
                          Double prob,
                          Double epochEquinox,
                          Double epochProperMotion,
                          Double cacheHitFraction,
                          List<CelestialCoord> targetCoords,
                          List<ImageCoord> targetSkyToImageCoords,
                          List<MatchedStar> matchedStars,
                          List<ImageCoord> patternCentroids,
                          List<MatchedStar> catalogStars,
                          RotationMatrix rotationMatrix,
                          WireDuration solveTime,
                          String failureReason,
                          SolveStatus status) {

    public SolveResult {
        targetCoords = targetCoords == null ? List.of() : List.copyOf(targetCoords);
        targetSkyToImageCoords = targetSkyToImageCoords == null ? List.of() : List.copyOf(targetSkyToImageCoords);
        matchedStars = matchedStars == null ? List.of() : List.copyOf(matchedStars);
        patternCentroids = patternCentroids == null ? List.of() : List.copyOf(patternCentroids);
        catalogStars = catalogStars == null ? List.of() : List.copyOf(catalogStars);
    }

    @JsonIgnore
    public boolean isSolved() {
        return imageCenterCoords != null;
    }
}
