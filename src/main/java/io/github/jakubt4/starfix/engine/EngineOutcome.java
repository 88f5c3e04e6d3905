package io.github.jakubt4.starfix.engine;

import io.github.jakubt4.starfix.dto.SolveStatus;
import lombok.Builder;

import java.util.List;

/**
 * Sparse engine result. Every field may be {@code null}; an orientation is present only when
 * both {@code ra} and {@code dec} are.
 *
 * <p>Per-target outputs come back as {@link OneOrMany}. Matched stars arrive as parallel lists
 * ({@code matchedStars}, {@code matchedCentroids}, optionally {@code matchedCatalogIds}), as do
 * catalog stars. {@code targetImagePositions} holds {@code null} for sky targets that fall
 * outside the image.
 */
@Builder
public record EngineOutcome(Double ra,
                            Double dec,
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
                            Double engineSolveMillis,
                            OneOrMany<Double> raTarget,
                            OneOrMany<Double> decTarget,
                            OneOrMany<PixelPosition> targetImagePositions,
                            List<CatalogEntry> matchedStars,
                            List<PixelPosition> matchedCentroids,
                            List<?> matchedCatalogIds,
                            List<PixelPosition> patternCentroids,
                            List<CatalogEntry> catalogStars,
                            List<PixelPosition> catalogCentroids,
                            List<Double> rotationMatrix,
                            SolveStatus status) {

    public boolean hasOrientation() {
        return ra != null && dec != null;
    }
}
