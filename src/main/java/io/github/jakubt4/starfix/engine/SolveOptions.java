package io.github.jakubt4.starfix.engine;

import io.github.jakubt4.starfix.dto.CelestialCoord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fully resolved engine options. Empty optionals mean "use the engine's own default".
 */
public record SolveOptions(OptionalDouble fovEstimate,
                           OptionalDouble fovMaxError,
                           int patternCheckingStars,
                           double matchRadius,
                           double matchThreshold,
                           OptionalDouble matchMaxError,
                           OptionalDouble distortion,
                           Optional<Duration> solveTimeout,
                           Optional<List<PixelPosition>> targetPixels,
                           Optional<List<CelestialCoord>> targetSkyCoords,
                           boolean returnMatches,
                           boolean returnCatalog,
                           boolean returnRotationMatrix) {

    public int targetPixelCount() {
        return targetPixels.map(List::size).orElse(0);
    }

    public int targetSkyCoordCount() {
        return targetSkyCoords.map(List::size).orElse(0);
    }
}
