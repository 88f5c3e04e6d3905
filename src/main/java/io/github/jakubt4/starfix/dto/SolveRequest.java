package io.github.jakubt4.starfix.dto;

import java.util.List;

/**
 * Inbound plate-solve request. Boxed fields are optional: {@code null} means the client did not
 * send the field, which is distinct from an explicit zero.
 *
 * @param starCentroids        detected star positions, brightest first
 * @param imageWidth           image width in pixels (required)
 * @param imageHeight          image height in pixels (required)
 * @param fovEstimate          horizontal field of view estimate, degrees
 * @param fovMaxError          maximum error of {@code fovEstimate}, degrees
 * @param patternCheckingStars number of stars used to build candidate patterns
 * @param matchRadius          match radius as a fraction of the image width
 * @param matchThreshold       false-positive probability threshold for accepting a match
 * @param matchMaxError        maximum pattern edge-ratio error
 * @param distortion           radial distortion coefficient
 * @param solveTimeout         requested solve budget
 * @param targetPixels         image positions to convert to sky coordinates
 * @param targetSkyCoords      sky positions to convert to image positions
 * @param returnMatches        whether to list matched stars
 * @param returnCatalog        whether to list every catalog star inside the field
 * @param returnRotationMatrix whether to include the solved rotation matrix
 */
public record SolveRequest(List<ImageCoord> starCentroids,
                           Integer imageWidth,
                           Integer imageHeight,
                           Double fovEstimate,
                           Double fovMaxError,
                           Integer patternCheckingStars,
                           Double matchRadius,
                           Double matchThreshold,
                           Double matchMaxError,
                           Double distortion,
                           WireDuration solveTimeout,
                           List<ImageCoord> targetPixels,
                           List<CelestialCoord> targetSkyCoords,
                           Boolean returnMatches,
                           Boolean returnCatalog,
                           Boolean returnRotationMatrix) {

    public SolveRequest {
        starCentroids = starCentroids == null ? List.of() : List.copyOf(starCentroids);
        targetPixels = targetPixels == null ? List.of() : List.copyOf(targetPixels);
        targetSkyCoords = targetSkyCoords == null ? List.of() : List.copyOf(targetSkyCoords);
    }

    /**
     * Request carrying only the required fields.
     */
    public static SolveRequest of(final List<ImageCoord> starCentroids, final int imageWidth, final int imageHeight) {
        return new SolveRequest(starCentroids, imageWidth, imageHeight, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public SolveRequest withSolveTimeout(final WireDuration timeout) {
        return new SolveRequest(starCentroids, imageWidth, imageHeight, fovEstimate, fovMaxError,
                patternCheckingStars, matchRadius, matchThreshold, matchMaxError, distortion, timeout,
                targetPixels, targetSkyCoords, returnMatches, returnCatalog, returnRotationMatrix);
    }
}
