package io.github.jakubt4.starfix.dto;

import java.util.List;

/**
 * Coordinate conversion request for a known orientation. Either list may be empty.
 *
 * @param rotationMatrix  camera-to-celestial rotation
 * @param imageWidth      image width in pixels
 * @param imageHeight     image height in pixels
 * @param fov             horizontal field of view, degrees
 * @param distortion      radial distortion coefficient, {@code null} for none
 * @param imageCoords     image positions to convert to sky coordinates
 * @param celestialCoords sky positions to convert to image positions
 */
public record TransformRequest(RotationMatrix rotationMatrix,
                               Integer imageWidth,
                               Integer imageHeight,
                               Double fov,
                               Double distortion,
                               List<ImageCoord> imageCoords,
                               List<CelestialCoord> celestialCoords) {

    public TransformRequest {
        imageCoords = imageCoords == null ? List.of() : List.copyOf(imageCoords);
        celestialCoords = celestialCoords == null ? List.of() : List.copyOf(celestialCoords);
    }
}
