package io.github.jakubt4.starfix.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of a coordinate conversion. A list is {@code null} when its source list in the request was empty.
 *
 * @param celestialCoords one entry per request {@code imageCoords} entry
 * @param imageCoords     one entry per request {@code celestialCoords} entry, {@link ImageCoord#unmapped()}
 *                        for positions outside the image
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransformResponse(List<CelestialCoord> celestialCoords, List<ImageCoord> imageCoords) {
}
