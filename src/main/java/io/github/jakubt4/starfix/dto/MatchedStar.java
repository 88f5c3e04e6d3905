package io.github.jakubt4.starfix.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A catalog star paired with the image position it was matched to (or, for catalog
 * listings, the position it is predicted to occupy).
 *
 * @param celestialCoord catalog position
 * @param magnitude      catalog magnitude
 * @param imageCoord     image position
 * @param catId          catalog identifier; absent when the engine's database carries none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchedStar(CelestialCoord celestialCoord, double magnitude, ImageCoord imageCoord, String catId) {
}
