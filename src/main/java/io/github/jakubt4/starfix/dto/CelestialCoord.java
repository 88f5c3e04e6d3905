package io.github.jakubt4.starfix.dto;

/**
 * Equatorial sky position.
 *
 * @param ra  right ascension in degrees, {@code [0, 360)}
 * @param dec declination in degrees, {@code [-90, 90]}
 */
public record CelestialCoord(double ra, double dec) {
}
