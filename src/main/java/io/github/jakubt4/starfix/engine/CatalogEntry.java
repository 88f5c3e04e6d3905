package io.github.jakubt4.starfix.engine;

/**
 * Catalog star as reported by the engine.
 *
 * @param ra        right ascension, degrees
 * @param dec       declination, degrees
 * @param magnitude catalog magnitude
 */
public record CatalogEntry(double ra, double dec, double magnitude) {
}
