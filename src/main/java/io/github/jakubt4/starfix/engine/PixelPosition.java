package io.github.jakubt4.starfix.engine;

/**
 * Image position in the engine's (row, column) order.
 */
public record PixelPosition(double row, double column) {
}
