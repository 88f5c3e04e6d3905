package io.github.jakubt4.starfix.engine;

/**
 * Image dimensions in pixels, in the engine's (height, width) order.
 */
public record ImageSize(int height, int width) {

    public ImageSize {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Image size must be positive, got " + height + "x" + width);
        }
    }
}
