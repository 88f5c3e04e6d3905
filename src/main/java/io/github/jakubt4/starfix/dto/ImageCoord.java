package io.github.jakubt4.starfix.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Pixel position in an image. {@code x} grows along columns, {@code y} along rows,
 * origin at the top-left corner of the image.
 */
public record ImageCoord(double x, double y) {

    private static final ImageCoord UNMAPPED = new ImageCoord(-1, -1);

    /**
     * Marker for a celestial coordinate that has no position inside the image.
     */
    public static ImageCoord unmapped() {
        return UNMAPPED;
    }

    @JsonIgnore
    public boolean isUnmapped() {
        return x == -1 && y == -1;
    }
}
