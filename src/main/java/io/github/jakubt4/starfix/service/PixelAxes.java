package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.engine.PixelPosition;

/**
 * Translation between wire {@code (x, y)} and engine {@code (row, column)} order.
 * Every crossing of that boundary goes through here.
 */
final class PixelAxes {

    private PixelAxes() {
    }

    static PixelPosition toEngine(final ImageCoord coord) {
        return new PixelPosition(coord.y(), coord.x());
    }

    static ImageCoord toWire(final PixelPosition position) {
        return new ImageCoord(position.column(), position.row());
    }
}
