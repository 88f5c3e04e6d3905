package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.engine.ImageSize;
import io.github.jakubt4.starfix.engine.PixelPosition;
import io.github.jakubt4.starfix.engine.SolveOptions;

import java.util.List;

/**
 * A solve request with every default applied, in engine conventions.
 */
public record SolveParameters(List<PixelPosition> centroids, ImageSize imageSize, SolveOptions options) {
}
