package io.github.jakubt4.starfix.dto;

import java.util.List;

/**
 * Row-major 3x3 matrix taking a camera-frame unit vector to a celestial-frame unit vector.
 *
 * @param matrixElements exactly nine elements, row-major
 */
public record RotationMatrix(List<Double> matrixElements) {

    public static final int ELEMENT_COUNT = 9;

    public RotationMatrix {
        if (matrixElements == null || matrixElements.size() != ELEMENT_COUNT) {
            throw new IllegalArgumentException("Rotation matrix requires exactly " + ELEMENT_COUNT
                    + " elements, got " + (matrixElements == null ? 0 : matrixElements.size()));
        }
        if (matrixElements.contains(null)) {
            throw new IllegalArgumentException("Rotation matrix elements must not be null");
        }
        matrixElements = List.copyOf(matrixElements);
    }

    public double[][] toArray() {
        final var rows = new double[3][3];
        for (var i = 0; i < ELEMENT_COUNT; i++) {
            rows[i / 3][i % 3] = matrixElements.get(i);
        }
        return rows;
    }
}
