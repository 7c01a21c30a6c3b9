package io.github.jakubt4.distslice.dto;

import io.github.jakubt4.distslice.exception.ShapeMismatchException;

/**
 * Time-tagged rows of equal width: 3 components for support vectors, 9
 * (row-major 3×3) for custom rotation matrices.
 *
 * @param times  sample times, seconds, ascending
 * @param values one row per time
 */
public record TimeSeries(double[] times, double[][] values) {

    public TimeSeries {
        if (times == null || values == null || times.length != values.length) {
            throw new ShapeMismatchException("time series needs one value row per time tag");
        }
    }

    /** Constant series holding a single row. */
    public static TimeSeries constant(final double... value) {
        return new TimeSeries(new double[] {0.0}, new double[][] {value});
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    /**
     * @throws ShapeMismatchException if any row is not {@code width} wide
     */
    public void requireWidth(final String name, final int width) {
        for (final var row : values) {
            if (row == null || row.length != width) {
                throw new ShapeMismatchException("%s rows must have %d components, found %s"
                        .formatted(name, width, row == null ? "null" : Integer.toString(row.length)));
            }
        }
    }
}
