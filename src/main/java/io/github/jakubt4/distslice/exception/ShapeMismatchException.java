package io.github.jakubt4.distslice.exception;

/**
 * Array dimensions do not match what the pipeline expects (sample arrays vs.
 * declared bin shape, support rows that are not 3-vectors, custom matrices that
 * are not 3×3).
 */
public class ShapeMismatchException extends SliceException {

    public ShapeMismatchException(final String message) {
        super(message);
    }
}
