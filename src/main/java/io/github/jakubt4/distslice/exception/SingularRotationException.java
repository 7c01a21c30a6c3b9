package io.github.jakubt4.distslice.exception;

/**
 * Reference vectors are parallel, antiparallel or zero, so the basis cannot be
 * built. The engine does not fall back to another rotation.
 */
public class SingularRotationException extends SliceException {

    public SingularRotationException(final String message) {
        super(message);
    }

    public SingularRotationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
