package io.github.jakubt4.distslice.exception;

/**
 * A rotation preset (or bulk subtraction) needs a support quantity the caller
 * did not provide.
 */
public class MissingSupportDataException extends SliceException {

    public MissingSupportDataException(final String requiredBy, final String missing) {
        super("%s requires %s data".formatted(requiredBy, missing));
    }
}
