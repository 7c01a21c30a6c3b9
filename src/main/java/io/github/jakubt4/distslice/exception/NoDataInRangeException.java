package io.github.jakubt4.distslice.exception;

/**
 * No sample falls inside the requested window, or none of the selected samples
 * leaves a usable bin after aggregation.
 */
public class NoDataInRangeException extends SliceException {

    public NoDataInRangeException(final String message) {
        super(message);
    }
}
