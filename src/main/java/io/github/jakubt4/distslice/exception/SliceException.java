package io.github.jakubt4.distslice.exception;

/**
 * Base type for every failure raised while computing a slice. All subtypes are
 * unchecked and propagate straight out of
 * {@link io.github.jakubt4.distslice.service.DistributionSliceService#slice}.
 */
public abstract class SliceException extends RuntimeException {

    protected SliceException(final String message) {
        super(message);
    }

    protected SliceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
