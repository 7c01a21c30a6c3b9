package io.github.jakubt4.distslice.dto;

/**
 * How compatible samples are combined bin by bin.
 */
public enum AggregationMode {
    /** Mean over contributing samples. */
    AVERAGE,
    /** Straight sum over contributing samples. */
    SUM
}
