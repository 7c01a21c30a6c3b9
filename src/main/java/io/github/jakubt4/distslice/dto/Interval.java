package io.github.jakubt4.distslice.dto;

/**
 * Closed numeric interval, used for time ranges, energy ranges and angle ranges.
 */
public record Interval(double min, double max) {

    public Interval {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("interval bounds must not be NaN");
        }
        if (min > max) {
            final var swap = min;
            min = max;
            max = swap;
        }
    }

    public static Interval of(final double a, final double b) {
        return new Interval(a, b);
    }

    public boolean contains(final double value) {
        return value >= min && value <= max;
    }

    public double width() {
        return max - min;
    }

    public double center() {
        return 0.5 * (min + max);
    }
}
