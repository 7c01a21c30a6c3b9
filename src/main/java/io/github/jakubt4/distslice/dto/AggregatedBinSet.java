package io.github.jakubt4.distslice.dto;

import java.util.Arrays;

/**
 * Flat list of aggregated bins ready for rebinning. Entries appear in
 * aggregation-segment order, not in any spatial order, and every entry had a
 * non-zero aggregation weight.
 *
 * @param sampleCount number of samples that contributed
 * @param timeRange   earliest start to latest end of the contributing samples
 */
public record AggregatedBinSet(double[] data,
                               double[] rad,
                               double[] phi,
                               double[] theta,
                               double[] dr,
                               double[] dp,
                               double[] dt,
                               int sampleCount,
                               Interval timeRange) {

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    /** Copy with every radial centre moved by {@code -offset}. */
    public AggregatedBinSet withRadialOffset(final double offset) {
        final var shifted = Arrays.stream(rad).map(r -> r - offset).toArray();
        return new AggregatedBinSet(data, shifted, phi, theta, dr, dp, dt, sampleCount, timeRange);
    }

    /** Smallest finite lower radial edge, or NaN when no entry is finite. */
    public double minRadialEdge() {
        var min = Double.NaN;
        for (var i = 0; i < rad.length; i++) {
            final var edge = rad[i] - 0.5 * Math.abs(dr[i]);
            if (Double.isFinite(edge) && (Double.isNaN(min) || edge < min)) {
                min = edge;
            }
        }
        return min;
    }

    /** Largest finite upper radial edge, or NaN when no entry is finite. */
    public double maxRadialEdge() {
        var max = Double.NaN;
        for (var i = 0; i < rad.length; i++) {
            final var edge = rad[i] + 0.5 * Math.abs(dr[i]);
            if (Double.isFinite(edge) && (Double.isNaN(max) || edge > max)) {
                max = edge;
            }
        }
        return max;
    }
}
