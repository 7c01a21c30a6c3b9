package io.github.jakubt4.distslice.dto;

import lombok.Builder;

/**
 * Auxiliary time series used only to orient the slice. Any member may be
 * {@code null}; presets that need a missing member fail with
 * {@link io.github.jakubt4.distslice.exception.MissingSupportDataException}.
 *
 * @param magneticField  B vectors
 * @param bulkVelocity   bulk flow vectors, km/s
 * @param sunDirection   sun direction vectors
 * @param customRotation row-major 3×3 matrices mapping data coordinates into a custom frame
 */
@Builder
public record SupportData(TimeSeries magneticField,
                          TimeSeries bulkVelocity,
                          TimeSeries sunDirection,
                          TimeSeries customRotation) {

    public static SupportData none() {
        return new SupportData(null, null, null, null);
    }
}
