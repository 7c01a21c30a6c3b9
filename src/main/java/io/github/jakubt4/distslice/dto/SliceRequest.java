package io.github.jakubt4.distslice.dto;

import io.github.jakubt4.distslice.geometry.RotationPreset;
import lombok.Builder;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Options for one slice computation. Unset members fall back to engine defaults.
 *
 * <p>The aggregation window is chosen by exactly one of: {@code timeRange};
 * {@code time} + {@code window} (forward, or centred when {@code centerTime});
 * {@code time} + {@code samples}; or {@code time} alone (nearest sample).
 *
 * @param timeRange    explicit window, seconds
 * @param time         target time, seconds
 * @param window       window length from {@code time}, seconds
 * @param centerTime   centre the window on {@code time}
 * @param samples      number of samples nearest to {@code time}
 * @param rotation     physical frame preset, defaults to {@link RotationPreset#XY}
 * @param sliceNormal  slice plane normal in the rotated frame, defaults to z
 * @param sliceX       slice x direction in the rotated frame, projected onto the plane
 * @param resolution   output grid size N
 * @param energy       radial axis is energy (eV) instead of velocity (km/s)
 * @param log          log10-scale the radial axis
 * @param subtractBulk shift axes into the bulk flow rest frame
 * @param averageAngle average over planes rotated about the slice x axis, degrees
 * @param sumAngle     sum over planes rotated about the slice x axis, degrees
 * @param energyRange  only aggregate bins whose energy lies inside, eV
 * @param aggregation  how samples are combined
 * @param smooth       width in pixels of the gaussian smoothing window
 */
@Builder(toBuilder = true)
public record SliceRequest(Interval timeRange,
                           Double time,
                           Double window,
                           boolean centerTime,
                           Integer samples,
                           RotationPreset rotation,
                           Vector3D sliceNormal,
                           Vector3D sliceX,
                           Integer resolution,
                           boolean energy,
                           boolean log,
                           boolean subtractBulk,
                           Interval averageAngle,
                           Interval sumAngle,
                           Interval energyRange,
                           AggregationMode aggregation,
                           Integer smooth) {

    public RotationPreset rotationOrDefault() {
        return rotation == null ? RotationPreset.XY : rotation;
    }

    public AggregationMode aggregationOrDefault() {
        return aggregation == null ? AggregationMode.AVERAGE : aggregation;
    }

    /** Angle range of the plane sweep, whichever of average/sum was requested. */
    public Interval sweepRange() {
        return sumAngle != null ? sumAngle : averageAngle;
    }

    public boolean sumsPlanes() {
        return sumAngle != null;
    }
}
