package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.AggregatedBinSet;
import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SupportVectors;
import io.github.jakubt4.distslice.exception.MissingSupportDataException;
import io.github.jakubt4.distslice.geometry.OrientationBasis;
import io.github.jakubt4.distslice.geometry.Quaternions;
import io.github.jakubt4.distslice.geometry.RotationMatrices;
import io.github.jakubt4.distslice.geometry.RotationPreset;
import io.github.jakubt4.distslice.geometry.SupportKind;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Composes the slice orientation.
 *
 * <p>Stages, applied in order: the optional custom rotation {@code C}, the named
 * physical rotation {@code P} built from support vectors expressed in the custom
 * frame, and the in-plane orientation {@code O}. The resulting slice-to-data
 * matrix is {@code C⁻¹ · P · O}.
 */
@Slf4j
@Service
public class OrientationResolver {

    private static final int MIN_SWEEP_PLANES = 2;

    /**
     * @param preset      named physical rotation
     * @param support     averaged support vectors, data frame
     * @param custom      custom rotation (data to custom frame), or {@code null}
     * @param sliceNormal slice normal in the rotated frame, or {@code null} for z
     * @param sliceX      slice x direction in the rotated frame, or {@code null}
     * @throws MissingSupportDataException if the preset needs absent support data
     * @throws io.github.jakubt4.distslice.exception.SingularRotationException if the basis is undefined
     */
    public OrientationBasis resolve(final RotationPreset preset,
                                    final SupportVectors support,
                                    final RealMatrix custom,
                                    final Vector3D sliceNormal,
                                    final Vector3D sliceX) {
        requireSupport(preset, support, custom);

        final var customMatrix = custom == null ? MatrixUtils.createRealIdentityMatrix(3) : custom;
        final var b = rotate(customMatrix, support.magneticField());
        final var v = rotate(customMatrix, support.bulkVelocity());

        final var physical = preset.referencePair(b, v)
                .map(pair -> RotationMatrices.calRot(pair.first(), pair.second()))
                .orElseGet(() -> MatrixUtils.createRealIdentityMatrix(3));
        final var orient = RotationMatrices.orientSlice(sliceNormal, sliceX);

        var composed = physical.multiply(orient);
        if (custom != null) {
            composed = RotationMatrices.invert(custom, "custom rotation").multiply(composed);
        }

        log.debug("Resolved rotation [{}]{}", preset.getLabel(), custom != null ? " after custom rotation" : "");
        return OrientationBasis.of(composed);
    }

    /**
     * Rotations about the slice x axis, linearly spaced over {@code range}
     * (degrees), in slice coordinates.
     */
    public List<RealMatrix> angleSweep(final Interval range, final int planes) {
        final var count = Math.max(MIN_SWEEP_PLANES, planes);
        final var angles = new double[count];
        for (var i = 0; i < count; i++) {
            angles[i] = Math.toRadians(range.min() + range.width() * i / (count - 1));
        }
        return Quaternions.qtom(Quaternions.qcompose(Vector3D.PLUS_I, angles));
    }

    /**
     * Number of sweep planes so that consecutive planes are no further apart
     * than the finest angular bin width; at least two.
     */
    public int planeCount(final Interval range, final AggregatedBinSet bins) {
        var step = Double.POSITIVE_INFINITY;
        for (var i = 0; i < bins.size(); i++) {
            step = finerOf(step, bins.dp()[i]);
            step = finerOf(step, bins.dt()[i]);
        }
        if (Double.isInfinite(step)) {
            return MIN_SWEEP_PLANES;
        }
        return Math.max(MIN_SWEEP_PLANES, (int) Math.ceil(range.width() / step));
    }

    private static double finerOf(final double current, final double width) {
        return Double.isFinite(width) && width > 0 ? Math.min(current, width) : current;
    }

    private static void requireSupport(final RotationPreset preset, final SupportVectors support,
                                       final RealMatrix custom) {
        final var requiredBy = "rotation " + preset.getLabel();
        if (preset.requires(SupportKind.CUSTOM_ROTATION) && custom == null) {
            throw new MissingSupportDataException(requiredBy, SupportKind.CUSTOM_ROTATION.getLabel());
        }
        if (preset.requires(SupportKind.MAGNETIC_FIELD) && support.magneticField() == null) {
            throw new MissingSupportDataException(requiredBy, SupportKind.MAGNETIC_FIELD.getLabel());
        }
        if (preset.requires(SupportKind.BULK_VELOCITY) && support.bulkVelocity() == null) {
            throw new MissingSupportDataException(requiredBy, SupportKind.BULK_VELOCITY.getLabel());
        }
    }

    private static Vector3D rotate(final RealMatrix matrix, final Vector3D v) {
        return v == null ? null : RotationMatrices.apply(matrix, v);
    }
}
