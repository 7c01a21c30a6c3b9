package io.github.jakubt4.distslice.geometry;

import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * Quaternion helpers for the angle sweep, backed by Hipparchus {@link Rotation}.
 * Angles are radians; rotations act on vectors (counter-clockwise about the axis).
 */
public final class Quaternions {

    private Quaternions() {
    }

    /**
     * Unit quaternion rotating by {@code angle} about {@code axis}.
     *
     * @throws org.hipparchus.exception.MathIllegalArgumentException if the axis has zero norm
     */
    public static Rotation qcompose(final Vector3D axis, final double angle) {
        return new Rotation(axis, angle, RotationConvention.VECTOR_OPERATOR);
    }

    public static List<Rotation> qcompose(final Vector3D axis, final double[] angles) {
        final var out = new ArrayList<Rotation>(angles.length);
        for (final var angle : angles) {
            out.add(qcompose(axis, angle));
        }
        return out;
    }

    /** Rotation matrix {@code M} of a quaternion, with {@code M · v} the rotated vector. */
    public static RealMatrix qtom(final Rotation q) {
        return MatrixUtils.createRealMatrix(q.getMatrix());
    }

    public static List<RealMatrix> qtom(final List<Rotation> quaternions) {
        final var out = new ArrayList<RealMatrix>(quaternions.size());
        for (final var q : quaternions) {
            out.add(qtom(q));
        }
        return out;
    }
}
