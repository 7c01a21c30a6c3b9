package io.github.jakubt4.distslice.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.RealMatrix;

/**
 * Slice-to-data transform. Column {@code k} of {@link #matrix()} is slice axis
 * {@code k} expressed in the instrument frame, so {@code matrix · u} maps slice
 * coordinates {@code u} to data coordinates.
 */
public final class OrientationBasis {

    private final RealMatrix matrix;
    private final RealMatrix inverse;

    private OrientationBasis(final RealMatrix matrix, final RealMatrix inverse) {
        this.matrix = matrix;
        this.inverse = inverse;
    }

    /**
     * @throws io.github.jakubt4.distslice.exception.SingularRotationException if the matrix is singular
     */
    public static OrientationBasis of(final RealMatrix matrix) {
        final var copy = matrix.copy();
        return new OrientationBasis(copy, RotationMatrices.invert(copy, "orientation matrix"));
    }

    public RealMatrix matrix() {
        return matrix.copy();
    }

    public double[][] toArray() {
        return matrix.getData();
    }

    public Vector3D toData(final Vector3D slice) {
        return RotationMatrices.apply(matrix, slice);
    }

    public Vector3D toSlice(final Vector3D data) {
        return RotationMatrices.apply(inverse, data);
    }

    /** Basis for a plane rotated by {@code planeRotation}, given in slice coordinates. */
    public RealMatrix rotatedBy(final RealMatrix planeRotation) {
        return matrix.multiply(planeRotation);
    }
}
