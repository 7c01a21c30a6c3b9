package io.github.jakubt4.distslice.geometry;

import io.github.jakubt4.distslice.exception.ShapeMismatchException;
import io.github.jakubt4.distslice.exception.SingularRotationException;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.LUDecomposition;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

import java.util.List;

/**
 * Basis construction primitives shared by the rotation presets and the in-plane
 * orientation step.
 */
public final class RotationMatrices {

    // |a × d| for unit a, d below which the pair is treated as parallel
    private static final double PARALLEL_TOLERANCE = 1.0e-12;

    private static final List<Vector3D> ORDINATES = List.of(Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K);

    private RotationMatrices() {
    }

    /**
     * Builds the rotation whose x axis lies along {@code v1} and whose x-y plane
     * contains {@code v2}. With {@code a = v1/|v1|}, {@code d = v2/|v2|},
     * {@code c = a×d/|a×d|} and {@code b = -(a×c)/|a×c|} the rows {@code [a;b;c]}
     * are inverted, so the columns of the result are the new axes expressed in
     * the incoming frame.
     *
     * @throws SingularRotationException if either vector is zero or they are (anti)parallel
     */
    public static RealMatrix calRot(final Vector3D v1, final Vector3D v2) {
        final var a = normalize(v1, "first reference vector");
        final var d = normalize(v2, "second reference vector");
        final var cross = Vector3D.crossProduct(a, d);
        if (cross.getNorm() <= PARALLEL_TOLERANCE) {
            throw new SingularRotationException("reference vectors %s and %s are parallel".formatted(v1, v2));
        }
        final var c = normalize(cross, "plane normal");
        final var b = normalize(Vector3D.crossProduct(a, c).negate(), "in-plane axis");

        final var rows = MatrixUtils.createRealMatrix(new double[][] {a.toArray(), b.toArray(), c.toArray()});
        return invert(rows, "reference basis");
    }

    /**
     * Orients the slice inside the rotated frame: z along {@code normal}
     * (default z), x along {@code xAxis} projected onto the plane or, when
     * absent, along the ordinate closest to perpendicular to z, and
     * {@code y = z × x}. Columns of the result are the slice x, y, z axes.
     *
     * @throws SingularRotationException if the normal is zero or {@code xAxis} is parallel to it
     */
    public static RealMatrix orientSlice(final Vector3D normal, final Vector3D xAxis) {
        final var z = normalize(normal == null ? Vector3D.PLUS_K : normal, "slice normal");

        final var seed = xAxis != null ? xAxis : mostPerpendicularOrdinate(z);
        final var projected = seed.subtract(z.scalarMultiply(seed.dotProduct(z)));
        if (projected.getNorm() <= PARALLEL_TOLERANCE * Math.max(1.0, seed.getNorm())) {
            throw new SingularRotationException("slice x axis %s is parallel to slice normal %s".formatted(seed, z));
        }
        final var x = normalize(projected, "slice x axis");
        final var y = Vector3D.crossProduct(z, x).normalize();

        final var columns = MatrixUtils.createRealMatrix(3, 3);
        columns.setColumn(0, x.toArray());
        columns.setColumn(1, y.toArray());
        columns.setColumn(2, z.toArray());
        return columns;
    }

    /**
     * @throws SingularRotationException if the matrix cannot be inverted
     */
    public static RealMatrix invert(final RealMatrix matrix, final String what) {
        final var solver = new LUDecomposition(matrix).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularRotationException(what + " is singular");
        }
        return solver.getInverse();
    }

    /**
     * Reads a row-major 3×3 matrix.
     *
     * @throws ShapeMismatchException if {@code values} is not 9 long
     */
    public static RealMatrix fromRowMajor(final double[] values) {
        if (values == null || values.length != 9) {
            throw new ShapeMismatchException("rotation matrix needs 9 row-major values");
        }
        final var matrix = MatrixUtils.createRealMatrix(3, 3);
        for (var row = 0; row < 3; row++) {
            for (var col = 0; col < 3; col++) {
                matrix.setEntry(row, col, values[row * 3 + col]);
            }
        }
        return matrix;
    }

    public static Vector3D apply(final RealMatrix matrix, final Vector3D v) {
        return new Vector3D(matrix.operate(v.toArray()));
    }

    private static Vector3D mostPerpendicularOrdinate(final Vector3D z) {
        var best = ORDINATES.get(0);
        var bestDot = Double.POSITIVE_INFINITY;
        for (final var ordinate : ORDINATES) {
            final var dot = Math.abs(ordinate.dotProduct(z));
            if (dot < bestDot) {
                best = ordinate;
                bestDot = dot;
            }
        }
        return best;
    }

    private static Vector3D normalize(final Vector3D v, final String what) {
        if (v == null) {
            throw new SingularRotationException(what + " is undefined");
        }
        if (!Double.isFinite(v.getNorm())) {
            throw new SingularRotationException("%s %s has no direction".formatted(what, v));
        }
        try {
            return v.normalize();
        } catch (final MathRuntimeException e) {
            throw new SingularRotationException("%s %s has no direction".formatted(what, v), e);
        }
    }
}
