package io.github.jakubt4.distslice.dto;

import io.github.jakubt4.distslice.geometry.RotationPreset;
import lombok.Builder;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Result of one slice computation, handed to a renderer.
 *
 * <p>{@code data[i][j]} is the value at {@code (xgrid[i], ygrid[j])}. Pixels no
 * bin covers hold 0. Support vectors are expressed in slice coordinates and are
 * {@code null} when not supplied.
 *
 * @param radialRange     smallest lower to largest upper radial bin edge
 * @param dataRange       smallest positive to largest output value
 * @param radialLogOffset log10 value subtracted from radii in log mode, 0 otherwise
 * @param orientation     slice to data frame matrix, columns are the slice axes
 */
@Builder
public record SliceGrid(double[][] data,
                        double[] xgrid,
                        double[] ygrid,
                        Interval radialRange,
                        Interval dataRange,
                        RotationPreset rotation,
                        Interval timeRange,
                        int sampleCount,
                        String unitsName,
                        String species,
                        boolean energy,
                        boolean log,
                        double radialLogOffset,
                        double[][] orientation,
                        Vector3D magneticField,
                        Vector3D bulkVelocity,
                        Vector3D sunDirection) {

    public int resolution() {
        return xgrid.length;
    }

    public Interval xrange() {
        return new Interval(xgrid[0], xgrid[xgrid.length - 1]);
    }

    public Interval yrange() {
        return new Interval(ygrid[0], ygrid[ygrid.length - 1]);
    }
}
