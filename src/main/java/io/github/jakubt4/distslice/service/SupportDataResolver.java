package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SupportData;
import io.github.jakubt4.distslice.dto.SupportVectors;
import io.github.jakubt4.distslice.dto.TimeSeries;
import io.github.jakubt4.distslice.geometry.RotationMatrices;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.analysis.interpolation.LinearInterpolator;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.RealMatrix;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Reduces support time series to one value per slice window.
 *
 * <p>Rows tagged inside the window are averaged component by component; rows
 * holding a non-finite component are skipped. When no row falls inside, the
 * series is linearly interpolated to the window centre (held constant beyond
 * its ends). Rows whose time does not advance past the previous finite row are
 * left out of the interpolation.
 */
@Slf4j
@Service
public class SupportDataResolver {

    private static final int VECTOR_WIDTH = 3;
    private static final int MATRIX_WIDTH = 9;

    public SupportVectors resolve(final SupportData support, final Interval range) {
        if (support == null) {
            return SupportVectors.none();
        }
        return new SupportVectors(
                vector(support.magneticField(), range, "magnetic field").orElse(null),
                vector(support.bulkVelocity(), range, "bulk velocity").orElse(null),
                vector(support.sunDirection(), range, "sun direction").orElse(null));
    }

    /**
     * @throws io.github.jakubt4.distslice.exception.ShapeMismatchException if rows are not 3-vectors
     */
    public Optional<Vector3D> vector(final TimeSeries series, final Interval range, final String name) {
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        series.requireWidth(name, VECTOR_WIDTH);
        return average(series, range, name).map(Vector3D::new);
    }

    /**
     * Element-wise time average of the custom rotation matrices. The average of
     * rotation matrices is generally not itself a rotation.
     *
     * @throws io.github.jakubt4.distslice.exception.ShapeMismatchException if rows are not 9 long
     */
    public Optional<RealMatrix> customRotation(final TimeSeries series, final Interval range) {
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        series.requireWidth("custom rotation", MATRIX_WIDTH);
        return average(series, range, "custom rotation").map(RotationMatrices::fromRowMajor);
    }

    Optional<double[]> average(final TimeSeries series, final Interval range, final String name) {
        final var times = series.times();
        final var values = series.values();
        final var width = values[0].length;

        final var sum = new double[width];
        var count = 0;
        for (var i = 0; i < times.length; i++) {
            if (range.contains(times[i]) && allFinite(values[i])) {
                for (var k = 0; k < width; k++) {
                    sum[k] += values[i][k];
                }
                count++;
            }
        }
        if (count > 0) {
            for (var k = 0; k < width; k++) {
                sum[k] /= count;
            }
            log.debug("Averaged {} {} rows over [{}, {}]", count, name, range.min(), range.max());
            return Optional.of(sum);
        }

        log.debug("No {} rows inside [{}, {}], interpolating to {}", name, range.min(), range.max(), range.center());
        return interpolate(times, values, range.center());
    }

    private static Optional<double[]> interpolate(final double[] times, final double[][] values, final double t) {
        final var knots = new ArrayList<Integer>();
        for (var i = 0; i < times.length; i++) {
            if (allFinite(values[i]) && (knots.isEmpty() || times[i] > times[knots.get(knots.size() - 1)])) {
                knots.add(i);
            }
        }
        if (knots.isEmpty()) {
            return Optional.empty();
        }
        final var first = knots.get(0);
        final var last = knots.get(knots.size() - 1);
        if (knots.size() == 1 || t <= times[first]) {
            return Optional.of(values[first].clone());
        }
        if (t >= times[last]) {
            return Optional.of(values[last].clone());
        }

        final var x = knots.stream().mapToDouble(i -> times[i]).toArray();
        final var out = new double[values[first].length];
        final var interpolator = new LinearInterpolator();
        for (var k = 0; k < out.length; k++) {
            final var component = k;
            final var y = knots.stream().mapToDouble(i -> values[i][component]).toArray();
            out[k] = interpolator.interpolate(x, y).value(t);
        }
        return Optional.of(out);
    }

    private static boolean allFinite(final double[] row) {
        for (final var v : row) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
