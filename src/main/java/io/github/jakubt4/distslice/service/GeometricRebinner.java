package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.AggregatedBinSet;
import io.github.jakubt4.distslice.exception.NoDataInRangeException;
import io.github.jakubt4.distslice.geometry.OrientationBasis;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.linear.RealMatrix;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Rebins spherical instrument bins onto a uniform square grid in the slice plane.
 *
 * <p>Each grid point is rotated into the instrument frame and converted to
 * (phi, theta, r). Every bin then claims the grid points inside its box:
 * <pre>
 *   theta:  (θ - dθ/2, θ + dθ/2]
 *   phi:    (φ - dφ/2, φ + dφ/2]   limits folded into [-180, 180]; wrapped when lo &gt; hi
 *   r:      [r - dr/2, r + dr/2)
 * </pre>
 * Claimed points accumulate the bin value and one unit of weight; overlapping
 * bins are averaged, regardless of which sample they came from. Points no bin
 * claims end up as 0.
 *
 * <p>Candidates for the radial test come from a per-plane index of grid points
 * sorted by radius, so each bin only visits the points inside its radial shell.
 * All buffers belong to a single call.
 */
@Slf4j
@Service
public class GeometricRebinner {

    private final Clock clock;
    private final Duration progressInterval;
    private final double tolerance;

    public GeometricRebinner(final Clock clock,
                             @Value("${slice.progress-interval:6s}") final Duration progressInterval,
                             @Value("${slice.angle-tolerance:5.0e-7}") final double tolerance) {
        this.clock = clock;
        this.progressInterval = progressInterval;
        this.tolerance = tolerance;
    }

    /**
     * @param bins       aggregated bins
     * @param resolution grid points per axis
     * @param basis      slice orientation
     * @param sweep      extra plane rotations about the slice x axis (slice coordinates), may be empty
     * @param sum        add plane contributions instead of averaging them
     * @throws NoDataInRangeException if no bin has finite radial geometry
     */
    public Result rebin(final AggregatedBinSet bins,
                        final int resolution,
                        final OrientationBasis basis,
                        final List<RealMatrix> sweep,
                        final boolean sum) {
        if (resolution < 2) {
            throw new IllegalArgumentException("Resolution must be at least 2, got " + resolution);
        }

        final var extent = maxAbsFinite(bins.rad()) + maxAbsFinite(bins.dr());
        if (!Double.isFinite(extent)) {
            throw new NoDataInRangeException("No bin has a valid radial extent");
        }
        final var grid = linspace(-extent, extent, resolution);

        final var planes = new ArrayList<RealMatrix>();
        planes.add(basis.matrix());
        sweep.forEach(rotation -> planes.add(basis.rotatedBy(rotation)));

        final var points = resolution * resolution;
        final var weight = new double[points];
        final var value = new double[points];

        final var progress = new Progress(planes.size() * (long) bins.size());
        for (final var plane : planes) {
            final var coords = PlaneCoordinates.of(plane, grid);
            for (var i = 0; i < bins.size(); i++) {
                accumulate(bins, i, coords, weight, value);
                progress.step();
            }
        }

        final var data = new double[resolution][resolution];
        for (var p = 0; p < points; p++) {
            final var w = weight[p] == 0 ? 1.0 : weight[p];
            data[p % resolution][p / resolution] = sum ? value[p] : value[p] / w;
        }

        log.debug("Rebinned {} bins over {} plane(s) onto {}x{} grid", bins.size(), planes.size(),
                resolution, resolution);
        return new Result(data, grid, grid.clone());
    }

    private void accumulate(final AggregatedBinSet bins, final int i, final PlaneCoordinates coords,
                            final double[] weight, final double[] value) {
        final var datum = bins.data()[i];
        if (datum == 0 || !Double.isFinite(datum)) {
            return;
        }
        final var rad = bins.rad()[i];
        final var dr = Math.abs(bins.dr()[i]);
        final var theta = bins.theta()[i];
        final var dt = bins.dt()[i];
        final var phi = bins.phi()[i];
        final var dp = bins.dp()[i];
        if (!allFinite(rad, dr, theta, dt, phi, dp)) {
            return;
        }

        final var thetaLow = snap(theta - 0.5 * dt, tolerance);
        final var thetaHigh = snap(theta + 0.5 * dt, tolerance);
        final var phiLimits = phiLimits(phi, dp, tolerance);

        final var first = lowerBound(coords.sortedR, rad - 0.5 * dr);
        final var last = lowerBound(coords.sortedR, rad + 0.5 * dr);
        for (var k = first; k < last; k++) {
            final var p = coords.order[k];
            final var t = coords.theta[p];
            if (t > thetaLow && t <= thetaHigh && phiMatches(phiLimits, coords.phi[p])) {
                weight[p] += 1;
                value[p] += datum;
            }
        }
    }

    /**
     * Phi interval of a bin folded into [-180, 180]; {@code null} when the bin
     * spans the full circle.
     */
    static double[] phiLimits(final double phi, final double dp, final double tolerance) {
        if (Math.abs(dp) >= 360.0) {
            return null;
        }
        return new double[] {
                snap(fold(phi - 0.5 * dp), tolerance),
                snap(fold(phi + 0.5 * dp), tolerance)
        };
    }

    static boolean phiMatches(final double[] limits, final double phi) {
        if (limits == null) {
            return true;
        }
        if (limits[0] > limits[1]) {
            return phi > limits[0] || phi <= limits[1];
        }
        return phi > limits[0] && phi <= limits[1];
    }

    static double fold(final double angle) {
        var folded = angle;
        while (folded > 180.0) {
            folded -= 360.0;
        }
        while (folded < -180.0) {
            folded += 360.0;
        }
        return folded;
    }

    /** Rounds values within {@code tolerance} of an integer to that integer. */
    static double snap(final double value, final double tolerance) {
        final var rounded = Math.rint(value);
        return Math.abs(value - rounded) < tolerance ? rounded : value;
    }

    /** First index whose value is {@code >= key}. */
    static int lowerBound(final double[] sorted, final double key) {
        var lo = 0;
        var hi = sorted.length;
        while (lo < hi) {
            final var mid = (lo + hi) >>> 1;
            if (sorted[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    static double[] linspace(final double start, final double stop, final int n) {
        final var out = new double[n];
        final var step = (stop - start) / (n - 1);
        for (var i = 0; i < n; i++) {
            out[i] = start + i * step;
        }
        out[n - 1] = stop;
        return out;
    }

    private static double maxAbsFinite(final double[] values) {
        var max = Double.NaN;
        for (final var v : values) {
            if (Double.isFinite(v) && (Double.isNaN(max) || Math.abs(v) > max)) {
                max = Math.abs(v);
            }
        }
        return max;
    }

    private static boolean allFinite(final double... values) {
        for (final var v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rebinned values, {@code data[i][j]} at {@code (xgrid[i], ygrid[j])}.
     */
    public record Result(double[][] data, double[] xgrid, double[] ygrid) {
    }

    /** Spherical coordinates of every grid point of one plane plus the radius index. */
    private static final class PlaneCoordinates {

        private final double[] phi;
        private final double[] theta;
        private final double[] sortedR;
        private final int[] order;

        private PlaneCoordinates(final double[] phi, final double[] theta, final double[] sortedR,
                                 final int[] order) {
            this.phi = phi;
            this.theta = theta;
            this.sortedR = sortedR;
            this.order = order;
        }

        static PlaneCoordinates of(final RealMatrix plane, final double[] grid) {
            final var n = grid.length;
            final var points = n * n;
            final var phi = new double[points];
            final var theta = new double[points];
            final var r = new double[points];

            final var m = plane.getData();
            for (var p = 0; p < points; p++) {
                final var u = grid[p % n];
                final var v = grid[p / n];
                final var x = m[0][0] * u + m[0][1] * v;
                final var y = m[1][0] * u + m[1][1] * v;
                final var z = m[2][0] * u + m[2][1] * v;
                final var rho = Math.sqrt(x * x + y * y);
                phi[p] = Math.toDegrees(Math.atan2(y, x));
                theta[p] = Math.toDegrees(Math.atan2(z, rho));
                r[p] = Math.sqrt(x * x + y * y + z * z);
            }

            final var order = IntStream.range(0, points)
                    .boxed()
                    .sorted(Comparator.comparingDouble(p -> r[p]))
                    .mapToInt(Integer::intValue)
                    .toArray();
            final var sortedR = new double[points];
            for (var k = 0; k < points; k++) {
                sortedR[k] = r[order[k]];
            }
            return new PlaneCoordinates(phi, theta, sortedR, order);
        }
    }

    /** Logs percentage complete at most once per {@code progressInterval}. */
    private final class Progress {

        private final long total;
        private long done;
        private long lastReport;

        Progress(final long total) {
            this.total = total;
            this.lastReport = clock.millis();
        }

        void step() {
            done++;
            final var now = clock.millis();
            if (now - lastReport > progressInterval.toMillis()) {
                log.info("Rebinning {}% complete", total == 0 ? 100 : 100 * done / total);
                lastReport = now;
            }
        }
    }
}
