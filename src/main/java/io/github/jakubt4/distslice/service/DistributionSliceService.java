package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.DistributionSample;
import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SliceGrid;
import io.github.jakubt4.distslice.dto.SliceRequest;
import io.github.jakubt4.distslice.dto.SupportData;
import io.github.jakubt4.distslice.dto.SupportVectors;
import io.github.jakubt4.distslice.exception.MissingSupportDataException;
import io.github.jakubt4.distslice.exception.NoDataInRangeException;
import io.github.jakubt4.distslice.geometry.OrientationBasis;
import io.github.jakubt4.distslice.geometry.SupportKind;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.RealMatrix;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the slicing pipeline: selection, aggregation, orientation,
 * rebinning and post-processing, executed synchronously in one call.
 *
 * <p>The service holds no per-call state; independent requests may run on
 * separate threads as long as their inputs are not mutated concurrently.
 */
@Slf4j
@Service
public class DistributionSliceService {

    private final SampleSelector sampleSelector;
    private final DistributionAggregator aggregator;
    private final SupportDataResolver supportDataResolver;
    private final OrientationResolver orientationResolver;
    private final GeometricRebinner rebinner;
    private final SliceSmoother smoother;
    private final int defaultResolution;

    public DistributionSliceService(final SampleSelector sampleSelector,
                                    final DistributionAggregator aggregator,
                                    final SupportDataResolver supportDataResolver,
                                    final OrientationResolver orientationResolver,
                                    final GeometricRebinner rebinner,
                                    final SliceSmoother smoother,
                                    @Value("${slice.resolution:500}") final int defaultResolution) {
        this.sampleSelector = sampleSelector;
        this.aggregator = aggregator;
        this.supportDataResolver = supportDataResolver;
        this.orientationResolver = orientationResolver;
        this.rebinner = rebinner;
        this.smoother = smoother;
        this.defaultResolution = defaultResolution;
    }

    /**
     * Computes one slice.
     *
     * @param samples distributions from the instrument loader, in time order
     * @param support support time series, may be {@code null}
     * @param request slice options
     * @throws NoDataInRangeException       if no usable bin falls in the window
     * @throws MissingSupportDataException  if the rotation or bulk subtraction lacks support data
     * @throws io.github.jakubt4.distslice.exception.SingularRotationException if the orientation is undefined
     * @throws io.github.jakubt4.distslice.exception.ShapeMismatchException    if support rows have the wrong width
     */
    public SliceGrid slice(final List<DistributionSample> samples,
                           final SupportData support,
                           final SliceRequest request) {
        final var resolution = request.resolution() == null ? defaultResolution : request.resolution();
        final var rotation = request.rotationOrDefault();
        final var supportData = support == null ? SupportData.none() : support;

        final var range = sampleSelector.resolveRange(samples, request)
                .orElseThrow(() -> new NoDataInRangeException("No samples to choose from"));
        final var indices = sampleSelector.selectIndices(samples, range);
        if (indices.length == 0) {
            throw new NoDataInRangeException("No samples between t=%s and t=%s".formatted(range.min(), range.max()));
        }
        log.info("Slicing {} sample(s) in [{}, {}], rotation={}, resolution={}",
                indices.length, range.min(), range.max(), rotation.getLabel(), resolution);

        var bins = aggregator.aggregate(samples, indices, request.energy(), request.log(),
                request.energyRange(), request.aggregationOrDefault());

        var logOffset = 0.0;
        if (request.log()) {
            logOffset = bins.minRadialEdge();
            bins = bins.withRadialOffset(logOffset);
        }

        final var vectors = supportDataResolver.resolve(supportData, bins.timeRange());
        final var custom = supportDataResolver.customRotation(supportData.customRotation(), bins.timeRange())
                .orElse(null);
        final var subtractBulk = subtractBulk(request, vectors);

        final var basis = orientationResolver.resolve(rotation, vectors, custom,
                request.sliceNormal(), request.sliceX());

        final var sweepRange = request.sweepRange();
        final var sweep = sweepRange == null
                ? List.<RealMatrix>of()
                : orientationResolver.angleSweep(sweepRange, orientationResolver.planeCount(sweepRange, bins));
        if (!sweep.isEmpty()) {
            log.info("{} over {} planes in [{}, {}] deg", request.sumsPlanes() ? "Summing" : "Averaging",
                    sweep.size() + 1, sweepRange.min(), sweepRange.max());
        }

        final var result = rebinner.rebin(bins, resolution, basis, sweep, request.sumsPlanes());

        var data = result.data();
        if (request.smooth() != null) {
            data = smoother.smooth(data, request.smooth());
        }

        final var xgrid = result.xgrid();
        final var ygrid = result.ygrid();
        if (subtractBulk) {
            final var bulk = basis.toSlice(vectors.bulkVelocity());
            shift(xgrid, bulk.getX());
            shift(ygrid, bulk.getY());
        }

        final var first = samples.get(indices[0]);
        return SliceGrid.builder()
                .data(data)
                .xgrid(xgrid)
                .ygrid(ygrid)
                .radialRange(Interval.of(bins.minRadialEdge(), bins.maxRadialEdge()))
                .dataRange(dataRange(data))
                .rotation(rotation)
                .timeRange(bins.timeRange())
                .sampleCount(bins.sampleCount())
                .unitsName(first.unitsName())
                .species(first.species())
                .energy(request.energy())
                .log(request.log())
                .radialLogOffset(logOffset)
                .orientation(basis.toArray())
                .magneticField(inSlice(basis, vectors.magneticField()))
                .bulkVelocity(inSlice(basis, vectors.bulkVelocity()))
                .sunDirection(inSlice(basis, vectors.sunDirection()))
                .build();
    }

    private static boolean subtractBulk(final SliceRequest request, final SupportVectors vectors) {
        if (!request.subtractBulk()) {
            return false;
        }
        if (request.energy() || request.log()) {
            log.warn("Bulk velocity subtraction only applies to linear velocity slices, ignoring it");
            return false;
        }
        if (vectors.bulkVelocity() == null) {
            throw new MissingSupportDataException("bulk velocity subtraction", SupportKind.BULK_VELOCITY.getLabel());
        }
        return true;
    }

    private static void shift(final double[] axis, final double offset) {
        for (var i = 0; i < axis.length; i++) {
            axis[i] -= offset;
        }
    }

    private static Vector3D inSlice(final OrientationBasis basis, final Vector3D v) {
        return v == null ? null : basis.toSlice(v);
    }

    /**
     * Smallest positive and largest finite value. A slice with no positive value
     * reports {@code [max, max]}; one with no finite value {@code [0, 0]}.
     */
    static Interval dataRange(final double[][] data) {
        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (final var row : data) {
            for (final var v : row) {
                if (!Double.isFinite(v)) {
                    continue;
                }
                max = Math.max(max, v);
                if (v > 0) {
                    min = Math.min(min, v);
                }
            }
        }
        if (Double.isInfinite(max)) {
            return Interval.of(0.0, 0.0);
        }
        if (Double.isInfinite(min)) {
            return Interval.of(max, max);
        }
        return Interval.of(min, max);
    }
}
