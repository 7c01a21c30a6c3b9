package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.AggregatedBinSet;
import io.github.jakubt4.distslice.dto.AggregationMode;
import io.github.jakubt4.distslice.dto.DistributionSample;
import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.exception.NoDataInRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the selected samples into one flat list of bins.
 *
 * <p>Runs of samples with identical bin geometry are accumulated bin by bin;
 * each run is collated (averaged or summed, flattened, zero-weight bins dropped)
 * when the geometry changes and once more after the last sample. Collated runs
 * are appended in time order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributionAggregator {

    private final BinCompatibilityChecker compatibilityChecker;
    private final SphericalGeometryExtractor geometryExtractor;

    /**
     * @param samples     all samples
     * @param indices     selected sample indices, in aggregation order
     * @param energy      radial coordinate is energy instead of velocity
     * @param logScale    log10-scaled radial coordinate
     * @param energyRange optional inclusive filter on bin energy, eV
     * @param mode        average or sum over samples
     * @throws NoDataInRangeException if no bin survives
     */
    public AggregatedBinSet aggregate(final List<DistributionSample> samples,
                                      final int[] indices,
                                      final boolean energy,
                                      final boolean logScale,
                                      final Interval energyRange,
                                      final AggregationMode mode) {
        if (indices.length == 0) {
            throw new NoDataInRangeException("No samples selected");
        }

        final var segments = new ArrayList<Segment>();
        Accumulation current = null;
        var start = Double.POSITIVE_INFINITY;
        var end = Double.NEGATIVE_INFINITY;

        for (final var index : indices) {
            final var sample = samples.get(index);
            if (current != null && !compatibilityChecker.compatible(current.reference, sample)) {
                segments.add(collate(current, energy, logScale, mode));
                current = null;
            }
            if (current == null) {
                current = new Accumulation(sample);
            }
            current.add(sample, energyRange);
            start = Math.min(start, sample.startTime());
            end = Math.max(end, sample.endTime());
        }
        segments.add(collate(current, energy, logScale, mode));

        final var result = concatenate(segments, indices.length, Interval.of(start, end));
        if (result.isEmpty()) {
            throw new NoDataInRangeException("No valid data in the %d selected samples".formatted(indices.length));
        }
        log.debug("Aggregated {} samples into {} bins across {} segment(s)",
                indices.length, result.size(), segments.size());
        return result;
    }

    private Segment collate(final Accumulation accumulation, final boolean energy, final boolean logScale,
                            final AggregationMode mode) {
        final var geometry = geometryExtractor.extract(accumulation.reference, energy, logScale);
        final var weight = accumulation.weight;
        final var sum = accumulation.sum;

        final var kept = new ArrayList<Integer>();
        for (var i = 0; i < weight.length; i++) {
            if (weight[i] > 0) {
                kept.add(i);
            }
        }

        final var segment = new Segment(kept.size());
        for (var k = 0; k < kept.size(); k++) {
            final int i = kept.get(k);
            segment.data[k] = mode == AggregationMode.SUM ? sum[i] : sum[i] / weight[i];
            segment.rad[k] = geometry.rad()[i];
            segment.phi[k] = geometry.phi()[i];
            segment.theta[k] = geometry.theta()[i];
            segment.dr[k] = geometry.dr()[i];
            segment.dp[k] = geometry.dp()[i];
            segment.dt[k] = geometry.dt()[i];
        }
        log.debug("Collated {} sample(s): {} of {} bins kept", accumulation.count, kept.size(), weight.length);
        return segment;
    }

    private static AggregatedBinSet concatenate(final List<Segment> segments, final int sampleCount,
                                                final Interval timeRange) {
        final var total = segments.stream().mapToInt(s -> s.data.length).sum();
        final var out = new Segment(total);
        var offset = 0;
        for (final var s : segments) {
            final var n = s.data.length;
            System.arraycopy(s.data, 0, out.data, offset, n);
            System.arraycopy(s.rad, 0, out.rad, offset, n);
            System.arraycopy(s.phi, 0, out.phi, offset, n);
            System.arraycopy(s.theta, 0, out.theta, offset, n);
            System.arraycopy(s.dr, 0, out.dr, offset, n);
            System.arraycopy(s.dp, 0, out.dp, offset, n);
            System.arraycopy(s.dt, 0, out.dt, offset, n);
            offset += n;
        }
        return new AggregatedBinSet(out.data, out.rad, out.phi, out.theta, out.dr, out.dp, out.dt,
                sampleCount, timeRange);
    }

    /** Running per-bin sums for one run of compatible samples. */
    private static final class Accumulation {

        private final DistributionSample reference;
        private final double[] weight;
        private final double[] sum;
        private int count;

        Accumulation(final DistributionSample reference) {
            this.reference = reference;
            this.weight = new double[reference.shape().size()];
            this.sum = new double[reference.shape().size()];
        }

        void add(final DistributionSample sample, final Interval energyRange) {
            final var data = sample.data();
            for (var i = 0; i < data.length; i++) {
                if (sample.bins()[i] == 0 || !Double.isFinite(data[i])) {
                    continue;
                }
                if (energyRange != null && !energyRange.contains(sample.energy()[i])) {
                    continue;
                }
                weight[i] += 1;
                sum[i] += data[i];
            }
            count++;
        }
    }

    private static final class Segment {

        private final double[] data;
        private final double[] rad;
        private final double[] phi;
        private final double[] theta;
        private final double[] dr;
        private final double[] dp;
        private final double[] dt;

        Segment(final int size) {
            data = new double[size];
            rad = new double[size];
            phi = new double[size];
            theta = new double[size];
            dr = new double[size];
            dp = new double[size];
            dt = new double[size];
        }
    }
}
