package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.DistributionSample;
import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SliceRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Picks the samples that make up one slice. A sample belongs to a window when
 * its midpoint {@code (start + end) / 2} lies inside it, bounds included.
 */
@Slf4j
@Service
public class SampleSelector {

    /**
     * Resolves the aggregation window from the request.
     *
     * @return the window, or empty when N-nearest selection has no samples to choose from
     * @throws IllegalArgumentException if neither a time range nor a time is given
     */
    public Optional<Interval> resolveRange(final List<DistributionSample> samples, final SliceRequest request) {
        if (request.timeRange() != null) {
            return Optional.of(request.timeRange());
        }
        if (request.time() == null) {
            throw new IllegalArgumentException("Either a time range or a time is required");
        }

        final double time = request.time();
        if (request.window() != null) {
            final double window = request.window();
            return Optional.of(request.centerTime()
                    ? Interval.of(time - 0.5 * window, time + 0.5 * window)
                    : Interval.of(time, time + window));
        }

        final var count = request.samples() == null ? 1 : request.samples();
        return nearest(samples, time, count);
    }

    /**
     * Window spanning the {@code count} samples whose midpoints are closest to
     * {@code time}: earliest start to latest end of the chosen samples.
     */
    public Optional<Interval> nearest(final List<DistributionSample> samples, final double time, final int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Sample count must be positive, got " + count);
        }
        final var chosen = samples.stream()
                .sorted(Comparator.comparingDouble(s -> Math.abs(s.midTime() - time)))
                .limit(count)
                .toList();
        if (chosen.isEmpty()) {
            return Optional.empty();
        }

        final var start = chosen.stream().mapToDouble(DistributionSample::startTime).min().orElseThrow();
        final var end = chosen.stream().mapToDouble(DistributionSample::endTime).max().orElseThrow();
        log.debug("{} nearest samples to t={} span [{}, {}]", chosen.size(), time, start, end);
        return Optional.of(Interval.of(start, end));
    }

    /**
     * Indices, in input order, of the samples whose midpoint lies in {@code range}.
     */
    public int[] selectIndices(final List<DistributionSample> samples, final Interval range) {
        return IntStream.range(0, samples.size())
                .filter(i -> range.contains(samples.get(i).midTime()))
                .toArray();
    }
}
