package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.DistributionSample;
import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SliceRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static io.github.jakubt4.distslice.support.TestDistributions.wholeSphere;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleSelectorTest {

    private final SampleSelector selector = new SampleSelector();

    // midpoints 0.5, 1.5, 2.5, 3.5
    private final List<DistributionSample> samples = IntStream.range(0, 4)
            .mapToObj(t -> wholeSphere(t, t + 1, new double[] {100.0}, 1.0))
            .toList();

    @Test
    void explicitRangeSelectsByMidpoint() {
        final var request = SliceRequest.builder().timeRange(Interval.of(1.0, 3.0)).build();

        final var range = selector.resolveRange(samples, request).orElseThrow();

        assertThat(selector.selectIndices(samples, range)).containsExactly(1, 2);
    }

    @Test
    void rangeBoundsAreInclusive() {
        assertThat(selector.selectIndices(samples, Interval.of(0.5, 2.5))).containsExactly(0, 1, 2);
    }

    @Test
    void windowRunsForwardFromTime() {
        final var request = SliceRequest.builder().time(1.0).window(2.0).build();

        assertThat(selector.resolveRange(samples, request)).contains(Interval.of(1.0, 3.0));
    }

    @Test
    void centeredWindowStraddlesTime() {
        final var request = SliceRequest.builder().time(2.0).window(2.0).centerTime(true).build();

        assertThat(selector.resolveRange(samples, request)).contains(Interval.of(1.0, 3.0));
    }

    @Test
    void nearestSamplesDefineTheWindow() {
        final var request = SliceRequest.builder().time(2.2).samples(2).build();

        final var range = selector.resolveRange(samples, request).orElseThrow();

        assertThat(range).isEqualTo(Interval.of(1.0, 3.0));
        assertThat(selector.selectIndices(samples, range)).containsExactly(1, 2);
    }

    @Test
    void nearestTakesWhatIsAvailableWhenCountExceedsInput() {
        final var range = selector.nearest(samples, 10.0, 50).orElseThrow();

        assertThat(range).isEqualTo(Interval.of(0.0, 4.0));
    }

    @Test
    void timeAloneSelectsNearestSample() {
        final var request = SliceRequest.builder().time(0.4).build();

        final var range = selector.resolveRange(samples, request).orElseThrow();

        assertThat(selector.selectIndices(samples, range)).containsExactly(0);
    }

    @Test
    void nearestOnEmptyInputIsEmpty() {
        assertThat(selector.nearest(List.of(), 1.0, 3)).isEmpty();
    }

    @Test
    void windowOutsideDataSelectsNothing() {
        assertThat(selector.selectIndices(samples, Interval.of(100.0, 200.0))).isEmpty();
    }

    @Test
    void requestWithoutTimeIsRejected() {
        final var request = SliceRequest.builder().samples(3).build();

        assertThatThrownBy(() -> selector.resolveRange(samples, request))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
