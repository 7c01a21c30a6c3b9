package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.Interval;
import io.github.jakubt4.distslice.dto.SupportData;
import io.github.jakubt4.distslice.dto.TimeSeries;
import io.github.jakubt4.distslice.exception.ShapeMismatchException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupportDataResolverTest {

    private final SupportDataResolver resolver = new SupportDataResolver();

    private final TimeSeries field = new TimeSeries(
            new double[] {0.0, 1.0, 2.0, 10.0},
            new double[][] {{1, 0, 0}, {2, 0, 3}, {3, 0, 6}, {100, 100, 100}});

    @Test
    void averagesRowsInsideWindow() {
        final var b = resolver.vector(field, Interval.of(0.0, 2.0), "magnetic field").orElseThrow();

        assertThat(b).isEqualTo(new Vector3D(2, 0, 3));
    }

    @Test
    void skipsNonFiniteRows() {
        final var series = new TimeSeries(
                new double[] {0.0, 1.0},
                new double[][] {{Double.NaN, 0, 0}, {4, 5, 6}});

        assertThat(resolver.vector(series, Interval.of(0.0, 1.0), "bulk velocity"))
                .contains(new Vector3D(4, 5, 6));
    }

    @Test
    void interpolatesToWindowCentreWhenNoRowInside() {
        final var series = new TimeSeries(
                new double[] {0.0, 10.0},
                new double[][] {{0, 0, 0}, {10, -20, 0}});

        assertThat(resolver.vector(series, Interval.of(4.0, 6.0), "bulk velocity"))
                .contains(new Vector3D(5, -10, 0));
    }

    @Test
    void interpolationSkipsNonFiniteRows() {
        final var series = new TimeSeries(
                new double[] {0.0, 2.0, 4.0, 10.0},
                new double[][] {{0, 0, 0}, {Double.NaN, 1, 1}, {4, 8, 0}, {10, 20, 6}});

        assertThat(resolver.vector(series, Interval.of(6.0, 8.0), "bulk velocity"))
                .hasValueSatisfying(v -> assertThat(v.distance(new Vector3D(7, 14, 3))).isLessThan(1e-12));
    }

    @Test
    void holdsFirstValueBeforeSeries() {
        assertThat(resolver.vector(field, Interval.of(-10.0, -6.0), "magnetic field"))
                .contains(new Vector3D(1, 0, 0));
    }

    @Test
    void holdsEndValueBeyondSeries() {
        assertThat(resolver.vector(field, Interval.of(20.0, 30.0), "magnetic field"))
                .contains(new Vector3D(100, 100, 100));
    }

    @Test
    void missingSeriesResolvesToEmpty() {
        assertThat(resolver.vector(null, Interval.of(0.0, 1.0), "sun direction")).isEmpty();
        assertThat(resolver.resolve(null, Interval.of(0.0, 1.0)).magneticField()).isNull();
    }

    @Test
    void rejectsRowsThatAreNotVectors() {
        final var series = new TimeSeries(new double[] {0.0}, new double[][] {{1, 2}});

        assertThatThrownBy(() -> resolver.vector(series, Interval.of(0.0, 1.0), "magnetic field"))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("magnetic field");
    }

    @Test
    void averagesCustomRotationElementWise() {
        final var series = new TimeSeries(
                new double[] {0.0, 1.0},
                new double[][] {{1, 0, 0, 0, 1, 0, 0, 0, 1}, {1, 0, 0, 0, 0, -1, 0, 1, 0}});

        final var m = resolver.customRotation(series, Interval.of(0.0, 1.0)).orElseThrow();

        assertThat(m.getEntry(1, 1)).isEqualTo(0.5);
        assertThat(m.getEntry(1, 2)).isEqualTo(-0.5);
        assertThat(m.getEntry(2, 1)).isEqualTo(0.5);
    }

    @Test
    void resolvesEverySuppliedVector() {
        final var support = SupportData.builder()
                .magneticField(TimeSeries.constant(0, 0, 5))
                .bulkVelocity(TimeSeries.constant(300, 0, 0))
                .build();

        final var vectors = resolver.resolve(support, Interval.of(0.0, 1.0));

        assertThat(vectors.magneticField()).isEqualTo(new Vector3D(0, 0, 5));
        assertThat(vectors.bulkVelocity()).isEqualTo(new Vector3D(300, 0, 0));
        assertThat(vectors.sunDirection()).isNull();
    }
}
