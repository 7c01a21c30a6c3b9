package io.github.jakubt4.distslice.service;

import org.junit.jupiter.api.Test;

import static io.github.jakubt4.distslice.support.TestDistributions.PROTON_MASS;
import static io.github.jakubt4.distslice.support.TestDistributions.instrument;
import static io.github.jakubt4.distslice.support.TestDistributions.wholeSphere;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SphericalGeometryExtractorTest {

    private final SphericalGeometryExtractor extractor = new SphericalGeometryExtractor();

    @Test
    void boundariesAreMidpointsWithMirroredEnds() {
        assertThat(SphericalGeometryExtractor.boundaries(new double[] {1.0, 2.0, 4.0}))
                .containsExactly(0.5, 1.5, 3.0, 5.0);
    }

    @Test
    void singleEnergyBinStartsAtZero() {
        assertThat(SphericalGeometryExtractor.boundaries(new double[] {3.0})).containsExactly(0.0, 6.0);
    }

    @Test
    void energyModeUsesBoundaryMidpointsAndWidths() {
        final var bins = extractor.extract(wholeSphere(0, 1, new double[] {1.0, 2.0, 4.0}, 1.0), true, false);

        assertThat(bins.rad()).containsExactly(1.0, 2.25, 4.0);
        assertThat(bins.dr()).containsExactly(1.0, 1.5, 2.0);
    }

    @Test
    void velocityMatchesClassicalLimitAtLowEnergy() {
        final var v = SphericalGeometryExtractor.velocity(1000.0, PROTON_MASS);

        assertThat(v).isCloseTo(Math.sqrt(2 * 1000.0 / PROTON_MASS), within(0.5));
    }

    @Test
    void velocityStaysBelowLightSpeed() {
        final var electronMass = 5.6856e-6;

        assertThat(SphericalGeometryExtractor.velocity(1.0e7, electronMass))
                .isLessThan(SphericalGeometryExtractor.C_KM_S)
                .isGreaterThan(0.99 * SphericalGeometryExtractor.C_KM_S);
        assertThat(SphericalGeometryExtractor.velocity(0.0, electronMass)).isZero();
    }

    @Test
    void velocityModeConvertsBoundariesBeforeTakingCentres() {
        final var energies = new double[] {100.0, 400.0};
        final var bins = extractor.extract(wholeSphere(0, 1, energies, 1.0), false, false);

        final var v0 = SphericalGeometryExtractor.velocity(-50.0, PROTON_MASS);
        final var v1 = SphericalGeometryExtractor.velocity(250.0, PROTON_MASS);
        final var v2 = SphericalGeometryExtractor.velocity(550.0, PROTON_MASS);
        assertThat(bins.rad()[1]).isCloseTo(0.5 * (v1 + v2), within(1e-9));
        assertThat(bins.dr()[1]).isCloseTo(v2 - v1, within(1e-9));
        // the mirrored lower boundary is negative energy; the resulting NaN is left to the rebinner
        assertThat(v0).isNaN();
        assertThat(bins.rad()[0]).isNaN();
    }

    @Test
    void logModeTakesLogOfBoundaries() {
        final var bins = extractor.extract(wholeSphere(0, 1, new double[] {1.0, 10.0, 100.0}, 1.0), true, true);

        assertThat(bins.rad()[0]).isNaN();
        assertThat(bins.rad()[1]).isCloseTo(0.5 * (Math.log10(5.5) + Math.log10(55.0)), within(1e-12));
        assertThat(bins.dr()[2]).isCloseTo(Math.log10(145.0) - Math.log10(55.0), within(1e-12));
    }

    @Test
    void anglesPassThroughPerColumn() {
        final var sample = instrument(0, 1, new double[] {10.0, 20.0, 40.0}, 2, 4, 1.0);

        final var bins = extractor.extract(sample, true, false);

        assertThat(bins.phi()).containsExactly(sample.phi());
        assertThat(bins.theta()).containsExactly(sample.theta());
        assertThat(bins.dp()).containsExactly(sample.dphi());
        assertThat(bins.dt()).containsExactly(sample.dtheta());
        final var shape = sample.shape();
        for (var column = 0; column < shape.columns(); column++) {
            assertThat(bins.rad()[shape.index(1, column)]).isEqualTo(22.5);
        }
    }
}
