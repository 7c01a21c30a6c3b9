package io.github.jakubt4.distslice.support;

import io.github.jakubt4.distslice.dto.BinShape;
import io.github.jakubt4.distslice.dto.DistributionSample;

import java.util.Arrays;

/**
 * Synthetic distributions for tests.
 */
public final class TestDistributions {

    /** Proton rest mass, eV/(km/s)^2. */
    public static final double PROTON_MASS = 0.010453;

    private TestDistributions() {
    }

    /**
     * One angular bin covering the whole sphere (phi 0 ± 180, theta 0 ± 90) at
     * each of the given energies, every bin holding {@code value}.
     */
    public static DistributionSample wholeSphere(final double start, final double end,
                                                 final double[] energies, final double value) {
        final var n = energies.length;
        return DistributionSample.builder()
                .startTime(start)
                .endTime(end)
                .shape(new BinShape(n, 1, 1))
                .energy(energies.clone())
                .phi(filled(n, 0.0))
                .theta(filled(n, 0.0))
                .dphi(filled(n, 360.0))
                .dtheta(filled(n, 180.0))
                .data(filled(n, value))
                .bins(ones(n))
                .mass(PROTON_MASS)
                .species("i")
                .unitsName("df_km")
                .build();
    }

    /**
     * Instrument-like sample: {@code energies} levels, {@code polar} elevation
     * bins evenly covering [-90, 90] and {@code azimuth} azimuth bins evenly
     * covering [0, 360), all holding {@code value}.
     */
    public static DistributionSample instrument(final double start, final double end, final double[] energies,
                                                final int polar, final int azimuth, final double value) {
        final var shape = new BinShape(energies.length, polar, azimuth);
        final var size = shape.size();
        final var energy = new double[size];
        final var phi = new double[size];
        final var theta = new double[size];
        final var dtheta = 180.0 / polar;
        final var dphi = 360.0 / azimuth;
        for (var e = 0; e < energies.length; e++) {
            for (var a1 = 0; a1 < polar; a1++) {
                for (var a2 = 0; a2 < azimuth; a2++) {
                    final var i = shape.index(e, a1 * azimuth + a2);
                    energy[i] = energies[e];
                    theta[i] = -90.0 + (a1 + 0.5) * dtheta;
                    phi[i] = (a2 + 0.5) * dphi;
                }
            }
        }
        return DistributionSample.builder()
                .startTime(start)
                .endTime(end)
                .shape(shape)
                .energy(energy)
                .phi(phi)
                .theta(theta)
                .dphi(filled(size, dphi))
                .dtheta(filled(size, dtheta))
                .data(filled(size, value))
                .bins(ones(size))
                .mass(PROTON_MASS)
                .species("i")
                .unitsName("df_km")
                .build();
    }

    public static double[] filled(final int n, final double value) {
        final var out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    public static int[] ones(final int n) {
        final var out = new int[n];
        Arrays.fill(out, 1);
        return out;
    }
}
