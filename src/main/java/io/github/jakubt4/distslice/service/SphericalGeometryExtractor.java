package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.BinShape;
import io.github.jakubt4.distslice.dto.DistributionSample;
import io.github.jakubt4.distslice.dto.SphericalBins;
import org.orekit.utils.Constants;
import org.springframework.stereotype.Service;

/**
 * Radial and angular bin geometry of one sample.
 *
 * <p>Energy boundaries are built per angular column so that consecutive energy
 * bins touch: interior boundaries are midpoints of neighbouring centres, the two
 * outer boundaries are mirrored about the outermost centres. In velocity mode
 * every boundary is converted to a relativistic speed before centres and widths
 * are taken, so the radial bins stay gapless in velocity as well.
 */
@Service
public class SphericalGeometryExtractor {

    /** Speed of light, km/s. */
    static final double C_KM_S = Constants.SPEED_OF_LIGHT / 1000.0;

    /**
     * @param sample source histogram
     * @param energy radial coordinate is energy (eV) instead of speed (km/s)
     * @param log    take log10 of the boundaries; non-positive boundaries become NaN/-Infinity
     */
    public SphericalBins extract(final DistributionSample sample, final boolean energy, final boolean log) {
        final var shape = sample.shape();
        final var rad = new double[shape.size()];
        final var dr = new double[shape.size()];

        final var energies = new double[shape.energies()];
        for (var column = 0; column < shape.columns(); column++) {
            for (var e = 0; e < energies.length; e++) {
                energies[e] = sample.energy()[shape.index(e, column)];
            }

            final var bounds = boundaries(energies);
            for (var k = 0; k < bounds.length; k++) {
                if (!energy) {
                    bounds[k] = velocity(bounds[k], sample.mass());
                }
                if (log) {
                    bounds[k] = Math.log10(bounds[k]);
                }
            }
            fill(shape, column, bounds, rad, dr);
        }

        return new SphericalBins(rad, dr,
                sample.phi().clone(), sample.theta().clone(),
                sample.dphi().clone(), sample.dtheta().clone());
    }

    /**
     * E + 1 gapless boundaries for E centres. A single centre {@code e} gets
     * boundaries {@code [0, 2e]}.
     */
    static double[] boundaries(final double[] centres) {
        final var n = centres.length;
        final var bounds = new double[n + 1];
        if (n == 1) {
            bounds[0] = 0.0;
            bounds[1] = 2.0 * centres[0];
            return bounds;
        }
        for (var i = 1; i < n; i++) {
            bounds[i] = 0.5 * (centres[i - 1] + centres[i]);
        }
        bounds[0] = centres[0] + (centres[0] - bounds[1]);
        bounds[n] = centres[n - 1] + (centres[n - 1] - bounds[n - 1]);
        return bounds;
    }

    /**
     * Relativistic speed (km/s) of a particle with kinetic energy {@code energy}
     * (eV) and rest mass {@code mass} (eV/(km/s)^2).
     */
    static double velocity(final double energy, final double mass) {
        final var restEnergy = mass * C_KM_S * C_KM_S;
        final var gamma = energy / restEnergy + 1.0;
        return C_KM_S * Math.sqrt(1.0 - 1.0 / (gamma * gamma));
    }

    private static void fill(final BinShape shape, final int column, final double[] bounds,
                             final double[] rad, final double[] dr) {
        for (var e = 0; e < shape.energies(); e++) {
            final var index = shape.index(e, column);
            rad[index] = 0.5 * (bounds[e] + bounds[e + 1]);
            dr[index] = Math.abs(bounds[e + 1] - bounds[e]);
        }
    }
}
