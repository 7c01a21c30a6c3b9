package io.github.jakubt4.distslice.dto;

/**
 * Geometry of one sample's bins: radial centre and width (velocity, energy, or
 * their log10) and angular centres and full widths in degrees. Arrays follow
 * the sample's flat bin order.
 */
public record SphericalBins(double[] rad,
                            double[] dr,
                            double[] phi,
                            double[] theta,
                            double[] dp,
                            double[] dt) {
}
