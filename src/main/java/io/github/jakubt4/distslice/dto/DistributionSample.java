package io.github.jakubt4.distslice.dto;

import io.github.jakubt4.distslice.exception.ShapeMismatchException;
import lombok.Builder;

/**
 * One timestamped 3-D particle histogram as delivered by an instrument loader.
 *
 * <p>Every per-bin array has {@link BinShape#size()} entries in row-major
 * {@code [energy][polar][azimuth]} order. Angles are in degrees; {@code phi} is
 * the azimuth and {@code theta} the elevation above the x-y plane.
 * {@code dphi}/{@code dtheta} are full bin widths. A {@code bins} entry of 0
 * marks a cell that must never contribute to a slice.
 *
 * <p>Arrays are not copied; callers must not mutate them after construction.
 *
 * @param startTime start of accumulation, seconds
 * @param endTime   end of accumulation, seconds
 * @param shape     histogram dimensions
 * @param energy    bin centre energies, eV
 * @param phi       bin centre azimuths
 * @param theta     bin centre elevations
 * @param dphi      azimuthal widths
 * @param dtheta    elevation widths
 * @param data      counts, flux or phase space density
 * @param bins      validity mask
 * @param mass      rest mass, eV/(km/s)^2
 * @param species   particle species tag (e.g. "e", "i", "hplus")
 * @param unitsName units of {@code data}
 */
@Builder(toBuilder = true)
public record DistributionSample(double startTime,
                                 double endTime,
                                 BinShape shape,
                                 double[] energy,
                                 double[] phi,
                                 double[] theta,
                                 double[] dphi,
                                 double[] dtheta,
                                 double[] data,
                                 int[] bins,
                                 double mass,
                                 String species,
                                 String unitsName) {

    public DistributionSample {
        if (shape == null) {
            throw new ShapeMismatchException("distribution sample has no bin shape");
        }
        final var size = shape.size();
        requireLength("energy", energy == null ? -1 : energy.length, size);
        requireLength("phi", phi == null ? -1 : phi.length, size);
        requireLength("theta", theta == null ? -1 : theta.length, size);
        requireLength("dphi", dphi == null ? -1 : dphi.length, size);
        requireLength("dtheta", dtheta == null ? -1 : dtheta.length, size);
        requireLength("data", data == null ? -1 : data.length, size);
        requireLength("bins", bins == null ? -1 : bins.length, size);
    }

    public double midTime() {
        return 0.5 * (startTime + endTime);
    }

    private static void requireLength(final String name, final int actual, final int expected) {
        if (actual != expected) {
            throw new ShapeMismatchException("sample array '%s' has %s elements, shape requires %d"
                    .formatted(name, actual < 0 ? "no" : Integer.toString(actual), expected));
        }
    }
}
