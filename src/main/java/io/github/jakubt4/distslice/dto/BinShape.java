package io.github.jakubt4.distslice.dto;

/**
 * Dimensions of one distribution histogram. Per-bin arrays are stored flat in
 * row-major {@code [energy][polar][azimuth]} order.
 *
 * @param energies number of energy levels (E)
 * @param polar    size of the first angular dimension (A1)
 * @param azimuth  size of the second angular dimension (A2)
 */
public record BinShape(int energies, int polar, int azimuth) {

    public BinShape {
        if (energies < 1 || polar < 1 || azimuth < 1) {
            throw new IllegalArgumentException(
                    "bin shape must be positive, got [%d, %d, %d]".formatted(energies, polar, azimuth));
        }
    }

    public int size() {
        return energies * polar * azimuth;
    }

    /** Number of angular cells sharing one energy sweep. */
    public int columns() {
        return polar * azimuth;
    }

    public int index(final int energy, final int column) {
        return energy * columns() + column;
    }
}
