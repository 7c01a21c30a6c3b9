package io.github.jakubt4.distslice.service;

import org.springframework.stereotype.Service;

/**
 * Gaussian smoothing of a finished slice, applied separably along each axis.
 * The window width is taken as the kernel's full width at half maximum; near
 * the edges the kernel is renormalised over the points that exist.
 */
@Service
public class SliceSmoother {

    private static final double FWHM_TO_SIGMA = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));

    /**
     * @param data  slice values, {@code [x][y]}
     * @param width window width in pixels; even widths grow by one, widths below 2 leave the data untouched
     * @return a new, smoothed array (or {@code data} itself when no smoothing applies)
     */
    public double[][] smooth(final double[][] data, final int width) {
        if (width < 2) {
            return data;
        }
        final var kernel = kernel(width % 2 == 0 ? width + 1 : width);
        return convolveY(convolveX(data, kernel), kernel);
    }

    static double[] kernel(final int width) {
        final var sigma = width * FWHM_TO_SIGMA;
        final var half = width / 2;
        final var kernel = new double[width];
        for (var i = 0; i < width; i++) {
            final var d = (i - half) / sigma;
            kernel[i] = Math.exp(-0.5 * d * d);
        }
        return kernel;
    }

    private static double[][] convolveX(final double[][] source, final double[] kernel) {
        final var half = kernel.length / 2;
        final var result = new double[source.length][source[0].length];
        for (var i = 0; i < source.length; i++) {
            for (var j = 0; j < source[i].length; j++) {
                var total = 0.0;
                var norm = 0.0;
                for (var k = Math.max(0, i - half); k <= Math.min(source.length - 1, i + half); k++) {
                    final var w = kernel[k - i + half];
                    total += w * source[k][j];
                    norm += w;
                }
                result[i][j] = total / norm;
            }
        }
        return result;
    }

    private static double[][] convolveY(final double[][] source, final double[] kernel) {
        final var half = kernel.length / 2;
        final var result = new double[source.length][source[0].length];
        for (var i = 0; i < source.length; i++) {
            final var row = source[i];
            for (var j = 0; j < row.length; j++) {
                var total = 0.0;
                var norm = 0.0;
                for (var k = Math.max(0, j - half); k <= Math.min(row.length - 1, j + half); k++) {
                    final var w = kernel[k - j + half];
                    total += w * row[k];
                    norm += w;
                }
                result[i][j] = total / norm;
            }
        }
        return result;
    }
}
