package org.janelia.mixer.fft;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jtransforms.fft.DoubleFFT_1D;

/**
 * 1D complex transforms of interleaved (real, imaginary) arrays backed by JTransforms,
 * plus the separable row/column sweeps used for power of two 2D grids.
 *
 * The forward transform uses the exp(-2 pi i k n / N) convention.
 * The inverse transform is scaled by 1 / N, so forward followed by inverse reproduces the input.
 */
public class FastFourierTransform {

    private static final Map<Integer, DoubleFFT_1D> FFT_CACHE = new ConcurrentHashMap<>();

    private FastFourierTransform() {
    }

    /**
     * @return smallest power of two that is greater than or equal to the value (never less than 2).
     */
    public static int nextPowerOfTwo(final int value) {
        if (value <= 2) {
            return 2;
        }
        final int highestBit = Integer.highestOneBit(value);
        if (highestBit == value) {
            return value;
        }
        if (highestBit == (1 << 30)) {
            throw new IllegalArgumentException("no int power of two is large enough for " + value);
        }
        return highestBit << 1;
    }

    public static boolean isPowerOfTwo(final int value) {
        return (value > 0) && ((value & (value - 1)) == 0);
    }

    /**
     * Transforms the specified interleaved values in place.
     *
     * @param  values   interleaved complex values, length must be 2 * n with n a power of two.
     * @param  inverse  true for the (scaled) inverse transform.
     *
     * @throws IllegalArgumentException
     *   if the number of complex values is not a power of two.
     */
    public static void transform(final double[] values,
                                 final boolean inverse)
            throws IllegalArgumentException {

        final int n = values.length / 2;
        if ((values.length % 2 != 0) || ! isPowerOfTwo(n)) {
            throw new IllegalArgumentException("transform length must be a power of two but got " +
                                               (values.length / 2.0) + " complex values");
        }

        final DoubleFFT_1D fft = getOrCreateFFT(n);
        if (inverse) {
            fft.complexInverse(values, true);
        } else {
            fft.complexForward(values);
        }
    }

    /**
     * Applies the 1D transform to every row of an interleaved row-major grid.
     */
    public static void transformRows(final double[] grid,
                                     final int width,
                                     final int height,
                                     final boolean inverse) {
        final double[] row = new double[width * 2];
        for (int y = 0; y < height; y++) {
            final int rowOffset = y * width * 2;
            System.arraycopy(grid, rowOffset, row, 0, row.length);
            transform(row, inverse);
            System.arraycopy(row, 0, grid, rowOffset, row.length);
        }
    }

    /**
     * Applies the 1D transform to every column of an interleaved row-major grid.
     */
    public static void transformColumns(final double[] grid,
                                        final int width,
                                        final int height,
                                        final boolean inverse) {
        final double[] column = new double[height * 2];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                final int index = (y * width + x) * 2;
                column[y * 2] = grid[index];
                column[y * 2 + 1] = grid[index + 1];
            }
            transform(column, inverse);
            for (int y = 0; y < height; y++) {
                final int index = (y * width + x) * 2;
                grid[index] = column[y * 2];
                grid[index + 1] = column[y * 2 + 1];
            }
        }
    }

    private static DoubleFFT_1D getOrCreateFFT(final int n) {
        return FFT_CACHE.computeIfAbsent(n, DoubleFFT_1D::new);
    }

}
