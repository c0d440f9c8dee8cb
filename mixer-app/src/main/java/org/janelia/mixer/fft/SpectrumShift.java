package org.janelia.mixer.fft;

/**
 * Quadrant swap that moves the zero frequency term between the grid corner and its center.
 *
 * For the even (power of two) grid sizes used here the shift is a translation by half the size
 * modulo the size, which makes it its own inverse.
 */
public class SpectrumShift {

    private SpectrumShift() {
    }

    /**
     * @return copy of the interleaved grid with the value at (x, y) moved to
     *         ((x + width/2) mod width, (y + height/2) mod height).
     */
    public static double[] shift(final double[] grid,
                                 final int width,
                                 final int height) {
        return translate(grid, width, height, width / 2, height / 2);
    }

    /**
     * @return copy of the interleaved grid with the centering performed by {@link #shift} undone.
     */
    public static double[] inverseShift(final double[] grid,
                                        final int width,
                                        final int height) {
        // translating by the remainder also handles odd sizes correctly
        return translate(grid, width, height, width - (width / 2), height - (height / 2));
    }

    private static double[] translate(final double[] grid,
                                      final int width,
                                      final int height,
                                      final int offsetX,
                                      final int offsetY) {
        if (grid.length != width * height * 2) {
            throw new IllegalArgumentException("grid length " + grid.length + " does not match " +
                                               width + "x" + height + " complex values");
        }

        final double[] shifted = new double[grid.length];
        for (int y = 0; y < height; y++) {
            final int newY = (y + offsetY) % height;
            for (int x = 0; x < width; x++) {
                final int newX = (x + offsetX) % width;
                final int oldIndex = (y * width + x) * 2;
                final int newIndex = (newY * width + newX) * 2;
                shifted[newIndex] = grid[oldIndex];
                shifted[newIndex + 1] = grid[oldIndex + 1];
            }
        }
        return shifted;
    }

}
