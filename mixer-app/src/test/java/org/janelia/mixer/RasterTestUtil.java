package org.janelia.mixer;

/**
 * Synthetic rasters and comparison helpers shared by tests.
 */
public class RasterTestUtil {

    private RasterTestUtil() {
    }

    /**
     * @return smooth sinusoidal pattern with values well inside [0, 255].
     */
    public static GrayscaleRaster buildSmoothRaster(final int width,
                                                    final int height) {
        final GrayscaleRaster raster = new GrayscaleRaster(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final double value = 128 + 60 * Math.sin(x / 5.0) * Math.cos(y / 4.0) + 40.0 * x / width;
                raster.set(x, y, (int) Math.round(value));
            }
        }
        return raster;
    }

    /**
     * @return raster with 255 where (x + y) is even and 0 elsewhere.
     */
    public static GrayscaleRaster buildCheckerboard(final int width,
                                                    final int height) {
        final GrayscaleRaster raster = new GrayscaleRaster(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.set(x, y, ((x + y) % 2 == 0) ? 255 : 0);
            }
        }
        return raster;
    }

    public static double pearsonCorrelation(final GrayscaleRaster a,
                                            final GrayscaleRaster b) {
        final int n = a.getPixelCount();
        double meanA = 0;
        double meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a.get(i);
            meanB += b.get(i);
        }
        meanA /= n;
        meanB /= n;

        double covariance = 0;
        double varianceA = 0;
        double varianceB = 0;
        for (int i = 0; i < n; i++) {
            final double da = a.get(i) - meanA;
            final double db = b.get(i) - meanB;
            covariance += da * db;
            varianceA += da * da;
            varianceB += db * db;
        }
        return covariance / Math.sqrt(varianceA * varianceB);
    }

    /**
     * @return values rescaled to [0, 255] with rounding, the same way reconstructed rasters are.
     */
    public static int[] normalizeRounded(final double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (final double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        final int[] normalized = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = (int) Math.round((values[i] - min) / (max - min) * 255);
        }
        return normalized;
    }

}
