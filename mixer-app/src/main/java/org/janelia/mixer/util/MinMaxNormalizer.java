package org.janelia.mixer.util;

import org.janelia.mixer.GrayscaleRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear min/max rescaling of double samples to an 8-bit raster.
 *
 * Minimum and maximum are found with a single linear scan.
 * When the range is zero or not finite the raster is filled with {@link GrayscaleRaster#MID_GRAY}.
 */
public class MinMaxNormalizer {

    /** How scaled values are converted to integer samples. */
    public enum Rounding {
        /** truncate toward negative infinity (display components) */
        FLOOR,
        /** round to nearest (reconstructed images) */
        NEAREST
    }

    private MinMaxNormalizer() {
    }

    /**
     * @param  values    samples to rescale (row-major).
     * @param  width     raster width.
     * @param  height    raster height.
     * @param  rounding  conversion to integer samples.
     * @param  context   name of the caller for log messages.
     *
     * @return normalized raster.
     */
    public static GrayscaleRaster normalize(final double[] values,
                                            final int width,
                                            final int height,
                                            final Rounding rounding,
                                            final String context) {

        final GrayscaleRaster raster = new GrayscaleRaster(width, height);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (final double value : values) {
            if (value < min) {
                min = value;
            }
            if (value > max) {
                max = value;
            }
        }

        final double range = max - min;

        if ((range == 0.0) || ! Double.isFinite(range)) {
            LOG.warn("normalize: {} value range is {} (min={}, max={}), filling {}x{} raster with {}",
                     context, range, min, max, width, height, GrayscaleRaster.MID_GRAY);
            raster.fill(GrayscaleRaster.MID_GRAY);
            return raster;
        }

        LOG.debug("normalize: {} value range is [{}, {}]", context, min, max);

        for (int i = 0; i < values.length; i++) {
            final double scaled = ((values[i] - min) / range) * 255.0;
            final long sample = (rounding == Rounding.FLOOR) ? (long) Math.floor(scaled) : Math.round(scaled);
            raster.set(i, (int) Math.max(0, Math.min(255, sample)));
        }

        return raster;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MinMaxNormalizer.class);
}
