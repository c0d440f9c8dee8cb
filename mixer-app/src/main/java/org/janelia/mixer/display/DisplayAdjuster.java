package org.janelia.mixer.display;

import org.janelia.mixer.GrayscaleRaster;

/**
 * Brightness/contrast remapping for rasters that are only meant to be looked at.
 * Never apply this to data that feeds the transform pipeline.
 */
public class DisplayAdjuster {

    public static final int MIN_ADJUSTMENT = -100;
    public static final int MAX_ADJUSTMENT = 100;

    private DisplayAdjuster() {
    }

    /**
     * @param  raster      source raster (not modified).
     * @param  brightness  additive offset, clamped to [-100, 100].
     * @param  contrast    contrast amount, clamped to [-100, 100].
     *
     * @return adjusted copy of the raster.
     */
    public static GrayscaleRaster adjust(final GrayscaleRaster raster,
                                         final double brightness,
                                         final double contrast) {

        final double clampedBrightness = clampAdjustment(brightness);
        final double factor = contrastFactor(clampAdjustment(contrast));

        final GrayscaleRaster adjusted = new GrayscaleRaster(raster.getWidth(), raster.getHeight());
        for (int i = 0; i < raster.getPixelCount(); i++) {
            adjusted.set(i, adjustSample(raster.get(i), clampedBrightness, factor));
        }
        return adjusted;
    }

    /**
     * @return 259 * (contrast + 255) / (255 * (259 - contrast)).
     */
    public static double contrastFactor(final double contrast) {
        return (259.0 * (contrast + 255.0)) / (255.0 * (259.0 - contrast));
    }

    /**
     * @return remapped sample clamped to [0, 255].
     */
    public static int adjustSample(final int sample,
                                   final double brightness,
                                   final double contrastFactor) {
        final double value = contrastFactor * (sample - 128) + 128 + brightness;
        return (int) Math.max(0.0, Math.min(255.0, Math.round(value)));
    }

    public static double clampAdjustment(final double value) {
        return Math.max(MIN_ADJUSTMENT, Math.min(MAX_ADJUSTMENT, value));
    }

}
