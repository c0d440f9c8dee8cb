package org.janelia.mixer.loader;

import java.util.ArrayList;
import java.util.List;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.MixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings source rasters to a common size before they are transformed.
 */
public class NearestNeighborResizer {

    private NearestNeighborResizer() {
    }

    /**
     * @return copy of the raster resampled to the specified size with nearest neighbor lookup.
     *
     * @throws MixException
     *   if the source is empty or the target size is not positive.
     */
    public static GrayscaleRaster resize(final GrayscaleRaster raster,
                                         final int newWidth,
                                         final int newHeight)
            throws MixException {

        if (raster.isEmpty() || (newWidth < 1) || (newHeight < 1)) {
            throw MixException.invalidInput("cannot resize " + raster + " to " + newWidth + "x" + newHeight);
        }

        if ((raster.getWidth() == newWidth) && (raster.getHeight() == newHeight)) {
            return raster.copy();
        }

        final double xRatio = raster.getWidth() / (double) newWidth;
        final double yRatio = raster.getHeight() / (double) newHeight;

        final GrayscaleRaster resized = new GrayscaleRaster(newWidth, newHeight);
        for (int y = 0; y < newHeight; y++) {
            final int srcY = (int) Math.floor(y * yRatio);
            for (int x = 0; x < newWidth; x++) {
                final int srcX = (int) Math.floor(x * xRatio);
                resized.set(x, y, raster.get(srcX, srcY));
            }
        }
        return resized;
    }

    /**
     * @return two element array with the minimum width and minimum height of the rasters.
     *
     * @throws MixException
     *   if no rasters are specified.
     */
    public static int[] unifiedSize(final List<GrayscaleRaster> rasters)
            throws MixException {

        if ((rasters == null) || rasters.isEmpty()) {
            throw MixException.noSources("no rasters to unify");
        }

        int minWidth = Integer.MAX_VALUE;
        int minHeight = Integer.MAX_VALUE;
        for (final GrayscaleRaster raster : rasters) {
            minWidth = Math.min(minWidth, raster.getWidth());
            minHeight = Math.min(minHeight, raster.getHeight());
        }
        return new int[] { minWidth, minHeight };
    }

    /**
     * @return rasters resized (when necessary) to their {@link #unifiedSize}.
     */
    public static List<GrayscaleRaster> resizeToUnifiedSize(final List<GrayscaleRaster> rasters)
            throws MixException {

        final int[] size = unifiedSize(rasters);

        LOG.info("resizeToUnifiedSize: unified size for {} rasters is {}x{}", rasters.size(), size[0], size[1]);

        final List<GrayscaleRaster> resized = new ArrayList<>(rasters.size());
        for (final GrayscaleRaster raster : rasters) {
            resized.add(resize(raster, size[0], size[1]));
        }
        return resized;
    }

    private static final Logger LOG = LoggerFactory.getLogger(NearestNeighborResizer.class);
}
