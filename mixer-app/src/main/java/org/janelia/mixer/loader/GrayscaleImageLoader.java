package org.janelia.mixer.loader;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;

import org.janelia.mixer.GrayscaleRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads image files into {@link GrayscaleRaster}s and writes rasters back out, using ImageJ for I/O.
 */
public class GrayscaleImageLoader {

    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    private GrayscaleImageLoader() {
    }

    /**
     * @param  path  path of the image file to load.
     *
     * @return grayscale version of the image.
     *
     * @throws IOException
     *   if the file cannot be opened as an image.
     */
    public static GrayscaleRaster load(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.exists()) {
            throw new IOException(file.getAbsolutePath() + " does not exist");
        }

        final ImagePlus imp = new Opener().openImage(file.getAbsolutePath());
        if (imp == null) {
            throw new IOException("failed to open " + file.getAbsolutePath() + " as an image");
        }

        final GrayscaleRaster raster = toGrayscale(imp.getProcessor());

        LOG.info("load: loaded {} from {}", raster, file.getAbsolutePath());

        return raster;
    }

    /**
     * Converts RGB pixels with the luminosity formula 0.299 R + 0.587 G + 0.114 B;
     * other bit depths are scaled to 8-bit by ImageJ.
     *
     * @param  ip  processor to convert (not modified).
     *
     * @return grayscale copy of the processor's pixels.
     */
    public static GrayscaleRaster toGrayscale(final ImageProcessor ip) {

        if (ip instanceof ColorProcessor) {
            final int[] rgbPixels = (int[]) ip.getPixels();
            final GrayscaleRaster raster = new GrayscaleRaster(ip.getWidth(), ip.getHeight());
            for (int i = 0; i < rgbPixels.length; i++) {
                raster.set(i, luminosity(rgbPixels[i]));
            }
            return raster;
        }

        return GrayscaleRaster.fromProcessor(ip);
    }

    /**
     * @return rounded luminosity of a packed RGB value.
     */
    public static int luminosity(final int rgb) {
        final int r = (rgb >> 16) & 0xff;
        final int g = (rgb >> 8) & 0xff;
        final int b = rgb & 0xff;
        return (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
    }

    /**
     * Saves the raster as a PNG or TIFF file (based upon the path's extension).
     *
     * @param  raster  raster to save.
     * @param  path    target file path (missing parent directories are created).
     *
     * @throws IOException
     *   if the format is not supported or the file cannot be written.
     */
    public static void save(final GrayscaleRaster raster,
                            final String path)
            throws IOException {

        final File file = new File(path).getAbsoluteFile();
        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists()) && (! parentDirectory.mkdirs())) {
            // check again in case another process created the directory
            if (! parentDirectory.exists()) {
                throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
            }
        }

        final String fileName = file.getName();
        final String format = fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase();

        final FileSaver saver = new FileSaver(new ImagePlus(fileName, raster.toByteProcessor()));
        final boolean saved;
        if (PNG_FORMAT.equals(format)) {
            saved = saver.saveAsPng(file.getAbsolutePath());
        } else if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {
            saved = saver.saveAsTiff(file.getAbsolutePath());
        } else {
            throw new IOException("unsupported output format '" + format + "' for " + file.getAbsolutePath() +
                                  ", use " + PNG_FORMAT + " or " + TIFF_FORMAT);
        }

        if (! saved) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }

        LOG.info("save: exit, saved {}", file.getAbsolutePath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(GrayscaleImageLoader.class);
}
