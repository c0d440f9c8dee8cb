package org.janelia.mixer.fft;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.MixException;
import org.janelia.mixer.SpectrumBuffer;
import org.janelia.mixer.display.DisplayAdjuster;
import org.janelia.mixer.util.MinMaxNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts grayscale rasters into shifted {@link SpectrumBuffer}s and derives display views of them.
 */
public class ForwardTransformer {

    /**
     * Pads the raster (top-left aligned) to power of two dimensions, transforms every row and then
     * every column, and centers the zero frequency term.
     *
     * @param  raster  source raster (not modified).
     *
     * @return shifted spectrum of the padded raster.
     *
     * @throws MixException
     *   if the raster is empty.
     */
    public SpectrumBuffer transform(final GrayscaleRaster raster)
            throws MixException {

        if ((raster == null) || raster.isEmpty()) {
            throw MixException.invalidInput("cannot transform empty raster " + raster);
        }

        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int fftWidth = FastFourierTransform.nextPowerOfTwo(width);
        final int fftHeight = FastFourierTransform.nextPowerOfTwo(height);

        LOG.debug("transform: entry, {}x{} raster padded to {}x{}", width, height, fftWidth, fftHeight);

        final double[] grid = pad(raster, fftWidth, fftHeight);

        FastFourierTransform.transformRows(grid, fftWidth, fftHeight, false);
        FastFourierTransform.transformColumns(grid, fftWidth, fftHeight, false);

        return new SpectrumBuffer(width, height, SpectrumShift.shift(grid, fftWidth, fftHeight));
    }

    /**
     * Derives an 8-bit view of a spectrum component.
     * Values are computed over the full padded grid, the top-left original size block is cropped,
     * magnitudes are log scaled, and the result is min/max normalized.
     *
     * @param  spectrum   source spectrum.
     * @param  component  view to derive.
     *
     * @return display raster with the spectrum's original dimensions.
     */
    public GrayscaleRaster deriveDisplay(final SpectrumBuffer spectrum,
                                         final SpectrumComponent component) {

        final int width = spectrum.getWidth();
        final int height = spectrum.getHeight();
        final int fftWidth = spectrum.getFftWidth();

        final double[] cropped = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int cell = y * fftWidth + x;
                double value = component.valueOf(spectrum.getReal(cell), spectrum.getImaginary(cell));
                if (component.isLogScaled()) {
                    value = Math.log(1 + value);
                }
                cropped[y * width + x] = value;
            }
        }

        return MinMaxNormalizer.normalize(cropped, width, height, MinMaxNormalizer.Rounding.FLOOR,
                                          component.name());
    }

    /**
     * @return display view of the component, passed through {@link DisplayAdjuster}
     *         when either adjustment is nonzero.
     */
    public GrayscaleRaster renderComponent(final SpectrumBuffer spectrum,
                                           final SpectrumComponent component,
                                           final double brightness,
                                           final double contrast) {
        final GrayscaleRaster display = deriveDisplay(spectrum, component);
        if ((brightness != 0) || (contrast != 0)) {
            return DisplayAdjuster.adjust(display, brightness, contrast);
        }
        return display;
    }

    static double[] pad(final GrayscaleRaster raster,
                        final int fftWidth,
                        final int fftHeight) {
        final int width = raster.getWidth();
        final double[] grid = new double[fftWidth * fftHeight * 2];
        for (int y = 0; y < raster.getHeight(); y++) {
            for (int x = 0; x < width; x++) {
                grid[(y * fftWidth + x) * 2] = raster.get(y * width + x);
            }
        }
        return grid;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ForwardTransformer.class);
}
