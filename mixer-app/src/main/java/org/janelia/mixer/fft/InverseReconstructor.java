package org.janelia.mixer.fft;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.SpectrumBuffer;
import org.janelia.mixer.util.MinMaxNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a shifted spectrum back into an 8-bit grayscale raster.
 *
 * Only the signed real channel of the spatial result is kept.
 */
public class InverseReconstructor {

    /**
     * @param  spectrum  shifted spectrum to reconstruct.
     *
     * @return raster with the spectrum's original dimensions (a uniform mid-gray raster
     *         if the reconstructed values have no usable range).
     */
    public GrayscaleRaster reconstruct(final SpectrumBuffer spectrum) {

        final int fftWidth = spectrum.getFftWidth();
        final int fftHeight = spectrum.getFftHeight();
        final int width = spectrum.getWidth();
        final int height = spectrum.getHeight();

        LOG.debug("reconstruct: entry, {}", spectrum);

        final double[] grid = SpectrumShift.inverseShift(spectrum.copyData(), fftWidth, fftHeight);

        FastFourierTransform.transformColumns(grid, fftWidth, fftHeight, true);
        FastFourierTransform.transformRows(grid, fftWidth, fftHeight, true);

        final double[] realValues = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                realValues[y * width + x] = grid[(y * fftWidth + x) * 2];
            }
        }

        return MinMaxNormalizer.normalize(realValues, width, height, MinMaxNormalizer.Rounding.NEAREST,
                                          "reconstructed");
    }

    private static final Logger LOG = LoggerFactory.getLogger(InverseReconstructor.class);
}
