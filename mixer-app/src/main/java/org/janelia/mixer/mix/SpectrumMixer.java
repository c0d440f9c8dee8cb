package org.janelia.mixer.mix;

import java.util.Arrays;
import java.util.List;

import org.janelia.mixer.MixException;
import org.janelia.mixer.SpectrumBuffer;
import org.janelia.mixer.mask.RegionMask;
import org.janelia.mixer.mask.RegionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines shifted spectra cell by cell.
 *
 * Mixing always works on the full precision complex values of the source spectra.
 * Cells excluded by an enabled region contribute nothing and are written as zero.
 */
public class SpectrumMixer {

    /**
     * @param  buffers  spectra to mix, all derived from images of the same size.
     * @param  spec     mixing mode and raw weights.
     * @param  region   optional frequency region (null or disabled for no masking).
     *
     * @return mixed spectrum with the same padded and original dimensions as the sources.
     *
     * @throws MixException
     *   if no spectra are provided or their dimensions differ.
     */
    public SpectrumBuffer mix(final List<SpectrumBuffer> buffers,
                              final MixSpec spec,
                              final RegionSpec region)
            throws MixException {

        if ((buffers == null) || buffers.isEmpty()) {
            throw MixException.noSources("no spectra to mix");
        }

        final SpectrumBuffer first = buffers.get(0);
        for (int i = 1; i < buffers.size(); i++) {
            final SpectrumBuffer buffer = buffers.get(i);
            if (! first.sameSizeAs(buffer)) {
                throw MixException.dimensionMismatch("all sources must have the same dimensions but source " + i +
                                                     " is " + buffer.getWidth() + "x" + buffer.getHeight() +
                                                     " while source 0 is " + first.getWidth() + "x" +
                                                     first.getHeight());
            }
        }

        if (spec.getWeightCount() != buffers.size()) {
            LOG.warn("mix: {} weights provided for {} sources, aligning by position",
                     spec.getWeightCount(), buffers.size());
        }

        final double[] weights = spec.getNormalizedWeights(buffers.size());

        final int fftWidth = first.getFftWidth();
        final int fftHeight = first.getFftHeight();
        final boolean[] mask = (region != null) && region.isEnabled() ?
                               RegionMask.build(fftWidth, fftHeight, region) : null;

        LOG.debug("mix: entry, {} sources, mode={}, normalizedWeights={}, region={}",
                  buffers.size(), spec.getMode(), Arrays.toString(weights), region);

        final double[] mixed = new double[fftWidth * fftHeight * 2];

        if (spec.getMode() == MixMode.MAGNITUDE_PHASE) {
            mixMagnitudePhase(buffers, weights, mask, mixed);
        } else {
            mixRealImaginary(buffers, weights, mask, mixed);
        }

        return new SpectrumBuffer(first.getWidth(), first.getHeight(), mixed);
    }

    private static void mixMagnitudePhase(final List<SpectrumBuffer> buffers,
                                          final double[] weights,
                                          final boolean[] mask,
                                          final double[] mixed) {

        final int cellCount = mixed.length / 2;
        for (int cell = 0; cell < cellCount; cell++) {

            if ((mask != null) && (! mask[cell])) {
                continue;
            }

            double magnitude = 0.0;
            double sumCos = 0.0;
            double sumSin = 0.0;

            for (int j = 0; j < weights.length; j++) {
                final double weight = weights[j];
                if (weight == 0.0) {
                    continue;
                }
                final SpectrumBuffer buffer = buffers.get(j);
                final double phase = buffer.getPhase(cell);
                magnitude += buffer.getMagnitude(cell) * weight;
                // phases are averaged on the unit circle so that +pi and -pi agree
                sumCos += Math.cos(phase) * weight;
                sumSin += Math.sin(phase) * weight;
            }

            final double phase = Math.atan2(sumSin, sumCos);
            mixed[cell * 2] = magnitude * Math.cos(phase);
            mixed[cell * 2 + 1] = magnitude * Math.sin(phase);
        }
    }

    private static void mixRealImaginary(final List<SpectrumBuffer> buffers,
                                         final double[] weights,
                                         final boolean[] mask,
                                         final double[] mixed) {

        final int cellCount = mixed.length / 2;
        for (int cell = 0; cell < cellCount; cell++) {

            if ((mask != null) && (! mask[cell])) {
                continue;
            }

            double real = 0.0;
            double imaginary = 0.0;

            for (int j = 0; j < weights.length; j++) {
                final double weight = weights[j];
                if (weight == 0.0) {
                    continue;
                }
                final SpectrumBuffer buffer = buffers.get(j);
                real += buffer.getReal(cell) * weight;
                imaginary += buffer.getImaginary(cell) * weight;
            }

            mixed[cell * 2] = real;
            mixed[cell * 2 + 1] = imaginary;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumMixer.class);
}
