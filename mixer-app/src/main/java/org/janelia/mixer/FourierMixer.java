package org.janelia.mixer;

import java.util.ArrayList;
import java.util.List;

import org.janelia.mixer.fft.ForwardTransformer;
import org.janelia.mixer.fft.InverseReconstructor;
import org.janelia.mixer.mix.SpectrumMixer;
import org.janelia.mixer.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the transform, mix and reconstruct steps for one request.
 *
 * Instances hold no per-request state, so one mixer can serve concurrent callers
 * as long as they do not share mutable rasters.
 * Forward transforms are meant to be computed once per source with {@link #transformAll}
 * and reused across mixes; only mixing and reconstruction run for each request.
 */
public class FourierMixer {

    private final ForwardTransformer forwardTransformer;
    private final SpectrumMixer spectrumMixer;
    private final InverseReconstructor inverseReconstructor;

    public FourierMixer() {
        this(new ForwardTransformer(), new SpectrumMixer(), new InverseReconstructor());
    }

    public FourierMixer(final ForwardTransformer forwardTransformer,
                        final SpectrumMixer spectrumMixer,
                        final InverseReconstructor inverseReconstructor) {
        this.forwardTransformer = forwardTransformer;
        this.spectrumMixer = spectrumMixer;
        this.inverseReconstructor = inverseReconstructor;
    }

    /**
     * @param  rasters  source rasters, all with the same dimensions.
     *
     * @return spectrum for each raster, in the same order.
     *
     * @throws MixException
     *   if there are no rasters, any raster is empty, or their dimensions differ.
     */
    public List<SpectrumBuffer> transformAll(final List<GrayscaleRaster> rasters)
            throws MixException {

        if ((rasters == null) || rasters.isEmpty()) {
            throw MixException.noSources("no rasters to transform");
        }

        final GrayscaleRaster first = rasters.get(0);
        final List<SpectrumBuffer> spectra = new ArrayList<>(rasters.size());
        for (final GrayscaleRaster raster : rasters) {
            if (! first.sameSizeAs(raster)) {
                throw MixException.dimensionMismatch("all rasters must have the same dimensions but found " +
                                                     first + " and " + raster);
            }
            spectra.add(forwardTransformer.transform(raster));
        }

        LOG.info("transformAll: transformed {} rasters", spectra.size());

        return spectra;
    }

    /**
     * @param  spectra  cached source spectra.
     * @param  request  mixing parameters.
     *
     * @return reconstructed mix of the spectra.
     *
     * @throws MixException
     *   if there are no spectra or their dimensions differ.
     */
    public GrayscaleRaster mix(final List<SpectrumBuffer> spectra,
                               final MixRequest request)
            throws MixException {

        LOG.info("mix: entry, {} spectra, request={}", spectra == null ? 0 : spectra.size(), request);

        final ProcessTimer timer = new ProcessTimer();

        final SpectrumBuffer mixed = spectrumMixer.mix(spectra, request.getMix(), request.getRegion());
        final GrayscaleRaster result = inverseReconstructor.reconstruct(mixed);

        LOG.info("mix: exit, built {} in {}", result, timer);

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FourierMixer.class);
}
