package org.janelia.mixer.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.mixer.FourierMixer;
import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.MixRequest;
import org.janelia.mixer.SpectrumBuffer;
import org.janelia.mixer.client.parameter.CommandLineParameters;
import org.janelia.mixer.client.parameter.DisplayAdjustmentParameters;
import org.janelia.mixer.filter.FilterSpec;
import org.janelia.mixer.loader.GrayscaleImageLoader;
import org.janelia.mixer.loader.NearestNeighborResizer;
import org.janelia.mixer.mask.RegionKind;
import org.janelia.mixer.mask.RegionSpec;
import org.janelia.mixer.mix.MixMode;
import org.janelia.mixer.mix.MixSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mixes the frequency content of several image files and saves the reconstructed result.
 */
public class MixClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--image",
                description = "Path of a source image (specify once for each source)",
                required = true)
        public List<String> imagePaths = new ArrayList<>();

        @Parameter(
                names = "--weight",
                description = "Weight for the source image at the same position (omit for equal weights)")
        public List<String> weights = new ArrayList<>();

        @Parameter(
                names = "--mode",
                description = "Mixing mode")
        public MixMode mode = MixMode.MAGNITUDE_PHASE;

        @Parameter(
                names = "--regionKind",
                description = "Frequency region to keep when --regionSize is specified")
        public RegionKind regionKind = RegionKind.INNER;

        @Parameter(
                names = "--regionSize",
                description = "Size (0 - 100 percent of the spectrum) of the centered frequency region to keep, " +
                              "omit to mix all frequencies")
        public Integer regionSize;

        @Parameter(
                names = "--request",
                description = "Path of a JSON mix request file (overrides --mode, --weight, --regionKind, " +
                              "and --regionSize)")
        public String requestPath;

        @ParametersDelegate
        public DisplayAdjustmentParameters display = new DisplayAdjustmentParameters();

        @Parameter(
                names = "--out",
                description = "Path for the output image file (png or tif)",
                required = true)
        public String outputPath;

        /**
         * @return weight values in source order.
         *
         * @throws IllegalArgumentException
         *   if any weight is not a number.
         */
        public double[] getWeightValues()
                throws IllegalArgumentException {
            final double[] weightValues = new double[weights.size()];
            for (int i = 0; i < weightValues.length; i++) {
                try {
                    weightValues[i] = Double.parseDouble(weights.get(i));
                } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException("invalid --weight value '" + weights.get(i) + "'", e);
                }
            }
            return weightValues;
        }

        /**
         * @return request from the --request file if one was specified, otherwise from the mix and region options.
         *
         * @throws IOException
         *   if the request file cannot be read.
         */
        public MixRequest buildRequest()
                throws IOException {

            final MixRequest request;
            if (requestPath == null) {
                final RegionSpec region = (regionSize == null) ? null : new RegionSpec(true, regionKind, regionSize);
                request = new MixRequest(new MixSpec(mode, getWeightValues()), region);
            } else {
                try (final Reader reader = Files.newBufferedReader(Paths.get(requestPath), StandardCharsets.UTF_8)) {
                    request = MixRequest.fromJson(reader);
                }
            }
            return request;
        }

        @Override
        protected void validate()
                throws IllegalArgumentException {
            if (requestPath == null) {
                // weights and region are checked before any image is loaded
                new MixSpec(mode, getWeightValues());
                if (regionSize != null) {
                    new RegionSpec(true, regionKind, regionSize);
                }
            }
        }

    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final MixClient client = new MixClient(parameters);
                client.mixToFile();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final FourierMixer mixer;

    public MixClient(final Parameters parameters) {
        this.parameters = parameters;
        this.mixer = new FourierMixer();
    }

    /**
     * Loads the source images, brings them to a common size, mixes them,
     * and saves the (optionally display adjusted) result.
     *
     * @return the saved raster.
     *
     * @throws IOException
     *   if any image cannot be read or written.
     */
    public GrayscaleRaster mixToFile()
            throws IOException {

        final MixRequest request = parameters.buildRequest();

        final List<GrayscaleRaster> sources = new ArrayList<>(parameters.imagePaths.size());
        for (final String imagePath : parameters.imagePaths) {
            sources.add(GrayscaleImageLoader.load(imagePath));
        }

        final List<SpectrumBuffer> spectra =
                mixer.transformAll(NearestNeighborResizer.resizeToUnifiedSize(sources));

        GrayscaleRaster result = mixer.mix(spectra, request);

        final FilterSpec displayFilterSpec = parameters.display.buildFilterSpec();
        if (displayFilterSpec != null) {
            LOG.info("mixToFile: applying display filter {}", displayFilterSpec);
            result = displayFilterSpec.apply(result);
        }

        GrayscaleImageLoader.save(result, parameters.outputPath);

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MixClient.class);
}
