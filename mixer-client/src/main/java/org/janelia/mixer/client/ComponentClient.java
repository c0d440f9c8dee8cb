package org.janelia.mixer.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.SpectrumBuffer;
import org.janelia.mixer.client.parameter.CommandLineParameters;
import org.janelia.mixer.client.parameter.DisplayAdjustmentParameters;
import org.janelia.mixer.fft.ForwardTransformer;
import org.janelia.mixer.fft.SpectrumComponent;
import org.janelia.mixer.filter.FilterSpec;
import org.janelia.mixer.loader.GrayscaleImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes display views (magnitude, phase, real, imaginary) of an image's spectrum.
 */
public class ComponentClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--image",
                description = "Path of the source image",
                required = true)
        public String imagePath;

        @Parameter(
                names = "--component",
                description = "Spectrum component to write: MAGNITUDE, PHASE, REAL, or IMAGINARY (omit to write all)")
        public List<String> components = new ArrayList<>();

        @ParametersDelegate
        public DisplayAdjustmentParameters display = new DisplayAdjustmentParameters();

        @Parameter(
                names = "--outDir",
                description = "Directory for the component images",
                required = true)
        public String outputDirectory;

        public List<SpectrumComponent> getComponents() {
            if (components.isEmpty()) {
                return Arrays.asList(SpectrumComponent.values());
            }
            final List<SpectrumComponent> list = new ArrayList<>(components.size());
            for (final String name : components) {
                try {
                    list.add(SpectrumComponent.valueOf(name.toUpperCase()));
                } catch (final IllegalArgumentException e) {
                    throw new IllegalArgumentException("unknown --component '" + name + "', valid values are " +
                                                       Arrays.toString(SpectrumComponent.values()), e);
                }
            }
            return list;
        }

        @Override
        protected void validate()
                throws IllegalArgumentException {
            getComponents();
        }

    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ComponentClient client = new ComponentClient(parameters);
                client.writeComponents();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final ForwardTransformer transformer;

    public ComponentClient(final Parameters parameters) {
        this.parameters = parameters;
        this.transformer = new ForwardTransformer();
    }

    /**
     * @return the written component files.
     *
     * @throws IOException
     *   if the source cannot be read or a component cannot be written.
     */
    public List<File> writeComponents()
            throws IOException {

        final GrayscaleRaster source = GrayscaleImageLoader.load(parameters.imagePath);
        final SpectrumBuffer spectrum = transformer.transform(source);

        final String sourceName = new File(parameters.imagePath).getName();
        final int dotIndex = sourceName.lastIndexOf('.');
        final String baseName = dotIndex > 0 ? sourceName.substring(0, dotIndex) : sourceName;

        // brightness and contrast options go through the transformer, filter spec files are applied as is
        final FilterSpec fileFilterSpec =
                (parameters.display.displayFilterPath == null) ? null : parameters.display.buildFilterSpec();

        final List<File> writtenFiles = new ArrayList<>();
        for (final SpectrumComponent component : parameters.getComponents()) {

            final GrayscaleRaster display;
            if (fileFilterSpec == null) {
                display = transformer.renderComponent(spectrum,
                                                      component,
                                                      parameters.display.brightness,
                                                      parameters.display.contrast);
            } else {
                display = fileFilterSpec.apply(transformer.deriveDisplay(spectrum, component));
            }

            final File file = new File(parameters.outputDirectory,
                                       baseName + "." + component.name().toLowerCase() + ".png");
            GrayscaleImageLoader.save(display, file.getAbsolutePath());
            writtenFiles.add(file);
        }

        LOG.info("writeComponents: exit, wrote {} component images for {}", writtenFiles.size(), spectrum);

        return writtenFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ComponentClient.class);
}
