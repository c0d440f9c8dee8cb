package org.janelia.mixer.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.janelia.mixer.filter.BrightnessContrast;
import org.janelia.mixer.filter.FilterSpec;

/**
 * Display filter applied to written images only.
 */
public class DisplayAdjustmentParameters
        implements Serializable {

    @Parameter(
            names = "--brightness",
            description = "Display brightness offset (-100 to 100) applied to written images")
    public double brightness = 0;

    @Parameter(
            names = "--contrast",
            description = "Display contrast (-100 to 100) applied to written images")
    public double contrast = 0;

    @Parameter(
            names = "--displayFilter",
            description = "Path of a JSON filter spec applied to written images (overrides --brightness and --contrast)")
    public String displayFilterPath;

    public boolean isAdjusted() {
        return (displayFilterPath != null) || (brightness != 0) || (contrast != 0);
    }

    /**
     * @return spec for the requested display filter, or null if no adjustment was requested.
     *
     * @throws IOException
     *   if the filter spec file cannot be read.
     */
    public FilterSpec buildFilterSpec()
            throws IOException {
        final FilterSpec filterSpec;
        if (displayFilterPath != null) {
            try (final Reader reader = Files.newBufferedReader(Paths.get(displayFilterPath), StandardCharsets.UTF_8)) {
                filterSpec = FilterSpec.fromJson(reader);
            }
        } else if (isAdjusted()) {
            filterSpec = FilterSpec.forFilter(new BrightnessContrast(brightness, contrast));
        } else {
            filterSpec = null;
        }
        return filterSpec;
    }

}
