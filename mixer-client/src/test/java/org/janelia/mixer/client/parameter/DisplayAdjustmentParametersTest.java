package org.janelia.mixer.client.parameter;

import java.io.File;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.janelia.mixer.filter.BrightnessContrast;
import org.janelia.mixer.filter.FilterSpec;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link DisplayAdjustmentParameters} class.
 */
public class DisplayAdjustmentParametersTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testNoAdjustment() throws Exception {
        final DisplayAdjustmentParameters parameters = new DisplayAdjustmentParameters();
        Assert.assertFalse("default parameters should not be adjusted", parameters.isAdjusted());
        Assert.assertNull("default parameters should not build a filter", parameters.buildFilterSpec());
    }

    @Test
    public void testBrightnessContrastSpec() throws Exception {

        final DisplayAdjustmentParameters parameters = new DisplayAdjustmentParameters();
        parameters.contrast = 30;

        final FilterSpec spec = parameters.buildFilterSpec();

        Assert.assertNotNull("filter spec should be built", spec);
        Assert.assertEquals("incorrect filter class", BrightnessContrast.class.getName(), spec.getClassName());
        Assert.assertEquals("incorrect contrast", 30, ((BrightnessContrast) spec.buildInstance()).getContrast(), 0);
    }

    @Test
    public void testFilterFileIsReadAsUtf8() throws Exception {

        final String label = "Phasenansicht für Bänder µm";
        final File filterFile = temporaryFolder.newFile("filter.json");
        try (final Writer writer = Files.newBufferedWriter(filterFile.toPath(), StandardCharsets.UTF_8)) {
            writer.write("{ \"className\": \"" + BrightnessContrast.class.getName() + "\", " +
                         "\"parameters\": { \"brightness\": \"15\", \"label\": \"" + label + "\" } }");
        }

        final DisplayAdjustmentParameters parameters = new DisplayAdjustmentParameters();
        parameters.displayFilterPath = filterFile.getAbsolutePath();

        final FilterSpec spec = parameters.buildFilterSpec();

        Assert.assertTrue("filter file should count as an adjustment", parameters.isAdjusted());
        Assert.assertEquals("non-ASCII parameter changed while reading", label, spec.getParameters().get("label"));
        Assert.assertEquals("incorrect brightness", 15, ((BrightnessContrast) spec.buildInstance()).getBrightness(), 0);
    }

}
