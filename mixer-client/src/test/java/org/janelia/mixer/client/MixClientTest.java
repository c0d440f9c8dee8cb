package org.janelia.mixer.client;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.MixRequest;
import org.janelia.mixer.client.parameter.CommandLineParameters;
import org.janelia.mixer.loader.GrayscaleImageLoader;
import org.janelia.mixer.mask.RegionKind;
import org.janelia.mixer.mix.MixMode;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link MixClient} class.
 */
public class MixClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new MixClient.Parameters());
    }

    @Test
    public void testBuildRequestFromFlags() throws Exception {

        final MixClient.Parameters parameters = new MixClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--image", "a.png", "--image", "b.png",
                "--weight", "1", "--weight", "3",
                "--mode", "REAL_IMAGINARY",
                "--regionKind", "OUTER", "--regionSize", "25",
                "--out", "mixed.png"
        }, MixClient.class, false);

        Assert.assertTrue("parse should succeed", parsed);
        Assert.assertEquals("incorrect number of images", 2, parameters.imagePaths.size());

        final MixRequest request = parameters.buildRequest();
        Assert.assertEquals("incorrect mode", MixMode.REAL_IMAGINARY, request.getMix().getMode());
        Assert.assertArrayEquals("incorrect weights", new double[] { 1, 3 }, request.getMix().getWeights(), 0);
        Assert.assertTrue("region should be enabled", request.hasEnabledRegion());
        Assert.assertEquals("incorrect region kind", RegionKind.OUTER, request.getRegion().getKind());
        Assert.assertEquals("incorrect region size", 25, request.getRegion().getSizePercent());
    }

    @Test
    public void testBuildRequestWithoutRegion() throws Exception {

        final MixClient.Parameters parameters = new MixClient.Parameters();
        parameters.parse(new String[] { "--image", "a.png", "--out", "mixed.png" }, MixClient.class, false);

        final MixRequest request = parameters.buildRequest();
        Assert.assertEquals("incorrect default mode", MixMode.MAGNITUDE_PHASE, request.getMix().getMode());
        Assert.assertEquals("weights should be empty", 0, request.getMix().getWeightCount());
        Assert.assertFalse("region should not be enabled", request.hasEnabledRegion());
    }

    @Test
    public void testInvalidOptionValues() throws Exception {

        final String[][] invalidArgs = {
                { "--image", "a.png", "--weight", "heavy", "--out", "mixed.png" },
                { "--image", "a.png", "--weight", "-1", "--out", "mixed.png" },
                { "--image", "a.png", "--regionSize", "101", "--out", "mixed.png" },
                { "--image", "a.png", "--mode", "AVERAGE", "--out", "mixed.png" },
                { "--image", "a.png" }
        };

        for (final String[] args : invalidArgs) {
            final MixClient.Parameters parameters = new MixClient.Parameters();
            Assert.assertFalse("parse should fail for " + String.join(" ", args),
                               parameters.parse(args, MixClient.class, false));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBuildRequestWithBadWeight() throws Exception {
        final MixClient.Parameters parameters = new MixClient.Parameters();
        parameters.weights.add("heavy");
        parameters.buildRequest();
    }

    @Test
    public void testBuildRequestFromJson() throws Exception {

        final File requestFile = temporaryFolder.newFile("request.json");
        try (final Writer writer = Files.newBufferedWriter(requestFile.toPath(), StandardCharsets.UTF_8)) {
            writer.write("{ \"comment\": \"Mischung der Frequenzbänder \u00b5\", " +
                         "\"mix\": { \"mode\": \"REAL_IMAGINARY\", \"weights\": [ 2 ] }, " +
                         "\"region\": { \"enabled\": true, \"kind\": \"INNER\", \"sizePercent\": 70 } }");
        }

        final MixClient.Parameters parameters = new MixClient.Parameters();
        parameters.parse(new String[] {
                "--image", "a.png", "--mode", "MAGNITUDE_PHASE",
                "--request", requestFile.getAbsolutePath(), "--out", "mixed.png"
        }, MixClient.class, false);

        final MixRequest request = parameters.buildRequest();
        Assert.assertEquals("request file should override mode flag",
                            MixMode.REAL_IMAGINARY, request.getMix().getMode());
        Assert.assertEquals("incorrect region size", 70, request.getRegion().getSizePercent());
    }

    @Test
    public void testMixToFile() throws Exception {

        final String smallPath = saveSource("small.tif", 20, 16);
        final String largePath = saveSource("large.tif", 31, 24);
        final File outputFile = new File(temporaryFolder.getRoot(), "out/mixed.tif");

        final MixClient.Parameters parameters = new MixClient.Parameters();
        parameters.parse(new String[] {
                "--image", smallPath, "--image", largePath,
                "--weight", "1", "--weight", "1",
                "--regionSize", "80",
                "--brightness", "10",
                "--out", outputFile.getAbsolutePath()
        }, MixClient.class, false);

        final GrayscaleRaster result = new MixClient(parameters).mixToFile();

        Assert.assertEquals("result should have smallest width", 20, result.getWidth());
        Assert.assertEquals("result should have smallest height", 16, result.getHeight());
        Assert.assertTrue("output file not written", outputFile.exists());
        Assert.assertEquals("saved image differs from result",
                            result, GrayscaleImageLoader.load(outputFile.getAbsolutePath()));
    }

    @Test(expected = IOException.class)
    public void testMixToFileWithMissingSource() throws Exception {

        final MixClient.Parameters parameters = new MixClient.Parameters();
        parameters.parse(new String[] {
                "--image", new File(temporaryFolder.getRoot(), "missing.tif").getAbsolutePath(),
                "--out", new File(temporaryFolder.getRoot(), "mixed.tif").getAbsolutePath()
        }, MixClient.class, false);

        new MixClient(parameters).mixToFile();
    }

    private String saveSource(final String name,
                              final int width,
                              final int height)
            throws IOException {
        final GrayscaleRaster raster = new GrayscaleRaster(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.set(x, y, (x * 7 + y * 13) % 256);
            }
        }
        final String path = new File(temporaryFolder.getRoot(), name).getAbsolutePath();
        GrayscaleImageLoader.save(raster, path);
        return path;
    }

}
