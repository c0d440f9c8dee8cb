package org.janelia.mixer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.mixer.mask.RegionSpec;
import org.janelia.mixer.mix.MixMode;
import org.janelia.mixer.mix.MixSpec;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FourierMixer} class.
 */
public class FourierMixerTest {

    private final FourierMixer fourierMixer = new FourierMixer();

    @Test
    public void testSingleSourceReconstruction() {

        final GrayscaleRaster raster = RasterTestUtil.buildSmoothRaster(45, 30);
        final List<SpectrumBuffer> spectra = fourierMixer.transformAll(Collections.singletonList(raster));

        for (final MixMode mode : MixMode.values()) {
            final GrayscaleRaster mixed = fourierMixer.mix(spectra, new MixRequest(new MixSpec(mode, 1), null));
            final double correlation = RasterTestUtil.pearsonCorrelation(raster, mixed);
            Assert.assertTrue(mode + " correlation " + correlation + " is too low", correlation > 0.99);
        }
    }

    @Test
    public void testWeightSelectsSource() {

        final GrayscaleRaster a = RasterTestUtil.buildSmoothRaster(16, 16);
        final GrayscaleRaster b = RasterTestUtil.buildCheckerboard(16, 16);
        final List<SpectrumBuffer> spectra = fourierMixer.transformAll(Arrays.asList(a, b));

        final GrayscaleRaster onlyB = fourierMixer.mix(spectra,
                                                       new MixRequest(new MixSpec(MixMode.MAGNITUDE_PHASE, 0, 1),
                                                                      null));

        final double correlation = RasterTestUtil.pearsonCorrelation(b, onlyB);
        Assert.assertTrue("correlation " + correlation + " is too low", correlation > 0.99);
    }

    @Test
    public void testCachedSpectraAreReusable() {

        final List<SpectrumBuffer> spectra =
                fourierMixer.transformAll(Arrays.asList(RasterTestUtil.buildSmoothRaster(20, 10),
                                                        RasterTestUtil.buildCheckerboard(20, 10)));
        final MixRequest request = new MixRequest(new MixSpec(MixMode.REAL_IMAGINARY, 0.3, 0.7),
                                                  RegionSpec.inner(60));

        final GrayscaleRaster first = fourierMixer.mix(spectra, request);
        fourierMixer.mix(spectra, new MixRequest(new MixSpec(MixMode.MAGNITUDE_PHASE, 1, 0), RegionSpec.outer(10)));
        final GrayscaleRaster second = fourierMixer.mix(spectra, request);

        Assert.assertEquals("repeated mix should give the same result", first, second);
    }

    @Test
    public void testFullOuterRegionIsMidGray() {

        final List<SpectrumBuffer> spectra =
                fourierMixer.transformAll(Collections.singletonList(RasterTestUtil.buildSmoothRaster(12, 12)));

        final GrayscaleRaster mixed = fourierMixer.mix(spectra,
                                                       new MixRequest(new MixSpec(MixMode.MAGNITUDE_PHASE, 1),
                                                                      RegionSpec.outer(100)));

        for (int i = 0; i < mixed.getPixelCount(); i++) {
            Assert.assertEquals("pixel " + i + " should be mid-gray", GrayscaleRaster.MID_GRAY, mixed.get(i));
        }
    }

    @Test
    public void testTransformAllWithoutSources() {
        try {
            fourierMixer.transformAll(Collections.emptyList());
            Assert.fail("exception should be thrown for empty list");
        } catch (final MixException e) {
            Assert.assertEquals("invalid reason", MixException.Reason.NO_SOURCES, e.getReason());
        }
    }

    @Test
    public void testTransformAllWithDifferentSizes() {
        try {
            fourierMixer.transformAll(Arrays.asList(new GrayscaleRaster(8, 8), new GrayscaleRaster(8, 9)));
            Assert.fail("exception should be thrown for different sizes");
        } catch (final MixException e) {
            Assert.assertEquals("invalid reason", MixException.Reason.DIMENSION_MISMATCH, e.getReason());
        }
    }

    @Test
    public void testMixWithoutSpectra() {
        try {
            fourierMixer.mix(Collections.emptyList(), new MixRequest(new MixSpec(MixMode.MAGNITUDE_PHASE), null));
            Assert.fail("exception should be thrown for empty list");
        } catch (final MixException e) {
            Assert.assertEquals("invalid reason", MixException.Reason.NO_SOURCES, e.getReason());
        }
    }

}
