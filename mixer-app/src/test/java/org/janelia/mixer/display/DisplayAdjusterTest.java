package org.janelia.mixer.display;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.RasterTestUtil;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DisplayAdjuster} class.
 */
public class DisplayAdjusterTest {

    @Test
    public void testNeutralAdjustmentIsIdentity() {

        final GrayscaleRaster raster = RasterTestUtil.buildSmoothRaster(10, 7);

        final GrayscaleRaster adjusted = DisplayAdjuster.adjust(raster, 0, 0);

        Assert.assertEquals("neutral adjustment should not change pixels", raster, adjusted);
        Assert.assertNotSame("adjust should return a new raster", raster, adjusted);
    }

    @Test
    public void testContrastFactor() {
        Assert.assertEquals("incorrect factor for 0", 1.0, DisplayAdjuster.contrastFactor(0), 1e-12);
        Assert.assertEquals("incorrect factor for 100", 91945.0 / 40545.0, DisplayAdjuster.contrastFactor(100), 1e-12);
        Assert.assertEquals("incorrect factor for -100", 40145.0 / 91545.0, DisplayAdjuster.contrastFactor(-100), 1e-12);
    }

    @Test
    public void testAdjustSample() {

        final double highContrast = DisplayAdjuster.contrastFactor(100);
        final double lowContrast = DisplayAdjuster.contrastFactor(-100);

        Assert.assertEquals("mid-gray should be a contrast fixed point",
                            128, DisplayAdjuster.adjustSample(128, 0, highContrast));
        Assert.assertEquals("high contrast should saturate", 255, DisplayAdjuster.adjustSample(200, 0, highContrast));
        Assert.assertEquals("high contrast should clip to black", 0, DisplayAdjuster.adjustSample(50, 0, highContrast));
        Assert.assertEquals("low contrast should pull black toward gray",
                            72, DisplayAdjuster.adjustSample(0, 0, lowContrast));
        Assert.assertEquals("brightness should be added", 60, DisplayAdjuster.adjustSample(10, 50, 1.0));
        Assert.assertEquals("brightness should clip to white", 255, DisplayAdjuster.adjustSample(250, 50, 1.0));
        Assert.assertEquals("negative brightness should clip to black", 0, DisplayAdjuster.adjustSample(20, -50, 1.0));
    }

    @Test
    public void testAdjustmentsAreClamped() {

        final GrayscaleRaster raster = GrayscaleRaster.fromValues(3, 1, new int[] { 0, 100, 200 });

        Assert.assertEquals("brightness beyond range should be clamped",
                            DisplayAdjuster.adjust(raster, 100, 0), DisplayAdjuster.adjust(raster, 500, 0));
        Assert.assertEquals("contrast beyond range should be clamped",
                            DisplayAdjuster.adjust(raster, 0, -100), DisplayAdjuster.adjust(raster, 0, -250));
        Assert.assertEquals("incorrect clamp", -100.0, DisplayAdjuster.clampAdjustment(-101), 0);
    }

    @Test
    public void testSourceIsNotModified() {
        final GrayscaleRaster raster = RasterTestUtil.buildCheckerboard(4, 4);
        final GrayscaleRaster before = raster.copy();
        DisplayAdjuster.adjust(raster, 40, 60);
        Assert.assertEquals("source raster should not change", before, raster);
    }

}
