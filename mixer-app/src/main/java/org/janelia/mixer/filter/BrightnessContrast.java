package org.janelia.mixer.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.HashMap;
import java.util.Map;

import org.janelia.mixer.display.DisplayAdjuster;

/**
 * {@link DisplayAdjuster} remapping packaged as a {@link Filter} for 8-bit previews.
 */
public class BrightnessContrast
        implements Filter {

    public static final String BRIGHTNESS_NAME = "brightness";
    public static final String CONTRAST_NAME = "contrast";

    private double brightness;
    private double contrast;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public BrightnessContrast() {
        this(0, 0);
    }

    public BrightnessContrast(final double brightness,
                              final double contrast) {
        this.brightness = DisplayAdjuster.clampAdjustment(brightness);
        this.contrast = DisplayAdjuster.clampAdjustment(contrast);
    }

    public double getBrightness() {
        return brightness;
    }

    public double getContrast() {
        return contrast;
    }

    @Override
    public void init(final Map<String, String> params) {
        this.brightness = DisplayAdjuster.clampAdjustment(Filter.getDoubleParameter(BRIGHTNESS_NAME, params, 0));
        this.contrast = DisplayAdjuster.clampAdjustment(Filter.getDoubleParameter(CONTRAST_NAME, params, 0));
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new HashMap<>();
        map.put(BRIGHTNESS_NAME, String.valueOf(brightness));
        map.put(CONTRAST_NAME, String.valueOf(contrast));
        return map;
    }

    @Override
    public void process(final ImageProcessor ip) {
        if (! (ip instanceof ByteProcessor)) {
            throw new IllegalArgumentException("this filter only supports 8-bit images but got " +
                                               ip.getClass().getName());
        }
        final double factor = DisplayAdjuster.contrastFactor(contrast);
        final int pixelCount = ip.getPixelCount();
        for (int i = 0; i < pixelCount; i++) {
            ip.set(i, DisplayAdjuster.adjustSample(ip.get(i), brightness, factor));
        }
    }

    @Override
    public String toString() {
        return "BrightnessContrast{brightness=" + brightness + ", contrast=" + contrast + '}';
    }

}
