/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.mixer;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;

/**
 * Dense row-major 8-bit intensity samples with explicit dimensions.
 *
 * Samples are stored as unsigned bytes, so callers should use {@link #get} and {@link #set}
 * rather than reading the backing array directly.
 */
public class GrayscaleRaster {

    public static final int MID_GRAY = 128;

    private final int width;
    private final int height;
    private final byte[] pixels;

    /**
     * Constructs a black raster.
     *
     * @param  width   raster width.
     * @param  height  raster height.
     */
    public GrayscaleRaster(final int width,
                           final int height) {
        this(width, height, new byte[checkedSize(width, height)]);
    }

    /**
     * Wraps the specified pixels (no copy is made).
     *
     * @param  width   raster width.
     * @param  height  raster height.
     * @param  pixels  row-major samples, length must be width * height.
     *
     * @throws MixException
     *   if the dimensions are negative or do not match the pixel count.
     */
    public GrayscaleRaster(final int width,
                           final int height,
                           final byte[] pixels)
            throws MixException {

        if (pixels == null) {
            throw MixException.invalidInput("pixels must be defined");
        }
        if (pixels.length != checkedSize(width, height)) {
            throw MixException.invalidInput("pixel count " + pixels.length + " does not match " +
                                            width + "x" + height + " raster");
        }

        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * @return raster built from integer samples that are clamped to [0, 255].
     */
    public static GrayscaleRaster fromValues(final int width,
                                             final int height,
                                             final int[] values) {
        final GrayscaleRaster raster = new GrayscaleRaster(width, height);
        if (values.length != raster.getPixelCount()) {
            throw MixException.invalidInput("value count " + values.length + " does not match " +
                                            width + "x" + height + " raster");
        }
        for (int i = 0; i < values.length; i++) {
            raster.set(i, values[i]);
        }
        return raster;
    }

    /**
     * @return raster with a copy of the specified processor's pixels converted to 8-bit.
     */
    public static GrayscaleRaster fromProcessor(final ImageProcessor ip) {
        final ByteProcessor bp = ip instanceof ByteProcessor ? (ByteProcessor) ip : ip.convertToByteProcessor();
        final byte[] source = (byte[]) bp.getPixels();
        return new GrayscaleRaster(bp.getWidth(), bp.getHeight(), Arrays.copyOf(source, source.length));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    public boolean isEmpty() {
        return (width == 0) || (height == 0);
    }

    public int get(final int index) {
        return pixels[index] & 0xff;
    }

    public int get(final int x,
                   final int y) {
        return get(y * width + x);
    }

    /**
     * Sets the sample at the specified index, clamping the value to [0, 255].
     */
    public void set(final int index,
                    final int value) {
        pixels[index] = (byte) Math.max(0, Math.min(255, value));
    }

    public void set(final int x,
                    final int y,
                    final int value) {
        set(y * width + x, value);
    }

    public void fill(final int value) {
        Arrays.fill(pixels, (byte) Math.max(0, Math.min(255, value)));
    }

    public boolean sameSizeAs(final GrayscaleRaster that) {
        return (this.width == that.width) && (this.height == that.height);
    }

    public GrayscaleRaster copy() {
        return new GrayscaleRaster(width, height, Arrays.copyOf(pixels, pixels.length));
    }

    /**
     * @return sample values widened to doubles (row-major).
     */
    public double[] toDoubles() {
        final double[] values = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            values[i] = get(i);
        }
        return values;
    }

    /**
     * @return processor backed by a copy of this raster's pixels.
     */
    public ByteProcessor toByteProcessor() {
        return new ByteProcessor(width, height, Arrays.copyOf(pixels, pixels.length));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final GrayscaleRaster that = (GrayscaleRaster) o;
        return (width == that.width) && (height == that.height) && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "GrayscaleRaster{" + width + "x" + height + '}';
    }

    private static int checkedSize(final int width,
                                   final int height) {
        if ((width < 0) || (height < 0)) {
            throw MixException.invalidInput("negative raster dimensions " + width + "x" + height);
        }
        return width * height;
    }

}
