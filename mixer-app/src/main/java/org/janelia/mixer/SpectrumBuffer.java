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

import java.util.Arrays;

import org.janelia.mixer.fft.FastFourierTransform;

/**
 * Padded complex frequency representation of one image.
 *
 * Values are interleaved (real, imaginary) pairs in row-major order over a
 * {@link #getFftWidth()} x {@link #getFftHeight()} grid and are stored spectrum-shifted,
 * so the zero frequency term sits at (fftWidth / 2, fftHeight / 2).
 * The original (unpadded) image dimensions are retained so that results can be cropped back.
 *
 * Instances are immutable: the constructor copies the data it is given and
 * {@link #copyData()} hands out copies, so buffers can be shared across concurrent mixes.
 */
public class SpectrumBuffer {

    private final int width;
    private final int height;
    private final int fftWidth;
    private final int fftHeight;
    private final double[] data;

    /**
     * @param  width   original image width.
     * @param  height  original image height.
     * @param  data    shifted interleaved complex values for the padded grid (copied).
     *
     * @throws MixException
     *   if the dimensions are empty or the data length does not match the padded grid.
     */
    public SpectrumBuffer(final int width,
                          final int height,
                          final double[] data)
            throws MixException {

        if ((width < 1) || (height < 1)) {
            throw MixException.invalidInput("spectrum requires non-empty dimensions but got " +
                                            width + "x" + height);
        }

        this.width = width;
        this.height = height;
        this.fftWidth = FastFourierTransform.nextPowerOfTwo(width);
        this.fftHeight = FastFourierTransform.nextPowerOfTwo(height);

        final int expectedLength = fftWidth * fftHeight * 2;
        if ((data == null) || (data.length != expectedLength)) {
            throw MixException.invalidInput("spectrum for " + width + "x" + height + " image requires " +
                                            expectedLength + " values but got " +
                                            (data == null ? null : data.length));
        }

        this.data = Arrays.copyOf(data, data.length);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFftWidth() {
        return fftWidth;
    }

    public int getFftHeight() {
        return fftHeight;
    }

    /**
     * @return number of complex cells in the padded grid.
     */
    public int getCellCount() {
        return fftWidth * fftHeight;
    }

    public double getReal(final int cell) {
        return data[cell * 2];
    }

    public double getImaginary(final int cell) {
        return data[cell * 2 + 1];
    }

    public double getMagnitude(final int cell) {
        final double re = data[cell * 2];
        final double im = data[cell * 2 + 1];
        return Math.sqrt(re * re + im * im);
    }

    public double getPhase(final int cell) {
        return Math.atan2(data[cell * 2 + 1], data[cell * 2]);
    }

    public boolean sameSizeAs(final SpectrumBuffer that) {
        return (this.width == that.width) && (this.height == that.height);
    }

    /**
     * @return copy of the interleaved complex values.
     */
    public double[] copyData() {
        return Arrays.copyOf(data, data.length);
    }

    @Override
    public String toString() {
        return "SpectrumBuffer{" + width + "x" + height + " padded to " + fftWidth + "x" + fftHeight + '}';
    }

}
