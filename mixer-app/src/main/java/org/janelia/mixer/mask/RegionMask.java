package org.janelia.mixer.mask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds boolean inclusion masks over shifted frequency grids.
 */
public class RegionMask {

    private RegionMask() {
    }

    /**
     * @param  fftWidth   padded spectrum width.
     * @param  fftHeight  padded spectrum height.
     * @param  spec       region to keep.
     *
     * @return row-major mask where true marks cells that take part in the mix.
     */
    public static boolean[] build(final int fftWidth,
                                  final int fftHeight,
                                  final RegionSpec spec) {

        final int centerX = fftWidth / 2;
        final int centerY = fftHeight / 2;
        final int halfWidth = spec.getHalfWidth(fftWidth);
        final int halfHeight = spec.getHalfHeight(fftHeight);
        final boolean keepInside = (spec.getKind() == RegionKind.INNER);

        LOG.debug("build: {}x{} mask for {}, halfWidth={}, halfHeight={}",
                  fftWidth, fftHeight, spec, halfWidth, halfHeight);

        final boolean[] mask = new boolean[fftWidth * fftHeight];
        for (int y = 0; y < fftHeight; y++) {
            final int dy = Math.abs(y - centerY);
            for (int x = 0; x < fftWidth; x++) {
                final int dx = Math.abs(x - centerX);
                final boolean insideRect = (dx <= halfWidth) && (dy <= halfHeight);
                mask[y * fftWidth + x] = (insideRect == keepInside);
            }
        }
        return mask;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegionMask.class);
}
