package org.janelia.mixer.mix;

/**
 * Strategies for blending complex spectra.
 */
public enum MixMode {

    /** weighted sum of magnitudes combined with a weighted circular mean of phases */
    MAGNITUDE_PHASE,

    /** weighted sum of real parts and of imaginary parts */
    REAL_IMAGINARY

}
