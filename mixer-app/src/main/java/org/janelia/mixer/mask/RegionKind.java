package org.janelia.mixer.mask;

/**
 * Which side of the centered frequency rectangle is kept.
 */
public enum RegionKind {

    /** keep the rectangle (low frequencies) */
    INNER,

    /** keep everything outside the rectangle (high frequencies) */
    OUTER

}
