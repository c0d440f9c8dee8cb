package org.janelia.mixer;

/**
 * Raised synchronously by the pipeline call that detects bad input.
 * The {@link Reason} lets callers distinguish the failure without parsing messages.
 */
public class MixException
        extends IllegalArgumentException {

    public enum Reason {
        /** empty or zero-sized raster, bad weights, bad region size */
        INVALID_INPUT,
        /** mix requested without any spectra */
        NO_SOURCES,
        /** sources differ in width or height */
        DIMENSION_MISMATCH
    }

    private final Reason reason;

    public MixException(final Reason reason,
                        final String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static MixException invalidInput(final String message) {
        return new MixException(Reason.INVALID_INPUT, message);
    }

    public static MixException noSources(final String message) {
        return new MixException(Reason.NO_SOURCES, message);
    }

    public static MixException dimensionMismatch(final String message) {
        return new MixException(Reason.DIMENSION_MISMATCH, message);
    }

}
