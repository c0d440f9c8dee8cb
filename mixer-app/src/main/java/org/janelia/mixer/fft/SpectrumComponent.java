package org.janelia.mixer.fft;

/**
 * Displayable views of a complex spectrum.
 */
public enum SpectrumComponent {

    MAGNITUDE(true),
    PHASE(false),
    REAL(false),
    IMAGINARY(false);

    private final boolean logScaled;

    SpectrumComponent(final boolean logScaled) {
        this.logScaled = logScaled;
    }

    /**
     * @return true if display values are compressed with log(1 + value) before normalization.
     */
    public boolean isLogScaled() {
        return logScaled;
    }

    public double valueOf(final double real,
                          final double imaginary) {
        final double value;
        switch (this) {
            case MAGNITUDE:
                value = Math.sqrt(real * real + imaginary * imaginary);
                break;
            case PHASE:
                value = Math.atan2(imaginary, real);
                break;
            case REAL:
                value = real;
                break;
            default:
                value = imaginary;
        }
        return value;
    }

}
