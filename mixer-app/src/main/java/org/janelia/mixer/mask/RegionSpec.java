package org.janelia.mixer.mask;

import java.io.Reader;

import org.janelia.mixer.MixException;
import org.janelia.mixer.json.JsonUtils;

/**
 * Describes a frequency region as a rectangle centered on the zero frequency term.
 * The rectangle's half extents are floor(fftSize * sizePercent / 100 / 2) in each dimension.
 */
public class RegionSpec {

    private final boolean enabled;
    private final RegionKind kind;
    private final int sizePercent;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private RegionSpec() {
        this.enabled = false;
        this.kind = RegionKind.INNER;
        this.sizePercent = 100;
    }

    /**
     * @param  enabled      indicates whether masking should be applied.
     * @param  kind         side of the rectangle to keep.
     * @param  sizePercent  rectangle size as a percentage (0 - 100) of the padded spectrum.
     *
     * @throws MixException
     *   if the kind is missing or the size is out of range.
     */
    public RegionSpec(final boolean enabled,
                      final RegionKind kind,
                      final int sizePercent)
            throws MixException {
        this.enabled = enabled;
        this.kind = kind;
        this.sizePercent = sizePercent;
        validate();
    }

    public static RegionSpec inner(final int sizePercent) {
        return new RegionSpec(true, RegionKind.INNER, sizePercent);
    }

    public static RegionSpec outer(final int sizePercent) {
        return new RegionSpec(true, RegionKind.OUTER, sizePercent);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RegionKind getKind() {
        return kind;
    }

    public int getSizePercent() {
        return sizePercent;
    }

    public int getHalfWidth(final int fftWidth) {
        return halfExtent(fftWidth);
    }

    public int getHalfHeight(final int fftHeight) {
        return halfExtent(fftHeight);
    }

    /**
     * @throws MixException
     *   if this spec (typically a deserialized one) is not usable.
     */
    public void validate()
            throws MixException {
        if (kind == null) {
            throw MixException.invalidInput("region kind must be defined");
        }
        if ((sizePercent < 0) || (sizePercent > 100)) {
            throw MixException.invalidInput("region sizePercent must be between 0 and 100 but was " + sizePercent);
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{enabled: " + enabled + ", kind: " + kind + ", sizePercent: " + sizePercent + '}';
    }

    public static RegionSpec fromJson(final String json) {
        final RegionSpec spec = JSON_HELPER.fromJson(json);
        spec.validate();
        return spec;
    }

    public static RegionSpec fromJson(final Reader json) {
        final RegionSpec spec = JSON_HELPER.fromJson(json);
        spec.validate();
        return spec;
    }

    private int halfExtent(final int fftSize) {
        return (int) Math.floor(fftSize * (sizePercent / 100.0) / 2.0);
    }

    private static final JsonUtils.Helper<RegionSpec> JSON_HELPER =
            new JsonUtils.Helper<>(RegionSpec.class);
}
