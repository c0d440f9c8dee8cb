package org.janelia.mixer;

import java.io.Reader;

import org.janelia.mixer.json.JsonUtils;
import org.janelia.mixer.mask.RegionSpec;
import org.janelia.mixer.mix.MixSpec;

/**
 * Everything a single mix needs besides the spectra themselves.
 */
public class MixRequest {

    private final MixSpec mix;
    private final RegionSpec region;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MixRequest() {
        this.mix = null;
        this.region = null;
    }

    /**
     * @param  mix     mixing mode and weights.
     * @param  region  frequency region to keep (null for no masking).
     */
    public MixRequest(final MixSpec mix,
                      final RegionSpec region) {
        this.mix = mix;
        this.region = region;
        validate();
    }

    public MixSpec getMix() {
        return mix;
    }

    /**
     * @return the frequency region, or null if none was specified.
     */
    public RegionSpec getRegion() {
        return region;
    }

    public boolean hasEnabledRegion() {
        return (region != null) && region.isEnabled();
    }

    public void validate()
            throws MixException {
        if (mix == null) {
            throw MixException.invalidInput("mix request must include a mix spec");
        }
        mix.validate();
        if (region != null) {
            region.validate();
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{mix: " + mix + ", region: " + region + '}';
    }

    public static MixRequest fromJson(final Reader json) {
        final MixRequest request = JSON_HELPER.fromJson(json);
        request.validate();
        return request;
    }

    public static MixRequest fromJson(final String json) {
        final MixRequest request = JSON_HELPER.fromJson(json);
        request.validate();
        return request;
    }

    private static final JsonUtils.Helper<MixRequest> JSON_HELPER =
            new JsonUtils.Helper<>(MixRequest.class);
}
