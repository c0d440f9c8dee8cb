package org.janelia.mixer.mix;

import java.io.Reader;
import java.util.Arrays;

import org.janelia.mixer.MixException;
import org.janelia.mixer.json.JsonUtils;

/**
 * Mixing mode plus raw (un-normalized) per-source weights.
 * Weights are positional: weight i applies to spectrum i of the mixed list.
 */
public class MixSpec {

    private final MixMode mode;
    private final double[] weights;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MixSpec() {
        this.mode = MixMode.MAGNITUDE_PHASE;
        this.weights = new double[0];
    }

    /**
     * @param  mode     mixing strategy.
     * @param  weights  raw weights (copied), each must be finite and non-negative.
     *
     * @throws MixException
     *   if the mode is missing or any weight is invalid.
     */
    public MixSpec(final MixMode mode,
                   final double... weights)
            throws MixException {
        this.mode = mode;
        this.weights = weights == null ? new double[0] : Arrays.copyOf(weights, weights.length);
        validate();
    }

    public MixMode getMode() {
        return mode;
    }

    public double[] getWeights() {
        return Arrays.copyOf(weights, weights.length);
    }

    public int getWeightCount() {
        return weights.length;
    }

    /**
     * Aligns the raw weights with the specified number of sources (missing weights count as zero,
     * extra weights are ignored) and scales them to sum to one.
     * If the aligned weights sum to zero, every source gets an equal share.
     *
     * @param  sourceCount  number of spectra being mixed.
     *
     * @return normalized weights, one per source.
     */
    public double[] getNormalizedWeights(final int sourceCount) {

        final double[] normalized = new double[sourceCount];
        final int alignedCount = Math.min(sourceCount, weights.length);

        double sum = 0.0;
        for (int i = 0; i < alignedCount; i++) {
            normalized[i] = weights[i];
            sum += weights[i];
        }

        if (sum > 0.0) {
            for (int i = 0; i < sourceCount; i++) {
                normalized[i] = normalized[i] / sum;
            }
        } else if (sourceCount > 0) {
            Arrays.fill(normalized, 1.0 / sourceCount);
        }

        return normalized;
    }

    /**
     * @throws MixException
     *   if this spec (typically a deserialized one) is not usable.
     */
    public void validate()
            throws MixException {
        if (mode == null) {
            throw MixException.invalidInput("mix mode must be defined");
        }
        if (weights == null) {
            throw MixException.invalidInput("mix weights must be defined");
        }
        for (int i = 0; i < weights.length; i++) {
            if ((! Double.isFinite(weights[i])) || (weights[i] < 0)) {
                throw MixException.invalidInput("weight " + i + " must be a non-negative number but was " +
                                                weights[i]);
            }
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{mode: " + mode + ", weights: " + Arrays.toString(weights) + '}';
    }

    public static MixSpec fromJson(final String json) {
        final MixSpec spec = JSON_HELPER.fromJson(json);
        spec.validate();
        return spec;
    }

    public static MixSpec fromJson(final Reader json) {
        final MixSpec spec = JSON_HELPER.fromJson(json);
        spec.validate();
        return spec;
    }

    private static final JsonUtils.Helper<MixSpec> JSON_HELPER =
            new JsonUtils.Helper<>(MixSpec.class);
}
