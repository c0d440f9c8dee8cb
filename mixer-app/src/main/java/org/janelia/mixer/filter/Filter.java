package org.janelia.mixer.filter;

import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Map;

/**
 * Display filter that can be described by a {@link FilterSpec}.
 * Implementations need a public no-arg constructor so that specs can instantiate them.
 */
public interface Filter extends Serializable {

    /**
     * @param  params  named parameter values (missing names fall back to implementation defaults).
     */
    void init(final Map<String, String> params);

    /**
     * @return parameter values that {@link #init} would accept to rebuild this filter.
     */
    Map<String, String> toParametersMap();

    /**
     * Remaps the processor's pixels in place.
     */
    void process(final ImageProcessor ip);

    /**
     * @return numeric value of the named parameter or the default if it is not present.
     *
     * @throws IllegalArgumentException
     *   if the value is present but is not a number.
     */
    static double getDoubleParameter(final String parameterName,
                                     final Map<String, String> params,
                                     final double defaultValue)
            throws IllegalArgumentException {
        final String valueString = (params == null) ? null : params.get(parameterName);
        if (valueString == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(valueString.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("filter parameter '" + parameterName + "' must be a number but was '" +
                                               valueString + "'", e);
        }
    }

}
