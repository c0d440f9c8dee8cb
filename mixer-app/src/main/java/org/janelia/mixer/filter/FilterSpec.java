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
package org.janelia.mixer.filter;

import ij.process.ByteProcessor;

import java.io.Reader;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.janelia.mixer.GrayscaleRaster;
import org.janelia.mixer.json.JsonUtils;

/**
 * Serializable description of a display {@link Filter}: the implementation class name
 * plus the string parameters it is initialized with.
 *
 * <pre>
 *   { "className": "org.janelia.mixer.filter.BrightnessContrast",
 *     "parameters": { "brightness": "20", "contrast": "35" } }
 * </pre>
 */
public class FilterSpec {

    private final String className;
    private final Map<String, String> parameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FilterSpec() {
        this.className = null;
        this.parameters = null;
    }

    /**
     * @param  className   fully qualified name of the {@link Filter} implementation.
     * @param  parameters  values passed to {@link Filter#init} (copied).
     */
    public FilterSpec(final String className,
                      final Map<String, String> parameters) {
        this.className = className;
        this.parameters = (parameters == null) ? new HashMap<>() : new HashMap<>(parameters);
    }

    public String getClassName() {
        return className;
    }

    public Map<String, String> getParameters() {
        return (parameters == null) ? Collections.emptyMap() : Collections.unmodifiableMap(parameters);
    }

    /**
     * @return new filter instance initialized with this spec's parameters.
     *
     * @throws IllegalArgumentException
     *   if the class is missing, is not a {@link Filter}, or cannot be instantiated.
     */
    public Filter buildInstance()
            throws IllegalArgumentException {

        if (className == null) {
            throw new IllegalArgumentException("filter spec does not define a className");
        }

        final Class<? extends Filter> filterClass;
        try {
            filterClass = Class.forName(className).asSubclass(Filter.class);
        } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("filter class '" + className + "' cannot be found", e);
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("class '" + className + "' does not implement " +
                                               Filter.class.getName(), e);
        }

        final Filter filter;
        try {
            filter = filterClass.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("failed to create instance of filter class '" + className + "'", e);
        }

        filter.init(getParameters());

        return filter;
    }

    /**
     * @param  raster  source raster (not modified).
     *
     * @return filtered copy of the raster.
     *
     * @throws IllegalArgumentException
     *   if the filter cannot be built.
     */
    public GrayscaleRaster apply(final GrayscaleRaster raster)
            throws IllegalArgumentException {
        final ByteProcessor bp = raster.toByteProcessor();
        buildInstance().process(bp);
        return GrayscaleRaster.fromProcessor(bp);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{className: " + className + ", parameters: " + parameters + '}';
    }

    public static FilterSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static FilterSpec fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static FilterSpec forFilter(final Filter filter) {
        return new FilterSpec(filter.getClass().getName(), filter.toParametersMap());
    }

    private static final JsonUtils.Helper<FilterSpec> JSON_HELPER =
            new JsonUtils.Helper<>(FilterSpec.class);
}
