package io.httpreq.util;

import org.jspecify.annotations.Nullable;

public final class Assert {

    private Assert() {
    }

    /**
     * Check that the named parameter is not {@code null}.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @param <T> the value type
     * @return the value that was passed in
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Check that the named string parameter is neither {@code null} nor blank.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @return the value that was passed in
     * @throws IllegalArgumentException if the value is {@code null} or blank
     */
    public static String checkNotBlankParam(String name, @Nullable String value) throws IllegalArgumentException {
        checkNotNullParam(name, value);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be blank");
        }
        return value;
    }
}
