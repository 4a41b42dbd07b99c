package com.layeredconfig.core.config;

/**
 * Raised by the typed accessors of {@link Config} when the stored value does
 * not have the requested type.
 *
 * @since 1.0.0
 */
public class ConfigTypeException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public ConfigTypeException(Object key, String expected, Object actual) {
        super("Value at " + key + " is not " + expected + ": "
                + (actual == null ? "null" : actual.getClass().getSimpleName()));
    }

    public ConfigTypeException(String message) {
        super(message);
    }
}
