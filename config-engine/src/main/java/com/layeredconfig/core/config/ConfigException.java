package com.layeredconfig.core.config;

/**
 * Base type for every failure raised while reading, addressing, merging or
 * composing a {@link Config}.
 *
 * <p>
 * All configuration errors are unchecked and fatal to the enclosing
 * operation: a configuration is either built completely or not at all.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
