package com.layeredconfig.core.config;

/**
 * Raised by {@link Config#names()} when no delimiter free of collisions with
 * the key content could be found.
 *
 * @since 1.0.0
 */
public class DelimiterSelectionException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public DelimiterSelectionException(String message) {
        super(message);
    }
}
