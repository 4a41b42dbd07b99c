package com.layeredconfig.core.config;

/**
 * Raised when a deep merge meets a value that is not a mapping on either side
 * of the recursion.
 *
 * @since 1.0.0
 */
public class MergeTypeMismatchException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public MergeTypeMismatchException(String message) {
        super(message);
    }
}
