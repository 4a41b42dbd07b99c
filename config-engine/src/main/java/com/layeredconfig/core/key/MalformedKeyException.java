package com.layeredconfig.core.key;

import com.layeredconfig.core.config.ConfigException;

/**
 * Raised when a delimited key expression cannot be split, e.g. when an
 * escaped delimiter is itself escaped.
 *
 * @since 1.0.0
 */
public class MalformedKeyException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public MalformedKeyException(String message) {
        super(message);
    }
}
