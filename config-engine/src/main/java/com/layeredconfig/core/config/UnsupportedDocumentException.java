package com.layeredconfig.core.config;

import java.nio.file.Path;

/**
 * Raised when a configuration source is not in a recognized document format.
 *
 * @since 1.0.0
 */
public class UnsupportedDocumentException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public UnsupportedDocumentException(Path path) {
        super("Unhandled config file type: " + path);
    }
}
