package com.layeredconfig.core.config;

/**
 * Raised when a file referenced by an include directive or an
 * {@code !include} tag cannot be found in any search location.
 *
 * @since 1.0.0
 */
public class UnresolvedIncludeException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String fileName;

    public UnresolvedIncludeException(String fileName) {
        super("Unable to find referenced include file: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
