package com.layeredconfig.core.subset;

import com.layeredconfig.core.config.ConfigException;

import java.util.List;

/**
 * Raised when a composed configuration lacks mandatory keys. Carries every
 * missing key, not only the first.
 *
 * @since 1.0.0
 */
public class MissingRequiredKeysException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    private final List<String> missingKeys;

    public MissingRequiredKeysException(String kind, List<String> missingKeys) {
        super("Mandatory keys " + missingKeys + " missing from supplied configuration for " + kind);
        this.kind = kind;
        this.missingKeys = List.copyOf(missingKeys);
    }

    /**
     * @return name of the subset kind that was validated
     */
    public String getKind() {
        return kind;
    }

    /**
     * @return unmodifiable list of absent key paths
     */
    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
