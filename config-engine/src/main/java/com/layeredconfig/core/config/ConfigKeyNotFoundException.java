package com.layeredconfig.core.config;

/**
 * Raised when a key path does not fully resolve inside a {@link Config}.
 *
 * @since 1.0.0
 */
public class ConfigKeyNotFoundException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public ConfigKeyNotFoundException(Object key) {
        this(key, key + " not found");
    }

    public ConfigKeyNotFoundException(Object key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * @return the key expression that failed to resolve, as supplied by the caller
     */
    public Object getKey() {
        return key;
    }
}
