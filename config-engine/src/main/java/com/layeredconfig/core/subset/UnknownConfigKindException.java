package com.layeredconfig.core.subset;

import com.layeredconfig.core.config.ConfigException;

/**
 * Raised when a configuration names a discriminator that is not registered
 * in the {@link ConfigKindRegistry}.
 *
 * @since 1.0.0
 */
public class UnknownConfigKindException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    public UnknownConfigKindException(String kind, String context) {
        super("Unknown config kind '" + kind + "' for config " + context);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
