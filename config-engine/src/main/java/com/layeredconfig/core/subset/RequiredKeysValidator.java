package com.layeredconfig.core.subset;

import com.layeredconfig.core.config.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that the required keys declared by a {@link SubsetDescriptor} are
 * present in a configuration.
 *
 * <p>
 * Every required key path is tested, so the failure lists all missing keys
 * at once rather than stopping at the first one.
 * </p>
 *
 * @since 1.0.0
 */
public final class RequiredKeysValidator {

    private RequiredKeysValidator() {
        // utility class; not instantiable
    }

    /**
     * Collect the required keys that are absent.
     *
     * @param config     configuration to check
     * @param descriptor descriptor declaring the required keys
     * @return missing key paths in declaration order, empty if none
     */
    public static List<String> findMissing(Config config, SubsetDescriptor descriptor) {
        Objects.requireNonNull(config, "Config must not be null");
        Objects.requireNonNull(descriptor, "Descriptor must not be null");
        List<String> missing = new ArrayList<>();
        for (String key : descriptor.getRequiredKeys()) {
            if (!config.contains(key)) {
                missing.add(key);
            }
        }
        return missing;
    }

    /**
     * Fail if any required key is absent.
     *
     * @param config     configuration to check
     * @param descriptor descriptor declaring the required keys
     * @throws MissingRequiredKeysException listing every missing key
     */
    public static void validate(Config config, SubsetDescriptor descriptor) {
        List<String> missing = findMissing(config, descriptor);
        if (!missing.isEmpty()) {
            throw new MissingRequiredKeysException(descriptor.getName(), missing);
        }
    }
}
