package com.layeredconfig.core.subset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps discriminator values to the descriptors that contribute extra defaults.
 *
 * <p>
 * A configuration subset may name its concrete kind in a discriminator field
 * (by default {@value #DEFAULT_DISCRIMINATOR_KEY}). The composer looks the
 * value up here by exact string and merges the registered descriptor's
 * default file; the descriptor may also declare a container key for child
 * configurations.
 * </p>
 *
 * <p>
 * The registry is populated once at startup and only read afterwards. This
 * is the single point of extension when adding a new kind.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigKindRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigKindRegistry.class);

    /** Field holding the discriminator unless another key is configured. */
    public static final String DEFAULT_DISCRIMINATOR_KEY = "cls";

    private final String discriminatorKey;

    private final Map<String, SubsetDescriptor> kinds = new LinkedHashMap<>();

    /**
     * Create an empty registry using {@value #DEFAULT_DISCRIMINATOR_KEY} as
     * discriminator field.
     */
    public ConfigKindRegistry() {
        this(DEFAULT_DISCRIMINATOR_KEY);
    }

    /**
     * @param discriminatorKey field holding the discriminator; must not be blank
     */
    public ConfigKindRegistry(String discriminatorKey) {
        if (discriminatorKey == null || discriminatorKey.isBlank()) {
            throw new IllegalArgumentException("discriminatorKey must not be null or blank");
        }
        this.discriminatorKey = discriminatorKey;
    }

    /**
     * Register a kind.
     *
     * @param discriminator exact discriminator value; must not be {@code null}
     * @param descriptor    descriptor supplying the kind's defaults
     * @return this registry
     * @throws IllegalArgumentException if the discriminator is already registered
     */
    public ConfigKindRegistry register(String discriminator, SubsetDescriptor descriptor) {
        Objects.requireNonNull(discriminator, "Discriminator must not be null");
        Objects.requireNonNull(descriptor, "Descriptor must not be null");
        if (kinds.containsKey(discriminator)) {
            throw new IllegalArgumentException("Config kind already registered: '" + discriminator + "'");
        }
        kinds.put(discriminator, descriptor);
        LOG.debug("Registered config kind '{}' -> {}", discriminator, descriptor.getName());
        return this;
    }

    /**
     * Look up a kind.
     *
     * @param discriminator discriminator value
     * @return registered descriptor, empty if unknown
     */
    public Optional<SubsetDescriptor> find(String discriminator) {
        return Optional.ofNullable(kinds.get(discriminator));
    }

    /**
     * Look up a kind that must be registered.
     *
     * @param discriminator discriminator value
     * @param context       name of the configuration being composed, for the error
     * @return registered descriptor
     * @throws UnknownConfigKindException if the discriminator is not registered
     */
    public SubsetDescriptor lookup(String discriminator, String context) {
        return find(discriminator)
                .orElseThrow(() -> new UnknownConfigKindException(discriminator, context));
    }

    public boolean isRegistered(String discriminator) {
        return kinds.containsKey(discriminator);
    }

    /**
     * @return unmodifiable set of registered discriminators, in registration order
     */
    public Set<String> registeredKinds() {
        return Collections.unmodifiableSet(kinds.keySet());
    }

    public String getDiscriminatorKey() {
        return discriminatorKey;
    }
}
