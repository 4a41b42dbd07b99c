package com.layeredconfig.core.subset;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declares one kind of configuration subset.
 *
 * <ul>
 * <li>{@code name}: label used in log and error messages</li>
 * <li>{@code component}: key selecting the subset out of a larger
 * configuration; absent means the whole input is the subset</li>
 * <li>{@code requiredKeys}: key paths that must be present after
 * composition</li>
 * <li>{@code defaultConfigFile}: file holding defaults, looked up along the
 * search path</li>
 * <li>{@code containerKey}: key whose value is a sequence of child
 * configurations of the same subset kind</li>
 * </ul>
 *
 * <p>
 * Instances are immutable; use {@link #builder(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SubsetDescriptor {

    private final String name;
    private final String component;
    private final Set<String> requiredKeys;
    private final String defaultConfigFile;
    private final String containerKey;

    private SubsetDescriptor(Builder b) {
        this.name = b.name;
        this.component = b.component;
        this.requiredKeys = Collections.unmodifiableSet(new LinkedHashSet<>(b.requiredKeys));
        this.defaultConfigFile = b.defaultConfigFile;
        this.containerKey = b.containerKey;
    }

    /**
     * Start building a descriptor.
     *
     * @param name descriptor name; must not be blank
     * @return new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getComponent() {
        return Optional.ofNullable(component);
    }

    /**
     * @return unmodifiable required key paths, in declaration order
     */
    public Set<String> getRequiredKeys() {
        return requiredKeys;
    }

    public Optional<String> getDefaultConfigFile() {
        return Optional.ofNullable(defaultConfigFile);
    }

    public Optional<String> getContainerKey() {
        return Optional.ofNullable(containerKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SubsetDescriptor that))
            return false;
        return name.equals(that.name)
                && Objects.equals(component, that.component)
                && requiredKeys.equals(that.requiredKeys)
                && Objects.equals(defaultConfigFile, that.defaultConfigFile)
                && Objects.equals(containerKey, that.containerKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, component, requiredKeys, defaultConfigFile, containerKey);
    }

    @Override
    public String toString() {
        return "SubsetDescriptor{" +
                "name='" + name + '\'' +
                ", component='" + component + '\'' +
                ", requiredKeys=" + requiredKeys +
                ", defaultConfigFile='" + defaultConfigFile + '\'' +
                ", containerKey='" + containerKey + '\'' +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SubsetDescriptor}.
     */
    public static class Builder {
        private final String name;
        private String component;
        private final Set<String> requiredKeys = new LinkedHashSet<>();
        private String defaultConfigFile;
        private String containerKey;

        private Builder(String name) {
            this.name = name;
        }

        public Builder component(String v) {
            this.component = v;
            return this;
        }

        public Builder requiredKeys(String... keys) {
            return requiredKeys(List.of(keys));
        }

        public Builder requiredKeys(Iterable<String> keys) {
            keys.forEach(requiredKeys::add);
            return this;
        }

        public Builder defaultConfigFile(String v) {
            this.defaultConfigFile = v;
            return this;
        }

        public Builder containerKey(String v) {
            this.containerKey = v;
            return this;
        }

        /**
         * Build and validate the descriptor.
         *
         * @return a validated {@link SubsetDescriptor}
         * @throws IllegalArgumentException if the name or a set key is blank
         */
        public SubsetDescriptor build() {
            requireNonBlank(name, "name");
            if (component != null) {
                requireNonBlank(component, "component");
            }
            if (defaultConfigFile != null) {
                requireNonBlank(defaultConfigFile, "defaultConfigFile");
            }
            if (containerKey != null) {
                requireNonBlank(containerKey, "containerKey");
            }
            for (String key : requiredKeys) {
                requireNonBlank(key, "requiredKeys entry");
            }
            return new SubsetDescriptor(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }
}
