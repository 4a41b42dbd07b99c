package com.layeredconfig.core.subset;

import com.layeredconfig.core.config.Config;
import com.layeredconfig.core.config.ConfigTypeException;
import com.layeredconfig.core.config.MergeTypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the configuration of a subset by layering defaults under the values
 * supplied by the caller.
 *
 * <h3>Composition order</h3>
 * <ol>
 * <li>Select the descriptor's component out of the input. A doubled
 * {@code component.component} is checked first, so that an included file may
 * repeat the component name. Without either, the whole input is the
 * subset.</li>
 * <li>Merge the descriptor's default file from every directory of the search
 * path that holds it: explicit directories first, then those of the
 * {@link SearchContext}. Files are applied lowest priority first, so the
 * highest priority directory wins.</li>
 * <li>Read the discriminator from the input, else from the defaults, and
 * merge the default file of the registered kind the same way.</li>
 * <li>Overlay the input values; they always win.</li>
 * <li>If the kind declares a container key, compose every child of that
 * sequence recursively with the same descriptor and arguments.</li>
 * <li>Optionally check the required keys.</li>
 * </ol>
 *
 * <p>
 * Each step runs to completion or the whole composition fails; there are no
 * partial results.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultsComposer {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultsComposer.class);

    private final ConfigKindRegistry registry;

    private final SearchContext searchContext;

    /**
     * @param registry      discriminator registry, populated at startup
     * @param searchContext default directories resolved at the entry boundary
     */
    public DefaultsComposer(ConfigKindRegistry registry, SearchContext searchContext) {
        this.registry = Objects.requireNonNull(registry, "Registry must not be null");
        this.searchContext = Objects.requireNonNull(searchContext, "Search context must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Compose with defaults merged and required keys validated.
     *
     * @param descriptor subset to compose
     * @param other      caller values: {@code null}, a {@link Config}, a
     *                   {@link Map} or a file path
     * @return composed configuration
     * @throws MissingRequiredKeysException if a required key is absent
     */
    public ConfigSubset compose(SubsetDescriptor descriptor, Object other) {
        return compose(descriptor, other, true, true, List.of());
    }

    /**
     * Compose a subset configuration.
     *
     * @param descriptor    subset to compose; must not be {@code null}
     * @param other         caller values: {@code null}, a {@link Config}, a
     *                      {@link Map} or a file path
     * @param validate      check the required keys once composed
     * @param mergeDefaults read and merge the default files
     * @param searchPaths   extra directories searched before the search context,
     *                      highest priority first; may be {@code null}
     * @return composed configuration
     * @throws MissingRequiredKeysException if validating and a required key is absent
     * @throws UnknownConfigKindException   if the discriminator is not registered
     */
    public ConfigSubset compose(SubsetDescriptor descriptor, Object other, boolean validate,
            boolean mergeDefaults, List<Path> searchPaths) {
        Objects.requireNonNull(descriptor, "Descriptor must not be null");
        List<Path> explicitPaths = searchPaths == null ? List.of() : searchPaths;

        ConfigSubset result = new ConfigSubset(descriptor);
        Config external = selectComponent(descriptor, Config.from(other));

        String containerKey = null;
        if (mergeDefaults) {
            List<Path> fullSearchPath = new ArrayList<>(explicitPaths);
            fullSearchPath.addAll(searchContext.getPaths());

            descriptor.getDefaultConfigFile()
                    .ifPresent(file -> updateWithConfigsFromPath(result, fullSearchPath, file));

            Optional<SubsetDescriptor> kind = discriminator(external, result)
                    .map(value -> registry.lookup(value, descriptor.getName()));
            if (kind.isPresent()) {
                kind.get().getDefaultConfigFile()
                        .ifPresent(file -> updateWithConfigsFromPath(result, fullSearchPath, file));
                containerKey = kind.get().getContainerKey().orElse(null);
            }
        }

        result.update(external);

        if (containerKey != null && result.contains(List.of(containerKey))) {
            expandChildren(result, containerKey, validate, mergeDefaults, explicitPaths);
        }

        if (validate) {
            result.validate();
        }
        return result;
    }

    /**
     * Update selected parameters of a subset in place.
     *
     * <p>
     * Only the part of {@code config} belonging to {@code descriptor} is
     * touched. Defaults are not merged and the result is not validated, since
     * mandatory keys may be filled in later. If {@code full} holds the
     * component but {@code config} does not, an empty component is added
     * first.
     * </p>
     *
     * @param descriptor subset whose values are updated
     * @param config     configuration modified in place
     * @param full       fully expanded configuration from the same hierarchy
     *                   level; read only, source of {@code toCopy}
     * @param toUpdate   keys and new values, may be {@code null}
     * @param toCopy     keys to copy from {@code full}, may be {@code null}
     * @param overwrite  replace values already present in {@code config}
     * @throws IllegalArgumentException if neither {@code toUpdate} nor
     *                                  {@code toCopy} is given
     */
    public void updateParameters(SubsetDescriptor descriptor, Config config, Config full,
            Map<String, ?> toUpdate, Collection<String> toCopy, boolean overwrite) {
        Objects.requireNonNull(descriptor, "Descriptor must not be null");
        Objects.requireNonNull(config, "Config must not be null");
        if (toUpdate == null && toCopy == null) {
            throw new IllegalArgumentException("One of toUpdate or toCopy parameters must be set.");
        }

        String component = descriptor.getComponent().orElse(null);
        if (component != null && full != null && full.contains(component) && !config.contains(component)) {
            config.set(List.of(component), new LinkedHashMap<String, Object>());
        }

        ConfigSubset local = compose(descriptor, config, false, false, List.of());

        if (toUpdate != null) {
            for (Map.Entry<String, ?> entry : toUpdate.entrySet()) {
                if (local.contains(entry.getKey()) && !overwrite) {
                    LOG.debug("Not overriding key '{}' with value '{}' in config {}",
                            entry.getKey(), entry.getValue(), descriptor.getName());
                } else {
                    local.set(entry.getKey(), entry.getValue());
                }
            }
        }

        if (toCopy != null) {
            Objects.requireNonNull(full, "Full config must not be null when copying keys");
            ConfigSubset localFull = compose(descriptor, full, true, false, List.of());
            for (String key : toCopy) {
                if (local.contains(key) && !overwrite) {
                    LOG.debug("Not overriding key '{}' from defaults in config {}", key, descriptor.getName());
                } else {
                    local.set(key, localFull.get(key));
                }
            }
        }

        if (component != null && config.contains(component)) {
            config.set(List.of(component), local);
        } else {
            config.update(local);
        }
    }

    public SearchContext getSearchContext() {
        return searchContext;
    }

    public ConfigKindRegistry getRegistry() {
        return registry;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Config selectComponent(SubsetDescriptor descriptor, Config external) {
        Optional<String> component = descriptor.getComponent();
        if (component.isEmpty()) {
            return external;
        }
        List<Object> doubled = List.of(component.get(), component.get());
        if (external.contains(doubled)) {
            return asConfig(external.get(doubled), descriptor);
        }
        if (external.contains(List.of(component.get()))) {
            return asConfig(external.get(List.of(component.get())), descriptor);
        }
        return external;
    }

    private static Config asConfig(Object value, SubsetDescriptor descriptor) {
        if (value == null) {
            return new Config();
        }
        if (value instanceof Config config) {
            return config;
        }
        throw new MergeTypeMismatchException("Component '" + descriptor.getComponent().orElse("")
                + "' of config " + descriptor.getName() + " is not a mapping: "
                + value.getClass().getSimpleName());
    }

    private Optional<String> discriminator(Config external, Config defaults) {
        String key = registry.getDiscriminatorKey();
        List<Object> path = List.of(key);
        Object value = null;
        if (external.contains(path)) {
            value = external.get(path);
        } else if (defaults.contains(path)) {
            value = defaults.get(path);
        }
        return Optional.ofNullable(value).map(String::valueOf);
    }

    /**
     * Merge every copy of {@code configFile} found along the search path,
     * lowest priority first. An absolute file is read directly if it exists.
     */
    private void updateWithConfigsFromPath(ConfigSubset target, List<Path> searchPath, String configFile) {
        Path file = Path.of(configFile);
        if (file.isAbsolute()) {
            if (Files.exists(file)) {
                updateWithOtherConfigFile(target, file);
            }
            return;
        }
        List<Path> reversed = new ArrayList<>(searchPath);
        Collections.reverse(reversed);
        for (Path dir : reversed) {
            Path candidate = dir.resolve(configFile);
            if (Files.exists(candidate)) {
                updateWithOtherConfigFile(target, candidate);
            }
        }
    }

    private void updateWithOtherConfigFile(ConfigSubset target, Path file) {
        LOG.debug("Merging defaults for {} from {}", target.getDescriptor().getName(), file);
        target.recordFileRead(file);
        target.update(compose(target.getDescriptor(), file, false, false, List.of()));
    }

    private void expandChildren(ConfigSubset result, String containerKey, boolean validate,
            boolean mergeDefaults, List<Path> searchPaths) {
        Object children = result.get(List.of(containerKey));
        if (!(children instanceof List<?> list)) {
            throw new ConfigTypeException(containerKey, "a sequence", children);
        }
        for (int i = 0; i < list.size(); i++) {
            ConfigSubset child = compose(result.getDescriptor(), list.get(i), validate, mergeDefaults, searchPaths);
            result.set(List.of(containerKey, i), child);
        }
    }
}
