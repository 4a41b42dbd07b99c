package com.layeredconfig.repository;

import com.layeredconfig.core.subset.ConfigKindRegistry;
import com.layeredconfig.core.subset.SubsetDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subsets and kinds making up a repository configuration.
 *
 * <p>
 * This is the single point of extension when adding a new registry or
 * datastore kind: register its discriminator in {@link #createRegistry()} and
 * ship its default file under the built-in {@code config} directory.
 * </p>
 *
 * @since 1.0.0
 */
public final class RepositoryConfigKinds {

    private static final Logger LOG = LoggerFactory.getLogger(RepositoryConfigKinds.class);

    /** Registry section: database connection and dimension packers. */
    public static final SubsetDescriptor REGISTRY = SubsetDescriptor.builder("registry")
            .component("registry")
            .requiredKeys("cls", "db")
            .defaultConfigFile("registry.yaml")
            .build();

    /** Datastore section: where and how datasets are stored. */
    public static final SubsetDescriptor DATASTORE = SubsetDescriptor.builder("datastore")
            .component("datastore")
            .requiredKeys("cls", "root")
            .defaultConfigFile("datastore.yaml")
            .build();

    private RepositoryConfigKinds() {
        // utility class; not instantiable
    }

    /**
     * Create a registry holding every built-in registry and datastore kind.
     *
     * @return new registry keyed on {@value ConfigKindRegistry#DEFAULT_DISCRIMINATOR_KEY}
     */
    public static ConfigKindRegistry createRegistry() {
        ConfigKindRegistry registry = new ConfigKindRegistry()
                .register("sqlite", kind("sqliteRegistry", "registries/sqliteRegistry.yaml"))
                .register("postgresql", kind("postgresqlRegistry", "registries/postgresqlRegistry.yaml"))
                .register("posix", kind("posixDatastore", "datastores/posixDatastore.yaml"))
                .register("inMemory", kind("inMemoryDatastore", "datastores/inMemoryDatastore.yaml"))
                .register("chained", SubsetDescriptor.builder("chainedDatastore")
                        .defaultConfigFile("datastores/chainedDatastore.yaml")
                        .containerKey("datastores")
                        .build());
        LOG.debug("Registered config kinds: {}", registry.registeredKinds());
        return registry;
    }

    private static SubsetDescriptor kind(String name, String defaultConfigFile) {
        return SubsetDescriptor.builder(name)
                .defaultConfigFile(defaultConfigFile)
                .build();
    }
}
