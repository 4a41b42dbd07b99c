package com.layeredconfig.repository;

import com.layeredconfig.core.config.Config;
import com.layeredconfig.core.config.ConfigException;
import com.layeredconfig.core.subset.ConfigSubset;
import com.layeredconfig.core.subset.DefaultsComposer;
import com.layeredconfig.core.subset.SearchContext;
import com.layeredconfig.core.subset.SubsetDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for reading and creating repository configurations.
 *
 * <h3>Search path</h3>
 * <p>
 * Default files are looked up, highest priority first, in:
 * </p>
 * <ol>
 * <li>explicit directories passed to {@link #load(Object, List)}</li>
 * <li>the directories listed in {@value SearchContext#CONFIG_PATH_ENV}</li>
 * <li>the built-in {@code config} directory, see {@link #builtinConfigDir()}</li>
 * </ol>
 *
 * <h3>Configuration</h3>
 * <p>
 * The environment is read once, in {@link #fromEnvironment()}. Use
 * {@link #create(Map)} to supply the variables explicitly.
 * </p>
 *
 * @since 1.0.0
 */
public final class RepositoryConfigs {

    private static final Logger LOG = LoggerFactory.getLogger(RepositoryConfigs.class);

    /** System property overriding the built-in defaults directory. */
    public static final String CONFIG_DIR_PROPERTY = "layeredconfig.config.dir";

    /** Name of the configuration file written at the root of a repository. */
    public static final String REPOSITORY_CONFIG_FILE = "butler.yaml";

    /** Placeholder in the default datastore root standing for the repository directory. */
    public static final String ROOT_PLACEHOLDER = "<repositoryRoot>";

    private static final String BUILTIN_RESOURCE = "config/registry.yaml";

    private static final List<String> KEY_ORDER = List.of("registry", "datastore");

    private final DefaultsComposer composer;

    public RepositoryConfigs(DefaultsComposer composer) {
        this.composer = Objects.requireNonNull(composer, "Composer must not be null");
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Resolve the search path from the process environment.
     *
     * @return repository configuration entry point
     */
    public static RepositoryConfigs fromEnvironment() {
        return create(System.getenv());
    }

    /**
     * Resolve the search path from the given variables.
     *
     * @param environment variables to read
     * @return repository configuration entry point
     * @throws IllegalStateException if the built-in defaults cannot be located
     */
    public static RepositoryConfigs create(Map<String, String> environment) {
        SearchContext context = SearchContext.fromEnvironment(environment, builtinConfigDir());
        LOG.info("Using config search path {}", context.getPaths());
        return new RepositoryConfigs(new DefaultsComposer(RepositoryConfigKinds.createRegistry(), context));
    }

    /**
     * Locate the directory of built-in default files.
     *
     * <p>
     * The {@value #CONFIG_DIR_PROPERTY} system property wins. Otherwise the
     * packaged {@code config} resource directory is used, opened as a zip file
     * system when it sits inside a jar.
     * </p>
     *
     * @return built-in defaults directory
     * @throws IllegalStateException if the directory cannot be located
     */
    public static Path builtinConfigDir() {
        String override = System.getProperty(CONFIG_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        URL resource = RepositoryConfigs.class.getClassLoader().getResource(BUILTIN_RESOURCE);
        if (resource == null) {
            throw new IllegalStateException("Classpath resource not found: " + BUILTIN_RESOURCE);
        }
        return resourceDirectory(resource);
    }

    /**
     * Directory holding a classpath resource, as a directory on disk or inside
     * a jar.
     */
    static Path resourceDirectory(URL resource) {
        try {
            URI uri = resource.toURI();
            if ("jar".equals(uri.getScheme())) {
                // Left open for the life of the process: returned paths point into it
                try {
                    FileSystems.newFileSystem(uri, Map.of());
                } catch (FileSystemAlreadyExistsException e) {
                    LOG.debug("Reusing open file system for {}", uri);
                }
            }
            return Path.of(uri).getParent();
        } catch (URISyntaxException | IOException e) {
            throw new IllegalStateException("Failed to open built-in config directory: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public DefaultsComposer composer() {
        return composer;
    }

    public SearchContext searchContext() {
        return composer.getSearchContext();
    }

    /**
     * Compose a full repository configuration.
     *
     * <p>
     * The {@code registry} and {@code datastore} sections are composed with
     * their defaults and validated. Other top-level keys of the seed are kept
     * as they are.
     * </p>
     *
     * @param seed        {@code null}, a {@link Config}, a {@link Map} or a file
     * @param searchPaths directories searched before the environment, may be
     *                    {@code null}
     * @return full configuration
     * @throws com.layeredconfig.core.subset.MissingRequiredKeysException if a
     *         section lacks a mandatory key
     */
    public Config load(Object seed, List<Path> searchPaths) {
        Config seedConfig = Config.from(seed);
        Config full = new Config();
        for (SubsetDescriptor section : List.of(RepositoryConfigKinds.REGISTRY, RepositoryConfigKinds.DATASTORE)) {
            ConfigSubset subset = composer.compose(section, sectionOf(seedConfig, section), true, true, searchPaths);
            LOG.debug("Composed {} from {}", section.getName(), subset.getFilesRead());
            full.set(List.of(section.getComponent().orElseThrow()), subset);
        }
        for (String key : seedConfig) {
            if (!full.contains(List.of(key))) {
                full.set(List.of(key), seedConfig.get(List.of(key)));
            }
        }
        return full;
    }

    /**
     * Read the configuration of an existing repository.
     *
     * <p>
     * The directory holding the file is searched for default files before
     * the environment.
     * </p>
     *
     * @param location repository directory or configuration file
     * @return full configuration
     * @throws IllegalArgumentException if the configuration file does not exist
     */
    public Config loadRepository(Path location) {
        Objects.requireNonNull(location, "Repository location must not be null");
        Path file = Files.isDirectory(location) ? location.resolve(REPOSITORY_CONFIG_FILE) : location;
        Path dir = file.toAbsolutePath().getParent();
        LOG.info("Loading repository config from {}", file);
        return load(file, List.of(dir));
    }

    /**
     * Create a repository configuration holding only the seed values.
     *
     * @see #makeRepository(Path, Object, boolean)
     */
    public Path makeRepository(Path root, Object seed) {
        return makeRepository(root, seed, false);
    }

    /**
     * Create a repository directory and write its configuration file.
     *
     * <p>
     * The full configuration is composed first, so an invalid seed fails
     * before anything is written. The datastore root is resolved against
     * {@code root} and the datastore kind is copied into the written file,
     * so that the repository keeps working when the defaults change.
     * </p>
     *
     * @param root       repository directory, created if missing
     * @param seed       {@code null}, a {@link Config}, a {@link Map} or a file
     * @param standalone write the full configuration instead of the seed
     * @return the written configuration file
     * @throws ConfigException if the directory or file cannot be written
     */
    public Path makeRepository(Path root, Object seed, boolean standalone) {
        Objects.requireNonNull(root, "Repository root must not be null");
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new ConfigException("Failed to create repository directory: " + root, e);
        }
        String rootPath = root.toAbsolutePath().normalize().toString();

        Config full = load(seed, List.of());
        Config config = standalone ? full.copy() : Config.from(seed);
        config.set(List.of("root"), rootPath);

        String datastoreRoot = full.getString(".datastore.root").replace(ROOT_PLACEHOLDER, rootPath);
        composer.updateParameters(RepositoryConfigKinds.DATASTORE, config, full,
                Map.of("root", datastoreRoot), List.of("cls"), true);

        Path file = root.resolve(REPOSITORY_CONFIG_FILE);
        config.dumpToFile(file, KEY_ORDER);
        LOG.info("Wrote repository config to {}", file);
        return file;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Only hand a section the seed when the seed has that section. */
    private static Config sectionOf(Config seed, SubsetDescriptor section) {
        String component = section.getComponent().orElseThrow();
        return seed.contains(List.of(component)) ? seed : null;
    }
}
