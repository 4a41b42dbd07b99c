package com.layeredconfig.core.subset;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered directories searched for default configuration files, highest
 * priority first.
 *
 * <p>
 * Built once at the program's entry boundary. {@link #fromEnvironment(Map, Path)}
 * reads the {@value #CONFIG_PATH_ENV} variable, a list of directories
 * separated by {@link File#pathSeparator}, and appends the built-in defaults
 * directory, which always has the lowest priority.
 * </p>
 *
 * @since 1.0.0
 */
public final class SearchContext {

    /** PATH-like environment variable listing default directories. */
    public static final String CONFIG_PATH_ENV = "LAYERED_CONFIG_PATH";

    private final List<Path> paths;

    private SearchContext(List<Path> paths) {
        this.paths = Collections.unmodifiableList(new ArrayList<>(paths));
    }

    /**
     * Create a context from explicit directories.
     *
     * @param paths directories in priority order
     * @return new context
     */
    public static SearchContext of(List<Path> paths) {
        Objects.requireNonNull(paths, "Search paths must not be null");
        return new SearchContext(paths);
    }

    /**
     * @return context without any directory
     */
    public static SearchContext empty() {
        return new SearchContext(List.of());
    }

    /**
     * Resolve the search path from an environment.
     *
     * @param environment variables to read, usually {@link System#getenv()}
     * @param builtinDir  directory of built-in defaults, or {@code null} for none
     * @return environment directories followed by {@code builtinDir}
     */
    public static SearchContext fromEnvironment(Map<String, String> environment, Path builtinDir) {
        Objects.requireNonNull(environment, "Environment must not be null");
        List<Path> paths = new ArrayList<>();
        String value = environment.get(CONFIG_PATH_ENV);
        if (value != null && !value.isBlank()) {
            for (String entry : value.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    paths.add(Path.of(entry));
                }
            }
        }
        if (builtinDir != null) {
            paths.add(builtinDir);
        }
        return new SearchContext(paths);
    }

    /**
     * @return unmodifiable directories, highest priority first
     */
    public List<Path> getPaths() {
        return paths;
    }

    @Override
    public String toString() {
        return "SearchContext" + paths;
    }
}
