package com.layeredconfig.core.config;

import com.layeredconfig.core.key.KeyPathParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Processes the {@value Config#INCLUDE_KEY} directives of a configuration
 * read from a file.
 *
 * <p>
 * Every mapping holding the directive is replaced by the named files merged
 * left to right, with the mapping's own keys merged last so that explicit
 * values win over included ones:
 * </p>
 *
 * <pre>
 * # a.yaml                    # b.yaml
 * includeConfigs: [b.yaml]    x: 1
 * y: 3                        y: 2
 *
 * # resolved a.yaml
 * x: 1
 * y: 3
 * </pre>
 *
 * <p>
 * Relative file names are looked up in the working directory, then in the
 * directory of the including file. The directive locations are collected once
 * before any file is merged; included files resolve their own directives when
 * they are read. Include cycles are not detected.
 * </p>
 *
 * @since 1.0.0
 */
final class IncludeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeResolver.class);

    private final Config config;

    private final List<Path> searchPaths = new ArrayList<>();

    IncludeResolver(Config config) {
        this.config = config;
        searchPaths.add(Path.of("").toAbsolutePath());
        config.getConfigFile()
                .map(file -> file.toAbsolutePath().getParent())
                .ifPresent(searchPaths::add);
    }

    /**
     * Resolve every directive present in the configuration.
     *
     * @throws UnresolvedIncludeException if a named file cannot be found
     */
    void resolve() {
        List<List<Object>> names = config.nameTuples();
        for (List<Object> path : names) {
            if (!Config.INCLUDE_KEY.equals(path.get(path.size() - 1))) {
                continue;
            }
            LOG.debug("Processing file include directive at {}",
                    KeyPathParser.join(path, config.getDelimiter()));
            List<Object> basePath = path.subList(0, path.size() - 1);

            Object includes = config.get(path);
            config.remove(path);

            List<Config> subConfigs = new ArrayList<>();
            for (Object fileName : asList(includes)) {
                subConfigs.add(new Config(locate(String.valueOf(fileName))));
            }
            if (subConfigs.isEmpty()) {
                continue;
            }

            Config merged = subConfigs.get(0);
            for (Config sub : subConfigs.subList(1, subConfigs.size())) {
                merged.update(sub);
            }

            if (basePath.isEmpty()) {
                merged.update(config);
                config.replaceData(merged.data());
            } else {
                merged.update(config.get(basePath));
                config.set(basePath, merged);
            }
        }
    }

    private Path locate(String fileName) {
        Path candidate = Path.of(fileName);
        if (candidate.isAbsolute()) {
            return candidate;
        }
        for (Path dir : searchPaths) {
            Path filePath = dir.resolve(fileName);
            if (Files.exists(filePath)) {
                return filePath.toAbsolutePath().normalize();
            }
        }
        throw new UnresolvedIncludeException(fileName);
    }

    private static List<?> asList(Object includes) {
        if (includes instanceof List<?> list) {
            return list;
        }
        return List.of(String.valueOf(includes));
    }
}
