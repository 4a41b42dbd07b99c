package com.layeredconfig.core.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads configuration documents from files and writes them back as YAML.
 *
 * <h3>Formats</h3>
 * <ul>
 * <li>{@code .yaml} / {@code .yml}: parsed by SnakeYAML with duplicate keys
 * rejected and the {@code !include} tag enabled</li>
 * <li>{@code .json}: parsed by Jackson with duplicate keys rejected</li>
 * </ul>
 * <p>
 * Any other extension is rejected with {@link UnsupportedDocumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private ConfigLoader() {
        // utility class; not instantiable
    }

    // ---------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------

    /**
     * Check whether a path names a supported document format.
     *
     * @param path file path
     * @return {@code true} for YAML and JSON files
     */
    public static boolean isSupported(Path path) {
        String name = fileName(path);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    /**
     * Read the top-level mapping of a configuration file.
     *
     * @param path file to read; must not be {@code null}
     * @return mutable document tree, empty for an empty file
     * @throws UnsupportedDocumentException if the extension is not recognized
     * @throws IllegalArgumentException     if the file does not exist
     * @throws ConfigException              if the file cannot be read or parsed, or
     *                                      does not hold a mapping
     */
    public static Map<String, Object> read(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        if (!isSupported(path)) {
            throw new UnsupportedDocumentException(path);
        }
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }

        Object content = fileName(path).endsWith(".json") ? readJsonDocument(path) : readYamlDocument(path);
        if (content == null) {
            return new LinkedHashMap<>();
        }
        if (!(content instanceof Map<?, ?> map)) {
            throw new ConfigException("Config file " + path + " must contain a mapping, found "
                    + content.getClass().getSimpleName());
        }
        return Documents.copyOfMapping(map);
    }

    /**
     * Parse a YAML file, resolving {@code !include} tags relative to its
     * directory. The document may be of any type.
     */
    static Object readYamlDocument(Path path) {
        LOG.debug("Opening YAML config file: {}", path);
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Path root = path.toAbsolutePath().getParent();
        Yaml yaml = new Yaml(new IncludeConstructor(root, options));

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return yaml.load(reader);
        } catch (YAMLException e) {
            if (e.getCause() instanceof ConfigException cause) {
                throw cause;
            }
            throw new ConfigException("Failed to parse YAML config at " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file: " + path, e);
        }
    }

    private static Object readJsonDocument(Path path) {
        LOG.debug("Opening JSON config file: {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return JSON.readValue(reader, Object.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to parse JSON config at " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file: " + path, e);
        }
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    /**
     * Write a document as block-style YAML.
     *
     * <p>
     * The keys listed in {@code keyOrder} are written first, in that order,
     * each followed by a blank line. The remaining keys follow in document
     * order.
     * </p>
     *
     * @param data     document tree
     * @param output   destination; not closed
     * @param keyOrder keys to write first, may be empty
     */
    public static void dump(Map<String, Object> data, Writer output, List<String> keyOrder) {
        Objects.requireNonNull(output, "Output must not be null");
        Yaml yaml = new Yaml(dumperOptions());
        Map<String, Object> remaining = new LinkedHashMap<>(data);
        try {
            for (String key : keyOrder) {
                if (!remaining.containsKey(key)) {
                    continue;
                }
                Map<String, Object> single = new LinkedHashMap<>();
                single.put(key, remaining.remove(key));
                yaml.dump(single, output);
                output.write("\n");
            }
            if (!remaining.isEmpty()) {
                yaml.dump(remaining, output);
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to write YAML config", e);
        }
    }

    /**
     * Render a document as a block-style YAML string.
     *
     * @param data document tree
     * @return YAML text, {@code "{}\n"} for an empty document
     */
    public static String toYaml(Map<String, Object> data) {
        StringWriter writer = new StringWriter();
        new Yaml(dumperOptions()).dump(data, writer);
        return writer.toString();
    }

    private static DumperOptions dumperOptions() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return options;
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
    }
}
