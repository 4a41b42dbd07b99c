package com.layeredconfig.core.config;

import com.layeredconfig.core.key.KeyPathParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchical configuration document.
 *
 * <p>
 * A {@code Config} owns a tree of mappings, sequences and scalars. Values are
 * addressed by key paths, either as a delimited string whose first character
 * selects the delimiter or as an explicit list of segments. The following all
 * address the same value:
 * </p>
 *
 * <pre>
 * config.get(".a.b.c");
 * config.get("/a/b/c");
 * config.get(List.of("a", "b", "c"));
 * </pre>
 *
 * <p>
 * A string starting with a letter or digit is never split: {@code "a.b.c"} is
 * a single key. A delimiter that is part of a key is escaped with a
 * backslash, so {@code ".a.b\\.c"} addresses {@code [a, b.c]}. Sequence
 * elements are addressed by their index.
 * </p>
 *
 * <p>
 * Setting a multi-level key creates the missing mapping levels; removing one
 * never prunes the levels left empty:
 * </p>
 *
 * <pre>
 * Config c = new Config();
 * c.set(".a.b", 1);
 * c.remove(".a.b");
 * c.get("a");   // empty Config
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class Config implements Iterable<String> {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    /** Default internal delimiter used when rendering key paths for external use. */
    public static final char DEFAULT_DELIMITER = '→';

    /** Key asking for other config files to be merged at its position in the tree. */
    public static final String INCLUDE_KEY = "includeConfigs";

    private static final int MAX_DELIMITER_ATTEMPTS = 100;

    private Map<String, Object> data = new LinkedHashMap<>();

    private char delimiter = DEFAULT_DELIMITER;

    private Path configFile;

    // ---------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------

    /**
     * Create an empty configuration.
     */
    public Config() {
    }

    /**
     * Create a deep copy of another configuration.
     *
     * @param other source configuration; must not be {@code null}
     */
    public Config(Config other) {
        Objects.requireNonNull(other, "Source config must not be null");
        this.data = Documents.copyOfMapping(other.data);
        this.delimiter = other.delimiter;
    }

    /**
     * Create a configuration holding the content of a plain mapping.
     *
     * @param other source mapping; must not be {@code null}
     */
    public Config(Map<?, ?> other) {
        Objects.requireNonNull(other, "Source mapping must not be null");
        update(other);
    }

    /**
     * Read a configuration file and process its {@value #INCLUDE_KEY}
     * directives.
     *
     * @param path YAML or JSON file; must not be {@code null}
     * @throws UnsupportedDocumentException if the file type is not supported
     * @throws IllegalArgumentException     if the file does not exist
     * @throws UnresolvedIncludeException   if an included file cannot be found
     */
    public Config(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        this.data = ConfigLoader.read(path);
        this.configFile = path;
        new IncludeResolver(this).resolve();
    }

    /**
     * Build a configuration from any supported source.
     *
     * @param other {@code null}, a {@link Config}, a {@link Map}, or a file
     *              given as {@link Path} or {@link String}
     * @return new configuration; never shares state with {@code other}
     * @throws IllegalArgumentException if the source type is not recognized
     */
    public static Config from(Object other) {
        if (other == null) {
            return new Config();
        }
        if (other instanceof Config config) {
            return new Config(config);
        }
        if (other instanceof Map<?, ?> map) {
            return new Config(map);
        }
        if (other instanceof Path path) {
            return new Config(path);
        }
        if (other instanceof String path) {
            return new Config(Path.of(path));
        }
        throw new IllegalArgumentException("A Config could not be loaded from other: " + other);
    }

    /**
     * Create a deep copy of this configuration.
     *
     * <p>
     * Subclasses carrying extra state override this to keep it.
     * </p>
     *
     * @return independent copy with the same delimiter
     */
    public Config copy() {
        return new Config(this);
    }

    // ---------------------------------------------------------------
    // Container operations
    // ---------------------------------------------------------------

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * @return iterator over the top-level keys
     */
    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableSet(data.keySet()).iterator();
    }

    /**
     * @return unmodifiable view of the top-level keys
     */
    public Set<String> keySet() {
        return Collections.unmodifiableSet(data.keySet());
    }

    /**
     * Return the value at a key path.
     *
     * <p>
     * A mapping is returned as a new {@code Config} holding a deep copy of the
     * subtree. It inherits this configuration's delimiter. Sequences are
     * returned as deep copies too.
     * </p>
     *
     * @param key key path
     * @return the value, possibly {@code null} if {@code null} is stored
     * @throws ConfigKeyNotFoundException if the path does not fully resolve
     */
    public Object get(Object key) {
        Lookup lookup = find(keyHierarchy(key), false);
        if (!lookup.complete) {
            throw new ConfigKeyNotFoundException(key);
        }
        return wrap(lookup.value);
    }

    /**
     * Return the value at a key path or a fallback if the path does not resolve.
     *
     * @param key      key path
     * @param fallback value to return when the key is missing
     * @return stored value or {@code fallback}
     */
    public Object getOrDefault(Object key, Object fallback) {
        Lookup lookup = find(keyHierarchy(key), false);
        return lookup.complete ? wrap(lookup.value) : fallback;
    }

    /**
     * Look up a key path.
     *
     * @param key key path
     * @return the value, empty if missing or if {@code null} is stored
     */
    public Optional<Object> find(Object key) {
        return Optional.ofNullable(getOrDefault(key, null));
    }

    /**
     * Store a value at a key path, creating missing mapping levels.
     *
     * <p>
     * Sequences are never extended: the index of a sequence element must
     * exist. A {@link Config} or {@link Map} value is deep-copied.
     * </p>
     *
     * @param key   key path
     * @param value value to store
     * @throws ConfigKeyNotFoundException if the path runs through a scalar or a
     *                                    missing sequence index
     */
    public void set(Object key, Object value) {
        List<Object> keys = keyHierarchy(key);
        Object last = removeLast(keys, key);

        Lookup lookup = find(keys, true);
        if (!lookup.complete) {
            throw new ConfigKeyNotFoundException(key, "Can not set " + key + ": parent path does not exist");
        }
        Object container = lookup.value;
        Object stored = Documents.copyOf(value);

        if (container instanceof Map<?, ?>) {
            asDocumentMap(container).put(String.valueOf(last), stored);
        } else if (container instanceof List<?>) {
            Integer index = Documents.toIndex(last);
            List<Object> list = asDocumentList(container);
            int position = index == null ? -1 : Documents.resolveIndex(index, list.size());
            if (position < 0) {
                throw new ConfigKeyNotFoundException(key, "Can not set " + key + ": no sequence element " + last);
            }
            list.set(position, stored);
        } else {
            throw new ConfigKeyNotFoundException(key, "Can not set " + key + ": parent is not a container");
        }
    }

    /**
     * Check whether a key path fully resolves.
     *
     * @param key key path
     * @return {@code true} if a value (possibly {@code null}) is stored there
     */
    public boolean contains(Object key) {
        return find(keyHierarchy(key), false).complete;
    }

    /**
     * Remove the value at a key path. Parent levels are kept even when they
     * become empty.
     *
     * @param key key path
     * @throws ConfigKeyNotFoundException if the path does not fully resolve
     */
    public void remove(Object key) {
        List<Object> keys = keyHierarchy(key);
        Object last = removeLast(keys, key);

        Lookup lookup = find(keys, false);
        if (!lookup.complete) {
            throw new ConfigKeyNotFoundException(key, key + " not found in Config");
        }
        Object container = lookup.value;

        if (container instanceof Map<?, ?> map) {
            String name = String.valueOf(last);
            if (!map.containsKey(name)) {
                throw new ConfigKeyNotFoundException(key, key + " not found in Config");
            }
            map.remove(name);
        } else if (container instanceof List<?> list) {
            Integer index = Documents.toIndex(last);
            int position = index == null ? -1 : Documents.resolveIndex(index, list.size());
            if (position < 0) {
                throw new ConfigKeyNotFoundException(key, key + " not found in Config");
            }
            list.remove(position);
        } else {
            throw new ConfigKeyNotFoundException(key, key + " not found in Config");
        }
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public String getString(Object key) {
        Object value = get(key);
        if (value != null && !(value instanceof String)) {
            throw new ConfigTypeException(key, "a string", value);
        }
        return (String) value;
    }

    /**
     * @param key key path
     * @return the integer at {@code key}, parsed if stored as a string
     * @throws ConfigTypeException if the value is not a whole number in the
     *                             {@code int} range
     */
    public int getInt(Object key) {
        Object value = get(key);
        try {
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return Math.toIntExact(((Number) value).longValue());
            }
            if (value instanceof BigInteger number) {
                return number.intValueExact();
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).intValueExact();
            }
            if (value instanceof String text) {
                return Integer.parseInt(text.trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            ConfigTypeException error = new ConfigTypeException(key, "an integer", value);
            error.initCause(e);
            throw error;
        }
        throw new ConfigTypeException(key, "an integer", value);
    }

    public boolean getBoolean(Object key) {
        Object value = get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigTypeException(key, "a boolean", value);
    }

    /**
     * @param key key path
     * @return the mapping at {@code key} as an independent configuration
     * @throws ConfigTypeException if the value is not a mapping
     */
    public Config getConfig(Object key) {
        Object value = get(key);
        if (!(value instanceof Config config)) {
            throw new ConfigTypeException(key, "a mapping", value);
        }
        return config;
    }

    /**
     * @param key key path
     * @return copy of the sequence at {@code key}
     * @throws ConfigTypeException if the value is not a sequence
     */
    public List<Object> getList(Object key) {
        Object value = get(key);
        if (!(value instanceof List<?>)) {
            throw new ConfigTypeException(key, "a sequence", value);
        }
        return asDocumentList(value);
    }

    /**
     * Return a value as a list with at least one element.
     *
     * <p>
     * A sequence is returned as is; any other value, including a string, a
     * mapping or a missing key ({@code null}), becomes the single element.
     * </p>
     *
     * @param key key path
     * @return list form of the value
     */
    public List<Object> asArray(Object key) {
        Object value = getOrDefault(key, null);
        if (value instanceof List<?>) {
            return asDocumentList(value);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    // ---------------------------------------------------------------
    // Merging
    // ---------------------------------------------------------------

    /**
     * Deep-merge another mapping into this one.
     *
     * <p>
     * Unlike {@link Map#putAll(Map)}, nested mappings are merged key by key:
     * </p>
     *
     * <pre>
     * {a: {b: 1}} updated with {a: {c: 2}}  =&gt;  {a: {b: 1, c: 2}}
     * {a: {b: 1}} updated with {a: 5}       =&gt;  {a: 5}
     * </pre>
     *
     * @param other a {@link Config} or {@link Map}
     * @throws MergeTypeMismatchException if {@code other}, or a value it merges a
     *                                    mapping into, is not a mapping
     */
    public void update(Object other) {
        if (!Documents.isMapping(other)) {
            throw new MergeTypeMismatchException("Only call update with a mapping, not "
                    + (other == null ? "null" : other.getClass().getSimpleName()));
        }
        doUpdate(data, Documents.asMap(other));
    }

    /**
     * Fill in keys from another mapping that do not exist here. Existing values
     * always win, at every depth.
     *
     * @param other a {@link Config} or {@link Map} holding defaults
     */
    public void merge(Object other) {
        if (!Documents.isMapping(other)) {
            throw new MergeTypeMismatchException("Only call merge with a mapping, not "
                    + (other == null ? "null" : other.getClass().getSimpleName()));
        }
        Map<String, Object> result = Documents.copyOfMapping(Documents.asMap(other));
        doUpdate(result, data);
        this.data = result;
    }

    private static void doUpdate(Map<String, Object> target, Map<?, ?> source) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (Documents.isMapping(value)) {
                Object existing = target.get(key);
                Map<String, Object> nested;
                if (existing == null && !target.containsKey(key)) {
                    nested = new LinkedHashMap<>();
                } else if (existing instanceof Map<?, ?>) {
                    nested = asDocumentMap(existing);
                } else {
                    throw new MergeTypeMismatchException("Only call update with a mapping, not "
                            + (existing == null ? "null" : existing.getClass().getSimpleName())
                            + " (key " + key + ")");
                }
                doUpdate(nested, Documents.asMap(value));
                target.put(key, nested);
            } else {
                target.put(key, Documents.copyOf(value));
            }
        }
    }

    // ---------------------------------------------------------------
    // Key enumeration
    // ---------------------------------------------------------------

    /**
     * @return every key path in the document, depth first
     * @see #nameTuples(boolean)
     */
    public List<List<Object>> nameTuples() {
        return nameTuples(false);
    }

    /**
     * Get the segments of every key path in the document.
     *
     * <p>
     * Each returned path can be passed to {@link #get(Object)}. Sequence
     * elements appear with their {@link Integer} index; strings are never
     * traversed.
     * </p>
     *
     * @param topLevelOnly only return the top-level keys
     * @return list of key paths
     */
    public List<List<Object>> nameTuples(boolean topLevelOnly) {
        List<List<Object>> names = new ArrayList<>();
        if (topLevelOnly) {
            for (String key : data.keySet()) {
                names.add(List.of(key));
            }
            return names;
        }
        collectNames(data, new ArrayList<>(), names);
        return names;
    }

    private static void collectNames(Object node, List<Object> base, List<List<Object>> names) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                visitName(entry.getKey(), entry.getValue(), base, names);
            }
        } else if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                visitName(i, list.get(i), base, names);
            }
        }
    }

    private static void visitName(Object key, Object value, List<Object> base, List<List<Object>> names) {
        List<Object> path = new ArrayList<>(base);
        path.add(key);
        names.add(Collections.unmodifiableList(path));
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            collectNames(value, path, names);
        }
    }

    /**
     * @return every key path as a delimited string
     * @see #names(boolean, Character)
     */
    public List<String> names() {
        return names(false, null);
    }

    public List<String> names(boolean topLevelOnly) {
        return names(topLevelOnly, null);
    }

    /**
     * Get every key path as a delimited string usable with {@link #get(Object)}.
     *
     * <p>
     * Without an explicit delimiter, one that does not occur in any key is
     * chosen, starting from this configuration's delimiter. A supplied
     * delimiter occurring in a key is escaped.
     * </p>
     *
     * @param topLevelOnly only return the top-level keys, unadorned
     * @param delimiter    delimiter to use, or {@code null} to pick one
     * @return delimited key paths
     * @throws IllegalArgumentException    if the supplied delimiter is alphanumeric
     * @throws DelimiterSelectionException if no free delimiter could be found
     */
    public List<String> names(boolean topLevelOnly, Character delimiter) {
        if (topLevelOnly) {
            return new ArrayList<>(data.keySet());
        }
        List<List<Object>> tuples = nameTuples();

        if (delimiter != null && !KeyPathParser.isDelimiter(delimiter)) {
            throw new IllegalArgumentException("Supplied delimiter ('" + delimiter + "') must not be alphanumeric.");
        }

        char chosen = delimiter != null ? delimiter : selectDelimiter(tuples);
        LOG.debug("Using delimiter '{}'", chosen);

        List<String> names = new ArrayList<>(tuples.size());
        for (List<Object> tuple : tuples) {
            names.add(KeyPathParser.join(tuple, chosen));
        }
        return names;
    }

    private char selectDelimiter(List<List<Object>> tuples) {
        StringBuilder combined = new StringBuilder();
        for (List<Object> tuple : tuples) {
            for (Object segment : tuple) {
                combined.append(segment);
            }
        }
        String content = combined.toString();

        char candidate = delimiter;
        int attempts = 0;
        while (content.indexOf(candidate) >= 0) {
            LOG.debug("Delimiter '{}' could not be used. Trying another.", candidate);
            attempts++;
            if (attempts > MAX_DELIMITER_ATTEMPTS) {
                throw new DelimiterSelectionException("Unable to determine a delimiter for Config " + this);
            }
            do {
                candidate++;
            } while (!KeyPathParser.isDelimiter(candidate));
        }
        return candidate;
    }

    // ---------------------------------------------------------------
    // Delimiter and source
    // ---------------------------------------------------------------

    /**
     * @return internal delimiter used when rendering key paths
     */
    public char getDelimiter() {
        return delimiter;
    }

    /**
     * @param delimiter non-alphanumeric delimiter inherited by sub-configs
     * @throws IllegalArgumentException if {@code delimiter} is alphanumeric
     */
    public void setDelimiter(char delimiter) {
        if (!KeyPathParser.isDelimiter(delimiter)) {
            throw new IllegalArgumentException("Delimiter ('" + delimiter + "') must not be alphanumeric.");
        }
        this.delimiter = delimiter;
    }

    /**
     * @return the file this configuration was read from, if any
     */
    public Optional<Path> getConfigFile() {
        return Optional.ofNullable(configFile);
    }

    // ---------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------

    /**
     * @return deep copy of the document as plain maps and lists
     */
    public Map<String, Object> toMap() {
        return Documents.copyOfMapping(data);
    }

    public void dump(Writer output) {
        dump(output, List.of());
    }

    /**
     * Write this configuration as YAML.
     *
     * @param output   destination; not closed
     * @param keyOrder top-level keys written first, in this order
     */
    public void dump(Writer output, List<String> keyOrder) {
        ConfigLoader.dump(data, output, keyOrder);
    }

    public void dumpToFile(Path path) {
        dumpToFile(path, List.of());
    }

    /**
     * Write this configuration as a YAML file.
     *
     * @param path     destination file, replaced if it exists
     * @param keyOrder top-level keys written first, in this order
     * @throws ConfigException if the file cannot be written
     */
    public void dumpToFile(Path path, List<String> keyOrder) {
        Objects.requireNonNull(path, "Output path must not be null");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            dump(writer, keyOrder);
        } catch (IOException e) {
            throw new ConfigException("Failed to write config file: " + path, e);
        }
    }

    /**
     * @return the document as block-style YAML
     */
    public String toYaml() {
        return ConfigLoader.toYaml(data);
    }

    /**
     * Render the document in a readable, indented form for debugging.
     *
     * @return multi-line rendering
     */
    public String prettyPrint() {
        return toYaml();
    }

    // ---------------------------------------------------------------
    // Equality
    // ---------------------------------------------------------------

    /**
     * Compare the document with another configuration or a plain mapping.
     *
     * @param other {@link Config} or {@link Map}
     * @return {@code true} if both hold equal trees
     */
    public boolean contentEquals(Object other) {
        if (other instanceof Config config) {
            return data.equals(config.data);
        }
        if (other instanceof Map<?, ?> map) {
            return data.equals(map);
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Config that))
            return false;
        return data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + data + ")";
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Live document tree. */
    Map<String, Object> data() {
        return data;
    }

    /** Replace the whole document tree. */
    void replaceData(Map<String, Object> replacement) {
        this.data = replacement;
    }

    private List<Object> keyHierarchy(Object key) {
        if (key instanceof String name && data.containsKey(name)) {
            List<Object> keys = new ArrayList<>(1);
            keys.add(name);
            return keys;
        }
        return KeyPathParser.split(key);
    }

    private Object wrap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Config child = new Config();
            child.data = Documents.copyOfMapping(map);
            if (delimiter != DEFAULT_DELIMITER) {
                child.delimiter = delimiter;
            }
            return child;
        }
        if (value instanceof List<?>) {
            return Documents.copyOf(value);
        }
        return value;
    }

    private static Object removeLast(List<Object> keys, Object key) {
        if (keys.isEmpty()) {
            throw new ConfigKeyNotFoundException(key, "Empty key path");
        }
        return keys.remove(keys.size() - 1);
    }

    private Lookup find(List<Object> keys, boolean create) {
        Object node = data;
        for (Object key : keys) {
            if (node instanceof Map<?, ?>) {
                Map<String, Object> map = asDocumentMap(node);
                String name = String.valueOf(key);
                if (map.containsKey(name)) {
                    node = map.get(name);
                } else if (create) {
                    node = new LinkedHashMap<String, Object>();
                    map.put(name, node);
                } else {
                    return Lookup.MISSING;
                }
            } else if (node instanceof List<?> list) {
                Integer index = Documents.toIndex(key);
                if (index == null) {
                    // Not an index: membership test on the sequence values
                    if (!list.contains(key)) {
                        return Lookup.MISSING;
                    }
                    node = null;
                } else {
                    int position = Documents.resolveIndex(index, list.size());
                    if (position < 0) {
                        return Lookup.MISSING;
                    }
                    node = list.get(position);
                }
            } else {
                return Lookup.MISSING;
            }
        }
        return new Lookup(true, node);
    }

    private static Map<String, Object> asDocumentMap(Object node) {
        return (Map<String, Object>) node;
    }

    private static List<Object> asDocumentList(Object node) {
        return (List<Object>) node;
    }

    /**
     * Outcome of descending a key path: whether it fully resolved and the
     * node it ended on.
     */
    private static final class Lookup {
        static final Lookup MISSING = new Lookup(false, null);

        private final boolean complete;
        private final Object value;

        Lookup(boolean complete, Object value) {
            this.complete = complete;
            this.value = value;
        }
    }
}
