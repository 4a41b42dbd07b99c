package com.layeredconfig.core.key;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a key expression into the ordered list of segments used to address a
 * nested configuration document.
 *
 * <h3>Notation</h3>
 * <ul>
 * <li>A string whose first character is a letter or digit is a single key:
 * {@code "a.b"} addresses one key named {@code a.b}.</li>
 * <li>Otherwise the first character is the delimiter for the rest of the
 * string: {@code ".a.b"}, {@code "/a/b"} and {@code "→a→b"} all address
 * {@code [a, b]}.</li>
 * <li>A literal delimiter inside a segment is escaped with a backslash:
 * {@code ".a.b\\.c"} addresses {@code [a, b.c]}.</li>
 * <li>An {@link Iterable} or array is taken as the segments themselves.</li>
 * <li>Any other object is a single segment.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class KeyPathParser {

    /** Placeholder for escaped delimiters while the expression is split. */
    static final String SENTINEL = "\r";

    private static final String ESCAPE = "\\";

    private KeyPathParser() {
        // utility class; not instantiable
    }

    /**
     * Split a key expression into its hierarchy of segments.
     *
     * @param key string, iterable, array or scalar key; must not be {@code null}
     * @return mutable list of segments
     * @throws MalformedKeyException if an escaped delimiter is escaped again, or
     *                               the sentinel character collides with the key
     */
    public static List<Object> split(Object key) {
        Objects.requireNonNull(key, "Key must not be null");

        if (key instanceof String text) {
            return splitString(text);
        }
        if (key instanceof Iterable<?> iterable) {
            List<Object> segments = new ArrayList<>();
            iterable.forEach(segments::add);
            return segments;
        }
        if (key instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        List<Object> single = new ArrayList<>(1);
        single.add(key);
        return single;
    }

    /**
     * Render segments as a delimited key expression that {@link #split(Object)}
     * turns back into the same segments.
     *
     * @param segments  the hierarchy
     * @param delimiter non-alphanumeric delimiter
     * @return delimiter-prefixed, escaped key expression
     */
    public static String join(List<?> segments, char delimiter) {
        String d = String.valueOf(delimiter);
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            sb.append(d).append(String.valueOf(segment).replace(d, ESCAPE + d));
        }
        return sb.toString();
    }

    /**
     * Check whether a character may be used as a delimiter.
     *
     * @param c candidate character
     * @return {@code true} unless the character is a letter or digit
     */
    public static boolean isDelimiter(char c) {
        return !Character.isLetterOrDigit(c);
    }

    private static List<Object> splitString(String key) {
        if (key.isEmpty()) {
            return new ArrayList<>(Collections.singletonList(key));
        }
        int first = key.codePointAt(0);
        if (Character.isLetterOrDigit(first)) {
            return new ArrayList<>(Collections.singletonList(key));
        }

        String d = new String(Character.toChars(first));
        String rest = key.substring(d.length());
        String escaped = ESCAPE + d;

        boolean hasEscapes = rest.contains(escaped);
        if (hasEscapes) {
            String doubled = ESCAPE + escaped;
            if (rest.contains(doubled)) {
                throw new MalformedKeyException("Escaping an escaped delimiter (" + doubled
                        + " in " + rest + ") is not yet supported.");
            }
            if (rest.contains(SENTINEL) || d.equals(SENTINEL)) {
                throw new MalformedKeyException("Can not use character '\\r' in hierarchical key"
                        + " or as delimiter if escaping the delimiter");
            }
            rest = rest.replace(escaped, SENTINEL);
        }

        String[] parts = rest.split(Pattern.quote(d), -1);
        List<Object> hierarchy = new ArrayList<>(parts.length);
        for (String part : parts) {
            hierarchy.add(hasEscapes ? part.replace(SENTINEL, d) : part);
        }
        return hierarchy;
    }
}
