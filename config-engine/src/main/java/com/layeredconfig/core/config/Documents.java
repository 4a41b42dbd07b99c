package com.layeredconfig.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the plain document tree held by a {@link Config}.
 *
 * <p>
 * Inside a document every mapping is a {@code LinkedHashMap<String, Object>}
 * and every sequence an {@code ArrayList<Object>}; {@link #copyOf(Object)}
 * produces such a tree from any mix of maps, lists, arrays and configs.
 * </p>
 */
final class Documents {

    private Documents() {
        // utility class; not instantiable
    }

    static boolean isMapping(Object value) {
        return value instanceof Map<?, ?> || value instanceof Config;
    }

    static boolean isSequence(Object value) {
        return value instanceof List<?> || value instanceof Object[];
    }

    /**
     * Deep copy a value into document form. Mapping keys become strings.
     *
     * @param value any value
     * @return an independent copy; scalars are returned as is
     */
    static Object copyOf(Object value) {
        if (value instanceof Config config) {
            return copyOfMapping(config.data());
        }
        if (value instanceof Map<?, ?> map) {
            return copyOfMapping(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyOf(item));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(copyOf(item));
            }
            return copy;
        }
        return value;
    }

    static Map<String, Object> copyOfMapping(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyOf(entry.getValue()));
        }
        return copy;
    }

    /**
     * View a mapping value (plain map or config) as a map without copying.
     */
    static Map<?, ?> asMap(Object value) {
        if (value instanceof Config config) {
            return config.data();
        }
        return (Map<?, ?>) value;
    }

    /**
     * Parse a sequence index. Returns {@code null} if the segment is not an
     * integer in the {@code int} range.
     */
    static Integer toIndex(Object segment) {
        if (segment instanceof Integer i) {
            return i;
        }
        if (segment instanceof Long || segment instanceof Short || segment instanceof Byte) {
            long value = ((Number) segment).longValue();
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                return null;
            }
            return (int) value;
        }
        try {
            return Integer.valueOf(String.valueOf(segment).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Resolve an index against a sequence of {@code size} elements. Negative
     * indices count from the end, so {@code -1} is the last element.
     *
     * @return position in the sequence, or {@code -1} if out of range
     */
    static int resolveIndex(int index, int size) {
        int position = index < 0 ? index + size : index;
        return position >= 0 && position < size ? position : -1;
    }
}
