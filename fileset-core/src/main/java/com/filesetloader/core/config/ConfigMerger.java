package com.filesetloader.core.config;

import com.filesetloader.core.FilesetException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep merge of configuration documents.
 *
 * <p>
 * Nested maps are merged key by key; for any other value (scalar, list,
 * null) the override replaces the base. Override keys containing a dot are
 * expanded first, so {@code fields.type: x} merges like
 * {@code fields: {type: x}}. Inputs are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigMerger {

    private ConfigMerger() {
        // utility class: not instantiable
    }

    /**
     * @param base      the document to merge into
     * @param overrides the document that wins on conflict; may be
     *                  {@code null} or empty
     * @return a new merged document
     * @throws FilesetException of kind {@code OVERRIDE_MERGE} if a dotted
     *                          override key collides with a non-map value
     */
    public static Map<String, Object> merge(Map<String, ?> base, Map<?, ?> overrides) {
        Map<String, Object> result = base == null ? new LinkedHashMap<>() : normalize(base);
        if (overrides == null || overrides.isEmpty()) {
            return result;
        }
        return deepMerge(result, expandDottedKeys(normalize(overrides)));
    }

    /**
     * Expand dotted keys into nested maps, recursively.
     *
     * @throws FilesetException of kind {@code OVERRIDE_MERGE} if two keys
     *                          disagree on whether a path is a map
     */
    public static Map<String, Object> expandDottedKeys(Map<String, ?> document) {
        Map<String, Object> expanded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : document.entrySet()) {
            String[] parts = entry.getKey().split("\\.", -1);
            Object value = entry.getValue() instanceof Map<?, ?> nested
                    ? expandDottedKeys(normalize(nested))
                    : entry.getValue();
            for (int i = parts.length - 1; i > 0; i--) {
                Map<String, Object> wrapper = new LinkedHashMap<>();
                wrapper.put(parts[i], value);
                value = wrapper;
            }
            expanded.put(parts[0], combine(entry.getKey(), expanded.get(parts[0]), value));
        }
        return expanded;
    }

    /**
     * Copy a document, converting every map key to a string.
     */
    public static Map<String, Object> normalize(Map<?, ?> document) {
        Map<String, Object> result = new LinkedHashMap<>();
        document.forEach((key, value) -> result.put(String.valueOf(key), normalizeValue(value)));
        return result;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return normalize(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(normalizeValue(element));
            }
            return copy;
        }
        return value;
    }

    /** Join two expansions of override keys sharing a prefix. */
    private static Object combine(String key, Object existing, Object value) {
        if (existing == null) {
            return value;
        }
        if (existing instanceof Map<?, ?> left && value instanceof Map<?, ?> right) {
            Map<String, Object> combined = normalize(left);
            normalize(right).forEach((k, v) -> combined.put(k, combine(key, combined.get(k), v)));
            return combined;
        }
        if (existing instanceof Map<?, ?> || value instanceof Map<?, ?>) {
            throw new FilesetException(FilesetException.Kind.OVERRIDE_MERGE,
                    "Override key '" + key + "' is given both as a map and as a value");
        }
        return value;
    }

    private static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        overrides.forEach((key, value) -> {
            if (merged.get(key) instanceof Map<?, ?> left && value instanceof Map<?, ?> right) {
                merged.put(key, deepMerge(normalize(left), normalize(right)));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }
}
