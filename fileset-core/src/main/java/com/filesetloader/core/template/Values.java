package com.filesetloader.core.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Printing, truthiness and ordering rules for values flowing through a
 * template.
 *
 * <p>
 * Collections print as {@code [a b]} and maps as {@code map[k:v]} with keys
 * in sorted order, so a rendered document only depends on the data, never
 * on map iteration order.
 * </p>
 */
final class Values {

    /** Marker for a lookup that found nothing under {@link MissingKeyPolicy#LENIENT}. */
    static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };

    static final String NO_VALUE = "<no value>";

    private Values() {
        // utility class: not instantiable
    }

    static String format(Object value) {
        if (value == MISSING) {
            return "";
        }
        if (value == null) {
            return NO_VALUE;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Collection<?> c) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object element : c) {
                if (!first) {
                    sb.append(' ');
                }
                sb.append(value == element ? "(this)" : format(element));
                first = false;
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> m) {
            StringBuilder sb = new StringBuilder("map[");
            boolean first = true;
            for (Object key : sortedKeys(m)) {
                if (!first) {
                    sb.append(' ');
                }
                sb.append(format(key)).append(':').append(format(m.get(key)));
                first = false;
            }
            return sb.append(']').toString();
        }
        return value.toString();
    }

    static boolean isTrue(Object value) {
        if (value == null || value == MISSING) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0d;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    static List<Object> sortedKeys(Map<?, ?> map) {
        List<Object> keys = new ArrayList<>(map.keySet());
        keys.sort((a, b) -> Objects.toString(a).compareTo(Objects.toString(b)));
        return keys;
    }

    static String typeName(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Collection<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "map";
        }
        return value.getClass().getSimpleName();
    }
}
