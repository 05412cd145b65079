package com.filesetloader.core.vars;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved variables of a fileset, in resolution order.
 *
 * <p>
 * Entries are only ever added or replaced, never removed. Besides the
 * declared variables it holds the reserved {@value #BUILTIN} map (host
 * facts) and, once the fileset is read, the reserved {@value #BEAT} map
 * holding {@value #PIPELINE_ID}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VariableEnvironment {

    public static final String BUILTIN = "builtin";
    public static final String BEAT = "beat";
    public static final String PIPELINE_ID = "pipeline_id";

    private final Map<String, Object> vars = new LinkedHashMap<>();

    /**
     * Bind {@code name} to {@code value}, replacing any earlier binding.
     *
     * @param name  variable name; must not be {@code null}
     * @param value resolved value; may be {@code null}
     */
    public void put(String name, Object value) {
        vars.put(Objects.requireNonNull(name, "Variable name must not be null"), value);
    }

    public Object get(String name) {
        return vars.get(name);
    }

    public boolean contains(String name) {
        return vars.containsKey(name);
    }

    public int size() {
        return vars.size();
    }

    /**
     * @return unmodifiable live view, usable as template data
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(vars);
    }

    @Override
    public String toString() {
        return "VariableEnvironment" + vars;
    }
}
