package com.filesetloader.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one render: output buffer and variable scopes.
 *
 * <p>
 * Scopes are a stack; {@link #mark()} and {@link #reset(int)} bracket the
 * body of {@code if} and {@code range} so variables declared inside do not
 * leak out.
 * </p>
 */
final class RenderState {

    private final String template;
    private final MissingKeyPolicy policy;
    private final StringBuilder out = new StringBuilder();
    private final List<String> names = new ArrayList<>();
    private final List<Object> values = new ArrayList<>();

    RenderState(String template, MissingKeyPolicy policy, Object root) {
        this.template = template;
        this.policy = policy;
        push("$", root);
    }

    void write(String s) {
        out.append(s);
    }

    String output() {
        return out.toString();
    }

    int mark() {
        return names.size();
    }

    void reset(int mark) {
        while (names.size() > mark) {
            names.remove(names.size() - 1);
            values.remove(values.size() - 1);
        }
    }

    void push(String name, Object value) {
        names.add(name);
        values.add(value);
    }

    Object variable(String name, int line) {
        for (int i = names.size() - 1; i >= 0; i--) {
            if (names.get(i).equals(name)) {
                return values.get(i);
            }
        }
        throw error(line, "undefined variable: " + name);
    }

    /**
     * Follow {@code path} through nested maps starting at {@code base}.
     */
    Object walk(Object base, List<String> path, String expr, int line) {
        Object current = base;
        for (String key : path) {
            if (current == Values.MISSING) {
                return current;
            }
            if (current instanceof Map<?, ?> map) {
                if (map.containsKey(key)) {
                    current = map.get(key);
                } else if (policy == MissingKeyPolicy.STRICT) {
                    throw error(line, "executing \"" + expr + "\": map has no entry for key \"" + key + "\"");
                } else {
                    current = Values.MISSING;
                }
            } else if (current == null) {
                throw error(line, "executing \"" + expr + "\": nil pointer evaluating ." + key);
            } else {
                throw error(line, "executing \"" + expr + "\": can't evaluate field " + key
                        + " in type " + Values.typeName(current));
            }
        }
        return current;
    }

    TemplateException error(int line, String message) {
        return new TemplateException("template:" + line + ": " + message, template);
    }
}
