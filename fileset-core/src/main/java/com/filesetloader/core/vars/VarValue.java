package com.filesetloader.core.vars;

import com.filesetloader.core.template.TemplateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Value of a declared variable, before resolution.
 *
 * <p>
 * The set of shapes is closed: the constructor is private and the only
 * subclasses are the three nested ones below, one per {@link Kind}.
 * </p>
 * <ul>
 * <li>{@link Text}: a string, rendered as a template</li>
 * <li>{@link Sequence}: a list; string elements are rendered, other
 * elements pass through</li>
 * <li>{@link Opaque}: anything else (numbers, booleans, maps, null),
 * passed through unchanged</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class VarValue {

    /** Shape of a {@link VarValue}. */
    public enum Kind {
        TEXT, SEQUENCE, OPAQUE
    }

    private VarValue() {
    }

    /**
     * Classify a raw manifest value.
     *
     * @param raw value as parsed from YAML; may be {@code null}
     * @return the matching shape
     */
    public static VarValue of(Object raw) {
        if (raw instanceof String s) {
            return new Text(s);
        }
        if (raw instanceof List<?> list) {
            return new Sequence(list);
        }
        return new Opaque(raw);
    }

    public abstract Kind kind();

    /**
     * Resolve this value.
     *
     * @param render renders one template string against the current
     *               environment
     * @return the resolved value: a string, a list, or the opaque value
     * @throws TemplateException if rendering fails
     */
    public abstract Object resolve(UnaryOperator<String> render);

    /** A string value. */
    public static final class Text extends VarValue {
        private final String value;

        private Text(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public Object resolve(UnaryOperator<String> render) {
            return render.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Text that && value.equals(that.value));
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Text{" + value + '}';
        }
    }

    /** A list value; elements may be of any type. */
    public static final class Sequence extends VarValue {
        private final List<Object> elements;

        private Sequence(List<?> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<Object> getElements() {
            return elements;
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        /**
         * Render every string element; the first failing element aborts the
         * whole sequence.
         */
        @Override
        public Object resolve(UnaryOperator<String> render) {
            List<Object> resolved = new ArrayList<>(elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Object element = elements.get(i);
                if (element instanceof String s) {
                    try {
                        resolved.add(render.apply(s));
                    } catch (TemplateException e) {
                        throw new TemplateException("array element " + i + ": " + e.getMessage(),
                                e.getTemplate(), e);
                    }
                } else {
                    resolved.add(element);
                }
            }
            return Collections.unmodifiableList(resolved);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Sequence that && elements.equals(that.elements));
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "Sequence" + elements;
        }
    }

    /** Any value that is neither a string nor a list. */
    public static final class Opaque extends VarValue {
        private final Object value;

        private Opaque(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.OPAQUE;
        }

        @Override
        public Object resolve(UnaryOperator<String> render) {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Opaque that && Objects.equals(value, that.value));
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Opaque{" + value + '}';
        }
    }
}
