package com.filesetloader.core.template;

import java.util.Map;
import java.util.Objects;

/**
 * A parsed template, ready to be rendered any number of times.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Template {

    private final String source;
    private final Node.Sequence root;
    private final MissingKeyPolicy policy;

    Template(String source, Node.Sequence root, MissingKeyPolicy policy) {
        this.source = source;
        this.root = root;
        this.policy = policy;
    }

    /**
     * Render this template with {@code data} as both dot and {@code $}.
     *
     * @param data the template context; must not be {@code null}
     * @return rendered text
     * @throws TemplateException if a reference cannot be evaluated
     */
    public String render(Map<String, ?> data) {
        Objects.requireNonNull(data, "Template data must not be null");
        RenderState state = new RenderState(source, policy, data);
        root.render(state, data);
        return state.output();
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "Template{" + source + '}';
    }
}
