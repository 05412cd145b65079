package com.filesetloader.core.template;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the template language used in manifests, path templates
 * and configuration files.
 *
 * <h3>Syntax</h3>
 * <ul>
 * <li><code>{{.a.b}}</code>: field access into nested maps,
 * <code>{{.}}</code> is the current value</li>
 * <li><code>{{$}}</code>, <code>{{$.a}}</code>, <code>{{$x.a}}</code>:
 * root and variable access</li>
 * <li><code>{{$x := .a}}</code>: variable declaration</li>
 * <li><code>{{range $i, $v := .list}}...{{else}}...{{end}}</code></li>
 * <li><code>{{if .a}}...{{else if .b}}...{{else}}...{{end}}</code></li>
 * <li><code>{{- </code> / <code> -}}</code> trim markers and
 * <code>{{/* comment *&#47;}}</code></li>
 * </ul>
 *
 * <h3>Missing keys</h3>
 * <p>
 * With {@link MissingKeyPolicy#STRICT} (the default) a reference to a key
 * absent from its map fails the render. With
 * {@link MissingKeyPolicy#LENIENT} it renders as an empty string.
 * </p>
 *
 * <p>
 * The engine holds no mutable state; a single instance can be shared.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemplateEngine {

    private final MissingKeyPolicy policy;

    public TemplateEngine() {
        this(MissingKeyPolicy.STRICT);
    }

    public TemplateEngine(MissingKeyPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "MissingKeyPolicy must not be null");
    }

    /**
     * Parse {@code source} into a reusable {@link Template}.
     *
     * @param source template text; must not be {@code null}
     * @return the parsed template
     * @throws TemplateException on a syntax error
     */
    public Template parse(String source) {
        Objects.requireNonNull(source, "Template source must not be null");
        return new Template(source, new TemplateParser(source).parse(), policy);
    }

    /**
     * Parse and render {@code source} in one step.
     *
     * @param source template text; must not be {@code null}
     * @param data   template context; must not be {@code null}
     * @return rendered text
     * @throws TemplateException on a syntax or evaluation error
     */
    public String render(String source, Map<String, ?> data) {
        Objects.requireNonNull(source, "Template source must not be null");
        Objects.requireNonNull(data, "Template data must not be null");
        if (source.indexOf("{{") < 0) {
            return source;
        }
        return parse(source).render(data);
    }

    public MissingKeyPolicy getPolicy() {
        return policy;
    }
}
