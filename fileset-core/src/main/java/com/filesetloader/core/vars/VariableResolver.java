package com.filesetloader.core.vars;

import com.filesetloader.core.FilesetException;
import com.filesetloader.core.template.TemplateEngine;
import com.filesetloader.core.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the variables declared by a manifest into a
 * {@link VariableEnvironment}.
 *
 * <h3>Order</h3>
 * <ol>
 * <li>{@value VariableEnvironment#BUILTIN} is computed from the
 * {@link HostFactsProvider}.</li>
 * <li>Declarations are resolved one by one, in manifest order. A
 * declaration's OS override replaces its default when its key equals the
 * current OS identifier. The value is rendered against everything resolved
 * so far, so a declaration may only refer to earlier ones.</li>
 * <li>Caller overrides replace resolved values verbatim; they are not
 * rendered.</li>
 * </ol>
 *
 * <p>
 * Declaration order is resolution order; there is no dependency analysis.
 * Any failure aborts the whole resolution.
 * </p>
 *
 * @since 1.0.0
 */
public final class VariableResolver {

    private static final Logger LOG = LoggerFactory.getLogger(VariableResolver.class);

    private final HostFactsProvider hostFacts;
    private final TemplateEngine templateEngine;

    public VariableResolver(HostFactsProvider hostFacts, TemplateEngine templateEngine) {
        this.hostFacts = Objects.requireNonNull(hostFacts, "HostFactsProvider must not be null");
        this.templateEngine = Objects.requireNonNull(templateEngine, "TemplateEngine must not be null");
    }

    /**
     * @param declarations raw {@code var} entries of the manifest; must not be
     *                     {@code null}
     * @param osName       identifier of the current OS
     * @param overrides    caller overrides, applied last; may be {@code null}
     * @return the resolved environment
     * @throws FilesetException of kind {@code HOST_RESOLUTION},
     *                          {@code MISSING_VARIABLE_FIELD} or
     *                          {@code TEMPLATE}
     */
    public VariableEnvironment resolve(List<? extends Map<?, ?>> declarations, String osName,
            Map<String, ?> overrides) {
        Objects.requireNonNull(declarations, "Variable declarations must not be null");

        VariableEnvironment env = new VariableEnvironment();
        env.put(VariableEnvironment.BUILTIN, BuiltinVariables.compute(hostFacts));

        for (int i = 0; i < declarations.size(); i++) {
            VariableDeclaration declaration = VariableDeclaration.fromMap(i, declarations.get(i));
            String name = declaration.getName();
            VarValue value = declaration.valueFor(osName);

            Object resolved;
            try {
                resolved = value.resolve(template -> templateEngine.render(template, env.asMap()));
            } catch (TemplateException e) {
                throw new FilesetException(FilesetException.Kind.TEMPLATE,
                        "Error resolving variables on " + name + ": " + e.getMessage()
                                + " (template: " + e.getTemplate() + ")",
                        e);
            }
            env.put(name, resolved);
            LOG.debug("Resolved variable {} ({}) = {}", name, value.kind(), resolved);
        }

        if (overrides != null) {
            overrides.forEach((name, value) -> {
                LOG.debug("Overriding variable {} = {}", name, value);
                env.put(name, value);
            });
        }
        return env;
    }
}
