package com.filesetloader.core.fileset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.filesetloader.core.FilesetException;
import com.filesetloader.core.config.ConfigDocuments;
import com.filesetloader.core.config.ConfigMerger;
import com.filesetloader.core.template.TemplateEngine;
import com.filesetloader.core.template.TemplateException;
import com.filesetloader.core.vars.VariableEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a templated file of a fileset into a configuration document.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>render the path template against the variables</li>
 * <li>read {@code <fileset dir>/<rendered path>}</li>
 * <li>render the file contents against the same variables</li>
 * <li>parse the result as YAML or JSON</li>
 * <li>deep-merge the caller's override document (override wins)</li>
 * </ol>
 *
 * <p>
 * Nothing is cached: every call reads and parses the file again. The
 * materializer itself is stateless.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigMaterializer.class);

    /** Syntax of a materialized document. */
    public enum Format {
        YAML, JSON
    }

    private final TemplateEngine templateEngine;

    public ConfigMaterializer(TemplateEngine templateEngine) {
        this.templateEngine = Objects.requireNonNull(templateEngine, "TemplateEngine must not be null");
    }

    /**
     * Render a path template.
     *
     * @param pathTemplate the template, e.g. {@code config/{{.type}}.yml}
     * @param vars         the resolved variables
     * @param what         what the path points at, for messages
     * @return the rendered path
     * @throws FilesetException of kind {@code TEMPLATE}
     */
    public String expandPath(String pathTemplate, VariableEnvironment vars, String what) {
        try {
            return templateEngine.render(pathTemplate, vars.asMap());
        } catch (TemplateException e) {
            throw new FilesetException(FilesetException.Kind.TEMPLATE,
                    "Error expanding vars on the " + what + " path " + e.getTemplate() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param filesetDir   directory the path is relative to
     * @param pathTemplate path template of the file
     * @param format       syntax of the rendered file
     * @param vars         the resolved variables
     * @param overrides    document merged over the result; may be
     *                     {@code null}
     * @return the merged document, insertion-ordered
     * @throws FilesetException of kind {@code TEMPLATE}, {@code FILE_READ},
     *                          {@code CONFIG_PARSE} or
     *                          {@code OVERRIDE_MERGE}
     */
    public Map<String, Object> materialize(Path filesetDir, String pathTemplate, Format format,
            VariableEnvironment vars, Map<?, ?> overrides) {
        Objects.requireNonNull(filesetDir, "Fileset directory must not be null");
        Objects.requireNonNull(pathTemplate, "Path template must not be null");
        Objects.requireNonNull(format, "Format must not be null");
        Objects.requireNonNull(vars, "Variables must not be null");

        Path file = resolveUnder(filesetDir, expandPath(pathTemplate, vars, format.name() + " file"));
        String rendered = render(file, read(file), vars);
        Map<String, Object> document = parse(file, rendered, format);

        try {
            return ConfigMerger.merge(document, overrides);
        } catch (FilesetException e) {
            throw new FilesetException(e.getKind(),
                    "Error applying config overrides to " + file + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Join {@code path} onto {@code dir}. Leading separators are dropped, so
     * an absolute-looking path still names a file under {@code dir}.
     */
    static Path resolveUnder(Path dir, String path) {
        int start = 0;
        while (start < path.length() && (path.charAt(start) == '/' || path.charAt(start) == '\\')) {
            start++;
        }
        return dir.resolve(path.substring(start));
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FilesetException(FilesetException.Kind.FILE_READ,
                    "Error reading file " + file + ": file not found", e);
        } catch (IOException e) {
            throw new FilesetException(FilesetException.Kind.FILE_READ,
                    "Error reading file " + file + ": " + e.getMessage(), e);
        }
    }

    private String render(Path file, String contents, VariableEnvironment vars) {
        try {
            return templateEngine.render(contents, vars.asMap());
        } catch (TemplateException e) {
            throw new FilesetException(FilesetException.Kind.TEMPLATE,
                    "Error interpreting the template of " + file + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parse(Path file, String text, Format format) {
        try {
            Map<String, Object> document = switch (format) {
                case YAML -> ConfigDocuments.parseYaml(text);
                case JSON -> ConfigDocuments.parseJson(text);
            };
            LOG.debug("Parsed {} document {} ({} top-level key(s))", format, file, document.size());
            return document;
        } catch (YAMLException | JsonProcessingException | IllegalArgumentException e) {
            throw new FilesetException(FilesetException.Kind.CONFIG_PARSE,
                    "Error parsing " + format + " file " + file + ": " + e.getMessage(), e);
        }
    }
}
