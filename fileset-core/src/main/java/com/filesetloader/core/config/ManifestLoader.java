package com.filesetloader.core.config;

import com.filesetloader.core.FilesetException;
import com.filesetloader.core.model.Manifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a fileset {@link Manifest} from its {@code manifest.yml}.
 *
 * <h3>Failures</h3>
 * <ul>
 * <li>{@code MANIFEST_READ}: the file is missing or unreadable</li>
 * <li>{@code MANIFEST_UNPACK}: the YAML is malformed, or a known key has
 * the wrong type ({@code var} must be a list of maps, the path templates
 * must be strings)</li>
 * </ul>
 *
 * <p>
 * Unknown keys are ignored. {@code module_version} may be written as a
 * number and is kept as its string form.
 * </p>
 *
 * @since 1.0.0
 */
public final class ManifestLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestLoader.class);

    /** File name of the manifest inside a fileset directory. */
    public static final String MANIFEST_FILE = "manifest.yml";

    private ManifestLoader() {
        // utility class: not instantiable
    }

    /**
     * Load the manifest of the fileset in {@code filesetDir}.
     *
     * @param filesetDir the fileset directory; must not be {@code null}
     * @return the parsed manifest
     * @throws FilesetException of kind {@code MANIFEST_READ} or
     *                          {@code MANIFEST_UNPACK}
     */
    public static Manifest fromFilesetDir(Path filesetDir) {
        Objects.requireNonNull(filesetDir, "Fileset directory must not be null");
        return fromFile(filesetDir.resolve(MANIFEST_FILE));
    }

    /**
     * Load a manifest from an explicit file.
     *
     * @param file path of the manifest file; must not be {@code null}
     * @return the parsed manifest
     * @throws FilesetException of kind {@code MANIFEST_READ} or
     *                          {@code MANIFEST_UNPACK}
     */
    public static Manifest fromFile(Path file) {
        Objects.requireNonNull(file, "Manifest file must not be null");
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FilesetException(FilesetException.Kind.MANIFEST_READ,
                    "Error reading manifest file: " + file + " not found", e);
        } catch (IOException e) {
            throw new FilesetException(FilesetException.Kind.MANIFEST_READ,
                    "Error reading manifest file " + file + ": " + e.getMessage(), e);
        }

        Manifest manifest = parse(text, file.toString());
        LOG.debug("Loaded manifest {}: {}", file, manifest);
        return manifest;
    }

    /**
     * Parse manifest text.
     *
     * @param text   the YAML text of the manifest
     * @param source description of where the text came from, for messages
     * @return the parsed manifest
     * @throws FilesetException of kind {@code MANIFEST_UNPACK}
     */
    public static Manifest parse(String text, String source) {
        Map<String, Object> doc;
        try {
            doc = ConfigDocuments.parseYaml(text);
        } catch (YAMLException | IllegalArgumentException e) {
            throw unpackError(source, e.getMessage(), e);
        }

        return new Manifest(
                scalar(doc, Manifest.MODULE_VERSION, source),
                vars(doc, source),
                string(doc, Manifest.INGEST_PIPELINE, source),
                string(doc, Manifest.PROSPECTOR, source));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Map<String, Object>> vars(Map<String, Object> doc, String source) {
        Object raw = doc.get(Manifest.VAR);
        List<Map<String, Object>> vars = new ArrayList<>();
        if (raw == null) {
            return vars;
        }
        if (!(raw instanceof List<?> list)) {
            throw unpackError(source, "'" + Manifest.VAR + "' must be a list", null);
        }
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> entry)) {
                throw unpackError(source, "'" + Manifest.VAR + "' entry " + i + " must be a map", null);
            }
            vars.add(ConfigMerger.normalize(entry));
        }
        return vars;
    }

    private static String string(Map<String, Object> doc, String key, String source) {
        Object value = doc.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw unpackError(source, "'" + key + "' must be a string", null);
    }

    private static String scalar(Map<String, Object> doc, String key, String source) {
        Object value = doc.get(key);
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw unpackError(source, "'" + key + "' must be a scalar", null);
        }
        return value == null ? null : String.valueOf(value);
    }

    private static FilesetException unpackError(String source, String detail, Throwable cause) {
        return new FilesetException(FilesetException.Kind.MANIFEST_UNPACK,
                "Error unpacking manifest " + source + ": " + detail, cause);
    }
}
