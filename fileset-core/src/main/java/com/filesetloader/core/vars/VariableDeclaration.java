package com.filesetloader.core.vars;

import com.filesetloader.core.FilesetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a manifest's {@code var} list.
 *
 * <pre>
 * - name: paths
 *   default:
 *     - /var/log/nginx/access.log*
 *   os:
 *     darwin:
 *       - /usr/local/var/log/nginx/access.log*
 * </pre>
 *
 * @since 1.0.0
 */
public final class VariableDeclaration {

    private static final Logger LOG = LoggerFactory.getLogger(VariableDeclaration.class);

    public static final String NAME = "name";
    public static final String DEFAULT = "default";
    public static final String OS = "os";

    private final String name;
    private final VarValue defaultValue;
    private final Map<String, VarValue> osOverrides;

    public VariableDeclaration(String name, VarValue defaultValue, Map<String, VarValue> osOverrides) {
        this.name = Objects.requireNonNull(name, "Variable name must not be null");
        this.defaultValue = Objects.requireNonNull(defaultValue, "Default value must not be null");
        this.osOverrides = osOverrides != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(osOverrides))
                : Collections.emptyMap();
    }

    /**
     * Build a declaration from its raw manifest form.
     *
     * @param index position in the manifest's {@code var} list, for messages
     * @param raw   the raw declaration map
     * @return the declaration
     * @throws FilesetException of kind {@code MISSING_VARIABLE_FIELD} if
     *                          {@code name} is not a string or
     *                          {@code default} is absent
     */
    public static VariableDeclaration fromMap(int index, Map<?, ?> raw) {
        if (raw == null || !(raw.get(NAME) instanceof String name)) {
            throw new FilesetException(FilesetException.Kind.MISSING_VARIABLE_FIELD,
                    "Variable at index " + index + " doesn't have a string '" + NAME + "' key");
        }
        if (!raw.containsKey(DEFAULT)) {
            throw new FilesetException(FilesetException.Kind.MISSING_VARIABLE_FIELD,
                    "Variable " + name + " (index " + index + ") doesn't have a '" + DEFAULT + "' key");
        }

        Map<String, VarValue> overrides = new LinkedHashMap<>();
        Object os = raw.get(OS);
        if (os instanceof Map<?, ?> osMap) {
            osMap.forEach((key, value) -> overrides.put(String.valueOf(key), VarValue.of(value)));
        } else if (os != null) {
            LOG.warn("Ignoring '{}' of variable {}: expected a map of OS overrides, got {}",
                    OS, name, os.getClass().getSimpleName());
        }
        return new VariableDeclaration(name, VarValue.of(raw.get(DEFAULT)), overrides);
    }

    /**
     * @param osName identifier of the current OS
     * @return the OS override for exactly {@code osName} if declared, the
     *         default otherwise
     */
    public VarValue valueFor(String osName) {
        if (osName != null && osOverrides.containsKey(osName)) {
            return osOverrides.get(osName);
        }
        return defaultValue;
    }

    public String getName() {
        return name;
    }

    public VarValue getDefaultValue() {
        return defaultValue;
    }

    public Map<String, VarValue> getOsOverrides() {
        return osOverrides;
    }

    @Override
    public String toString() {
        return "VariableDeclaration{" +
                "name='" + name + '\'' +
                ", default=" + defaultValue +
                ", os=" + osOverrides.keySet() +
                '}';
    }
}
