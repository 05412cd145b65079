package com.filesetloader.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User configuration of one module: its name, whether it is enabled, and
 * per-fileset settings.
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class ModuleConfig {

    /** Module name, also the directory name under the modules root. */
    private String module;

    private boolean enabled = true;

    /** Per-fileset settings, keyed by fileset name. */
    private Map<String, FilesetConfig> filesets = new LinkedHashMap<>();

    public ModuleConfig() {
    }

    public ModuleConfig(String module) {
        this.module = module;
    }

    /**
     * @throws IllegalStateException if the module name is missing or a
     *                               fileset entry is empty
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (module == null || module.isBlank()) {
            errors.add("Module 'module' name is required");
        }
        filesets.forEach((name, cfg) -> {
            if (cfg == null) {
                errors.add("Fileset '" + name + "' of module '" + module + "' has no settings");
            }
        });
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid ModuleConfig: " + String.join("; ", errors));
        }
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return unmodifiable per-fileset settings
     */
    public Map<String, FilesetConfig> getFilesets() {
        return Collections.unmodifiableMap(filesets);
    }

    public void setFilesets(Map<String, FilesetConfig> filesets) {
        this.filesets = filesets != null ? new LinkedHashMap<>(filesets) : new LinkedHashMap<>();
    }

    /**
     * @param name fileset name
     * @return the configured settings, or defaults if the fileset is not
     *         mentioned
     */
    public FilesetConfig filesetConfig(String name) {
        FilesetConfig cfg = filesets.get(name);
        return cfg != null ? cfg : new FilesetConfig();
    }

    @Override
    public String toString() {
        return "ModuleConfig{" +
                "module='" + module + '\'' +
                ", enabled=" + enabled +
                ", filesets=" + filesets.keySet() +
                '}';
    }
}
