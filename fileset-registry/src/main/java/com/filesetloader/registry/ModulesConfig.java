package com.filesetloader.registry;

import com.filesetloader.core.model.ModuleConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO of the module selection YAML.
 *
 * <pre>
 * modules:
 *   - module: nginx
 *     filesets:
 *       access:
 *         var:
 *           paths: ["/srv/logs/access.log*"]
 *       error:
 *         enabled: false
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ModulesConfig {

    private List<ModuleConfig> modules = new ArrayList<>();

    /**
     * @return unmodifiable list of module configurations
     */
    public List<ModuleConfig> getModules() {
        return Collections.unmodifiableList(modules);
    }

    /**
     * Set the modules list (used by SnakeYAML during deserialization).
     */
    public void setModules(List<ModuleConfig> modules) {
        this.modules = modules != null ? new ArrayList<>(modules) : new ArrayList<>();
    }

    /**
     * Validate every module entry and reject duplicate module names.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        List<String> seen = new ArrayList<>();

        for (int i = 0; i < modules.size(); i++) {
            ModuleConfig module = modules.get(i);
            if (module == null) {
                errors.add("Module at index " + i + " is empty");
                continue;
            }
            try {
                module.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (seen.contains(module.getModule())) {
                errors.add("Module '" + module.getModule() + "' is configured more than once");
            }
            seen.add(module.getModule());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Modules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ModulesConfig{modules=" + modules + '}';
    }
}
