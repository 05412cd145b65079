package com.filesetloader.registry;

import com.filesetloader.core.fileset.FilesetOptions;
import com.filesetloader.core.template.MissingKeyPolicy;
import com.filesetloader.core.vars.OperatingSystems;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed, immutable configuration of a registry load.
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@value #ENV_MODULES_PATH}: root directory of the modules (default
 * {@code module})</li>
 * <li>{@value #ENV_MODULES_CONFIG}: module selection YAML file; empty means
 * the classpath {@code modules.yml}</li>
 * <li>{@value #ENV_OS}: OS identifier used for variable overrides
 * (default: detected)</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for the command line, or the
 * {@link Builder} in tests. The builder validates at {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegistryConfig {

    public static final String ENV_MODULES_PATH = "FILESET_MODULES_PATH";
    public static final String ENV_MODULES_CONFIG = "FILESET_MODULES_CONFIG";
    public static final String ENV_OS = "FILESET_OS";

    private final Path modulesPath;
    private final String modulesConfigPath;
    private final String osName;

    private RegistryConfig(Builder b) {
        this.modulesPath = b.modulesPath;
        this.modulesConfigPath = b.modulesConfigPath;
        this.osName = b.osName;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration populated from environment variables
     * @throws IllegalArgumentException if a value is invalid
     */
    public static RegistryConfig fromEnvironment() {
        return new Builder()
                .modulesPath(Path.of(env(ENV_MODULES_PATH, "module")))
                .modulesConfigPath(env(ENV_MODULES_CONFIG, ""))
                .osName(env(ENV_OS, OperatingSystems.current()))
                .build();
    }

    /**
     * @return fileset options for the local host, this OS and strict
     *         templates
     */
    public FilesetOptions filesetOptions() {
        return FilesetOptions.builder()
                .osName(osName)
                .missingKeyPolicy(MissingKeyPolicy.STRICT)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getModulesPath() {
        return modulesPath;
    }

    public String getModulesConfigPath() {
        return modulesConfigPath;
    }

    public String getOsName() {
        return osName;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RegistryConfig}.
     */
    public static class Builder {
        private Path modulesPath = Path.of("module");
        private String modulesConfigPath = "";
        private String osName = OperatingSystems.current();

        public Builder modulesPath(Path v) {
            this.modulesPath = v;
            return this;
        }

        public Builder modulesConfigPath(String v) {
            this.modulesConfigPath = v;
            return this;
        }

        public Builder osName(String v) {
            this.osName = v;
            return this;
        }

        /**
         * @return a validated {@link RegistryConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RegistryConfig build() {
            Objects.requireNonNull(modulesPath, "modulesPath required");
            if (modulesConfigPath == null) {
                modulesConfigPath = "";
            }
            if (osName == null || osName.isBlank()) {
                throw new IllegalArgumentException("osName must not be null or blank");
            }
            return new RegistryConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "RegistryConfig{" +
                "modulesPath=" + modulesPath +
                ", modulesConfigPath='" + modulesConfigPath + '\'' +
                ", osName='" + osName + '\'' +
                '}';
    }
}
