package com.filesetloader.registry;

import com.filesetloader.core.model.FilesetConfig;
import com.filesetloader.core.model.ModuleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link ModulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>An explicit file system path, usually taken from
 * {@link RegistryConfig#getModulesConfigPath()}</li>
 * <li>Otherwise the classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so a broken module
 * list fails before any fileset is touched.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModulesConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ModulesConfigLoader.class);

    /** Classpath fallback used when no file path is configured. */
    public static final String DEFAULT_RESOURCE = "modules.yml";

    private ModulesConfigLoader() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load from {@code path} when it is set, otherwise from the classpath.
     *
     * @param path file system path; may be {@code null} or blank
     * @return parsed and validated configuration
     */
    public static ModulesConfig load(String path) {
        if (path != null && !path.isBlank()) {
            LOG.info("Loading modules from file: {}", path);
            return fromFile(Path.of(path));
        }
        LOG.info("Loading modules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ModulesConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Modules file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return parseAndValidate(is);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Modules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read modules file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ModulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ModulesConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ModulesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);

        Constructor constructor = new Constructor(ModulesConfig.class, options);
        TypeDescription modulesType = new TypeDescription(ModulesConfig.class);
        modulesType.addPropertyParameters("modules", ModuleConfig.class);
        constructor.addTypeDescription(modulesType);
        TypeDescription moduleType = new TypeDescription(ModuleConfig.class);
        moduleType.addPropertyParameters("filesets", String.class, FilesetConfig.class);
        constructor.addTypeDescription(moduleType);

        ModulesConfig config = new Yaml(constructor).load(is);
        if (config == null || config.getModules().isEmpty()) {
            LOG.warn("No modules defined in configuration");
            config = new ModulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} module configuration(s)", config.getModules().size());
        return config;
    }
}
