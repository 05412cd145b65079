package com.filesetloader.registry;

import com.filesetloader.core.FilesetException;
import com.filesetloader.core.config.ManifestLoader;
import com.filesetloader.core.fileset.Fileset;
import com.filesetloader.core.fileset.FilesetOptions;
import com.filesetloader.core.model.FilesetConfig;
import com.filesetloader.core.model.ModuleConfig;
import com.filesetloader.core.model.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The read filesets of every enabled module.
 *
 * <h3>Loading</h3>
 * <p>
 * For each enabled module, the fileset directories (sub-directories holding
 * a {@code manifest.yml}) are listed in name order. Every fileset named in
 * the module's {@code filesets} map must be one of them. Disabled filesets
 * are skipped; the others are constructed and read.
 * </p>
 *
 * <h3>Failure policy</h3>
 * <p>
 * Fail fast: the first failing fileset aborts the load with a
 * {@link FilesetException} of the same kind, naming module and fileset.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleRegistry.class);

    private final List<Fileset> filesets;

    private ModuleRegistry(List<Fileset> filesets) {
        this.filesets = Collections.unmodifiableList(filesets);
    }

    /**
     * Load a registry from a {@link RegistryConfig}: the module selection is
     * read through {@link ModulesConfigLoader#load(String)}.
     *
     * @param config registry settings; must not be {@code null}
     * @return the loaded registry
     */
    public static ModuleRegistry load(RegistryConfig config) {
        Objects.requireNonNull(config, "RegistryConfig must not be null");
        ModulesConfig modules = ModulesConfigLoader.load(config.getModulesConfigPath());
        return load(config.getModulesPath(), modules.getModules(), config.filesetOptions());
    }

    /**
     * @param modulesPath root directory holding one directory per module
     * @param modules     module configurations, in load order
     * @param options     host / OS / template settings shared by all filesets
     * @return the loaded registry
     * @throws FilesetException         on the first fileset failure
     * @throws IllegalArgumentException if a configured fileset does not exist
     */
    public static ModuleRegistry load(Path modulesPath, List<ModuleConfig> modules, FilesetOptions options) {
        Objects.requireNonNull(modulesPath, "Modules path must not be null");
        Objects.requireNonNull(modules, "Module configurations must not be null");
        Objects.requireNonNull(options, "FilesetOptions must not be null");

        List<Fileset> loaded = new ArrayList<>();
        for (ModuleConfig module : modules) {
            if (!module.isEnabled()) {
                LOG.info("Module {} is disabled, skipping", module.getModule());
                continue;
            }
            loaded.addAll(loadModule(modulesPath, module, options));
        }

        LOG.info("Loaded {} fileset(s) from {} module(s)", loaded.size(), modules.size());
        return new ModuleRegistry(loaded);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * @return the read filesets, in module / fileset order
     */
    public List<Fileset> getFilesets() {
        return filesets;
    }

    /**
     * Materialize every prospector configuration.
     *
     * @return one merged configuration per fileset, in registry order
     * @throws FilesetException on the first failure
     */
    public List<Map<String, Object>> getProspectorConfigs() {
        List<Map<String, Object>> configs = new ArrayList<>(filesets.size());
        for (Fileset fileset : filesets) {
            configs.add(withContext(fileset, fileset::getProspectorConfig));
        }
        return configs;
    }

    /**
     * Materialize every ingest pipeline.
     *
     * @return one pipeline per fileset, in registry order
     * @throws FilesetException on the first failure
     */
    public List<PipelineDefinition> getPipelines() {
        List<PipelineDefinition> pipelines = new ArrayList<>(filesets.size());
        for (Fileset fileset : filesets) {
            pipelines.add(withContext(fileset, fileset::getPipeline));
        }
        return pipelines;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Fileset> loadModule(Path modulesPath, ModuleConfig module, FilesetOptions options) {
        Path modulePath = modulesPath.resolve(module.getModule());
        if (!Files.isDirectory(modulePath)) {
            throw new FilesetException(FilesetException.Kind.MISSING_MODULE,
                    "Module " + module.getModule() + " (" + modulePath + ") doesn't exist.");
        }

        List<String> available = listFilesets(modulePath);
        for (String configured : module.getFilesets().keySet()) {
            if (!available.contains(configured)) {
                throw new IllegalArgumentException("Fileset " + configured + " is configured for module "
                        + module.getModule() + " but doesn't exist; available: " + available);
            }
        }

        List<Fileset> result = new ArrayList<>();
        for (String name : available) {
            FilesetConfig filesetConfig = module.filesetConfig(name);
            if (!filesetConfig.isEnabled()) {
                LOG.info("Fileset {}/{} is disabled, skipping", module.getModule(), name);
                continue;
            }
            Fileset fileset = new Fileset(modulesPath, name, module, filesetConfig, options);
            withContext(fileset, () -> {
                fileset.read();
                return null;
            });
            result.add(fileset);
        }
        return result;
    }

    private static List<String> listFilesets(Path modulePath) {
        try (Stream<Path> children = Files.list(modulePath)) {
            return children
                    .filter(p -> Files.isRegularFile(p.resolve(ManifestLoader.MANIFEST_FILE)))
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list filesets of " + modulePath, e);
        }
    }

    private interface Step<T> {
        T run();
    }

    private static <T> T withContext(Fileset fileset, Step<T> step) {
        try {
            return step.run();
        } catch (FilesetException e) {
            throw new FilesetException(e.getKind(),
                    "Error loading fileset " + fileset.getModuleName() + "/" + fileset.getName()
                            + ": " + e.getMessage(),
                    e);
        }
    }

    @Override
    public String toString() {
        return "ModuleRegistry{filesets=" + filesets + '}';
    }
}
