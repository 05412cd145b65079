package com.filesetloader.core.fileset;

import com.filesetloader.core.FilesetException;
import com.filesetloader.core.config.ManifestLoader;
import com.filesetloader.core.model.FilesetConfig;
import com.filesetloader.core.model.Manifest;
import com.filesetloader.core.model.ModuleConfig;
import com.filesetloader.core.model.PipelineDefinition;
import com.filesetloader.core.template.TemplateEngine;
import com.filesetloader.core.vars.VariableEnvironment;
import com.filesetloader.core.vars.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One fileset of a module: its manifest, resolved variables, prospector
 * configuration and ingest pipeline.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>Construct; fails if the module directory does not exist.</li>
 * <li>{@link #read()} loads {@code <module>/<fileset>/manifest.yml},
 * resolves the variables and adds {@code beat.pipeline_id}.</li>
 * <li>{@link #getProspectorConfig()} and {@link #getPipeline()} materialize
 * the referenced files; each call reads them from disk again.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Separate instances share no state and may be loaded
 * concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class Fileset {

    private static final Logger LOG = LoggerFactory.getLogger(Fileset.class);

    private final String name;
    private final ModuleConfig moduleConfig;
    private final FilesetConfig filesetConfig;
    private final Path modulePath;
    private final FilesetOptions options;
    private final VariableResolver resolver;
    private final ConfigMaterializer materializer;

    private Manifest manifest;
    private VariableEnvironment vars;

    public Fileset(Path modulesPath, String name, ModuleConfig moduleConfig, FilesetConfig filesetConfig) {
        this(modulesPath, name, moduleConfig, filesetConfig, FilesetOptions.defaults());
    }

    /**
     * @param modulesPath   root directory holding one directory per module
     * @param name          fileset name, the directory under the module
     * @param moduleConfig  configuration of the owning module
     * @param filesetConfig user settings of this fileset
     * @param options       host / OS / template settings
     * @throws FilesetException of kind {@code MISSING_MODULE} if
     *                          {@code <modulesPath>/<module>} does not exist
     */
    public Fileset(Path modulesPath, String name, ModuleConfig moduleConfig, FilesetConfig filesetConfig,
            FilesetOptions options) {
        Objects.requireNonNull(modulesPath, "Modules path must not be null");
        this.name = Objects.requireNonNull(name, "Fileset name must not be null");
        this.moduleConfig = Objects.requireNonNull(moduleConfig, "ModuleConfig must not be null");
        this.filesetConfig = filesetConfig != null ? filesetConfig : new FilesetConfig();
        this.options = Objects.requireNonNull(options, "FilesetOptions must not be null");
        Objects.requireNonNull(moduleConfig.getModule(), "Module name must not be null");

        this.modulePath = modulesPath.resolve(moduleConfig.getModule());
        if (!Files.exists(modulePath)) {
            throw new FilesetException(FilesetException.Kind.MISSING_MODULE,
                    "Module " + moduleConfig.getModule() + " (" + modulePath + ") doesn't exist.");
        }

        TemplateEngine engine = new TemplateEngine(options.getMissingKeyPolicy());
        this.resolver = new VariableResolver(options.getHostFacts(), engine);
        this.materializer = new ConfigMaterializer(engine);
    }

    /**
     * Read the manifest and resolve the variables.
     *
     * <p>
     * On failure the fileset keeps its previous state; nothing partially
     * resolved is retained.
     * </p>
     *
     * @throws FilesetException on any manifest, variable or template error
     */
    public void read() {
        Manifest loaded = ManifestLoader.fromFilesetDir(getFilesetDir());
        VariableEnvironment env = resolver.resolve(loaded.getVars(), options.getOsName(),
                filesetConfig.getVar());

        String pipelineId = pipelineId(loaded, env);
        Map<String, Object> beat = new LinkedHashMap<>();
        beat.put(VariableEnvironment.PIPELINE_ID, pipelineId);
        env.put(VariableEnvironment.BEAT, Collections.unmodifiableMap(beat));

        this.manifest = loaded;
        this.vars = env;
        LOG.info("Loaded fileset {}/{} (module_version {}) with {} variable(s), pipeline {}",
                getModuleName(), name, loaded.getModuleVersion(), loaded.getVars().size(), pipelineId);
    }

    /**
     * Materialize the prospector configuration, with the fileset's
     * {@code prospector} overrides merged in.
     *
     * @return the merged configuration
     * @throws IllegalStateException if {@link #read()} has not succeeded
     * @throws FilesetException      on template, read, parse or merge errors
     */
    public Map<String, Object> getProspectorConfig() {
        requireRead();
        String template = requireTemplate(manifest.getProspector(), Manifest.PROSPECTOR);
        Map<String, Object> config = materializer.materialize(getFilesetDir(), template,
                ConfigMaterializer.Format.YAML, vars, filesetConfig.getProspector());
        LOG.debug("Merged prospector config for fileset {}/{}: {}", getModuleName(), name, config);
        return config;
    }

    /**
     * @return the ingest pipeline ID, {@code <module>-<fileset>-<file>}
     * @throws IllegalStateException if {@link #read()} has not succeeded
     */
    public String getPipelineId() {
        requireRead();
        return pipelineId(manifest, vars);
    }

    /**
     * Materialize the ingest pipeline.
     *
     * @return the pipeline ID and parsed JSON body
     * @throws IllegalStateException if {@link #read()} has not succeeded
     * @throws FilesetException      on template, read or parse errors
     */
    public PipelineDefinition getPipeline() {
        requireRead();
        String template = requireTemplate(manifest.getIngestPipeline(), Manifest.INGEST_PIPELINE);
        String path = materializer.expandPath(template, vars, "ingest pipeline");
        Map<String, Object> body = materializer.materialize(getFilesetDir(), template,
                ConfigMaterializer.Format.JSON, vars, null);
        return new PipelineDefinition(PipelineIds.format(getModuleName(), name, path), body);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getModuleName() {
        return moduleConfig.getModule();
    }

    public Path getModulePath() {
        return modulePath;
    }

    public Path getFilesetDir() {
        return modulePath.resolve(name);
    }

    public FilesetConfig getFilesetConfig() {
        return filesetConfig;
    }

    /**
     * @return the manifest
     * @throws IllegalStateException if {@link #read()} has not succeeded
     */
    public Manifest getManifest() {
        requireRead();
        return manifest;
    }

    /**
     * @return the resolved variables
     * @throws IllegalStateException if {@link #read()} has not succeeded
     */
    public VariableEnvironment getVars() {
        requireRead();
        return vars;
    }

    public boolean isRead() {
        return vars != null;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String pipelineId(Manifest m, VariableEnvironment env) {
        String template = requireTemplate(m.getIngestPipeline(), Manifest.INGEST_PIPELINE);
        return PipelineIds.format(getModuleName(), name, materializer.expandPath(template, env, "ingest pipeline"));
    }

    private String requireTemplate(String template, String key) {
        if (template == null || template.isBlank()) {
            throw new FilesetException(FilesetException.Kind.MANIFEST_UNPACK,
                    "Manifest of fileset " + getModuleName() + "/" + name + " has no '" + key + "' key");
        }
        return template;
    }

    private void requireRead() {
        if (vars == null) {
            throw new IllegalStateException(
                    "Fileset " + getModuleName() + "/" + name + " has not been read; call read() first");
        }
    }

    @Override
    public String toString() {
        return "Fileset{" + getModuleName() + "/" + name + ", read=" + isRead() + '}';
    }
}
