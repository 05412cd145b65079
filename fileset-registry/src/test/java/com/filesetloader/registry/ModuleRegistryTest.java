package com.filesetloader.registry;

import com.filesetloader.core.FilesetException;
import com.filesetloader.core.fileset.Fileset;
import com.filesetloader.core.fileset.FilesetOptions;
import com.filesetloader.core.model.FilesetConfig;
import com.filesetloader.core.model.ModuleConfig;
import com.filesetloader.core.model.PipelineDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ModuleRegistry} against the apache and system module
 * fixtures.
 */
class ModuleRegistryTest {

    private static final FilesetOptions OPTIONS = FilesetOptions.builder()
            .hostName("web01.example.com")
            .osName("linux")
            .build();

    private Path modulesPath;

    @BeforeEach
    void setUp() throws Exception {
        modulesPath = Paths.get(getClass().getResource("/module").toURI());
    }

    @Test
    @DisplayName("Should load every fileset with a manifest, in name order")
    void shouldLoadAllFilesets() {
        ModuleRegistry registry = ModuleRegistry.load(modulesPath,
                List.of(new ModuleConfig("apache"), new ModuleConfig("system")), OPTIONS);

        assertThat(registry.getFilesets())
                .extracting(fs -> fs.getModuleName() + "/" + fs.getName())
                .containsExactly("apache/access", "apache/error", "system/syslog");
        assertThat(registry.getFilesets()).allMatch(Fileset::isRead);
        assertThat(registry.getPipelines())
                .extracting(PipelineDefinition::getId)
                .containsExactly("apache-access-default", "apache-error-pipeline", "system-syslog-pipeline");
    }

    @Test
    @DisplayName("Should apply the module selection from YAML")
    void shouldApplyConfiguredOverrides() {
        ModulesConfig config = ModulesConfigLoader.fromClasspath("modules-test.yml");

        ModuleRegistry registry = ModuleRegistry.load(modulesPath, config.getModules(), OPTIONS);
        List<Map<String, Object>> prospectors = registry.getProspectorConfigs();

        assertThat(registry.getFilesets()).extracting(Fileset::getName).containsExactly("access", "syslog");
        assertThat(prospectors.get(0)).containsEntry("paths", List.of("/srv/apache/access.log"));
        assertThat(prospectors.get(0).get("fields")).isEqualTo(Map.of(
                "service", "apache-web01",
                "pipeline", "apache-access-default",
                "env", "test"));
        assertThat(prospectors.get(1)).containsEntry("paths", List.of("/var/log/messages*", "/var/log/syslog*"));
        assertThat(registry.getPipelines().get(1).getBody())
                .containsEntry("description", "Syslog on web01.example.com");
    }

    @Test
    @DisplayName("Should skip disabled modules")
    void shouldSkipDisabledModules() {
        ModuleConfig apache = new ModuleConfig("apache");
        apache.setEnabled(false);

        ModuleRegistry registry = ModuleRegistry.load(modulesPath,
                List.of(apache, new ModuleConfig("system")), OPTIONS);

        assertThat(registry.getFilesets()).extracting(Fileset::getModuleName).containsOnly("system");
    }

    @Test
    @DisplayName("Should fail when a configured fileset does not exist")
    void shouldFailOnUnknownFileset() {
        ModuleConfig system = new ModuleConfig("system");
        system.setFilesets(Map.of("auth", new FilesetConfig()));

        assertThatThrownBy(() -> ModuleRegistry.load(modulesPath, List.of(system), OPTIONS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Fileset auth")
                .hasMessageContaining("[syslog]");
    }

    @Test
    @DisplayName("Should fail when a module directory does not exist")
    void shouldFailOnMissingModule() {
        assertThatThrownBy(() -> ModuleRegistry.load(modulesPath, List.of(new ModuleConfig("redis")), OPTIONS))
                .isInstanceOf(FilesetException.class)
                .hasMessageContaining("Module redis")
                .extracting("kind").isEqualTo(FilesetException.Kind.MISSING_MODULE);
    }

    @Test
    @DisplayName("Should abort on the first broken fileset and name it")
    void shouldFailFast(@TempDir Path dir) throws Exception {
        Path fileset = Files.createDirectories(dir.resolve("broken").resolve("logs"));
        Files.writeString(fileset.resolve("manifest.yml"),
                "var:\n  - name: paths\n    default: \"{{.undefined}}\"\n"
                        + "ingest_pipeline: p.json\nprospector: p.yml\n");

        assertThatThrownBy(() -> ModuleRegistry.load(dir, List.of(new ModuleConfig("broken")), OPTIONS))
                .isInstanceOf(FilesetException.class)
                .hasMessageContaining("Error loading fileset broken/logs")
                .hasMessageContaining("Error resolving variables on paths")
                .extracting("kind").isEqualTo(FilesetException.Kind.TEMPLATE);
    }

    @Test
    @DisplayName("Should name the fileset when materialization fails")
    void shouldAddContextToMaterializationErrors(@TempDir Path dir) throws Exception {
        Path fileset = Files.createDirectories(dir.resolve("app").resolve("logs"));
        Files.writeString(fileset.resolve("manifest.yml"), "ingest_pipeline: p.json\nprospector: p.yml\n");

        ModuleRegistry registry = ModuleRegistry.load(dir, List.of(new ModuleConfig("app")), OPTIONS);

        assertThatThrownBy(registry::getProspectorConfigs)
                .isInstanceOf(FilesetException.class)
                .hasMessageContaining("Error loading fileset app/logs")
                .extracting("kind").isEqualTo(FilesetException.Kind.FILE_READ);
    }
}
