package com.filesetloader.core.fileset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesetloader.core.FilesetException;
import com.filesetloader.core.model.FilesetConfig;
import com.filesetloader.core.model.ModuleConfig;
import com.filesetloader.core.model.PipelineDefinition;
import com.filesetloader.core.template.MissingKeyPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Fileset} against the nginx module fixtures and
 * hand-built modules in a temporary directory.
 */
class FilesetTest {

    private static final FilesetOptions LINUX = FilesetOptions.builder()
            .hostName("web01.example.com")
            .osName("linux")
            .build();

    private Path modulesPath;

    @BeforeEach
    void setUp() throws Exception {
        modulesPath = Paths.get(getClass().getResource("/module").toURI());
    }

    private Fileset nginx(String fileset, FilesetConfig config, FilesetOptions options) {
        return new Fileset(modulesPath, fileset, new ModuleConfig("nginx"), config, options);
    }

    @Nested
    @DisplayName("nginx/access")
    class Access {

        @Test
        @DisplayName("Should resolve variables with builtins and the pipeline id")
        void shouldResolveVariables() {
            Fileset fs = nginx("access", null, LINUX);
            fs.read();

            assertThat(fs.getManifest().getModuleVersion()).isEqualTo("1.0");
            assertThat(fs.getVars().get("paths")).isEqualTo(List.of("/var/log/nginx/access.log*"));
            assertThat(fs.getVars().get("source_tag")).isEqualTo("web01-nginx");
            assertThat(fs.getVars().get("builtin"))
                    .isEqualTo(Map.of("hostname", "web01", "domain", "example.com"));
            assertThat(fs.getVars().get("beat")).isEqualTo(Map.of("pipeline_id", "nginx-access-default"));
            assertThat(fs.getPipelineId()).isEqualTo("nginx-access-default");
        }

        @Test
        @DisplayName("Should render and parse the prospector configuration")
        void shouldMaterializeProspector() {
            Fileset fs = nginx("access", null, LINUX);
            fs.read();

            Map<String, Object> config = fs.getProspectorConfig();

            assertThat(config).containsEntry("input_type", "log")
                    .containsEntry("paths", List.of("/var/log/nginx/access.log*"))
                    .containsEntry("exclude_files", List.of(".gz$"));
            assertThat(config.get("fields")).isEqualTo(Map.of(
                    "source_tag", "web01-nginx",
                    "pipeline_id", "nginx-access-default"));
        }

        @Test
        @DisplayName("Should pick the OS-specific default")
        void shouldApplyOsOverride() {
            FilesetOptions darwin = FilesetOptions.builder().hostName("mac").osName("darwin").build();
            Fileset fs = nginx("access", null, darwin);
            fs.read();

            assertThat(fs.getVars().get("paths")).isEqualTo(List.of("/usr/local/var/log/nginx/access.log*"));
            assertThat(fs.getVars().get("source_tag")).isEqualTo("mac-nginx");
        }

        @Test
        @DisplayName("Should apply variable and prospector overrides from the fileset config")
        void shouldApplyUserOverrides() {
            FilesetConfig config = new FilesetConfig();
            config.setVar(Map.of("paths", List.of("/srv/nginx/access.log"), "pipeline", "custom"));
            config.setProspector(Map.of("fields.env", "prod", "close_eof", true));

            Fileset fs = nginx("access", config, LINUX);
            fs.read();
            Map<String, Object> prospector = fs.getProspectorConfig();

            assertThat(fs.getPipelineId()).isEqualTo("nginx-access-custom");
            assertThat(prospector).containsEntry("paths", List.of("/srv/nginx/access.log"))
                    .containsEntry("close_eof", true);
            assertThat(prospector.get("fields")).isEqualTo(Map.of(
                    "source_tag", "web01-nginx",
                    "pipeline_id", "nginx-access-custom",
                    "env", "prod"));
        }

        @Test
        @DisplayName("Should template the ingest pipeline and keep escaped delimiters")
        void shouldMaterializePipeline() {
            Fileset fs = nginx("access", null, LINUX);
            fs.read();

            PipelineDefinition pipeline = fs.getPipeline();

            assertThat(pipeline.getId()).isEqualTo("nginx-access-default");
            assertThat(pipeline.getBody())
                    .containsEntry("description", "Pipeline for parsing Nginx access logs on web01");
            List<?> onFailure = (List<?>) pipeline.getBody().get("on_failure");
            Map<?, ?> set = (Map<?, ?>) ((Map<?, ?>) onFailure.get(0)).get("set");
            assertThat(set.get("value")).isEqualTo("{{ _ingest.on_failure_message }}");
        }

        @Test
        @DisplayName("Should produce identical results on repeated calls")
        void shouldBeIdempotent() throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            Fileset fs = nginx("access", null, LINUX);
            fs.read();

            String first = mapper.writeValueAsString(fs.getProspectorConfig());
            String firstPipeline = mapper.writeValueAsString(fs.getPipeline().getBody());
            fs.read();

            assertThat(mapper.writeValueAsString(fs.getProspectorConfig())).isEqualTo(first);
            assertThat(mapper.writeValueAsString(fs.getPipeline().getBody())).isEqualTo(firstPipeline);
        }
    }

    @Nested
    @DisplayName("nginx/error")
    class ErrorLog {

        @Test
        @DisplayName("Should honour trim markers and conditionals in the prospector template")
        void shouldMaterializeProspector() {
            Fileset fs = nginx("error", null, LINUX);
            fs.read();

            Map<String, Object> config = fs.getProspectorConfig();

            assertThat(config).containsEntry("paths", List.of("/var/log/nginx/error.log*"));
            assertThat(config.get("multiline")).isEqualTo(Map.of(
                    "pattern", "^\\d{4}/\\d{2}/\\d{2}",
                    "negate", true,
                    "match", "after"));
            assertThat(fs.getPipeline().getId()).isEqualTo("nginx-error-pipeline");
        }

        @Test
        @DisplayName("Should drop the multiline block when the variable is overridden to false")
        void shouldSkipConditionalBlock() {
            FilesetConfig config = new FilesetConfig();
            config.setVar(Map.of("multiline", false));
            Fileset fs = nginx("error", config, LINUX);
            fs.read();

            assertThat(fs.getProspectorConfig()).doesNotContainKey("multiline");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Should fail construction when the module directory is missing")
        void shouldFailOnMissingModule() {
            assertThatThrownBy(() -> new Fileset(dir, "access", new ModuleConfig("nope"), null, LINUX))
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("Module nope")
                    .hasMessageContaining("doesn't exist")
                    .extracting("kind").isEqualTo(FilesetException.Kind.MISSING_MODULE);
        }

        @Test
        @DisplayName("Should fail read when the fileset has no manifest")
        void shouldFailOnMissingManifest() throws Exception {
            Files.createDirectories(dir.resolve("app"));
            Fileset fs = new Fileset(dir, "ghost", new ModuleConfig("app"), null, LINUX);

            assertThatThrownBy(fs::read)
                    .isInstanceOf(FilesetException.class)
                    .extracting("kind").isEqualTo(FilesetException.Kind.MANIFEST_READ);
            assertThat(fs.isRead()).isFalse();
        }

        @Test
        @DisplayName("Should refuse accessors before read")
        void shouldRequireRead() {
            Fileset fs = nginx("access", null, LINUX);

            assertThatThrownBy(fs::getProspectorConfig)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("call read() first");
            assertThatThrownBy(fs::getVars).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should report a missing prospector file")
        void shouldFailOnMissingProspectorFile() throws Exception {
            writeFileset("manifest.yml", "prospector: config/missing.yml\ningest_pipeline: ingest/p.json\n");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThatThrownBy(fs::getProspectorConfig)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("missing.yml")
                    .extracting("kind").isEqualTo(FilesetException.Kind.FILE_READ);
        }

        @Test
        @DisplayName("Should report a prospector that is not valid YAML after rendering")
        void shouldFailOnUnparsableProspector() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\ningest_pipeline: p.json\n");
            writeFileset("p.yml", "paths: [{{.builtin.hostname}}\n");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThatThrownBy(fs::getProspectorConfig)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("Error parsing YAML file")
                    .extracting("kind").isEqualTo(FilesetException.Kind.CONFIG_PARSE);
        }

        @Test
        @DisplayName("Should report a template referencing an unknown variable")
        void shouldFailOnUnknownVariable() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\ningest_pipeline: p.json\n");
            writeFileset("p.yml", "paths: [{{.nope}}]\n");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThatThrownBy(fs::getProspectorConfig)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("Error interpreting the template")
                    .hasMessageContaining("nope")
                    .extracting("kind").isEqualTo(FilesetException.Kind.TEMPLATE);
        }

        @Test
        @DisplayName("Should render unknown variables as empty under the lenient policy")
        void shouldRenderUnknownVariableWhenLenient() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\ningest_pipeline: p.json\n");
            writeFileset("p.yml", "name: \"{{.nope}}\"\n");
            FilesetOptions lenient = FilesetOptions.builder().hostName("h").osName("linux")
                    .missingKeyPolicy(MissingKeyPolicy.LENIENT).build();
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, lenient);
            fs.read();

            assertThat(fs.getProspectorConfig()).containsEntry("name", "");
        }

        @Test
        @DisplayName("Should fail when the ingest pipeline path is missing")
        void shouldFailWithoutPipelinePath() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\n");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);

            assertThatThrownBy(fs::read)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("'ingest_pipeline'")
                    .extracting("kind").isEqualTo(FilesetException.Kind.MANIFEST_UNPACK);
        }

        @Test
        @DisplayName("Should read an absolute-looking prospector path from under the fileset directory")
        void shouldKeepAbsolutePathUnderFileset() throws Exception {
            writeFileset("manifest.yml", "prospector: /config/x.yml\ningest_pipeline: p.json\n");
            writeFileset("config/x.yml", "input_type: log\n");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThat(fs.getProspectorConfig()).containsEntry("input_type", "log");
        }

        @Test
        @DisplayName("Should report a pipeline file holding JSON null as a parse error")
        void shouldFailOnNullPipeline() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\ningest_pipeline: p.json\n");
            writeFileset("p.json", "null");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThatThrownBy(fs::getPipeline)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("Error parsing JSON file")
                    .hasMessageContaining("p.json")
                    .extracting("kind").isEqualTo(FilesetException.Kind.CONFIG_PARSE);
        }

        @Test
        @DisplayName("Should report a malformed pipeline file as a parse error")
        void shouldFailOnMalformedPipeline() throws Exception {
            writeFileset("manifest.yml", "prospector: p.yml\ningest_pipeline: p.json\n");
            writeFileset("p.json", "{\"description\": \"unterminated\"");
            Fileset fs = new Fileset(dir, "fs", new ModuleConfig("app"), null, LINUX);
            fs.read();

            assertThatThrownBy(fs::getPipeline)
                    .isInstanceOf(FilesetException.class)
                    .hasMessageContaining("p.json")
                    .extracting("kind").isEqualTo(FilesetException.Kind.CONFIG_PARSE);
        }

        private void writeFileset(String file, String contents) throws Exception {
            Path target = dir.resolve("app").resolve("fs").resolve(file);
            Files.createDirectories(target.getParent());
            Files.writeString(target, contents, StandardCharsets.UTF_8);
        }
    }
}
