package com.filesetloader.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesetloader.core.fileset.FilesetOptions;
import com.filesetloader.core.model.ModuleConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the JSON document printed by {@link FilesetLoaderApp}.
 */
class FilesetLoaderAppTest {

    @Test
    @DisplayName("Should print prospectors as a list and pipelines keyed by id")
    void shouldRenderJsonDocument() throws Exception {
        Path modulesPath = Paths.get(getClass().getResource("/module").toURI());
        FilesetOptions options = FilesetOptions.builder().hostName("web01").osName("darwin").build();
        ModuleRegistry registry = ModuleRegistry.load(modulesPath, List.of(new ModuleConfig("system")), options);

        JsonNode json = new ObjectMapper().readTree(FilesetLoaderApp.toJson(registry));

        assertThat(json.get("prospectors").size()).isEqualTo(1);
        assertThat(json.get("prospectors").get(0).get("paths").get(0).asText()).isEqualTo("/var/log/system.log*");
        assertThat(json.get("pipelines").has("system-syslog-pipeline")).isTrue();
        assertThat(json.get("pipelines").get("system-syslog-pipeline").get("description").asText())
                .isEqualTo("Syslog on web01.");
    }
}
