package com.filesetloader.core.fileset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineIds}.
 */
class PipelineIdsTest {

    @Test
    @DisplayName("Should join module, fileset and file name without extension")
    void shouldFormatPipelineId() {
        assertThat(PipelineIds.format("nginx", "access", "ingest/default.json")).isEqualTo("nginx-access-default");
        assertThat(PipelineIds.format("nginx", "access", "access.json")).isEqualTo("nginx-access-access");
        assertThat(PipelineIds.format("mysql", "slowlog", "ingest/pipeline")).isEqualTo("mysql-slowlog-pipeline");
    }

    @Test
    @DisplayName("Should strip only the last extension")
    void shouldRemoveLastExtension() {
        assertThat(PipelineIds.removeExt("a.b.c")).isEqualTo("a.b");
        assertThat(PipelineIds.removeExt("noext")).isEqualTo("noext");
        assertThat(PipelineIds.removeExt(".hidden")).isEmpty();
        assertThat(PipelineIds.removeExt("dir.d/file")).isEqualTo("dir.d/file");
    }

    @Test
    @DisplayName("Should take the last path element, ignoring trailing separators")
    void shouldTakeBaseName() {
        assertThat(PipelineIds.baseName("ingest/default.json")).isEqualTo("default.json");
        assertThat(PipelineIds.baseName("ingest/")).isEqualTo("ingest");
        assertThat(PipelineIds.baseName("")).isEqualTo(".");
        assertThat(PipelineIds.baseName("//")).isEqualTo("/");
    }
}
