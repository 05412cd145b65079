package com.filesetloader.registry;

import com.filesetloader.core.template.MissingKeyPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RegistryConfig}.
 */
class RegistryConfigTest {

    @Test
    @DisplayName("Should use defaults when nothing is set")
    void shouldUseDefaults() {
        RegistryConfig config = new RegistryConfig.Builder().build();

        assertThat(config.getModulesPath()).isEqualTo(Path.of("module"));
        assertThat(config.getModulesConfigPath()).isEmpty();
        assertThat(config.getOsName()).isNotBlank();
    }

    @Test
    @DisplayName("Should carry the OS name into the fileset options")
    void shouldBuildFilesetOptions() {
        RegistryConfig config = new RegistryConfig.Builder().osName("windows").build();

        assertThat(config.filesetOptions().getOsName()).isEqualTo("windows");
        assertThat(config.filesetOptions().getMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.STRICT);
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldValidate() {
        assertThatThrownBy(() -> new RegistryConfig.Builder().osName(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("osName");
        assertThatThrownBy(() -> new RegistryConfig.Builder().modulesPath(null).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("modulesPath");
    }

    @Test
    @DisplayName("Should build from the environment")
    void shouldBuildFromEnvironment() {
        RegistryConfig config = RegistryConfig.fromEnvironment();

        assertThat(config.getModulesPath()).isNotNull();
        assertThat(config.getOsName()).isNotBlank();
    }
}
