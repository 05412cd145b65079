package com.filesetloader.core.vars;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OperatingSystems}.
 */
class OperatingSystemsTest {

    @Test
    @DisplayName("Should map os.name values to short identifiers")
    void shouldNormalizeKnownSystems() {
        assertThat(OperatingSystems.normalize("Linux")).isEqualTo("linux");
        assertThat(OperatingSystems.normalize("Mac OS X")).isEqualTo("darwin");
        assertThat(OperatingSystems.normalize("Windows Server 2019")).isEqualTo("windows");
        assertThat(OperatingSystems.normalize("FreeBSD")).isEqualTo("freebsd");
        assertThat(OperatingSystems.normalize("SunOS")).isEqualTo("solaris");
    }

    @Test
    @DisplayName("Should lower-case and strip spaces from unknown systems")
    void shouldFallBackForUnknownSystems() {
        assertThat(OperatingSystems.normalize("Plan 9")).isEqualTo("plan9");
        assertThat(OperatingSystems.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("Should detect the current system")
    void shouldDetectCurrentSystem() {
        assertThat(OperatingSystems.current()).isNotBlank().doesNotContain(" ");
    }
}
