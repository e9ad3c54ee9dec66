package de.mirkosertic.mcp.reranklearn.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Version is the Maven version or 'dev'")
    void versionIsFilteredOrDev() {
        assertThat(BuildInfo.getVersion())
                .isNotEmpty()
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
    }

    @Test
    @DisplayName("Timestamp is ISO formatted or 'unknown'")
    void timestampIsFilteredOrUnknown() {
        assertThat(BuildInfo.getBuildTimestamp())
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }
}
