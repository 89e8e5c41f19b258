package com.workflowops.planner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PlannerConfig}.
 */
class PlannerConfigTest {

    @Test
    @DisplayName("Should apply deployment defaults")
    void shouldApplyDefaults() {
        PlannerConfig config = new PlannerConfig.Builder().build();

        assertThat(config.getConfigPath()).isEmpty();
        assertThat(config.getJobKeyPrefix()).isEqualTo("workflow");
        assertThat(config.getStateDir()).isEqualTo("state");
        assertThat(config.isRecordState()).isFalse();
        assertThat(config.getPayloadSettings().getTimezoneId()).isEqualTo("Europe/London");
        assertThat(config.getPayloadSettings().getAclGroupName()).isEqualTo("Uk");
    }

    @Test
    @DisplayName("Should pass payload values through to the payload settings")
    void shouldBuildPayloadSettings() {
        PlannerConfig config = new PlannerConfig.Builder()
                .timezoneId("UTC")
                .maxConcurrentRuns(3)
                .sqlWarehouseId("wh-1")
                .secretScope("gcp")
                .build();

        assertThat(config.getPayloadSettings().getTimezoneId()).isEqualTo("UTC");
        assertThat(config.getPayloadSettings().getMaxConcurrentRuns()).isEqualTo(3);
        assertThat(config.getPayloadSettings().getSqlWarehouseId()).isEqualTo("wh-1");
        assertThat(config.getPayloadSettings().getSecretScope()).isEqualTo("gcp");
    }

    @Test
    @DisplayName("Should reject an unknown time zone")
    void shouldRejectUnknownZone() {
        assertThatThrownBy(() -> new PlannerConfig.Builder().timezoneId("Mars/Olympus").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timezoneId");
    }

    @Test
    @DisplayName("Should reject fewer than one concurrent run")
    void shouldRejectZeroRuns() {
        assertThatThrownBy(() -> new PlannerConfig.Builder().maxConcurrentRuns(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConcurrentRuns");
    }

    @Test
    @DisplayName("Should reject a blank state directory")
    void shouldRejectBlankStateDir() {
        assertThatThrownBy(() -> new PlannerConfig.Builder().stateDir(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stateDir");
    }

    @Test
    @DisplayName("Should parse boolean flags strictly")
    void shouldParseBooleans() {
        assertThat(PlannerConfig.parseBoolean("WORKFLOW_RECORD_STATE", "TRUE")).isTrue();
        assertThat(PlannerConfig.parseBoolean("WORKFLOW_RECORD_STATE", "false")).isFalse();
        assertThatThrownBy(() -> PlannerConfig.parseBoolean("WORKFLOW_RECORD_STATE", "yes"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WORKFLOW_RECORD_STATE");
    }
}
