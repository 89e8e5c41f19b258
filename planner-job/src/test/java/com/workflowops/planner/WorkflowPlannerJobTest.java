package com.workflowops.planner;

import com.workflowops.core.config.ConfigLoader;
import com.workflowops.core.config.WorkflowConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WorkflowPlannerJob}.
 */
class WorkflowPlannerJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-01T02:00:00Z"), ZoneId.of("Europe/London"));

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private PlannerConfig.Builder config() {
        return new PlannerConfig.Builder()
                .stateDir(workDir.resolve("state").toString())
                .clusterConfigDir(workDir.toString());
    }

    private int run(PlannerConfig config) {
        stdout.reset();
        return WorkflowPlannerJob.run(config, new PrintStream(stdout, true, StandardCharsets.UTF_8), CLOCK);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should plan creation of the bundled descriptor without recording state")
    void shouldPlanWithoutRecording() {
        int status = run(config().build());

        assertThat(status).isZero();
        assertThat(output()).contains("\"action\" : \"CREATE\"", "\"jobKey\" : \"workflow-api\"",
                "\"name\" : \"test-api-job\"", "{{secrets/scope/test-private-key}}");
        assertThat(workDir.resolve("state/current_state.json")).doesNotExist();
    }

    @Test
    @DisplayName("Should record a snapshot and find no changes on the next run")
    void shouldRecordAndStayUnchanged() throws IOException {
        PlannerConfig config = config().recordState(true).build();

        assertThat(run(config)).isZero();
        String state = Files.readString(workDir.resolve("state/current_state.json"), StandardCharsets.UTF_8);
        assertThat(state).contains("\"version\" : \"1.0\"", "\"timestamp\" : \"2024-07-01 03:00:00\"");

        assertThat(run(config)).isZero();
        assertThat(output()).contains("\"action\" : \"UNCHANGED\"");
        StateStore store = new StateStore(workDir.resolve("state"), JsonMappers.create());
        assertThat(store.listVersions()).containsExactly("1.0");
    }

    @Test
    @DisplayName("Should exit with status 1 for an invalid descriptor")
    void shouldFailForInvalidDescriptor() throws IOException {
        Path descriptor = workDir.resolve("job_config.yaml");
        Files.writeString(descriptor, """
                workflow-api:
                  job_name: api
                  schedule: "00 00 03 * * ?"
                  tasks:
                    - task_name: api2
                      depends_on: [missing-task]
                """);

        assertThat(run(config().configPath(descriptor.toString()).build())).isEqualTo(1);
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("Should exit with status 1 when a task cannot be converted")
    void shouldFailForIncompleteTask() throws IOException {
        Path descriptor = workDir.resolve("job_config.yaml");
        Files.writeString(descriptor, """
                workflow-api:
                  job_name: api
                  schedule: "00 00 03 * * ?"
                  tasks:
                    - task_name: api
                      tasktype: sql
                """);

        assertThat(run(config().configPath(descriptor.toString()).build())).isEqualTo(1);
    }

    @Test
    @DisplayName("Should compute each job's next run in the clock's zone")
    void shouldComputeNextRuns() {
        WorkflowConfig descriptor = new ConfigLoader().load("""
                workflow-daily:
                  job_name: daily
                  schedule: "00 00 03 * * ?"
                  tasks:
                    - task_name: run
                workflow-expired:
                  job_name: expired
                  schedule: "0 0 12 1 1 ? 2020"
                  tasks:
                    - task_name: run
                """);

        assertThat(WorkflowPlannerJob.nextRuns(descriptor, CLOCK))
                .containsOnlyKeys("workflow-daily")
                .containsEntry("workflow-daily", Instant.parse("2024-07-02T02:00:00Z"));
    }
}
