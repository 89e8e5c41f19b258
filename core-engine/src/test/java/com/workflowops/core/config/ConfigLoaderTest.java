package com.workflowops.core.config;

import com.workflowops.core.model.JobDefinition;
import com.workflowops.core.model.LibraryRef;
import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    private static final String DEFAULTS = """
            default-settings: &default_settings
              tasktype: notebook
              cluster_config_path: clusters/small.json
              email_on_failure:
                - alerts@example.com
              gcp_connection:
                project_id: shared-project
                service_account_email: runner@example.com
            """;

    private final ConfigLoader loader = new ConfigLoader();

    private static String job(String tasks) {
        return DEFAULTS + """
                workflow-api:
                  job_name: api_ingest
                  schedule: "00 00 03 * * ?"
                  tasks:
                """ + tasks;
    }

    private ConfigValidationException rejected(String source) {
        return catchThrowableOfType(() -> loader.load(source), ConfigValidationException.class);
    }

    @Test
    @DisplayName("Should order a task after the task it depends on")
    void shouldOrderDependencyFirst() {
        JobDefinition job = loader.loadJob(job("""
                    - <<: *default_settings
                      task_name: api2
                      filepath: notebooks/api2
                      depends_on: [api]
                    - <<: *default_settings
                      task_name: api
                      filepath: notebooks/api
                """));

        assertThat(job.getKey()).isEqualTo("workflow-api");
        assertThat(job.getJobName()).isEqualTo("api_ingest");
        assertThat(job.getSchedule()).isEqualTo("00 00 03 * * ?");
        assertThat(job.getTasks()).extracting(TaskDefinition::getTaskName).containsExactly("api2", "api");
        assertThat(job.getExecutionOrder()).containsExactly("api", "api2");
    }

    @Test
    @DisplayName("Should apply anchored defaults to every task that merges them")
    void shouldApplyDefaults() {
        JobDefinition job = loader.loadJob(job("""
                    - <<: *default_settings
                      task_name: api
                      filepath: notebooks/api
                """));

        TaskDefinition task = job.getTask("api").orElseThrow();
        assertThat(task.getTaskType()).contains(TaskType.NOTEBOOK);
        assertThat(task.getClusterConfigPath()).contains("clusters/small.json");
        assertThat(task.getEmailOnFailure()).containsExactly("alerts@example.com");
        assertThat(task.getGcpConnection()).hasValueSatisfying(gcp -> {
            assertThat(gcp.getProjectId()).isEqualTo("shared-project");
            assertThat(gcp.getServiceAccountEmail()).isEqualTo("runner@example.com");
        });
    }

    @Test
    @DisplayName("Should merge a nested mapping key-wise with the defaults")
    void shouldMergeNestedMapping() {
        JobDefinition job = loader.loadJob(job("""
                    - <<: *default_settings
                      task_name: api
                      filepath: notebooks/api
                      gcp_connection:
                        project_id: local-project
                """));

        TaskDefinition task = job.getTask("api").orElseThrow();
        assertThat(task.getGcpConnection()).hasValueSatisfying(gcp -> {
            assertThat(gcp.getProjectId()).isEqualTo("local-project");
            assertThat(gcp.getServiceAccountEmail()).isEqualTo("runner@example.com");
        });
    }

    @Test
    @DisplayName("Should replace a defaulted list instead of appending to it")
    void shouldReplaceDefaultedList() {
        JobDefinition job = loader.loadJob(job("""
                    - <<: *default_settings
                      task_name: api
                      filepath: notebooks/api
                      email_on_failure:
                        - oncall@example.com
                """));

        assertThat(job.getTask("api").orElseThrow().getEmailOnFailure()).containsExactly("oncall@example.com");
    }

    @Test
    @DisplayName("Should accept a single dependency written as a scalar")
    void shouldAcceptScalarDependency() {
        JobDefinition job = loader.loadJob(job("""
                    - task_name: b
                      depends_on: a
                    - task_name: a
                """));

        assertThat(job.getTask("b").orElseThrow().getDependsOn()).containsExactly("a");
        assertThat(job.getExecutionOrder()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should allow the same task name in different jobs")
    void shouldAllowSameTaskNameAcrossJobs() {
        WorkflowConfig config = loader.load("""
                workflow-one:
                  job_name: one
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - task_name: extract
                workflow-two:
                  job_name: two
                  schedule: "0 0 2 * * ?"
                  tasks:
                    - task_name: extract
                """);

        assertThat(config.getJobKeys()).containsExactly("workflow-one", "workflow-two");
        assertThat(config.findByJobName("two")).isPresent();
    }

    @Test
    @DisplayName("Should ignore top-level entries without the job key prefix")
    void shouldIgnoreNonJobEntries() {
        WorkflowConfig config = loader.load(job("""
                    - task_name: api
                """));

        assertThat(config.getJobKeys()).containsExactly("workflow-api");
    }

    @Test
    @DisplayName("Should honour a custom job key prefix")
    void shouldHonourCustomPrefix() {
        WorkflowConfig config = new ConfigLoader("job-").load("""
                job-nightly:
                  job_name: nightly
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - task_name: run
                workflow-ignored: 42
                """);

        assertThat(config.getJobKeys()).containsExactly("job-nightly");
    }

    @Test
    @DisplayName("Should return an empty config when no job is declared")
    void shouldReturnEmptyConfig() {
        assertThat(loader.load(DEFAULTS).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should produce equal results for the same input")
    void shouldBeIdempotent() {
        String source = job("""
                    - <<: *default_settings
                      task_name: api2
                      depends_on: [api]
                    - <<: *default_settings
                      task_name: api
                """);

        assertThat(loader.load(source)).isEqualTo(loader.load(source));
    }

    @Test
    @DisplayName("Should bind libraries, parameters, commands and timeout")
    void shouldBindOptionalFields() {
        JobDefinition job = loader.loadJob(job("""
                    - task_name: models
                      tasktype: DBT
                      filepath: dbt/project
                      commands: [dbt deps, dbt run]
                      parameters: [--full-refresh]
                      timeout_seconds: 3600
                      libraries:
                        - whl: dbfs:/libs/helpers-1.0-py3-none-any.whl
                        - pypi:
                            package: requests==2.31.0
                            repo: https://pypi.example.com/simple
                """));

        TaskDefinition task = job.getTask("models").orElseThrow();
        assertThat(task.getTaskType()).contains(TaskType.DBT);
        assertThat(task.getCommands()).containsExactly("dbt deps", "dbt run");
        assertThat(task.getParameters()).containsExactly("--full-refresh");
        assertThat(task.getTimeoutSeconds()).isEqualTo(3600);
        assertThat(task.getLibraries()).containsExactly(
                LibraryRef.whl("dbfs:/libs/helpers-1.0-py3-none-any.whl"),
                LibraryRef.pypi("requests==2.31.0", "https://pypi.example.com/simple"));
    }
    @Test
    @DisplayName("Should reject a dependency on an undeclared task")
    void shouldRejectUnknownDependency() {
        ConfigValidationException e = rejected(job("""
                    - task_name: api
                      depends_on: [missing-task]
                """));

        assertThat(e.getViolations()).singleElement().satisfies(v -> {
            assertThat(v.getKind()).isEqualTo(Violation.Kind.UNKNOWN_DEPENDENCY);
            assertThat(v.getJobKey()).isEqualTo("workflow-api");
            assertThat(v.getTaskNames()).containsExactly("api", "missing-task");
            assertThat(v.getMessage()).contains("missing-task");
        });
    }

    @Test
    @DisplayName("Should reject a task name declared twice in one job")
    void shouldRejectDuplicateTaskName() {
        ConfigValidationException e = rejected(job("""
                    - task_name: api
                    - task_name: api
                """));

        assertThat(e.getViolations(Violation.Kind.DUPLICATE_TASK_NAME)).singleElement()
                .satisfies(v -> assertThat(v.getTaskNames()).containsExactly("api"));
    }

    @Test
    @DisplayName("Should reject a task that depends on itself")
    void shouldRejectSelfLoop() {
        ConfigValidationException e = rejected(job("""
                    - task_name: a
                      depends_on: [a]
                """));

        assertThat(e.getViolations(Violation.Kind.DEPENDENCY_CYCLE)).singleElement()
                .satisfies(v -> assertThat(v.getTaskNames()).containsExactly("a"));
    }

    @Test
    @DisplayName("Should reject mutually dependent tasks and name both")
    void shouldRejectMutualCycle() {
        ConfigValidationException e = rejected(job("""
                    - task_name: a
                      depends_on: [b]
                    - task_name: b
                      depends_on: [a]
                """));

        Violation cycle = e.getViolations(Violation.Kind.DEPENDENCY_CYCLE).get(0);
        assertThat(cycle.getTaskNames()).containsExactlyInAnyOrder("a", "b");
        assertThat(cycle.getMessage()).contains("a -> b -> a");
    }

    @Test
    @DisplayName("Should reject a dependency listed twice")
    void shouldRejectDuplicateDependency() {
        ConfigValidationException e = rejected(job("""
                    - task_name: a
                    - task_name: b
                      depends_on: [a, a]
                """));

        assertThat(e.getViolations()).extracting(Violation::getKind)
                .containsExactly(Violation.Kind.DUPLICATE_DEPENDENCY);
    }

    @Test
    @DisplayName("Should reject an invalid cron schedule")
    void shouldRejectInvalidSchedule() {
        ConfigValidationException e = rejected("""
                workflow-api:
                  job_name: api_ingest
                  schedule: "every day at three"
                  tasks:
                    - task_name: api
                """);

        assertThat(e.getViolations()).extracting(Violation::getKind)
                .containsExactly(Violation.Kind.INVALID_SCHEDULE);
    }

    @Test
    @DisplayName("Should reject an unknown task type")
    void shouldRejectUnknownTaskType() {
        ConfigValidationException e = rejected(job("""
                    - task_name: api
                      tasktype: spark_jar
                """));

        assertThat(e.getViolations(Violation.Kind.UNKNOWN_TASK_TYPE)).singleElement()
                .satisfies(v -> assertThat(v.getMessage()).contains("spark_jar", "NOTEBOOK"));
    }

    @Test
    @DisplayName("Should reject malformed library entries")
    void shouldRejectMalformedLibraries() {
        ConfigValidationException e = rejected(job("""
                    - task_name: api
                      libraries:
                        - jar: dbfs:/libs/a.jar
                        - pypi: requests
                        - whl: ""
                """));

        assertThat(e.getViolations(Violation.Kind.MALFORMED_LIBRARY)).hasSize(3);
    }

    @Test
    @DisplayName("Should reject a job without tasks")
    void shouldRejectEmptyJob() {
        ConfigValidationException e = rejected("""
                workflow-api:
                  job_name: api_ingest
                  schedule: "00 00 03 * * ?"
                  tasks: []
                """);

        assertThat(e.getViolations()).extracting(Violation::getKind)
                .containsExactly(Violation.Kind.EMPTY_JOB);
    }

    @Test
    @DisplayName("Should reject two jobs sharing a job name")
    void shouldRejectDuplicateJobName() {
        ConfigValidationException e = rejected("""
                workflow-a:
                  job_name: shared
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - task_name: x
                workflow-b:
                  job_name: shared
                  schedule: "0 0 2 * * ?"
                  tasks:
                    - task_name: y
                """);

        assertThat(e.getViolations(Violation.Kind.DUPLICATE_JOB_NAME)).singleElement()
                .satisfies(v -> assertThat(v.getJobKey()).isEqualTo("workflow-b"));
    }

    @Test
    @DisplayName("Should collect violations from every job before failing")
    void shouldCollectAllViolations() {
        ConfigValidationException e = rejected("""
                workflow-a:
                  job_name: a
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - task_name: x
                      depends_on: [nope]
                workflow-b:
                  job_name: b
                  schedule: "0 0 2 * * ?"
                  tasks:
                    - task_name: y
                      depends_on: [y]
                """);

        assertThat(e.getViolations()).extracting(Violation::getKind)
                .containsExactly(Violation.Kind.UNKNOWN_DEPENDENCY, Violation.Kind.DEPENDENCY_CYCLE);
        assertThat(e.getMessage()).contains("workflow-a", "workflow-b");
    }
    @Test
    @DisplayName("Should reject a job without job_name")
    void shouldRejectMissingJobName() {
        assertThatThrownBy(() -> loader.load("""
                workflow-api:
                  schedule: "00 00 03 * * ?"
                  tasks:
                    - task_name: api
                """))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("job_name")
                .extracting(e -> ((ConfigParseException) e).getPath())
                .isEqualTo("workflow-api.job_name");
    }

    @Test
    @DisplayName("Should reject a job without schedule")
    void shouldRejectMissingSchedule() {
        assertThatThrownBy(() -> loader.load("""
                workflow-api:
                  job_name: api_ingest
                  tasks:
                    - task_name: api
                """))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("schedule");
    }

    @Test
    @DisplayName("Should reject a task without task_name")
    void shouldRejectMissingTaskName() {
        assertThatThrownBy(() -> loader.load(job("""
                    - filepath: notebooks/api
                """)))
                .isInstanceOf(ConfigParseException.class)
                .extracting(e -> ((ConfigParseException) e).getPath())
                .isEqualTo("workflow-api.tasks[0].task_name");
    }

    @Test
    @DisplayName("Should reject a document that is not a mapping")
    void shouldRejectNonMappingDocument() {
        assertThatThrownBy(() -> loader.load("- just\n- a list\n"))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    @DisplayName("Should reject an empty document")
    void shouldRejectEmptyDocument() {
        assertThatThrownBy(() -> loader.load(""))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should reject syntactically invalid YAML")
    void shouldRejectInvalidYaml() {
        assertThatThrownBy(() -> loader.load("workflow-api: [unclosed\n"))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("Malformed YAML");
    }

    @Test
    @DisplayName("Should reject a duplicate mapping key")
    void shouldRejectDuplicateKey() {
        assertThatThrownBy(() -> loader.load("""
                workflow-api:
                  job_name: one
                  job_name: two
                """))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("job_name");
    }

    @Test
    @DisplayName("Should reject a merge key that references an unknown anchor")
    void shouldRejectUnknownAnchor() {
        assertThatThrownBy(() -> loader.load(job("""
                    - <<: *no_such_anchor
                      task_name: api
                """)))
                .isInstanceOf(ConfigParseException.class);
    }

    @Test
    @DisplayName("Should reject a mapping that merges itself through its own anchor")
    void shouldRejectSelfMergingAnchor() {
        assertThatThrownBy(() -> loader.load("""
                defaults: &d
                  x: 1
                  <<: *d
                workflow-a:
                  job_name: j
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - <<: *d
                      task_name: t
                """))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("recursive alias");
    }

    @Test
    @DisplayName("Should reject a self-referencing anchor in a merge sequence")
    void shouldRejectSelfMergingAnchorInSequence() {
        assertThatThrownBy(() -> loader.load("""
                defaults: &d
                  x: 1
                  <<: [*d]
                workflow-a:
                  job_name: j
                  schedule: "0 0 1 * * ?"
                  tasks:
                    - <<: *d
                      task_name: t
                """))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("recursive alias");
    }

    @Test
    @DisplayName("Should reject a negative timeout")
    void shouldRejectNegativeTimeout() {
        assertThatThrownBy(() -> loader.load(job("""
                    - task_name: api
                      timeout_seconds: -5
                """)))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("timeout_seconds");
    }

    @Test
    @DisplayName("Should require exactly one job when loading a single job")
    void shouldRequireSingleJob() {
        assertThatThrownBy(() -> loader.loadJob(DEFAULTS))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("exactly one job");
    }
    @Test
    @DisplayName("Should load the descriptor from the classpath")
    void shouldLoadFromClasspath() {
        WorkflowConfig config = loader.fromClasspath("job_config.yaml");

        assertThat(config.getJobKeys()).containsExactly("workflow-api", "workflow-reporting");
        JobDefinition api = config.getJob("workflow-api").orElseThrow();
        assertThat(api.getExecutionOrder()).containsExactly("api", "api2");
        JobDefinition reporting = config.findByJobName("reporting").orElseThrow();
        assertThat(reporting.getExecutionOrder()).containsExactly("extract", "load", "models");
        assertThat(reporting.getTask("extract").orElseThrow().getGcpConnection())
                .hasValueSatisfying(gcp -> {
                    assertThat(gcp.getProjectId()).isEqualTo("reporting-prod");
                    assertThat(gcp.getServiceAccountPrivateKeyId()).isEqualTo("runner-key-id");
                });
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> loader.fromClasspath("does-not-exist.yaml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the descriptor file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> loader.fromFile("/nonexistent/job_config.yaml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
    @Test
    @DisplayName("Should list violations in the exception message")
    void shouldDescribeViolations() {
        ConfigValidationException e = new ConfigValidationException(List.of(
                new Violation(Violation.Kind.UNKNOWN_DEPENDENCY, "workflow-api", "api_ingest",
                        List.of("api", "missing-task"), "task 'api' depends on unknown task 'missing-task'")));

        assertThat(e.getMessage()).contains("UNKNOWN_DEPENDENCY", "missing-task");
    }
}
