package com.workflowops.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowops.core.config.ConfigException;
import com.workflowops.core.config.ConfigLoader;
import com.workflowops.core.config.ConfigValidationException;
import com.workflowops.core.config.Violation;
import com.workflowops.core.config.WorkflowConfig;
import com.workflowops.core.model.JobDefinition;
import com.workflowops.core.payload.JobSettingsAssembler;
import com.workflowops.core.payload.PayloadException;
import com.workflowops.core.schedule.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point for the workflow planner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   job_config.yaml
 *     → ConfigLoader (merge defaults, validate, order tasks)
 *     → JobSettingsAssembler (job-settings documents)
 *     → DeploymentPlanner (diff against current_state.json)
 *     → plan JSON on stdout
 *     → StateStore (new snapshot, when recording is enabled)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link PlannerConfig}.
 * </p>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} on success, {@code 1} when the descriptor is invalid or a job
 * cannot be converted to a payload.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkflowPlannerJob {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowPlannerJob.class);

    private WorkflowPlannerJob() {
    }

    public static void main(String[] args) {
        PlannerConfig config = PlannerConfig.fromEnvironment();
        LOG.info("Starting workflow planner with config: {}", config);

        Clock clock = Clock.system(ZoneId.of(config.getPayloadSettings().getTimezoneId()));
        int status = run(config, System.out, clock);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Plan (and optionally record) one deployment.
     *
     * @param config planner configuration
     * @param out    receives the plan as JSON
     * @param clock  source of the snapshot timestamp
     * @return process exit status
     */
    static int run(PlannerConfig config, PrintStream out, Clock clock) {
        ObjectMapper mapper = JsonMappers.create();
        try {
            // 1. Load and validate the descriptor
            WorkflowConfig descriptor = loadDescriptor(config);
            nextRuns(descriptor, clock).forEach((key, next) -> LOG.info("Job '{}' next runs at {}", key, next));

            // 2. Assemble job settings
            JobSettingsAssembler assembler = new JobSettingsAssembler(config.getPayloadSettings(),
                    new JsonFileClusterSpecResolver(Path.of(config.getClusterConfigDir()), mapper));
            Map<String, Map<String, Object>> desired = assembler.assembleAll(descriptor);

            // 3. Diff against recorded state
            StateStore store = new StateStore(Path.of(config.getStateDir()), mapper);
            Map<String, Map<String, Object>> recorded = store.readCurrent()
                    .map(StateSnapshot::getConfig)
                    .orElse(Map.of());
            DeploymentPlan plan = new DeploymentPlanner(mapper).plan(desired, recorded);
            out.println(mapper.writeValueAsString(plan));

            // 4. Record the new state
            if (!config.isRecordState()) {
                LOG.info("State recording disabled; plan not recorded");
            } else if (!plan.hasChanges()) {
                LOG.info("No changes; state left at its current version");
            } else {
                StateSnapshot snapshot = store.record(plan.toSnapshotConfig(), LocalDateTime.now(clock));
                LOG.info("Recorded state version {}", snapshot.getVersion());
            }
            return 0;
        } catch (ConfigValidationException e) {
            LOG.error("Workflow descriptor is invalid:");
            for (Violation violation : e.getViolations()) {
                LOG.error("  {}", violation);
            }
            return 1;
        } catch (ConfigException e) {
            LOG.error("Workflow descriptor cannot be parsed: {}", e.getMessage());
            return 1;
        } catch (PayloadException e) {
            LOG.error("Job settings cannot be built: {}", e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render deployment plan", e);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Next fire time of each job's schedule, evaluated in the clock's zone.
     * Jobs whose schedule never fires again are left out.
     */
    static Map<String, Instant> nextRuns(WorkflowConfig descriptor, Clock clock) {
        Map<String, Instant> nextRuns = new LinkedHashMap<>();
        for (JobDefinition job : descriptor.getJobs()) {
            CronSchedule.nextRunAfter(job.getSchedule(), clock.instant(), clock.getZone())
                    .ifPresentOrElse(next -> nextRuns.put(job.getKey(), next),
                            () -> LOG.warn("Job '{}' schedule '{}' never fires again", job.getKey(), job.getSchedule()));
        }
        return nextRuns;
    }

    private static WorkflowConfig loadDescriptor(PlannerConfig config) {
        ConfigLoader loader = new ConfigLoader(config.getJobKeyPrefix());
        String path = config.getConfigPath();
        if (path != null && !path.isBlank()) {
            return loader.fromFile(path);
        }
        return loader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);
    }
}
