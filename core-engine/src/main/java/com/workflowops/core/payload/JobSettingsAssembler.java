package com.workflowops.core.payload;

import com.workflowops.core.config.WorkflowConfig;
import com.workflowops.core.model.JobDefinition;
import com.workflowops.core.model.LibraryRef;
import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns validated jobs into the job-settings documents accepted by the job
 * cluster backend.
 *
 * <h3>Job document</h3>
 *
 * <pre>
 * name, email_notifications{on_success, on_failure}, webhook_notifications,
 * timeout_seconds, schedule{quartz_cron_expression, timezone_id, pause_status},
 * max_concurrent_runs, tasks[...], format, access_control_list[...]
 * </pre>
 *
 * <p>
 * Job-level recipients are the union of the task recipients in execution
 * order. Tasks are emitted in execution order, each with its type-specific
 * section, {@code task_key}, {@code new_cluster}, {@code libraries},
 * {@code timeout_seconds}, {@code email_notifications} and, when it has
 * dependencies, {@code depends_on: [{task_key: ...}]}.
 * </p>
 *
 * <p>
 * Output maps are freshly built on every call and safe for the caller to
 * modify.
 * </p>
 *
 * @since 1.0.0
 */
public class JobSettingsAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(JobSettingsAssembler.class);

    private final PayloadSettings settings;
    private final ClusterSpecResolver clusterSpecResolver;

    public JobSettingsAssembler(PayloadSettings settings, ClusterSpecResolver clusterSpecResolver) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clusterSpecResolver = Objects.requireNonNull(clusterSpecResolver, "clusterSpecResolver must not be null");
    }

    /**
     * @param config validated descriptor
     * @return job settings keyed by top-level job key, in declaration order
     * @throws PayloadException if any task cannot be converted
     */
    public Map<String, Map<String, Object>> assembleAll(WorkflowConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (JobDefinition job : config.getJobs()) {
            result.put(job.getKey(), assemble(job));
        }
        LOG.info("Assembled settings for {} job(s)", result.size());
        return result;
    }

    /**
     * @param job validated job
     * @return the job-settings document
     * @throws PayloadException if any task cannot be converted
     */
    public Map<String, Object> assemble(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");

        List<Object> tasks = new ArrayList<>();
        Set<String> onSuccess = new LinkedHashSet<>();
        Set<String> onFailure = new LinkedHashSet<>();
        for (TaskDefinition task : job.getTasksInExecutionOrder()) {
            tasks.add(assembleTask(job, task));
            onSuccess.addAll(task.getEmailOnSuccess());
            onFailure.addAll(task.getEmailOnFailure());
        }

        Map<String, Object> schedule = new LinkedHashMap<>();
        schedule.put("quartz_cron_expression", job.getSchedule());
        schedule.put("timezone_id", settings.getTimezoneId());
        schedule.put("pause_status", settings.getPauseStatus());

        Map<String, Object> acl = new LinkedHashMap<>();
        acl.put("group_name", settings.getAclGroupName());
        acl.put("permission_level", settings.getAclPermissionLevel());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", job.getJobName());
        document.put("email_notifications", notifications(onSuccess, onFailure));
        document.put("webhook_notifications", new LinkedHashMap<>());
        document.put("timeout_seconds", 0);
        document.put("schedule", schedule);
        document.put("max_concurrent_runs", settings.getMaxConcurrentRuns());
        document.put("tasks", tasks);
        document.put("format", "MULTI_TASK");
        document.put("access_control_list", new ArrayList<>(List.of(acl)));

        LOG.debug("Assembled job '{}' with {} task(s)", job.getJobName(), tasks.size());
        return document;
    }

    /**
     * @param job  the owning job, used for error context
     * @param task one of its tasks
     * @return the task payload
     * @throws PayloadException if the task cannot be converted
     */
    public Map<String, Object> assembleTask(JobDefinition job, TaskDefinition task) {
        TaskType type = task.getTaskType().orElseThrow(() -> new PayloadException(
                "Task '" + task.getTaskName() + "' of job '" + job.getJobName() + "' has no 'tasktype'"));
        TaskPayloadBuilder builder = PayloadBuilderFactory.create(type);

        Map<String, Object> payload;
        try {
            payload = builder.buildTaskSection(task, settings);
        } catch (PayloadException e) {
            throw new PayloadException("Job '" + job.getJobName() + "': " + e.getMessage(), e);
        }

        Map<String, Object> cluster = resolveCluster(job, task);
        if (builder.runsOnSparkCluster()) {
            task.getGcpConnection().ifPresent(gcp -> GcpSparkConf.apply(cluster, gcp, settings.getSecretScope()));
        }

        List<Object> libraries = new ArrayList<>();
        for (LibraryRef library : task.getLibraries()) {
            libraries.add(libraryPayload(library));
        }
        libraries.addAll(builder.requiredLibraries());

        payload.put("task_key", task.getTaskName());
        payload.put("new_cluster", cluster);
        payload.put("libraries", libraries);
        payload.put("timeout_seconds", task.getTimeoutSeconds());
        payload.put("email_notifications", notifications(task.getEmailOnSuccess(), task.getEmailOnFailure()));

        if (!task.getDependsOn().isEmpty()) {
            List<Object> dependsOn = new ArrayList<>();
            for (String dep : task.getDependsOn()) {
                Map<String, Object> ref = new LinkedHashMap<>();
                ref.put("task_key", dep);
                dependsOn.add(ref);
            }
            payload.put("depends_on", dependsOn);
        }
        return payload;
    }

    static Map<String, Object> libraryPayload(LibraryRef library) {
        Map<String, Object> entry = new LinkedHashMap<>();
        switch (library.getKind()) {
            case WHL -> entry.put("whl", library.getLocation().orElseThrow());
            case PYPI -> {
                Map<String, Object> pypi = new LinkedHashMap<>();
                pypi.put("package", library.getPackage().orElseThrow());
                library.getRepo().ifPresent(repo -> pypi.put("repo", repo));
                entry.put("pypi", pypi);
            }
        }
        return entry;
    }

    private Map<String, Object> resolveCluster(JobDefinition job, TaskDefinition task) {
        if (task.getClusterConfigPath().isEmpty()) {
            return new LinkedHashMap<>();
        }
        String path = task.getClusterConfigPath().get();
        Map<String, Object> spec;
        try {
            spec = clusterSpecResolver.resolve(path);
        } catch (PayloadException e) {
            throw new PayloadException("Job '" + job.getJobName() + "', task '" + task.getTaskName()
                    + "': " + e.getMessage(), e);
        }
        if (spec == null) {
            throw new PayloadException("Job '" + job.getJobName() + "', task '" + task.getTaskName()
                    + "': no cluster spec for '" + path + "'");
        }
        return deepCopy(spec);
    }

    private static Map<String, Object> notifications(Set<String> onSuccess, Set<String> onFailure) {
        Map<String, Object> notifications = new LinkedHashMap<>();
        notifications.put("on_success", new ArrayList<>(onSuccess));
        notifications.put("on_failure", new ArrayList<>(onFailure));
        return notifications;
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (!(key instanceof String name)) {
                throw new PayloadException("Cluster spec keys must be strings, found: " + key);
            }
            copy.put(name, copyValue(value));
        });
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
