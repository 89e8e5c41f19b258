package com.workflowops.core.config;

import com.workflowops.core.model.GcpConnection;
import com.workflowops.core.model.LibraryRef;
import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Binds the merged document tree of one job to model objects.
 *
 * <p>
 * Structural problems (wrong node shape, missing required key) abort with a
 * {@link ConfigParseException}. Semantic problems found on the way, such as
 * an unknown task type or a malformed library entry, are appended to the
 * caller's violation list so that they are reported together with the
 * graph checks.
 * </p>
 */
final class DescriptorBinder {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptorBinder.class);

    static final String JOB_NAME = "job_name";
    static final String SCHEDULE = "schedule";
    static final String TASKS = "tasks";

    static final String TASK_NAME = "task_name";
    static final String FILEPATH = "filepath";
    static final String CLUSTER_CONFIG_PATH = "cluster_config_path";
    static final String TASK_TYPE = "tasktype";
    static final String GCP_CONNECTION = "gcp_connection";
    static final String LIBRARIES = "libraries";
    static final String EMAIL_ON_FAILURE = "email_on_failure";
    static final String EMAIL_ON_SUCCESS = "email_on_success";
    static final String DEPENDS_ON = "depends_on";
    static final String PARAMETERS = "parameters";
    static final String COMMANDS = "commands";
    static final String TIMEOUT_SECONDS = "timeout_seconds";

    private static final Set<String> JOB_KEYS = Set.of(JOB_NAME, SCHEDULE, TASKS);
    private static final Set<String> TASK_KEYS = Set.of(TASK_NAME, FILEPATH, CLUSTER_CONFIG_PATH, TASK_TYPE,
            GCP_CONNECTION, LIBRARIES, EMAIL_ON_FAILURE, EMAIL_ON_SUCCESS, DEPENDS_ON, PARAMETERS, COMMANDS,
            TIMEOUT_SECONDS);

    private final List<Violation> violations;

    DescriptorBinder(List<Violation> violations) {
        this.violations = violations;
    }

    /**
     * A job as declared, before dependency validation.
     */
    static final class JobDraft {
        final String key;
        final String jobName;
        final String schedule;
        final List<TaskDefinition> tasks;

        JobDraft(String key, String jobName, String schedule, List<TaskDefinition> tasks) {
            this.key = key;
            this.jobName = jobName;
            this.schedule = schedule;
            this.tasks = tasks;
        }
    }

    JobDraft bindJob(String key, Object body) {
        Map<String, Object> job = requireMapping(body, key, "job body");
        warnUnknownKeys(job, JOB_KEYS, key);

        String jobName = requireString(job, JOB_NAME, key);
        String schedule = requireString(job, SCHEDULE, key);

        String tasksPath = MergingYamlReader.child(key, TASKS);
        if (!job.containsKey(TASKS) || job.get(TASKS) == null) {
            throw new ConfigParseException(tasksPath, "missing required key '" + TASKS + "'");
        }
        if (!(job.get(TASKS) instanceof List<?> rawTasks)) {
            throw new ConfigParseException(tasksPath, "must be a sequence of task mappings");
        }

        List<TaskDefinition> tasks = new ArrayList<>();
        for (int i = 0; i < rawTasks.size(); i++) {
            tasks.add(bindTask(key, jobName, rawTasks.get(i), tasksPath + "[" + i + "]"));
        }
        LOG.debug("Bound job '{}' ({}) with {} task(s)", key, jobName, tasks.size());
        return new JobDraft(key, jobName, schedule, tasks);
    }

    // ---------------------------------------------------------------
    // Tasks
    // ---------------------------------------------------------------

    private TaskDefinition bindTask(String jobKey, String jobName, Object body, String path) {
        Map<String, Object> task = requireMapping(body, path, "task");
        warnUnknownKeys(task, TASK_KEYS, path);

        String taskName = requireString(task, TASK_NAME, path);
        TaskDefinition.Builder builder = TaskDefinition.builder(taskName)
                .filepath(optionalString(task, FILEPATH, path))
                .clusterConfigPath(optionalString(task, CLUSTER_CONFIG_PATH, path))
                .emailOnFailure(stringList(task, EMAIL_ON_FAILURE, path))
                .emailOnSuccess(stringList(task, EMAIL_ON_SUCCESS, path))
                .dependsOn(stringList(task, DEPENDS_ON, path))
                .parameters(stringList(task, PARAMETERS, path))
                .commands(stringList(task, COMMANDS, path))
                .timeoutSeconds(timeout(task, path));

        String rawType = optionalString(task, TASK_TYPE, path);
        if (rawType != null) {
            Optional<TaskType> type = TaskType.parse(rawType);
            if (type.isPresent()) {
                builder.taskType(type.get());
            } else {
                violations.add(new Violation(Violation.Kind.UNKNOWN_TASK_TYPE, jobKey, jobName, List.of(taskName),
                        "task '" + taskName + "' has unknown tasktype '" + rawType
                                + "'. Supported: " + TaskType.supportedValues()));
            }
        }

        Object gcp = task.get(GCP_CONNECTION);
        if (gcp != null) {
            builder.gcpConnection(bindGcpConnection(gcp, MergingYamlReader.child(path, GCP_CONNECTION)));
        }

        Object libraries = task.get(LIBRARIES);
        if (libraries != null) {
            if (!(libraries instanceof List<?> entries)) {
                throw new ConfigParseException(MergingYamlReader.child(path, LIBRARIES), "must be a sequence");
            }
            for (int i = 0; i < entries.size(); i++) {
                bindLibrary(entries.get(i), i, jobKey, jobName, taskName).ifPresent(builder::library);
            }
        }

        return builder.build();
    }

    private GcpConnection bindGcpConnection(Object body, String path) {
        Map<String, Object> gcp = requireMapping(body, path, GCP_CONNECTION);
        return new GcpConnection(
                optionalString(gcp, "project_id", path),
                optionalString(gcp, "service_account_email", path),
                optionalString(gcp, "service_account_private_key", path),
                optionalString(gcp, "service_account_private_key_id", path));
    }

    /**
     * An entry is well-formed when it is a single-key mapping: either
     * {@code whl: <uri>} or {@code pypi: {package: <spec>[, repo: <url>]}}.
     */
    private Optional<LibraryRef> bindLibrary(Object entry, int index, String jobKey, String jobName,
                                             String taskName) {
        String problem;
        if (!(entry instanceof Map<?, ?> library) || library.size() != 1) {
            problem = "must be a mapping with exactly one of 'whl' or 'pypi'";
        } else {
            Map.Entry<?, ?> only = library.entrySet().iterator().next();
            Object kind = only.getKey();
            Object value = only.getValue();
            if (LibraryRef.Kind.WHL.key().equals(kind)) {
                if (value instanceof String uri && !uri.isBlank()) {
                    return Optional.of(LibraryRef.whl(uri));
                }
                problem = "'whl' must be a non-blank archive location";
            } else if (LibraryRef.Kind.PYPI.key().equals(kind)) {
                problem = pypiProblem(value);
                if (problem == null) {
                    Map<?, ?> pypi = (Map<?, ?>) value;
                    return Optional.of(LibraryRef.pypi((String) pypi.get("package"), (String) pypi.get("repo")));
                }
            } else {
                problem = "unknown library kind '" + kind + "', expected 'whl' or 'pypi'";
            }
        }
        violations.add(new Violation(Violation.Kind.MALFORMED_LIBRARY, jobKey, jobName, List.of(taskName),
                "task '" + taskName + "' libraries[" + index + "] " + problem));
        return Optional.empty();
    }

    private static String pypiProblem(Object value) {
        if (!(value instanceof Map<?, ?> pypi)) {
            return "'pypi' must be a mapping with a 'package' key";
        }
        for (Object key : pypi.keySet()) {
            if (!"package".equals(key) && !"repo".equals(key)) {
                return "'pypi' has unexpected key '" + key + "'";
            }
        }
        if (!(pypi.get("package") instanceof String pkg) || pkg.isBlank()) {
            return "'pypi.package' must be a non-blank requirement";
        }
        Object repo = pypi.get("repo");
        if (repo != null && !(repo instanceof String)) {
            return "'pypi.repo' must be a string";
        }
        return null;
    }

    // ---------------------------------------------------------------
    // Field readers
    // ---------------------------------------------------------------

    static Map<String, Object> requireMapping(Object value, String path, String what) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigParseException(path, what + " must be a mapping, found " + describe(value));
        }
        try {
            return DefaultsMerger.asStringKeyed(map);
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException(path, what + " must have string keys", e);
        }
    }

    private static String requireString(Map<String, Object> map, String key, String path) {
        String value = optionalString(map, key, path);
        if (value == null || value.isBlank()) {
            throw new ConfigParseException(MergingYamlReader.child(path, key), "missing required key '" + key + "'");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new ConfigParseException(MergingYamlReader.child(path, key),
                    "must be a scalar, found " + describe(value));
        }
        return String.valueOf(value);
    }

    /** Accepts a single scalar as a one-element list. */
    private static List<String> stringList(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        String fieldPath = MergingYamlReader.child(path, key);
        if (!(value instanceof List<?> items)) {
            if (value instanceof Map) {
                throw new ConfigParseException(fieldPath, "must be a scalar or a sequence of scalars");
            }
            return List.of(String.valueOf(value));
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item == null || item instanceof Map || item instanceof List) {
                throw new ConfigParseException(fieldPath + "[" + i + "]", "must be a scalar, found " + describe(item));
            }
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static int timeout(Map<String, Object> map, String path) {
        Object value = map.get(TIMEOUT_SECONDS);
        if (value == null) {
            return 0;
        }
        if (value instanceof Integer seconds && seconds >= 0) {
            return seconds;
        }
        throw new ConfigParseException(MergingYamlReader.child(path, TIMEOUT_SECONDS),
                "must be a non-negative integer, found " + describe(value));
    }

    private static void warnUnknownKeys(Map<String, Object> map, Set<String> known, String path) {
        for (String key : map.keySet()) {
            if (!known.contains(key)) {
                LOG.warn("Ignoring unknown key '{}' at {}", key, path);
            }
        }
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "mapping";
        }
        if (value instanceof List) {
            return "sequence";
        }
        return "'" + value + "'";
    }
}
