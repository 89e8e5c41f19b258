package com.workflowops.core.config;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A single semantic problem found while validating a descriptor.
 *
 * <p>
 * Every violation identifies the job it belongs to (the top-level key and,
 * when known, the {@code job_name}) and the task names involved. For a
 * dependency cycle the task names are the cycle members in traversal order.
 * </p>
 *
 * @since 1.0.0
 */
public final class Violation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Category of the violation. */
    public enum Kind {
        DUPLICATE_JOB_NAME,
        EMPTY_JOB,
        INVALID_SCHEDULE,
        DUPLICATE_TASK_NAME,
        UNKNOWN_TASK_TYPE,
        UNKNOWN_DEPENDENCY,
        DUPLICATE_DEPENDENCY,
        DEPENDENCY_CYCLE,
        MALFORMED_LIBRARY
    }

    private final Kind kind;
    private final String jobKey;
    private final String jobName;
    private final List<String> taskNames;
    private final String message;

    public Violation(Kind kind, String jobKey, String jobName, List<String> taskNames, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.jobKey = Objects.requireNonNull(jobKey, "jobKey must not be null");
        this.jobName = jobName;
        this.taskNames = taskNames == null ? List.of() : List.copyOf(taskNames);
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public Kind getKind() {
        return kind;
    }

    public String getJobKey() {
        return jobKey;
    }

    /**
     * @return the declared {@code job_name}, or {@code null} if it could not
     *         be read
     */
    public String getJobName() {
        return jobName;
    }

    public List<String> getTaskNames() {
        return taskNames;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Violation that))
            return false;
        return kind == that.kind
                && jobKey.equals(that.jobKey)
                && Objects.equals(jobName, that.jobName)
                && taskNames.equals(that.taskNames)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, jobKey, jobName, taskNames, message);
    }

    @Override
    public String toString() {
        String job = jobName != null ? jobKey + " (" + jobName + ")" : jobKey;
        return "[" + kind + "] job " + job + ": " + message;
    }
}
