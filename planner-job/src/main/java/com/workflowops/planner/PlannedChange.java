package com.workflowops.planner;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/**
 * What deploying the descriptor does to one job.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PlannedChange {

    /**
     * Kind of change.
     */
    public enum Action {
        /** The job is new and has to be created. */
        CREATE,
        /** The job exists and its settings changed. */
        UPDATE,
        /** The job exists with identical settings. */
        UNCHANGED,
        /** The job was removed from the descriptor. */
        DELETE
    }

    private final String jobKey;
    private final Action action;
    private final Long jobId;
    private final Map<String, Object> settings;

    /**
     * @param jobKey   descriptor job key
     * @param action   the change
     * @param jobId    recorded backend id; {@code null} for new jobs
     * @param settings desired job settings; {@code null} for deletions
     */
    public PlannedChange(String jobKey, Action action, Long jobId, Map<String, Object> settings) {
        this.jobKey = Objects.requireNonNull(jobKey, "jobKey must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.jobId = jobId;
        this.settings = settings;
    }

    public String getJobKey() {
        return jobKey;
    }

    public Action getAction() {
        return action;
    }

    public Long getJobId() {
        return jobId;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PlannedChange that))
            return false;
        return jobKey.equals(that.jobKey) && action == that.action
                && Objects.equals(jobId, that.jobId) && Objects.equals(settings, that.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobKey, action, jobId, settings);
    }

    @Override
    public String toString() {
        return action + " " + jobKey + (jobId != null ? " (job_id " + jobId + ")" : "");
    }
}
