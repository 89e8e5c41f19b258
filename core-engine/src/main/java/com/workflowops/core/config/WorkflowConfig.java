package com.workflowops.core.config;

import com.workflowops.core.model.JobDefinition;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The validated content of one workflow descriptor: its jobs, keyed by the
 * top-level key they were declared under.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * default-settings: &amp;default-settings
 *   tasktype: "PYTHON"
 *   email_on_failure: ["ops@example.com"]
 *
 * workflow-api:
 *   job_name: "test-api-job"
 *   schedule: "00 00 03 * * ?"
 *   tasks:
 *     - &lt;&lt;: *default-settings
 *       task_name: "api"
 *       filepath: "project/main.py"
 *     - &lt;&lt;: *default-settings
 *       task_name: "api2"
 *       filepath: "project/main.py"
 *       depends_on: ["api"]
 * </pre>
 *
 * @since 1.0.0
 */
public final class WorkflowConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, JobDefinition> jobs;

    public WorkflowConfig(List<JobDefinition> jobs) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Map<String, JobDefinition> byKey = new LinkedHashMap<>();
        for (JobDefinition job : jobs) {
            if (byKey.putIfAbsent(job.getKey(), job) != null) {
                throw new IllegalArgumentException("Duplicate job key: " + job.getKey());
            }
        }
        this.jobs = Collections.unmodifiableMap(byKey);
    }

    /**
     * @return unmodifiable list of jobs in declaration order
     */
    public List<JobDefinition> getJobs() {
        return List.copyOf(jobs.values());
    }

    /**
     * @return unmodifiable list of top-level job keys in declaration order
     */
    public List<String> getJobKeys() {
        return List.copyOf(jobs.keySet());
    }

    /**
     * @param key top-level descriptor key, e.g. {@code workflow-api}
     * @return the job declared under that key
     */
    public Optional<JobDefinition> getJob(String key) {
        return Optional.ofNullable(jobs.get(key));
    }

    /**
     * @param jobName the {@code job_name} value
     * @return the job carrying that name
     */
    public Optional<JobDefinition> findByJobName(String jobName) {
        return jobs.values().stream()
                .filter(j -> j.getJobName().equals(jobName))
                .findFirst();
    }

    public int size() {
        return jobs.size();
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkflowConfig that))
            return false;
        return jobs.equals(that.jobs);
    }

    @Override
    public int hashCode() {
        return jobs.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowConfig{jobs=" + jobs.values() + '}';
    }
}
