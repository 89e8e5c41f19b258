package com.workflowops.core.model;

import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named, independently scheduled collection of tasks.
 *
 * <p>
 * Produced by {@link com.workflowops.core.config.ConfigLoader} once the job
 * has passed validation, so the invariants below always hold for loaded
 * instances:
 * </p>
 * <ul>
 * <li>task names are unique within the job;</li>
 * <li>every {@code depends_on} entry names a task of this job;</li>
 * <li>the dependency relation is acyclic, and {@link #getExecutionOrder()}
 * lists every task after all of its dependencies.</li>
 * </ul>
 *
 * <p>
 * The constructor checks only that the execution order is a permutation of
 * the task names; dependency checks belong to the loader.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final String jobName;
    private final String schedule;
    private final List<TaskDefinition> tasks;
    private final List<String> executionOrder;

    /**
     * @param key            top-level descriptor key, e.g. {@code workflow-api}
     * @param jobName        the {@code job_name}
     * @param schedule       Quartz cron expression
     * @param tasks          tasks in declaration order
     * @param executionOrder task names in dependency order
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if {@code executionOrder} does not list
     *                                  each task exactly once
     */
    public JobDefinition(String key, String jobName, String schedule,
                         List<TaskDefinition> tasks, List<String> executionOrder) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks must not be null"));
        this.executionOrder = List.copyOf(Objects.requireNonNull(executionOrder, "executionOrder must not be null"));

        Set<String> names = new HashSet<>();
        for (TaskDefinition task : this.tasks) {
            names.add(task.getTaskName());
        }
        if (names.size() != this.executionOrder.size() || !names.containsAll(this.executionOrder)) {
            throw new IllegalArgumentException("Execution order " + executionOrder
                    + " does not match the tasks of job '" + jobName + "'");
        }
    }

    public String getKey() {
        return key;
    }

    public String getJobName() {
        return jobName;
    }

    public String getSchedule() {
        return schedule;
    }

    /**
     * @return unmodifiable list of tasks in declaration order
     */
    public List<TaskDefinition> getTasks() {
        return tasks;
    }

    /**
     * @return unmodifiable list of task names in topological order
     */
    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    /**
     * @return tasks in topological order
     */
    public List<TaskDefinition> getTasksInExecutionOrder() {
        return executionOrder.stream()
                .map(name -> getTask(name).orElseThrow())
                .toList();
    }

    public Optional<TaskDefinition> getTask(String taskName) {
        return tasks.stream()
                .filter(t -> t.getTaskName().equals(taskName))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobDefinition that))
            return false;
        return key.equals(that.key)
                && jobName.equals(that.jobName)
                && schedule.equals(that.schedule)
                && tasks.equals(that.tasks)
                && executionOrder.equals(that.executionOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, jobName, schedule, tasks, executionOrder);
    }

    @Override
    public String toString() {
        return "JobDefinition{" +
                "key='" + key + '\'' +
                ", jobName='" + jobName + '\'' +
                ", schedule='" + schedule + '\'' +
                ", executionOrder=" + executionOrder +
                '}';
    }
}
