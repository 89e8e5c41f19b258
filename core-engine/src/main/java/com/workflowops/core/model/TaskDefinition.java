package com.workflowops.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A unit of work inside a {@link JobDefinition}, after the defaults block has
 * been merged into it.
 *
 * <p>
 * Instances are immutable. Collections are returned as unmodifiable views that
 * keep declaration order; e-mail recipients are de-duplicated.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Only {@code taskName} is required; every other
 * attribute is optional at this level and checked by whoever consumes it.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaskDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String taskName;
    private final String filepath;
    private final String clusterConfigPath;
    private final TaskType taskType;
    private final GcpConnection gcpConnection;
    private final List<LibraryRef> libraries;
    private final Set<String> emailOnFailure;
    private final Set<String> emailOnSuccess;
    private final List<String> dependsOn;
    private final List<String> parameters;
    private final List<String> commands;
    private final int timeoutSeconds;

    private TaskDefinition(Builder builder) {
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName must not be null");
        this.filepath = builder.filepath;
        this.clusterConfigPath = builder.clusterConfigPath;
        this.taskType = builder.taskType;
        this.gcpConnection = builder.gcpConnection;
        this.libraries = List.copyOf(builder.libraries);
        this.emailOnFailure = Collections.unmodifiableSet(new LinkedHashSet<>(builder.emailOnFailure));
        this.emailOnSuccess = Collections.unmodifiableSet(new LinkedHashSet<>(builder.emailOnSuccess));
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.parameters = List.copyOf(builder.parameters);
        this.commands = List.copyOf(builder.commands);
        if (builder.timeoutSeconds < 0) {
            throw new IllegalArgumentException(
                    "timeoutSeconds must be >= 0 for task '" + taskName + "', got: " + builder.timeoutSeconds);
        }
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    public static Builder builder(String taskName) {
        return new Builder().taskName(taskName);
    }

    public String getTaskName() {
        return taskName;
    }

    public Optional<String> getFilepath() {
        return Optional.ofNullable(filepath);
    }

    public Optional<String> getClusterConfigPath() {
        return Optional.ofNullable(clusterConfigPath);
    }

    public Optional<TaskType> getTaskType() {
        return Optional.ofNullable(taskType);
    }

    public Optional<GcpConnection> getGcpConnection() {
        return Optional.ofNullable(gcpConnection);
    }

    public List<LibraryRef> getLibraries() {
        return libraries;
    }

    public Set<String> getEmailOnFailure() {
        return emailOnFailure;
    }

    public Set<String> getEmailOnSuccess() {
        return emailOnSuccess;
    }

    /**
     * @return names of sibling tasks that must finish before this one, in
     *         declaration order
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<String> getCommands() {
        return commands;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    /**
     * Fluent builder for {@link TaskDefinition} instances.
     */
    public static class Builder {
        private String taskName;
        private String filepath;
        private String clusterConfigPath;
        private TaskType taskType;
        private GcpConnection gcpConnection;
        private final List<LibraryRef> libraries = new ArrayList<>();
        private final List<String> emailOnFailure = new ArrayList<>();
        private final List<String> emailOnSuccess = new ArrayList<>();
        private final List<String> dependsOn = new ArrayList<>();
        private final List<String> parameters = new ArrayList<>();
        private final List<String> commands = new ArrayList<>();
        private int timeoutSeconds;

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder filepath(String filepath) {
            this.filepath = filepath;
            return this;
        }

        public Builder clusterConfigPath(String clusterConfigPath) {
            this.clusterConfigPath = clusterConfigPath;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder gcpConnection(GcpConnection gcpConnection) {
            this.gcpConnection = gcpConnection;
            return this;
        }

        public Builder libraries(Collection<LibraryRef> libraries) {
            this.libraries.addAll(libraries);
            return this;
        }

        public Builder library(LibraryRef library) {
            this.libraries.add(Objects.requireNonNull(library, "library must not be null"));
            return this;
        }

        public Builder emailOnFailure(Collection<String> recipients) {
            this.emailOnFailure.addAll(recipients);
            return this;
        }

        public Builder emailOnSuccess(Collection<String> recipients) {
            this.emailOnSuccess.addAll(recipients);
            return this;
        }

        public Builder dependsOn(Collection<String> taskNames) {
            this.dependsOn.addAll(taskNames);
            return this;
        }

        public Builder dependsOn(String... taskNames) {
            return dependsOn(List.of(taskNames));
        }

        public Builder parameters(Collection<String> parameters) {
            this.parameters.addAll(parameters);
            return this;
        }

        public Builder commands(Collection<String> commands) {
            this.commands.addAll(commands);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        /**
         * @return a new {@link TaskDefinition}
         * @throws NullPointerException     if {@code taskName} is {@code null}
         * @throws IllegalArgumentException if {@code timeoutSeconds} is negative
         */
        public TaskDefinition build() {
            return new TaskDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskDefinition that))
            return false;
        return timeoutSeconds == that.timeoutSeconds
                && taskName.equals(that.taskName)
                && Objects.equals(filepath, that.filepath)
                && Objects.equals(clusterConfigPath, that.clusterConfigPath)
                && taskType == that.taskType
                && Objects.equals(gcpConnection, that.gcpConnection)
                && libraries.equals(that.libraries)
                && emailOnFailure.equals(that.emailOnFailure)
                && emailOnSuccess.equals(that.emailOnSuccess)
                && dependsOn.equals(that.dependsOn)
                && parameters.equals(that.parameters)
                && commands.equals(that.commands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskName, filepath, clusterConfigPath, taskType, gcpConnection, libraries,
                emailOnFailure, emailOnSuccess, dependsOn, parameters, commands, timeoutSeconds);
    }

    @Override
    public String toString() {
        return "TaskDefinition{" +
                "taskName='" + taskName + '\'' +
                ", taskType=" + taskType +
                ", filepath='" + filepath + '\'' +
                ", dependsOn=" + dependsOn +
                ", libraries=" + libraries +
                '}';
    }
}
