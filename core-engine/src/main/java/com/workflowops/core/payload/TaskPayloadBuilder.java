package com.workflowops.core.payload;

import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;

import java.util.List;
import java.util.Map;

/**
 * Contract for the type-specific part of a task payload.
 *
 * <p>
 * Implementations are stateless. The fields shared by every task type
 * ({@code task_key}, {@code new_cluster}, {@code libraries}, notifications,
 * dependencies) are added by {@link JobSettingsAssembler}.
 * </p>
 */
public interface TaskPayloadBuilder {

    /**
     * @return the task type this builder handles
     */
    TaskType getTaskType();

    /**
     * @param task     the task; its type matches {@link #getTaskType()}
     * @param settings deployment-wide payload settings
     * @return the type-specific entries, e.g. {@code {"notebook_task": {...}}}
     * @throws PayloadException if the task lacks a field the type needs
     */
    Map<String, Object> buildTaskSection(TaskDefinition task, PayloadSettings settings);

    /**
     * @return {@code true} if the task runs on a Spark cluster that accepts
     *         GCS connector settings
     */
    default boolean runsOnSparkCluster() {
        return false;
    }

    /**
     * @return libraries the type always needs, in payload form
     */
    default List<Map<String, Object>> requiredLibraries() {
        return List.of();
    }

    /**
     * @return the task's {@code filepath}
     * @throws PayloadException if the task has none
     */
    default String requireFilepath(TaskDefinition task) {
        return task.getFilepath()
                .filter(p -> !p.isBlank())
                .orElseThrow(() -> new PayloadException(getTaskType() + " task '" + task.getTaskName()
                        + "' requires 'filepath'"));
    }
}
