package com.workflowops.core.payload;

import com.workflowops.core.model.TaskType;

import java.util.Objects;

/**
 * Creates the {@link TaskPayloadBuilder} for a {@link TaskType}.
 *
 * <p>
 * This is the single point of extension when adding new task types: add the
 * enum constant and map it to its builder here.
 * </p>
 *
 * @since 1.0.0
 */
public final class PayloadBuilderFactory {

    private PayloadBuilderFactory() {
    }

    /**
     * @param type the task type; must not be {@code null}
     * @return the builder for that type
     */
    public static TaskPayloadBuilder create(TaskType type) {
        Objects.requireNonNull(type, "TaskType must not be null");
        return switch (type) {
            case NOTEBOOK -> new NotebookTaskPayloadBuilder();
            case PYTHON -> new PythonTaskPayloadBuilder();
            case SQL -> new SqlTaskPayloadBuilder();
            case DBT -> new DbtTaskPayloadBuilder();
        };
    }
}
