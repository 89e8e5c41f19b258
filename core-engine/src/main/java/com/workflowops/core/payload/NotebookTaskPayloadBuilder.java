package com.workflowops.core.payload;

import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notebook tasks: runs the notebook at {@code filepath}, sourced from Git.
 *
 * @since 1.0.0
 */
public class NotebookTaskPayloadBuilder implements TaskPayloadBuilder {

    @Override
    public TaskType getTaskType() {
        return TaskType.NOTEBOOK;
    }

    @Override
    public Map<String, Object> buildTaskSection(TaskDefinition task, PayloadSettings settings) {
        Map<String, Object> notebook = new LinkedHashMap<>();
        notebook.put("notebook_path", requireFilepath(task));
        notebook.put("source", "GIT");

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("notebook_task", notebook);
        return section;
    }

    @Override
    public boolean runsOnSparkCluster() {
        return true;
    }
}
