package com.workflowops.core.payload;

import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Python tasks: runs the script at {@code filepath} with the task's
 * {@code parameters}, sourced from Git.
 *
 * @since 1.0.0
 */
public class PythonTaskPayloadBuilder implements TaskPayloadBuilder {

    @Override
    public TaskType getTaskType() {
        return TaskType.PYTHON;
    }

    @Override
    public Map<String, Object> buildTaskSection(TaskDefinition task, PayloadSettings settings) {
        Map<String, Object> python = new LinkedHashMap<>();
        python.put("python_file", requireFilepath(task));
        python.put("parameters", new ArrayList<>(task.getParameters()));
        python.put("source", "GIT");

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("spark_python_task", python);
        return section;
    }

    @Override
    public boolean runsOnSparkCluster() {
        return true;
    }
}
