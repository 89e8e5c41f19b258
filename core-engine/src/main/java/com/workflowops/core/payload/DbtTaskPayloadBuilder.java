package com.workflowops.core.payload;

import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * dbt tasks: runs the task's {@code commands} in the project directory at
 * {@code filepath}. The dbt adapter is always installed.
 *
 * @since 1.0.0
 */
public class DbtTaskPayloadBuilder implements TaskPayloadBuilder {

    static final String DBT_ADAPTER_REQUIREMENT = "dbt-databricks>=1.0.0,<2.0.0";

    @Override
    public TaskType getTaskType() {
        return TaskType.DBT;
    }

    @Override
    public Map<String, Object> buildTaskSection(TaskDefinition task, PayloadSettings settings) {
        Map<String, Object> dbt = new LinkedHashMap<>();
        dbt.put("project_directory", requireFilepath(task));
        dbt.put("commands", new ArrayList<>(task.getCommands()));
        dbt.put("warehouse_id", settings.getSqlWarehouseId());

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("dbt_task", dbt);
        return section;
    }

    @Override
    public List<Map<String, Object>> requiredLibraries() {
        Map<String, Object> pypi = new LinkedHashMap<>();
        pypi.put("package", DBT_ADAPTER_REQUIREMENT);
        Map<String, Object> library = new LinkedHashMap<>();
        library.put("pypi", pypi);
        return List.of(library);
    }
}
