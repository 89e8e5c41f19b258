package com.workflowops.core.payload;

import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.model.TaskType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL tasks: runs the SQL file at {@code filepath} on the configured
 * warehouse.
 *
 * @since 1.0.0
 */
public class SqlTaskPayloadBuilder implements TaskPayloadBuilder {

    @Override
    public TaskType getTaskType() {
        return TaskType.SQL;
    }

    @Override
    public Map<String, Object> buildTaskSection(TaskDefinition task, PayloadSettings settings) {
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("path", requireFilepath(task));

        Map<String, Object> sql = new LinkedHashMap<>();
        sql.put("file", file);
        sql.put("warehouse_id", settings.getSqlWarehouseId());

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("sql_task", sql);
        return section;
    }
}
