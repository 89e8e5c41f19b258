/**
 * Job-settings payloads for the job cluster backend.
 *
 * <p>
 * Each {@link com.workflowops.core.model.TaskType} has a
 * {@link com.workflowops.core.payload.TaskPayloadBuilder}, created through
 * {@link com.workflowops.core.payload.PayloadBuilderFactory}:
 * </p>
 * <ul>
 * <li>{@link com.workflowops.core.payload.NotebookTaskPayloadBuilder}</li>
 * <li>{@link com.workflowops.core.payload.PythonTaskPayloadBuilder}</li>
 * <li>{@link com.workflowops.core.payload.SqlTaskPayloadBuilder}</li>
 * <li>{@link com.workflowops.core.payload.DbtTaskPayloadBuilder}</li>
 * </ul>
 * <p>
 * {@link com.workflowops.core.payload.JobSettingsAssembler} adds the fields
 * common to all tasks and wraps them in the job document. Payloads are plain
 * {@code Map}/{@code List} trees, ready for any JSON mapper.
 * </p>
 *
 * @since 1.0.0
 */
package com.workflowops.core.payload;
