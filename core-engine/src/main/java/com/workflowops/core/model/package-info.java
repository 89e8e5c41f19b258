/**
 * Immutable value objects describing a loaded workflow descriptor.
 *
 * <ul>
 * <li>{@link com.workflowops.core.model.JobDefinition}: a scheduled job with
 * its tasks and their execution order</li>
 * <li>{@link com.workflowops.core.model.TaskDefinition}: one task, defaults
 * already merged in</li>
 * <li>{@link com.workflowops.core.model.LibraryRef},
 * {@link com.workflowops.core.model.GcpConnection}: opaque references to
 * external collaborators</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.workflowops.core.model;
