/**
 * Loading and validation of workflow descriptors.
 *
 * <p>
 * Descriptors are YAML documents loaded by
 * {@link com.workflowops.core.config.ConfigLoader} into a
 * {@link com.workflowops.core.config.WorkflowConfig}. Shared defaults are
 * merged into tasks by {@link com.workflowops.core.config.DefaultsMerger};
 * validation runs automatically after parsing so that invalid descriptors
 * fail fast with a {@link com.workflowops.core.config.ConfigParseException}
 * or a {@link com.workflowops.core.config.ConfigValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.workflowops.core.config;
