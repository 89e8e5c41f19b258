/**
 * Command-line planner that turns a workflow descriptor into job-settings
 * documents and diffs them against the recorded deployment state.
 *
 * <p>
 * Entry point: {@link com.workflowops.planner.WorkflowPlannerJob}.
 * </p>
 */
package com.workflowops.planner;
