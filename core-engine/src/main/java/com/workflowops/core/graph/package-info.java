/**
 * Task dependency graph: cycle detection and execution order.
 *
 * @since 1.0.0
 */
package com.workflowops.core.graph;
