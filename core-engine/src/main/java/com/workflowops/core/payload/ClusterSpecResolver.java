package com.workflowops.core.payload;

import java.util.Map;

/**
 * Resolves a task's {@code cluster_config_path} to the cluster spec embedded
 * as {@code new_cluster} in its payload.
 *
 * <p>
 * The core never reads cluster specs itself; the application decides where
 * they live.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClusterSpecResolver {

    /** Resolver for descriptors whose tasks carry no cluster spec. */
    ClusterSpecResolver NONE = path -> Map.of();

    /**
     * @param clusterConfigPath the path declared by the task
     * @return the cluster spec as a JSON-like tree
     * @throws PayloadException if the spec cannot be resolved
     */
    Map<String, Object> resolve(String clusterConfigPath);
}
