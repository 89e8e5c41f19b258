package com.workflowops.core.graph;

import java.util.List;

/**
 * Thrown when a topological order is requested from a graph with a cycle.
 *
 * @since 1.0.0
 */
public class CyclicDependencyException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Dependency cycle: " + describe(cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * @return cycle members in traversal order
     */
    public List<String> getCycle() {
        return cycle;
    }

    /**
     * Render a cycle as a closed chain, e.g. {@code a -> b -> a}.
     *
     * @param cycle cycle members in traversal order; must not be empty
     * @return printable chain
     */
    public static String describe(List<String> cycle) {
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
