package com.workflowops.core.graph;

import com.workflowops.core.model.TaskDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed dependency graph of the tasks of one job.
 *
 * <p>
 * Nodes are task names; an edge {@code a -> b} means task {@code a} depends on
 * task {@code b}. Iteration follows declaration order everywhere, so the
 * topological order and the reported cycle are deterministic for a given
 * descriptor.
 * </p>
 *
 * <h3>Traversal</h3>
 * <p>
 * Depth-first search with three marks: unvisited, in progress (on the current
 * path) and done. Reaching an in-progress node closes a cycle; its members are
 * the path suffix starting at that node. A node is appended to the order when
 * it is done, i.e. after all of its dependencies.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaskGraph {

    private enum Mark {
        UNVISITED,
        IN_PROGRESS,
        DONE
    }

    private final Map<String, List<String>> dependencies;

    private TaskGraph(Map<String, List<String>> dependencies) {
        this.dependencies = dependencies;
    }

    /**
     * Build a graph from an adjacency map.
     *
     * @param dependencies task name to the names it depends on, in
     *                     declaration order; must not be {@code null}
     * @return the graph
     * @throws IllegalArgumentException if an edge points at an unknown node
     */
    public static TaskGraph of(Map<String, ? extends List<String>> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((node, deps) -> copy.put(node, List.copyOf(new LinkedHashSet<>(deps))));
        copy.forEach((node, deps) -> {
            for (String dep : deps) {
                if (!copy.containsKey(dep)) {
                    throw new IllegalArgumentException(
                            "Task '" + node + "' depends on unknown task '" + dep + "'");
                }
            }
        });
        return new TaskGraph(Collections.unmodifiableMap(copy));
    }

    /**
     * Build a graph from task definitions.
     *
     * @param tasks tasks with unique names whose dependencies all resolve
     * @return the graph
     * @throws IllegalArgumentException if a name repeats or a dependency does
     *                                  not resolve
     */
    public static TaskGraph fromTasks(List<TaskDefinition> tasks) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (TaskDefinition task : tasks) {
            if (adjacency.put(task.getTaskName(), task.getDependsOn()) != null) {
                throw new IllegalArgumentException("Duplicate task name: '" + task.getTaskName() + "'");
            }
        }
        return of(adjacency);
    }

    /**
     * @return task names in declaration order
     */
    public Set<String> nodes() {
        return dependencies.keySet();
    }

    /**
     * @param taskName a node of this graph
     * @return the tasks {@code taskName} depends on directly
     */
    public List<String> dependenciesOf(String taskName) {
        List<String> deps = dependencies.get(taskName);
        if (deps == null) {
            throw new IllegalArgumentException("Unknown task: '" + taskName + "'");
        }
        return deps;
    }

    /**
     * @param taskName a node of this graph
     * @return the tasks that depend directly on {@code taskName}, in
     *         declaration order
     */
    public List<String> dependentsOf(String taskName) {
        dependenciesOf(taskName);
        List<String> dependents = new ArrayList<>();
        dependencies.forEach((node, deps) -> {
            if (deps.contains(taskName)) {
                dependents.add(node);
            }
        });
        return Collections.unmodifiableList(dependents);
    }

    /**
     * Tasks with no dependencies, which can start as soon as the job does.
     *
     * @return root task names in declaration order
     */
    public List<String> roots() {
        return dependencies.entrySet().stream()
                .filter(e -> e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * @return the first cycle met by the traversal, members in path order
     *         (a self-loop yields a single member), or empty if acyclic
     */
    public Optional<List<String>> findCycle() {
        return Optional.ofNullable(traverse().cycle);
    }

    /**
     * @return every task name, each one after all of its dependencies
     * @throws CyclicDependencyException if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        Traversal result = traverse();
        if (result.cycle != null) {
            throw new CyclicDependencyException(result.cycle);
        }
        return result.order;
    }

    // ---------------------------------------------------------------
    // Depth-first traversal
    // ---------------------------------------------------------------

    private Traversal traverse() {
        Map<String, Mark> marks = new HashMap<>();
        List<String> path = new ArrayList<>();
        List<String> order = new ArrayList<>();

        for (String node : dependencies.keySet()) {
            if (marks.getOrDefault(node, Mark.UNVISITED) == Mark.UNVISITED) {
                List<String> cycle = visit(node, marks, path, order);
                if (cycle != null) {
                    return new Traversal(null, cycle);
                }
            }
        }
        return new Traversal(Collections.unmodifiableList(order), null);
    }

    private List<String> visit(String node, Map<String, Mark> marks, List<String> path, List<String> order) {
        marks.put(node, Mark.IN_PROGRESS);
        path.add(node);

        for (String dep : dependencies.get(node)) {
            Mark mark = marks.getOrDefault(dep, Mark.UNVISITED);
            if (mark == Mark.IN_PROGRESS) {
                return List.copyOf(path.subList(path.indexOf(dep), path.size()));
            }
            if (mark == Mark.UNVISITED) {
                List<String> cycle = visit(dep, marks, path, order);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.remove(path.size() - 1);
        marks.put(node, Mark.DONE);
        order.add(node);
        return null;
    }

    private static final class Traversal {
        private final List<String> order;
        private final List<String> cycle;

        private Traversal(List<String> order, List<String> cycle) {
            this.order = order;
            this.cycle = cycle;
        }
    }

    @Override
    public String toString() {
        return "TaskGraph" + dependencies;
    }
}
