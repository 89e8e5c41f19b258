package com.workflowops.core.config;

import com.workflowops.core.graph.CyclicDependencyException;
import com.workflowops.core.graph.TaskGraph;
import com.workflowops.core.model.TaskDefinition;
import com.workflowops.core.schedule.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic checks over bound jobs. Every problem found is appended to the
 * shared violation list; nothing is thrown here.
 */
final class DescriptorValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptorValidator.class);

    private final List<Violation> violations;

    DescriptorValidator(List<Violation> violations) {
        this.violations = violations;
    }

    /**
     * Job names are global: two top-level keys must not declare the same
     * {@code job_name}.
     */
    void checkJobNames(List<DescriptorBinder.JobDraft> jobs) {
        Map<String, String> firstKeyByName = new HashMap<>();
        for (DescriptorBinder.JobDraft job : jobs) {
            String previous = firstKeyByName.putIfAbsent(job.jobName, job.key);
            if (previous != null) {
                violations.add(new Violation(Violation.Kind.DUPLICATE_JOB_NAME, job.key, job.jobName, List.of(),
                        "job_name '" + job.jobName + "' is already used by '" + previous + "'"));
            }
        }
    }

    /**
     * @return the execution order when the job's dependency graph is sound,
     *         otherwise empty
     */
    Optional<List<String>> validate(DescriptorBinder.JobDraft job) {
        Optional<String> cronProblem = CronSchedule.validate(job.schedule);
        cronProblem.ifPresent(problem -> add(Violation.Kind.INVALID_SCHEDULE, job, List.of(),
                "schedule '" + job.schedule + "' is not a valid cron expression: " + problem));

        if (job.tasks.isEmpty()) {
            add(Violation.Kind.EMPTY_JOB, job, List.of(), "job declares no tasks");
            return Optional.empty();
        }

        Set<String> duplicates = duplicateTaskNames(job);
        Set<String> names = new HashSet<>();
        job.tasks.forEach(t -> names.add(t.getTaskName()));

        boolean referencesResolve = true;
        for (TaskDefinition task : job.tasks) {
            Set<String> seen = new HashSet<>();
            for (String dep : task.getDependsOn()) {
                if (!seen.add(dep)) {
                    add(Violation.Kind.DUPLICATE_DEPENDENCY, job, List.of(task.getTaskName(), dep),
                            "task '" + task.getTaskName() + "' lists dependency '" + dep + "' more than once");
                }
                if (!names.contains(dep)) {
                    referencesResolve = false;
                    add(Violation.Kind.UNKNOWN_DEPENDENCY, job, List.of(task.getTaskName(), dep),
                            "task '" + task.getTaskName() + "' depends on unknown task '" + dep + "'");
                }
            }
        }

        // Cycle detection needs a graph keyed by unique, resolvable names.
        if (!duplicates.isEmpty() || !referencesResolve) {
            return Optional.empty();
        }

        TaskGraph graph = TaskGraph.fromTasks(job.tasks);
        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            add(Violation.Kind.DEPENDENCY_CYCLE, job, cycle.get(),
                    "dependency cycle " + CyclicDependencyException.describe(cycle.get()));
            return Optional.empty();
        }

        List<String> order = graph.topologicalOrder();
        LOG.debug("Job '{}' execution order: {}", job.key, order);
        return cronProblem.isPresent() ? Optional.empty() : Optional.of(order);
    }

    private Set<String> duplicateTaskNames(DescriptorBinder.JobDraft job) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TaskDefinition task : job.tasks) {
            counts.merge(task.getTaskName(), 1, Integer::sum);
        }
        Set<String> duplicates = new LinkedHashSet<>();
        counts.forEach((name, count) -> {
            if (count > 1) {
                duplicates.add(name);
                add(Violation.Kind.DUPLICATE_TASK_NAME, job, List.of(name),
                        "task_name '" + name + "' is declared " + count + " times");
            }
        });
        return duplicates;
    }

    private void add(Violation.Kind kind, DescriptorBinder.JobDraft job, List<String> taskNames, String message) {
        violations.add(new Violation(kind, job.key, job.jobName, taskNames, message));
    }
}
