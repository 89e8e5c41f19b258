package com.workflowops.planner;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of {@link PlannedChange}s: jobs of the descriptor in
 * declaration order, then deleted jobs in recorded order.
 *
 * @since 1.0.0
 */
public final class DeploymentPlan {

    private final List<PlannedChange> changes;

    public DeploymentPlan(List<PlannedChange> changes) {
        this.changes = List.copyOf(changes);
    }

    public List<PlannedChange> getChanges() {
        return changes;
    }

    public List<PlannedChange> getChanges(PlannedChange.Action action) {
        return changes.stream().filter(c -> c.getAction() == action).toList();
    }

    /**
     * @return number of jobs per action, every action present
     */
    public Map<PlannedChange.Action, Integer> getSummary() {
        Map<PlannedChange.Action, Integer> summary = new EnumMap<>(PlannedChange.Action.class);
        for (PlannedChange.Action action : PlannedChange.Action.values()) {
            summary.put(action, 0);
        }
        changes.forEach(c -> summary.merge(c.getAction(), 1, Integer::sum));
        return summary;
    }

    @JsonIgnore
    public boolean hasChanges() {
        return changes.stream().anyMatch(c -> c.getAction() != PlannedChange.Action.UNCHANGED);
    }

    /**
     * State to record once the plan is applied: desired settings of every
     * remaining job, with the recorded {@code job_id} carried over
     * ({@code null} for jobs still to be created).
     */
    public Map<String, Map<String, Object>> toSnapshotConfig() {
        Map<String, Map<String, Object>> config = new LinkedHashMap<>();
        for (PlannedChange change : changes) {
            if (change.getAction() == PlannedChange.Action.DELETE) {
                continue;
            }
            Map<String, Object> settings = new LinkedHashMap<>(change.getSettings());
            settings.put(DeploymentPlanner.JOB_ID, change.getJobId());
            config.put(change.getJobKey(), settings);
        }
        return config;
    }

    @Override
    public String toString() {
        return "DeploymentPlan" + getSummary();
    }
}
