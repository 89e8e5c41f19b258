package com.workflowops.planner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares desired job settings with recorded state.
 *
 * <p>
 * Desired settings are passed through the JSON mapper before comparison so
 * that they have the same value types as settings read back from a state
 * file. The recorded {@value #JOB_ID} is ignored when comparing.
 * </p>
 *
 * @since 1.0.0
 */
public class DeploymentPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentPlanner.class);

    /** Backend job id stored next to the settings of a deployed job. */
    public static final String JOB_ID = "job_id";

    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public DeploymentPlanner(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @param desired  job settings assembled from the descriptor, keyed by job
     *                 key
     * @param recorded job settings from the current snapshot, keyed by job key
     * @return the plan
     */
    public DeploymentPlan plan(Map<String, Map<String, Object>> desired,
                               Map<String, Map<String, Object>> recorded) {
        Objects.requireNonNull(desired, "desired must not be null");
        Objects.requireNonNull(recorded, "recorded must not be null");

        List<PlannedChange> changes = new ArrayList<>();
        desired.forEach((key, settings) -> {
            Map<String, Object> normalised = mapper.convertValue(settings, SETTINGS_TYPE);
            Map<String, Object> previous = recorded.get(key);
            if (previous == null) {
                changes.add(new PlannedChange(key, PlannedChange.Action.CREATE, null, normalised));
                return;
            }
            Long jobId = jobId(previous);
            Map<String, Object> comparable = new LinkedHashMap<>(previous);
            comparable.remove(JOB_ID);
            PlannedChange.Action action = comparable.equals(normalised)
                    ? PlannedChange.Action.UNCHANGED
                    : PlannedChange.Action.UPDATE;
            LOG.debug("Job '{}' ({}): {}", key, jobId, action);
            changes.add(new PlannedChange(key, action, jobId, normalised));
        });
        recorded.forEach((key, previous) -> {
            if (!desired.containsKey(key)) {
                changes.add(new PlannedChange(key, PlannedChange.Action.DELETE, jobId(previous), null));
            }
        });

        DeploymentPlan plan = new DeploymentPlan(changes);
        LOG.info("Planned {}", plan.getSummary());
        return plan;
    }

    // A state file may record a job as null.
    private static Long jobId(Map<String, Object> recorded) {
        if (recorded == null) {
            return null;
        }
        Object id = recorded.get(JOB_ID);
        if (id == null) {
            return null;
        }
        if (id instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(id.toString());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Recorded job_id is not a number: " + id, e);
        }
    }
}
