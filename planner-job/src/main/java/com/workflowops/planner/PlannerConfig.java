package com.workflowops.planner;

import com.workflowops.core.config.ConfigLoader;
import com.workflowops.core.payload.PayloadSettings;

import java.util.Locale;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the workflow planner.
 *
 * <p>
 * Values are resolved from environment variables with defaults matching the
 * deployment conventions of the job cluster backend, so the planner can run
 * unchanged from a CI step or a shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class PlannerConfig {

    // ---------------------------------------------------------------
    // Descriptor
    // ---------------------------------------------------------------
    private final String configPath;
    private final String jobKeyPrefix;
    private final String clusterConfigDir;

    // ---------------------------------------------------------------
    // State
    // ---------------------------------------------------------------
    private final String stateDir;
    private final boolean recordState;

    // ---------------------------------------------------------------
    // Payload
    // ---------------------------------------------------------------
    private final PayloadSettings payloadSettings;

    private PlannerConfig(Builder b, PayloadSettings payloadSettings) {
        this.configPath = b.configPath;
        this.jobKeyPrefix = b.jobKeyPrefix;
        this.clusterConfigDir = b.clusterConfigDir;
        this.stateDir = b.stateDir;
        this.recordState = b.recordState;
        this.payloadSettings = payloadSettings;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link PlannerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static PlannerConfig fromEnvironment() {
        try {
            return new Builder()
                    .configPath(env(ConfigLoader.ENV_CONFIG_PATH, ""))
                    .jobKeyPrefix(env("WORKFLOW_JOB_PREFIX", ConfigLoader.DEFAULT_JOB_KEY_PREFIX))
                    .clusterConfigDir(env("WORKFLOW_CLUSTER_CONFIG_DIR", "."))
                    .stateDir(env("WORKFLOW_STATE_DIR", "state"))
                    .recordState(parseBooleanEnv("WORKFLOW_RECORD_STATE", "false"))
                    .timezoneId(env("WORKFLOW_TIMEZONE", "Europe/London"))
                    .maxConcurrentRuns(parseIntEnv("WORKFLOW_MAX_CONCURRENT_RUNS", "1"))
                    .aclGroupName(env("WORKFLOW_ACL_GROUP", "Uk"))
                    .aclPermissionLevel(env("WORKFLOW_ACL_PERMISSION", "CAN_MANAGE"))
                    .sqlWarehouseId(env("WORKFLOW_SQL_WAREHOUSE_ID", "warehouse_id"))
                    .secretScope(env("WORKFLOW_SECRET_SCOPE", "scope"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return descriptor path, or an empty string to use the classpath
     *         default
     */
    public String getConfigPath() {
        return configPath;
    }

    public String getJobKeyPrefix() {
        return jobKeyPrefix;
    }

    public String getClusterConfigDir() {
        return clusterConfigDir;
    }

    public String getStateDir() {
        return stateDir;
    }

    public boolean isRecordState() {
        return recordState;
    }

    public PayloadSettings getPayloadSettings() {
        return payloadSettings;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PlannerConfig}.
     *
     * <p>
     * Payload values are validated by {@link PayloadSettings.Builder}; the
     * remaining directories must not be blank.
     * </p>
     */
    public static class Builder {
        private String configPath = "";
        private String jobKeyPrefix = ConfigLoader.DEFAULT_JOB_KEY_PREFIX;
        private String clusterConfigDir = ".";
        private String stateDir = "state";
        private boolean recordState = false;
        private final PayloadSettings.Builder payload = PayloadSettings.builder();

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder jobKeyPrefix(String v) {
            this.jobKeyPrefix = v;
            return this;
        }

        public Builder clusterConfigDir(String v) {
            this.clusterConfigDir = v;
            return this;
        }

        public Builder stateDir(String v) {
            this.stateDir = v;
            return this;
        }

        public Builder recordState(boolean v) {
            this.recordState = v;
            return this;
        }

        public Builder timezoneId(String v) {
            payload.timezoneId(v);
            return this;
        }

        public Builder maxConcurrentRuns(int v) {
            payload.maxConcurrentRuns(v);
            return this;
        }

        public Builder aclGroupName(String v) {
            payload.aclGroupName(v);
            return this;
        }

        public Builder aclPermissionLevel(String v) {
            payload.aclPermissionLevel(v);
            return this;
        }

        public Builder sqlWarehouseId(String v) {
            payload.sqlWarehouseId(v);
            return this;
        }

        public Builder secretScope(String v) {
            payload.secretScope(v);
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link PlannerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PlannerConfig build() {
            Objects.requireNonNull(configPath, "configPath required");
            Objects.requireNonNull(jobKeyPrefix, "jobKeyPrefix required");
            requireNonBlank(clusterConfigDir, "clusterConfigDir");
            requireNonBlank(stateDir, "stateDir");
            return new PlannerConfig(this, payload.build());
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    static boolean parseBoolean(String name, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalStateException(
                    "Environment variable " + name + " must be 'true' or 'false', got: " + value);
        };
    }

    private static boolean parseBooleanEnv(String name, String defaultValue) {
        return parseBoolean(name, env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "PlannerConfig{" +
                "configPath='" + configPath + '\'' +
                ", jobKeyPrefix='" + jobKeyPrefix + '\'' +
                ", clusterConfigDir='" + clusterConfigDir + '\'' +
                ", stateDir='" + stateDir + '\'' +
                ", recordState=" + recordState +
                ", payloadSettings=" + payloadSettings +
                '}';
    }
}
