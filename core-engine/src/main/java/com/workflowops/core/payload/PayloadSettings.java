package com.workflowops.core.payload;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Deployment-wide values written into every job-settings payload.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}; {@link Builder#build()}
 * validates the values.
 * </p>
 *
 * @since 1.0.0
 */
public final class PayloadSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String timezoneId;
    private final int maxConcurrentRuns;
    private final String aclGroupName;
    private final String aclPermissionLevel;
    private final String sqlWarehouseId;
    private final String secretScope;
    private final String pauseStatus;

    private PayloadSettings(Builder b) {
        this.timezoneId = b.timezoneId;
        this.maxConcurrentRuns = b.maxConcurrentRuns;
        this.aclGroupName = b.aclGroupName;
        this.aclPermissionLevel = b.aclPermissionLevel;
        this.sqlWarehouseId = b.sqlWarehouseId;
        this.secretScope = b.secretScope;
        this.pauseStatus = b.pauseStatus;
    }

    public static PayloadSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTimezoneId() {
        return timezoneId;
    }

    public int getMaxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public String getAclGroupName() {
        return aclGroupName;
    }

    public String getAclPermissionLevel() {
        return aclPermissionLevel;
    }

    public String getSqlWarehouseId() {
        return sqlWarehouseId;
    }

    public String getSecretScope() {
        return secretScope;
    }

    public String getPauseStatus() {
        return pauseStatus;
    }

    /**
     * Fluent builder for {@link PayloadSettings}.
     */
    public static class Builder {
        private String timezoneId = "Europe/London";
        private int maxConcurrentRuns = 1;
        private String aclGroupName = "Uk";
        private String aclPermissionLevel = "CAN_MANAGE";
        private String sqlWarehouseId = "warehouse_id";
        private String secretScope = "scope";
        private String pauseStatus = "UNPAUSED";

        public Builder timezoneId(String v) {
            this.timezoneId = v;
            return this;
        }

        public Builder maxConcurrentRuns(int v) {
            this.maxConcurrentRuns = v;
            return this;
        }

        public Builder aclGroupName(String v) {
            this.aclGroupName = v;
            return this;
        }

        public Builder aclPermissionLevel(String v) {
            this.aclPermissionLevel = v;
            return this;
        }

        public Builder sqlWarehouseId(String v) {
            this.sqlWarehouseId = v;
            return this;
        }

        public Builder secretScope(String v) {
            this.secretScope = v;
            return this;
        }

        public Builder pauseStatus(String v) {
            this.pauseStatus = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if a value is blank or out of range
         */
        public PayloadSettings build() {
            requireNonBlank(timezoneId, "timezoneId");
            requireNonBlank(aclGroupName, "aclGroupName");
            requireNonBlank(aclPermissionLevel, "aclPermissionLevel");
            requireNonBlank(sqlWarehouseId, "sqlWarehouseId");
            requireNonBlank(secretScope, "secretScope");
            requireNonBlank(pauseStatus, "pauseStatus");
            try {
                ZoneId.of(timezoneId);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("timezoneId is not a valid zone: " + timezoneId, e);
            }
            if (maxConcurrentRuns < 1) {
                throw new IllegalArgumentException("maxConcurrentRuns must be >= 1, got: " + maxConcurrentRuns);
            }
            return new PayloadSettings(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PayloadSettings that))
            return false;
        return maxConcurrentRuns == that.maxConcurrentRuns
                && timezoneId.equals(that.timezoneId)
                && aclGroupName.equals(that.aclGroupName)
                && aclPermissionLevel.equals(that.aclPermissionLevel)
                && sqlWarehouseId.equals(that.sqlWarehouseId)
                && secretScope.equals(that.secretScope)
                && pauseStatus.equals(that.pauseStatus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timezoneId, maxConcurrentRuns, aclGroupName, aclPermissionLevel, sqlWarehouseId,
                secretScope, pauseStatus);
    }

    @Override
    public String toString() {
        return "PayloadSettings{" +
                "timezoneId='" + timezoneId + '\'' +
                ", maxConcurrentRuns=" + maxConcurrentRuns +
                ", aclGroupName='" + aclGroupName + '\'' +
                ", aclPermissionLevel='" + aclPermissionLevel + '\'' +
                ", sqlWarehouseId='" + sqlWarehouseId + '\'' +
                ", secretScope='" + secretScope + '\'' +
                ", pauseStatus='" + pauseStatus + '\'' +
                '}';
    }
}
