package com.workflowops.planner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded deployment state: the settings of every deployed job, keyed by
 * descriptor job key, with the backend {@code job_id} of each.
 *
 * <pre>
 * {"metadata": {"version": "1.3", "timestamp": "2024-07-01 03:00:00"},
 *  "config": {"workflow-api": {"name": ..., "job_id": 42}}}
 * </pre>
 *
 * @since 1.0.0
 */
public final class StateSnapshot {

    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final Metadata metadata;
    private final Map<String, Map<String, Object>> config;

    @JsonCreator
    public StateSnapshot(@JsonProperty("metadata") Metadata metadata,
                         @JsonProperty("config") Map<String, Map<String, Object>> config) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.config = config == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Map<String, Map<String, Object>> getConfig() {
        return config;
    }

    @JsonIgnore
    public String getVersion() {
        return metadata.getVersion();
    }

    /**
     * Snapshot header.
     */
    public static final class Metadata {

        private final String version;

        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TIMESTAMP_PATTERN)
        private final LocalDateTime timestamp;

        @JsonCreator
        public Metadata(@JsonProperty("version") String version,
                        @JsonProperty("timestamp") LocalDateTime timestamp) {
            if (!StateVersion.isValid(version)) {
                throw new IllegalArgumentException("Snapshot version must be 'major.minor', got: " + version);
            }
            this.version = version;
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        public String getVersion() {
            return version;
        }

        public LocalDateTime getTimestamp() {
            return timestamp;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Metadata that))
                return false;
            return version.equals(that.version) && timestamp.equals(that.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(version, timestamp);
        }

        @Override
        public String toString() {
            return "Metadata{version='" + version + "', timestamp=" + timestamp + '}';
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StateSnapshot that))
            return false;
        return metadata.equals(that.metadata) && config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, config);
    }

    @Override
    public String toString() {
        return "StateSnapshot{" + metadata + ", jobs=" + config.keySet() + '}';
    }
}
