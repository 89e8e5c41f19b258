package com.workflowops.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Kind of work a task runs on the job cluster backend.
 *
 * @since 1.0.0
 */
public enum TaskType {

    NOTEBOOK,
    PYTHON,
    SQL,
    DBT;

    /**
     * Resolve a descriptor value, ignoring case.
     *
     * @param value the {@code tasktype} value; may be {@code null}
     * @return the matching type, or empty if unknown
     */
    public static Optional<TaskType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalised))
                .findFirst();
    }

    /**
     * @return comma-separated list of supported type names
     */
    public static String supportedValues() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
