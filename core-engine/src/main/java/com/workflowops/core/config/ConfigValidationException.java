package com.workflowops.core.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a structurally valid descriptor breaks a semantic rule:
 * duplicate task names, dangling or cyclic dependencies, malformed library
 * references, an invalid cron schedule, and so on.
 *
 * <p>
 * All violations of a document are collected before this exception is thrown,
 * so a single load reports every problem at once.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigValidationException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final List<Violation> violations;

    public ConfigValidationException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return unmodifiable list of violations, in discovery order
     */
    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * @param kind violation category
     * @return the violations of the given kind
     */
    public List<Violation> getViolations(Violation.Kind kind) {
        return violations.stream()
                .filter(v -> v.getKind() == kind)
                .toList();
    }

    private static String describe(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("At least one violation is required");
        }
        return "Workflow configuration validation failed:\n  - "
                + violations.stream().map(Violation::toString).collect(Collectors.joining("\n  - "));
    }
}
