package com.workflowops.core.config;

/**
 * Raised when a descriptor is structurally malformed: invalid YAML, a node of
 * the wrong shape, or a missing required key ({@code job_name},
 * {@code schedule}, {@code tasks}, {@code task_name}).
 *
 * <p>
 * The {@linkplain #getPath() path} locates the offending node, e.g.
 * {@code workflow-api.tasks[1].task_name}. It is empty for failures that
 * concern the document as a whole.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigParseException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public ConfigParseException(String path, String message) {
        super(format(path, message));
        this.path = path == null ? "" : path;
    }

    public ConfigParseException(String path, String message, Throwable cause) {
        super(format(path, message), cause);
        this.path = path == null ? "" : path;
    }

    /**
     * @return dotted path of the offending node, or an empty string
     */
    public String getPath() {
        return path;
    }

    private static String format(String path, String message) {
        return (path == null || path.isEmpty()) ? message : path + ": " + message;
    }
}
