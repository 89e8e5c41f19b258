package com.workflowops.core.config;

/**
 * Base type for every failure raised while loading a workflow descriptor.
 *
 * <p>
 * Loading is deterministic over static input, so none of these failures is
 * retryable: the same text always produces the same error.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ConfigException(String message) {
        super(message);
    }

    protected ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
