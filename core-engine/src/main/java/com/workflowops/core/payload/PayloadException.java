package com.workflowops.core.payload;

/**
 * Raised when a loaded task cannot be turned into a job-settings payload,
 * e.g. because it has no {@code tasktype} or {@code filepath}, or its cluster
 * spec cannot be read.
 *
 * @since 1.0.0
 */
public class PayloadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PayloadException(String message) {
        super(message);
    }

    public PayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
