package com.quoteflow.runtime;

/**
 * Raised when an external collaborator (LLM or embedding service) cannot serve a request.
 * Callers degrade instead of aborting the run.
 */
public class ServiceUnavailableException extends RuntimeException {
    private final boolean transientFailure;

    public ServiceUnavailableException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ServiceUnavailableException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
