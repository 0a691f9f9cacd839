package com.shipyard.orchestrator.error;

/**
 * Root of the orchestrator's error taxonomy.
 *
 * Unchecked so callers only catch what they have a recovery for; the web
 * layer maps each subtype to an HTTP status in {@code ApiExceptionHandler}.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code, e.g. "invalid_transition". */
    public abstract String code();
}
