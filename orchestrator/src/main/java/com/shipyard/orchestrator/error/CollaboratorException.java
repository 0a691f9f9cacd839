package com.shipyard.orchestrator.error;

/**
 * Thrown when an external collaborator (agent runtime, version control,
 * notification service) returns an error or is unreachable.
 */
public class CollaboratorException extends OrchestrationException {

    private final int statusCode;

    public CollaboratorException(String message) {
        this(message, -1);
    }

    public CollaboratorException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the collaborator, or -1 if it was never reached. */
    public int statusCode() { return statusCode; }

    @Override
    public String code() { return "collaborator_error"; }
}
