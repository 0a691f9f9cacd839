package com.shipyard.orchestrator.error;

/**
 * Rolling back to a checkpoint failed. Treated as a crash of the recovery
 * attempt itself, which forces escalation instead of another retry.
 */
public class RestoreFailedException extends OrchestrationException {

    private final String ref;

    public RestoreFailedException(String ref, Throwable cause) {
        super("Restore to checkpoint '" + ref + "' failed: " + cause.getMessage(), cause);
        this.ref = ref;
    }

    public String ref() { return ref; }

    @Override
    public String code() { return "restore_failed"; }
}
