package com.shipyard.orchestrator.error;

import java.util.UUID;

/**
 * Another writer advanced the pipeline first. Re-read and retry.
 */
public class VersionConflictException extends OrchestrationException {

    private final UUID workflowId;

    public VersionConflictException(UUID workflowId, String detail) {
        super("Version conflict on workflow " + workflowId + ": " + detail);
        this.workflowId = workflowId;
    }

    public VersionConflictException(UUID workflowId, Throwable cause) {
        super("Version conflict on workflow " + workflowId + ": concurrent update", cause);
        this.workflowId = workflowId;
    }

    public UUID workflowId() { return workflowId; }

    @Override
    public String code() { return "version_conflict"; }
}
