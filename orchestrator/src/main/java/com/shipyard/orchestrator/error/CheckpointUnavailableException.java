package com.shipyard.orchestrator.error;

/**
 * No checkpoint exists for the story. The policy downgrades
 * CHECKPOINT_RECOVERY to CONTEXT_REFRESH when it sees this.
 */
public class CheckpointUnavailableException extends OrchestrationException {

    public CheckpointUnavailableException(String projectId, String storyId) {
        super("No checkpoint recorded for project " + projectId + ", story " + storyId);
    }

    @Override
    public String code() { return "checkpoint_unavailable"; }
}
