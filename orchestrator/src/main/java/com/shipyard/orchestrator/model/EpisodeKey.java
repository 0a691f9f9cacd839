package com.shipyard.orchestrator.model;

import java.util.Objects;
import java.util.UUID;

/** Identity of a failure episode: one agent's work on one story in one workflow. */
public record EpisodeKey(UUID workflowId, String storyId, String agentId) {

    public EpisodeKey {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(storyId, "storyId");
        Objects.requireNonNull(agentId, "agentId");
    }

    @Override
    public String toString() {
        return workflowId + "/" + storyId + "/" + agentId;
    }
}
