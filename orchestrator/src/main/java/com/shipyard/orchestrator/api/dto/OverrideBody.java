package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.recovery.OverrideAction;
import com.shipyard.orchestrator.recovery.OverrideCommand;

import java.util.UUID;

/**
 * Request body for POST /workflows/{id}/recovery/override.
 *
 * action: TERMINATE | REASSIGN | PROVIDE_GUIDANCE
 */
public record OverrideBody(String storyId, String agentId, OverrideAction action,
                           String operator, String reason, String newAgentId) {

    public OverrideCommand toCommand(UUID workflowId) {
        if (storyId == null || agentId == null) {
            throw new IllegalArgumentException("storyId and agentId are required");
        }
        return new OverrideCommand(new EpisodeKey(workflowId, storyId, agentId), action, operator, reason, newAgentId);
    }
}
