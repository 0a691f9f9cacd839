package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.model.EpisodeKey;

/**
 * An operator's forced outcome for one episode.
 *
 * @param newAgentId agent to take over on REASSIGN; null keeps the current one
 * @param reason     free text; passed to the agent as guidance on PROVIDE_GUIDANCE
 */
public record OverrideCommand(
        EpisodeKey     key,
        OverrideAction action,
        String         operator,
        String         reason,
        String         newAgentId
) {
    public OverrideCommand {
        if (key == null || action == null) {
            throw new IllegalArgumentException("episode and action are required");
        }
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
    }
}
