package com.shipyard.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.RecoveryStrategy;

import java.time.Instant;
import java.util.UUID;

/** One entry of GET /workflows/{id}/recovery-history. */
public record RecoveryRecordResponse(
        long             id,
        UUID             episodeId,
        String           storyId,
        String           sessionId,
        String           agentId,
        AgentType        agentType,
        FailureType      failureType,
        RecoveryStrategy recoveryStrategy,
        int              retryCount,
        String           checkpointRef,
        String           newSessionId,
        boolean          success,
        String           errorDetails,
        long             durationMs,
        @JsonRawValue String metadata,
        Instant          createdAt
) {
    public static RecoveryRecordResponse from(FailureRecoveryRecord r) {
        return new RecoveryRecordResponse(
                r.getId(),
                r.getEpisodeId(),
                r.getStoryId(),
                r.getSessionId(),
                r.getAgentId(),
                r.getAgentType(),
                r.getFailureType(),
                r.getRecoveryStrategy(),
                r.getRetryCount(),
                r.getCheckpointRef(),
                r.getNewSessionId(),
                r.isSuccess(),
                r.getErrorDetails(),
                r.getDurationMs(),
                r.getMetadata(),
                r.getCreatedAt()
        );
    }
}
