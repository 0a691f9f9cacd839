package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.model.EpisodeStatus;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.RecoveryEpisode;

import java.time.Instant;
import java.util.UUID;

/** An open or escalated episode, as listed by GET /workflows/{id}/recovery-status. */
public record EpisodeResponse(
        UUID          episodeId,
        String        storyId,
        String        agentId,
        EpisodeStatus status,
        int           retryCount,
        int           stuckCount,
        int           contextRefreshCount,
        boolean       checkpointRecoveryUsed,
        FailureType   lastFailureType,
        Instant       openedAt,
        Instant       lastFailureAt
) {
    public static EpisodeResponse from(RecoveryEpisode e) {
        return new EpisodeResponse(
                e.getId(),
                e.getStoryId(),
                e.getAgentId(),
                e.getStatus(),
                e.getRetryCount(),
                e.getStuckCount(),
                e.getContextRefreshCount(),
                e.isCheckpointRecoveryUsed(),
                e.getLastFailureType(),
                e.getOpenedAt(),
                e.getLastFailureAt()
        );
    }
}
