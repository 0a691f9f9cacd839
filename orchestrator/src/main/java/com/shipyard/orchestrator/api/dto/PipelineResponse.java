package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;

import java.time.Instant;
import java.util.UUID;

/**
 * The live pipeline row as returned by every workflow endpoint.
 * Clients echo {@code version} back as expectedVersion.
 */
public record PipelineResponse(
        UUID          workflowId,
        String        projectId,
        String        workspaceId,
        PipelineState state,
        PipelineState pausedFrom,
        String        currentStoryId,
        String        currentAgentId,
        Instant       enteredStateAt,
        long          version,
        Instant       createdAt,
        Instant       updatedAt
) {
    public static PipelineResponse from(Pipeline p) {
        return new PipelineResponse(
                p.getWorkflowId(),
                p.getProjectId(),
                p.getWorkspaceId(),
                p.getState(),
                p.getPausedFrom(),
                p.getCurrentStoryId(),
                p.getCurrentAgentId(),
                p.getEnteredStateAt(),
                p.versionOrZero(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
