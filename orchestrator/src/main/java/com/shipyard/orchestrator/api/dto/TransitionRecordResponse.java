package com.shipyard.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.StateTransitionRecord;

import java.time.Instant;
import java.util.UUID;

/** One entry of GET /workflows/{id}/history. */
public record TransitionRecordResponse(
        long          id,
        UUID          workflowId,
        PipelineState previousState,
        PipelineState newState,
        String        triggeredBy,
        String        agentId,
        String        storyId,
        @JsonRawValue String metadata,
        String        errorMessage,
        long          version,
        String        requestId,
        Instant       occurredAt
) {
    public static TransitionRecordResponse from(StateTransitionRecord r) {
        return new TransitionRecordResponse(
                r.getId(),
                r.getWorkflowId(),
                r.getPreviousState(),
                r.getNewState(),
                r.getTriggeredBy(),
                r.getAgentId(),
                r.getStoryId(),
                r.getMetadata(),
                r.getErrorMessage(),
                r.getVersion(),
                r.getRequestId(),
                r.getOccurredAt()
        );
    }
}
