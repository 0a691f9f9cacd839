package com.shipyard.orchestrator.statemachine;

import com.shipyard.orchestrator.model.PipelineState;

import java.util.UUID;

/**
 * Published inside the transaction that committed a transition.
 * Listeners that act on it use {@code @TransactionalEventListener} so they
 * only see committed transitions.
 */
public record PipelineTransitionedEvent(
        UUID          workflowId,
        String        projectId,
        String        workspaceId,
        PipelineState previousState,
        PipelineState newState,
        String        triggeredBy,
        String        storyId,
        String        agentId,
        long          version,
        String        errorMessage
) {}
