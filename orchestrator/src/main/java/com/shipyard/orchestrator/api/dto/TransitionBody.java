package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.statemachine.TransitionRequest;

import java.util.Map;

/**
 * Request body for POST /workflows/{id}/transition.
 *
 * expectedVersion turns the call into a compare-and-set; requestId makes a
 * retried call safe to replay.
 */
public record TransitionBody(
        PipelineState       targetState,
        String              actor,
        Long                expectedVersion,
        String              requestId,
        String              agentId,
        String              storyId,
        Map<String, Object> context
) {
    public TransitionBody {
        if (targetState == null) throw new IllegalArgumentException("targetState is required");
    }

    public TransitionRequest toRequest() {
        String error = context != null && context.get("reason") instanceof String reason ? reason : null;
        return new TransitionRequest(actor, agentId, storyId, context, error, expectedVersion, requestId);
    }
}
