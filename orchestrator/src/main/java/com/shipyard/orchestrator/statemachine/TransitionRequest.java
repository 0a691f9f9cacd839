package com.shipyard.orchestrator.statemachine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Who asks for a transition and with what context.
 *
 * @param actor           recorded as triggeredBy, e.g. "user:42" or "system:recovery"
 * @param agentId         agent now owning the pipeline, null to keep the current one
 * @param storyId         story now in flight, null to keep the current one
 * @param metadata        free-form context stored with the audit record
 * @param errorMessage    reason for FAILED/PAUSED transitions, may be null
 * @param expectedVersion version the caller last saw; a mismatch is a conflict. Null skips the check.
 * @param requestId       idempotency key; a replayed request returns the current pipeline unchanged
 */
public record TransitionRequest(
        String actor,
        String agentId,
        String storyId,
        Map<String, Object> metadata,
        String errorMessage,
        Long expectedVersion,
        String requestId
) {
    public TransitionRequest {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TransitionRequest by(String actor) {
        return new TransitionRequest(actor, null, null, Map.of(), null, null, null);
    }

    public TransitionRequest withAgent(String agentId, String storyId) {
        return new TransitionRequest(actor, agentId, storyId, metadata, errorMessage, expectedVersion, requestId);
    }

    public TransitionRequest withMetadata(Map<String, Object> extra) {
        return new TransitionRequest(actor, agentId, storyId, extra, errorMessage, expectedVersion, requestId);
    }

    public TransitionRequest withExpectedVersion(long version) {
        return new TransitionRequest(actor, agentId, storyId, metadata, errorMessage, version, requestId);
    }

    public TransitionRequest withError(String message) {
        return new TransitionRequest(actor, agentId, storyId, metadata, message, expectedVersion, requestId);
    }
}
