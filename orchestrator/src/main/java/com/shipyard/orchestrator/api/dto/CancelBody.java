package com.shipyard.orchestrator.api.dto;

/** Request body for POST /workflows/{id}/recovery/cancel. */
public record CancelBody(String storyId, String agentId, String operator) {

    public CancelBody {
        if (storyId == null || agentId == null) {
            throw new IllegalArgumentException("storyId and agentId are required");
        }
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
    }
}
