package com.shipyard.orchestrator.api.dto;

/**
 * Request body for POST /workflows.
 *
 * Required: projectId, workspaceId, actor
 * Optional: storyId, the first story to work on
 */
public record StartWorkflowRequest(String projectId, String workspaceId, String actor, String storyId) {

    public StartWorkflowRequest {
        if (projectId == null || projectId.isBlank())     throw new IllegalArgumentException("projectId is required");
        if (workspaceId == null || workspaceId.isBlank()) throw new IllegalArgumentException("workspaceId is required");
    }
}
