package com.shipyard.orchestrator.error;

import com.shipyard.orchestrator.model.PipelineState;

import java.util.UUID;

/** A project may only have one non-terminal pipeline at a time. */
public class PipelineAlreadyActiveException extends OrchestrationException {

    public PipelineAlreadyActiveException(String projectId, UUID workflowId, PipelineState state) {
        super("An active pipeline already exists for project %s (workflow %s, state %s)"
                .formatted(projectId, workflowId, state));
    }

    @Override
    public String code() { return "pipeline_already_active"; }
}
