package com.shipyard.orchestrator.error;

import java.util.UUID;

public class WorkflowNotFoundException extends OrchestrationException {

    public WorkflowNotFoundException(UUID workflowId) {
        super("Workflow not found: " + workflowId);
    }

    @Override
    public String code() { return "workflow_not_found"; }
}
