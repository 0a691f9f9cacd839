package com.shipyard.orchestrator.agent;

import java.util.Map;

/**
 * The agent execution capability consumed by the orchestrator. Model
 * selection and the agents' actual work live behind this interface.
 */
public interface AgentRuntime {

    ExecutionHandle startExecution(String agentId, String storyId, Map<String, Object> context);

    ExecutionStatus getExecutionStatus(ExecutionHandle handle);

    void terminateExecution(ExecutionHandle handle);
}
