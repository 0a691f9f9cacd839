package com.shipyard.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Opaque reference to one running agent execution, as returned by the runtime.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionHandle(String sessionId, String agentId, String storyId) {}
