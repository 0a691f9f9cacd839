package com.shipyard.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.http.CollaboratorHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP client for the agent runtime service.
 *
 *   POST   /executions               start an execution
 *   GET    /executions/{sessionId}   poll its status
 *   DELETE /executions/{sessionId}   terminate it
 *
 * Called from the detector's poll thread and the recovery workers, so
 * blocking I/O is acceptable here.
 */
@Component
public class HttpAgentRuntime extends CollaboratorHttpClient implements AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentRuntime.class);

    public HttpAgentRuntime(@Value("${shipyard.agent-runtime.base-url}") String baseUrl,
                            ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
    }

    @Override
    public ExecutionHandle startExecution(String agentId, String storyId, Map<String, Object> context) {
        log.info("Starting execution for agent '{}' on story '{}'", agentId, storyId);
        Map<String, Object> body = new HashMap<>();
        body.put("agent_id", agentId);
        body.put("story_id", storyId);
        body.put("context",  context);
        String resp = post("/executions", body, "startExecution for " + agentId);
        return parse(resp, ExecutionHandle.class, "startExecution");
    }

    @Override
    public ExecutionStatus getExecutionStatus(ExecutionHandle handle) {
        String resp = get("/executions/" + handle.sessionId(), "getExecutionStatus for " + handle.sessionId());
        return parse(resp, ExecutionStatus.class, "getExecutionStatus");
    }

    @Override
    public void terminateExecution(ExecutionHandle handle) {
        log.info("Terminating execution '{}'", handle.sessionId());
        delete("/executions/" + handle.sessionId(), "terminateExecution for " + handle.sessionId());
    }
}
