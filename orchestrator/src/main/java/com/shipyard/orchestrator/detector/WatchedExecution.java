package com.shipyard.orchestrator.detector;

import com.shipyard.orchestrator.agent.ExecutionHandle;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.PipelineState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Everything needed to watch an agent execution and, if it fails, to
 * re-run it: who runs it, for which pipeline phase, and the context it was
 * started with.
 */
public record WatchedExecution(
        UUID                workflowId,
        String              projectId,
        String              workspaceId,
        String              storyId,
        String              agentId,
        AgentType           agentType,
        PipelineState       phase,
        ExecutionHandle     handle,
        Map<String, Object> context,
        Instant             startedAt
) {
    public WatchedExecution {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String sessionId() {
        return handle.sessionId();
    }

    public EpisodeKey episodeKey() {
        return new EpisodeKey(workflowId, storyId, agentId);
    }

    /** Same execution, now running under a new handle. */
    public WatchedExecution restartedAs(ExecutionHandle newHandle, Map<String, Object> newContext, Instant now) {
        return new WatchedExecution(workflowId, projectId, workspaceId, storyId, agentId,
                agentType, phase, newHandle, newContext, now);
    }
}
