package com.shipyard.orchestrator.statemachine;

import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;

import java.time.Instant;
import java.util.UUID;

/**
 * Pipeline fields recomputed from the transition log alone.
 */
public record PipelineView(
        UUID          workflowId,
        PipelineState state,
        PipelineState pausedFrom,
        String        currentStoryId,
        String        currentAgentId,
        long          version,
        Instant       enteredStateAt
) {
    /** True when the live row agrees with what the log says. */
    public boolean matches(Pipeline live) {
        return live.getState() == state
                && live.versionOrZero() == version
                && live.getPausedFrom() == pausedFrom;
    }
}
