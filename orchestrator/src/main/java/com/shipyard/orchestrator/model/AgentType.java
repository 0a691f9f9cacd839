package com.shipyard.orchestrator.model;

/**
 * Worker agent roles and the pipeline phase each one owns.
 */
public enum AgentType {
    PLANNER(PipelineState.PLANNING),
    DEV(PipelineState.IMPLEMENTING),
    QA(PipelineState.QA),
    DEVOPS(PipelineState.DEPLOYING);

    private final PipelineState phase;

    AgentType(PipelineState phase) {
        this.phase = phase;
    }

    public PipelineState phase() {
        return phase;
    }

    /** The agent role responsible for a working state, or null for non-working states. */
    public static AgentType forPhase(PipelineState state) {
        for (AgentType type : values()) {
            if (type.phase == state) return type;
        }
        return null;
    }
}
