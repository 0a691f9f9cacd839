package com.shipyard.orchestrator.error;

import com.shipyard.orchestrator.model.PipelineState;

/** Illegal edge requested. Nothing was written. */
public class InvalidTransitionException extends OrchestrationException {

    private final PipelineState from;
    private final PipelineState to;

    public InvalidTransitionException(PipelineState from, PipelineState to) {
        super("Invalid state transition: %s → %s".formatted(from, to));
        this.from = from;
        this.to   = to;
    }

    public InvalidTransitionException(PipelineState from, PipelineState to, String reason) {
        super("Invalid state transition: %s → %s (%s)".formatted(from, to, reason));
        this.from = from;
        this.to   = to;
    }

    public PipelineState from() { return from; }
    public PipelineState to()   { return to; }

    @Override
    public String code() { return "invalid_transition"; }
}
