package com.shipyard.orchestrator.statemachine;

import com.shipyard.orchestrator.config.RecoveryProperties;
import com.shipyard.orchestrator.error.VersionConflictException;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Re-read-and-retry loop for internal writers (facade, recovery engine).
 *
 * Each attempt reads the current pipeline, asks {@code decide} which state to
 * move to given that pipeline, and pins the write to the version it read.
 * A lost race re-reads and decides again, so a stale decision is never applied.
 */
@Component
public class TransitionRetrier {

    private static final Logger log = LoggerFactory.getLogger(TransitionRetrier.class);

    private final PipelineStateMachine stateMachine;
    private final int maxAttempts;

    public TransitionRetrier(PipelineStateMachine stateMachine, RecoveryProperties properties) {
        this.stateMachine = stateMachine;
        this.maxAttempts  = Math.max(1, properties.getTransitionAttempts());
    }

    /**
     * @param decide maps the freshly read pipeline to a target, or empty to do nothing
     * @return the pipeline after the transition, or empty if {@code decide} declined
     * @throws VersionConflictException if every attempt lost the race
     */
    public Optional<Pipeline> transition(UUID workflowId,
                                         Function<Pipeline, Optional<PipelineState>> decide,
                                         TransitionRequest request) {
        VersionConflictException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Pipeline current = stateMachine.getCurrentState(workflowId);
            Optional<PipelineState> target = decide.apply(current);
            if (target.isEmpty()) {
                log.debug("Workflow {}: no transition needed from {}", workflowId, current.getState());
                return Optional.empty();
            }
            try {
                return Optional.of(stateMachine.transition(workflowId, target.get(),
                        request.withExpectedVersion(current.versionOrZero())));
            } catch (VersionConflictException e) {
                last = e;
                log.debug("Workflow {}: lost race on attempt {}/{}, re-reading", workflowId, attempt, maxAttempts);
            }
        }
        throw last;
    }

    /** Move to a fixed target if it is still legal from whatever state the pipeline is in. */
    public Optional<Pipeline> transitionIfLegal(UUID workflowId, PipelineState target, TransitionRequest request) {
        return transition(workflowId, p -> {
            boolean legal = !p.getState().isTerminal()
                    && PipelineTransitions.isEdge(p.getState(), target)
                    && (p.getState() != PipelineState.PAUSED || p.getPausedFrom() == target);
            return legal ? Optional.of(target) : Optional.empty();
        }, request);
    }
}
