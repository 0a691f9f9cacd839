package com.shipyard.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a delivery pipeline.
 *
 * Happy path:
 *   IDLE → PLANNING → IMPLEMENTING → QA → DEPLOYING → COMPLETE
 *
 * QA can send work back to IMPLEMENTING (rework). Every working state can
 * move to PAUSED or FAILED; PAUSED only returns to the state it came from.
 * The legal edges themselves live in {@code PipelineTransitions}.
 */
public enum PipelineState {
    IDLE,
    PLANNING,
    IMPLEMENTING,
    QA,
    DEPLOYING,
    COMPLETE,
    FAILED,
    PAUSED;

    private static final Set<PipelineState> WORKING =
            EnumSet.of(PLANNING, IMPLEMENTING, QA, DEPLOYING);

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /** States in which an agent is expected to be doing work. */
    public boolean isWorking() {
        return WORKING.contains(this);
    }

    public static Set<PipelineState> workingStates() {
        return EnumSet.copyOf(WORKING);
    }
}
