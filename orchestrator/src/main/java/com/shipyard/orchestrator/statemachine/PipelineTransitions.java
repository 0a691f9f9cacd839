package com.shipyard.orchestrator.statemachine;

import com.shipyard.orchestrator.error.InvalidTransitionException;
import com.shipyard.orchestrator.model.PipelineState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.shipyard.orchestrator.model.PipelineState.*;

/**
 * The static edge table of the pipeline state machine.
 *
 * <p>Legal edges:</p>
 * <ul>
 *   <li>IDLE → PLANNING</li>
 *   <li>PLANNING → IMPLEMENTING</li>
 *   <li>IMPLEMENTING → QA</li>
 *   <li>QA → IMPLEMENTING (rework), QA → DEPLOYING</li>
 *   <li>DEPLOYING → COMPLETE</li>
 *   <li>every working state → PAUSED, → FAILED</li>
 *   <li>PAUSED → the state it was paused from</li>
 * </ul>
 *
 * <p>COMPLETE and FAILED have no outgoing edges.</p>
 */
public final class PipelineTransitions {

    private static final Map<PipelineState, Set<PipelineState>> EDGES = new EnumMap<>(PipelineState.class);

    static {
        for (PipelineState s : PipelineState.values()) {
            EDGES.put(s, EnumSet.noneOf(PipelineState.class));
        }
        EDGES.get(IDLE).add(PLANNING);
        EDGES.get(PLANNING).add(IMPLEMENTING);
        EDGES.get(IMPLEMENTING).add(QA);
        EDGES.get(QA).addAll(EnumSet.of(IMPLEMENTING, DEPLOYING));
        EDGES.get(DEPLOYING).add(COMPLETE);
        for (PipelineState working : PipelineState.workingStates()) {
            EDGES.get(working).addAll(EnumSet.of(PAUSED, FAILED));
        }
        // Narrowed to the actual origin in validate().
        EDGES.get(PAUSED).addAll(PipelineState.workingStates());
    }

    private PipelineTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /** Targets reachable from {@code from}, ignoring the PAUSED origin rule. */
    public static Set<PipelineState> targetsOf(PipelineState from) {
        return Collections.unmodifiableSet(EDGES.get(from));
    }

    /**
     * Edge check without the origin rule. Used to audit recorded history,
     * where the origin is implied by the preceding record.
     */
    public static boolean isEdge(PipelineState from, PipelineState to) {
        return from != null && to != null && EDGES.get(from).contains(to);
    }

    /**
     * Validate a transition.
     *
     * @param pausedFrom origin state when {@code from} is PAUSED, otherwise ignored
     * @throws InvalidTransitionException if the edge is not legal
     */
    public static void validate(PipelineState from, PipelineState to, PipelineState pausedFrom) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new InvalidTransitionException(from, to, "terminal state");
        }
        if (!EDGES.get(from).contains(to)) {
            throw new InvalidTransitionException(from, to);
        }
        if (from == PAUSED && to != pausedFrom) {
            throw new InvalidTransitionException(from, to, "paused from " + pausedFrom);
        }
    }
}
