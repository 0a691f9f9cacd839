package com.shipyard.orchestrator.detector;

import java.time.Instant;

/**
 * An execution exited with code 0.
 *
 * @param verdict result the agent reported for its phase, null if none
 */
public record ExecutionCompletedEvent(WatchedExecution execution, Instant completedAt, String verdict) {

    public ExecutionCompletedEvent(WatchedExecution execution, Instant completedAt) {
        this(execution, completedAt, null);
    }

    /** True when the agent reported a verdict other than PASS. */
    public boolean isRejection() {
        return verdict != null && !"PASS".equalsIgnoreCase(verdict.trim());
    }
}
