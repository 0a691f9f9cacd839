package com.shipyard.orchestrator.model;

/**
 * Lifecycle of a failure episode.
 *
 *   OPEN       → CLOSED      (healthy execution after recovery)
 *   OPEN       → ESCALATED   (bounds hit, cancelled, or restore failed)
 *   OPEN|ESCALATED → OVERRIDDEN (operator forced an outcome; a later failure opens a new episode)
 *   OPEN|ESCALATED → EXPIRED (no failure within the episode window)
 */
public enum EpisodeStatus {
    OPEN,
    CLOSED,
    ESCALATED,
    OVERRIDDEN,
    EXPIRED;

    /** Unresolved episodes carry their counters forward to the next failure. */
    public boolean isUnresolved() {
        return this == OPEN || this == ESCALATED;
    }
}
