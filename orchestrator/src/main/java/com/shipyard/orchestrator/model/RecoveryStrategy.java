package com.shipyard.orchestrator.model;

/**
 * Recovery actions the engine can take for a failure episode.
 *
 * MANUAL_OVERRIDE is never chosen by the policy; it is only recorded when an
 * operator forces an outcome.
 */
public enum RecoveryStrategy {
    RETRY,
    CHECKPOINT_RECOVERY,
    CONTEXT_REFRESH,
    ESCALATION,
    MANUAL_OVERRIDE
}
