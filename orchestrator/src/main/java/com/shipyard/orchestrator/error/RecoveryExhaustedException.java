package com.shipyard.orchestrator.error;

import com.shipyard.orchestrator.model.EpisodeKey;

/**
 * Automatic recovery bounds were hit for an episode. The policy turns this
 * into an ESCALATION decision; the message ends up in the record's errorDetails.
 */
public class RecoveryExhaustedException extends OrchestrationException {

    public RecoveryExhaustedException(EpisodeKey key, String reason) {
        super("Recovery exhausted for episode " + key + ": " + reason);
    }

    @Override
    public String code() { return "recovery_exhausted"; }
}
