package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.checkpoint.CheckpointRef;
import com.shipyard.orchestrator.error.OrchestrationException;
import com.shipyard.orchestrator.model.RecoveryStrategy;

import java.time.Duration;

/**
 * What the policy decided for one failure.
 *
 * @param strategy   chosen strategy
 * @param delay      wait before re-invoking (RETRY only), else zero
 * @param checkpoint checkpoint to roll back to (CHECKPOINT_RECOVERY only)
 * @param cause      the bound or shortage that shaped the decision, if any
 * @param reason     human-readable explanation, written to the record
 */
public record RecoveryDecision(
        RecoveryStrategy      strategy,
        Duration              delay,
        CheckpointRef         checkpoint,
        OrchestrationException cause,
        String                reason
) {
    static RecoveryDecision retry(Duration delay, String reason) {
        return new RecoveryDecision(RecoveryStrategy.RETRY, delay, null, null, reason);
    }

    static RecoveryDecision checkpointRecovery(CheckpointRef checkpoint, String reason) {
        return new RecoveryDecision(RecoveryStrategy.CHECKPOINT_RECOVERY, Duration.ZERO, checkpoint, null, reason);
    }

    static RecoveryDecision contextRefresh(OrchestrationException cause, String reason) {
        return new RecoveryDecision(RecoveryStrategy.CONTEXT_REFRESH, Duration.ZERO, null, cause, reason);
    }

    static RecoveryDecision escalate(OrchestrationException cause, String reason) {
        return new RecoveryDecision(RecoveryStrategy.ESCALATION, Duration.ZERO, null, cause, reason);
    }
}
