package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.RecoveryStrategy;

import java.util.List;
import java.util.UUID;

/**
 * Result of handling one failure report or operator action.
 *
 * @param records       attempts written, oldest first; empty when the report was ignored
 * @param pipelineState pipeline state after an escalation or override drove it, else null
 */
public record RecoveryOutcome(
        EpisodeKey                  key,
        UUID                        episodeId,
        List<FailureRecoveryRecord> records,
        PipelineState               pipelineState
) {
    public RecoveryOutcome {
        records = List.copyOf(records);
    }

    static RecoveryOutcome ignored(EpisodeKey key, UUID episodeId) {
        return new RecoveryOutcome(key, episodeId, List.of(), null);
    }

    public boolean isIgnored() {
        return records.isEmpty();
    }

    public FailureRecoveryRecord lastRecord() {
        return records.isEmpty() ? null : records.get(records.size() - 1);
    }

    public RecoveryStrategy strategy() {
        return isIgnored() ? null : lastRecord().getRecoveryStrategy();
    }

    public boolean success() {
        return !isIgnored() && lastRecord().isSuccess();
    }
}
