package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.recovery.RecoveryOutcome;

import java.util.List;
import java.util.UUID;

/** What an operator action did: the records it wrote and where the pipeline ended up. */
public record RecoveryOutcomeResponse(
        UUID                         episodeId,
        List<RecoveryRecordResponse> records,
        PipelineState                pipelineState
) {
    public static RecoveryOutcomeResponse from(RecoveryOutcome outcome) {
        return new RecoveryOutcomeResponse(
                outcome.episodeId(),
                outcome.records().stream().map(RecoveryRecordResponse::from).toList(),
                outcome.pipelineState()
        );
    }
}
