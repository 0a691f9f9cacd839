package com.shipyard.orchestrator.repository;

import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.StateTransitionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to pipeline_transitions. Nothing here updates or deletes.
 */
public interface StateTransitionRepository extends JpaRepository<StateTransitionRecord, Long> {

    /**
     * One page of history strictly older than the cursor id, newest first.
     * The first page passes Long.MAX_VALUE.
     */
    @Query("""
            SELECT r FROM StateTransitionRecord r
            WHERE r.workflowId = :workflowId AND r.id < :cursor
            ORDER BY r.id DESC
            """)
    List<StateTransitionRecord> findPage(@Param("workflowId") UUID workflowId,
                                         @Param("cursor") long cursor,
                                         Pageable page);

    /** Full log in write order; used to rebuild the pipeline view. */
    List<StateTransitionRecord> findByWorkflowIdOrderByIdAsc(UUID workflowId);

    long countByWorkflowIdAndStoryIdAndPreviousStateAndNewState(UUID workflowId, String storyId,
                                                                PipelineState previousState,
                                                                PipelineState newState);

    Optional<StateTransitionRecord> findByWorkflowIdAndRequestId(UUID workflowId, String requestId);
}
