package com.shipyard.orchestrator.repository;

import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to failure_recovery_records.
 *
 * Pages are newest first and keyed on the identity id: callers pass the
 * smallest id they have seen (or Long.MAX_VALUE for the first page).
 */
public interface FailureRecoveryRepository extends JpaRepository<FailureRecoveryRecord, Long> {

    @Query("""
            SELECT r FROM FailureRecoveryRecord r
            WHERE r.workflowId = :workflowId AND r.id < :cursor
            ORDER BY r.id DESC
            """)
    List<FailureRecoveryRecord> findPage(@Param("workflowId") UUID workflowId,
                                         @Param("cursor") long cursor,
                                         Pageable page);

    @Query("""
            SELECT r FROM FailureRecoveryRecord r
            WHERE r.workflowId = :workflowId AND r.storyId = :storyId AND r.id < :cursor
            ORDER BY r.id DESC
            """)
    List<FailureRecoveryRecord> findStoryPage(@Param("workflowId") UUID workflowId,
                                              @Param("storyId") String storyId,
                                              @Param("cursor") long cursor,
                                              Pageable page);

    /** Every attempt of one episode in write order; used to rebuild the episode row. */
    List<FailureRecoveryRecord> findByEpisodeIdOrderByIdAsc(UUID episodeId);

    Optional<FailureRecoveryRecord> findFirstByEpisodeIdOrderByIdDesc(UUID episodeId);
}
