package com.shipyard.orchestrator.repository;

import com.shipyard.orchestrator.model.EpisodeStatus;
import com.shipyard.orchestrator.model.RecoveryEpisode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecoveryEpisodeRepository extends JpaRepository<RecoveryEpisode, UUID> {

    /** Most recent episode for a key, whatever its status. */
    Optional<RecoveryEpisode> findFirstByWorkflowIdAndStoryIdAndAgentIdOrderByOpenedAtDesc(
            UUID workflowId, String storyId, String agentId);

    List<RecoveryEpisode> findByWorkflowIdAndStatusIn(UUID workflowId, Collection<EpisodeStatus> statuses);
}
