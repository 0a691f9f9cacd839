package com.shipyard.orchestrator.repository;

import com.shipyard.orchestrator.model.Checkpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CheckpointRepository extends JpaRepository<Checkpoint, Long> {

    /** Newest checkpoint for a story; ids are identity-generated so the largest id is the latest write. */
    Optional<Checkpoint> findFirstByProjectIdAndStoryIdOrderByIdDesc(String projectId, String storyId);
}
