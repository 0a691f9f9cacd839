package com.shipyard.orchestrator.repository;

import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + lookups for the pipelines table.
 *
 * Writes rely on the entity's {@code @Version}: Hibernate issues
 * {@code UPDATE ... WHERE version = ?} and fails the flush when another
 * writer got there first.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, UUID> {

    /** Pipelines of a project that are still in one of the given states. */
    List<Pipeline> findByProjectIdAndStateIn(String projectId, Collection<PipelineState> states);
}
