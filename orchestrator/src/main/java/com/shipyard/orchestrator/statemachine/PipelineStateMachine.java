package com.shipyard.orchestrator.statemachine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.error.InvalidTransitionException;
import com.shipyard.orchestrator.error.PipelineAlreadyActiveException;
import com.shipyard.orchestrator.error.VersionConflictException;
import com.shipyard.orchestrator.error.WorkflowNotFoundException;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.StateTransitionRecord;
import com.shipyard.orchestrator.repository.PipelineRepository;
import com.shipyard.orchestrator.repository.StateTransitionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns every write to a pipeline row.
 *
 * A transition is one transaction: validate the edge, bump the version via
 * JPA's optimistic lock, append the audit record. Both rows commit together
 * or neither does. There is no lock held between read and write; a writer
 * that lost the race gets {@link VersionConflictException} and must re-read.
 */
@Service
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private static final EnumSet<PipelineState> ACTIVE_STATES =
            EnumSet.complementOf(EnumSet.of(PipelineState.COMPLETE, PipelineState.FAILED));

    private final PipelineRepository        pipelineRepo;
    private final StateTransitionRepository transitionRepo;
    private final ApplicationEventPublisher events;
    private final ObjectMapper              objectMapper;
    private final MeterRegistry             meterRegistry;
    private final Clock                     clock;

    public PipelineStateMachine(PipelineRepository pipelineRepo,
                                StateTransitionRepository transitionRepo,
                                ApplicationEventPublisher events,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.pipelineRepo   = pipelineRepo;
        this.transitionRepo = transitionRepo;
        this.events         = events;
        this.objectMapper   = objectMapper;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Create the pipeline for a new workflow and move it IDLE → PLANNING.
     *
     * @throws PipelineAlreadyActiveException if the project already has a non-terminal pipeline
     */
    @Transactional
    public Pipeline start(String projectId, String workspaceId, String actor, String storyId) {
        List<Pipeline> active = pipelineRepo.findByProjectIdAndStateIn(projectId, ACTIVE_STATES);
        if (!active.isEmpty()) {
            Pipeline existing = active.get(0);
            throw new PipelineAlreadyActiveException(projectId, existing.getWorkflowId(), existing.getState());
        }

        Pipeline pipeline = pipelineRepo.saveAndFlush(
                new Pipeline(UUID.randomUUID(), projectId, workspaceId, clock.instant()));
        log.info("Pipeline created for project {} (workflow {})", projectId, pipeline.getWorkflowId());

        TransitionRequest request = new TransitionRequest(actor, null, storyId, Map.of(), null, null, null);
        return apply(pipeline, PipelineState.PLANNING, request);
    }

    // ------------------------------------------------------------------
    // Transition
    // ------------------------------------------------------------------

    /**
     * Move a pipeline to {@code target}.
     *
     * @throws WorkflowNotFoundException  unknown workflow
     * @throws InvalidTransitionException illegal edge; nothing is written
     * @throws VersionConflictException   another writer won; re-read and retry
     */
    @Transactional
    public Pipeline transition(UUID workflowId, PipelineState target, TransitionRequest request) {
        Pipeline pipeline = load(workflowId);
        return apply(pipeline, target, request);
    }

    /** Pause a working pipeline; it remembers where to resume. */
    @Transactional
    public Pipeline pause(UUID workflowId, String actor, String reason) {
        Pipeline pipeline = load(workflowId);
        TransitionRequest request = TransitionRequest.by(actor)
                .withMetadata(Map.of("pausedFrom", pipeline.getState().name()))
                .withError(reason);
        return apply(pipeline, PipelineState.PAUSED, request);
    }

    /** Resume a paused pipeline to the state it was paused from. */
    @Transactional
    public Pipeline resume(UUID workflowId, String actor) {
        Pipeline pipeline = load(workflowId);
        if (pipeline.getState() != PipelineState.PAUSED) {
            throw new InvalidTransitionException(pipeline.getState(), pipeline.getState(), "not paused");
        }
        TransitionRequest request = TransitionRequest.by(actor)
                .withMetadata(Map.of("resumedFrom", PipelineState.PAUSED.name()));
        return apply(pipeline, pipeline.getPausedFrom(), request);
    }

    private Pipeline apply(Pipeline pipeline, PipelineState target, TransitionRequest request) {
        UUID workflowId = pipeline.getWorkflowId();

        if (request.requestId() != null) {
            Optional<StateTransitionRecord> replayed =
                    transitionRepo.findByWorkflowIdAndRequestId(workflowId, request.requestId());
            if (replayed.isPresent()) {
                log.info("Workflow {}: request {} already applied as version {}, returning current state",
                        workflowId, request.requestId(), replayed.get().getVersion());
                return pipeline;
            }
        }

        if (request.expectedVersion() != null && request.expectedVersion() != pipeline.versionOrZero()) {
            throw new VersionConflictException(workflowId,
                    "expected version " + request.expectedVersion() + " but found " + pipeline.versionOrZero());
        }

        PipelineState previous = pipeline.getState();
        PipelineTransitions.validate(previous, target, pipeline.getPausedFrom());

        pipeline.moveTo(target, request.storyId(), request.agentId(), clock.instant());
        StateTransitionRecord record;
        try {
            pipeline = pipelineRepo.saveAndFlush(pipeline);
            record = transitionRepo.saveAndFlush(new StateTransitionRecord(
                    pipeline, previous, request.actor(), toJson(request.metadata()),
                    request.errorMessage(), request.requestId()));
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            meterRegistry.counter("shipyard.pipeline.conflicts").increment();
            throw new VersionConflictException(workflowId, e);
        }

        meterRegistry.counter("shipyard.pipeline.transitions",
                "from", previous.name(), "to", target.name()).increment();
        log.info("Pipeline {}: {} → {} (version {}, by {})",
                workflowId, previous, target, record.getVersion(), request.actor());

        events.publishEvent(new PipelineTransitionedEvent(
                workflowId, pipeline.getProjectId(), pipeline.getWorkspaceId(),
                previous, target, request.actor(),
                pipeline.getCurrentStoryId(), pipeline.getCurrentAgentId(),
                record.getVersion(), request.errorMessage()));
        return pipeline;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Pipeline getCurrentState(UUID workflowId) {
        return load(workflowId);
    }

    /**
     * One page of transition history, newest first.
     *
     * @param cursor null for the first page, then the nextCursor of the previous page
     */
    @Transactional(readOnly = true)
    public HistoryPage<StateTransitionRecord> getHistory(UUID workflowId, Integer limit, String cursor) {
        load(workflowId);
        int pageSize = HistoryPage.clampLimit(limit);
        List<StateTransitionRecord> items = transitionRepo.findPage(
                workflowId, HistoryPage.decodeCursor(cursor), PageRequest.of(0, pageSize));
        Long lastId = items.isEmpty() ? null : items.get(items.size() - 1).getId();
        return new HistoryPage<>(items, HistoryPage.nextCursor(items.size(), pageSize, lastId));
    }

    /** How many times the workflow moved {@code from} → {@code to} while on the given story. */
    @Transactional(readOnly = true)
    public long countTransitions(UUID workflowId, String storyId, PipelineState from, PipelineState to) {
        return transitionRepo.countByWorkflowIdAndStoryIdAndPreviousStateAndNewState(workflowId, storyId, from, to);
    }

    /**
     * Rebuild the pipeline view from the transition log alone.
     *
     * @throws IllegalStateException if the log contains an illegal or out-of-order edge
     */
    @Transactional(readOnly = true)
    public PipelineView replay(UUID workflowId) {
        Pipeline live = load(workflowId);
        PipelineState state      = PipelineState.IDLE;
        PipelineState pausedFrom = null;
        String storyId = null;
        String agentId = null;
        long version = 0L;
        Instant enteredAt = live.getCreatedAt();

        for (StateTransitionRecord r : transitionRepo.findByWorkflowIdOrderByIdAsc(workflowId)) {
            if (r.getPreviousState() != state || !PipelineTransitions.isEdge(state, r.getNewState())) {
                throw new IllegalStateException("Transition log of workflow %s is inconsistent at record %d: %s → %s while in %s"
                        .formatted(workflowId, r.getId(), r.getPreviousState(), r.getNewState(), state));
            }
            pausedFrom = r.getNewState() == PipelineState.PAUSED ? state : null;
            state      = r.getNewState();
            version    = r.getVersion();
            enteredAt  = r.getOccurredAt();
            if (r.getStoryId() != null) storyId = r.getStoryId();
            if (r.getAgentId() != null) agentId = r.getAgentId();
        }
        return new PipelineView(workflowId, state, pausedFrom, storyId, agentId, version, enteredAt);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Pipeline load(UUID workflowId) {
        return pipelineRepo.findById(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Transition metadata is not serializable", e);
        }
    }
}
