package com.shipyard.orchestrator.service;

import com.shipyard.orchestrator.checkpoint.CheckpointService;
import com.shipyard.orchestrator.config.PipelineProperties;
import com.shipyard.orchestrator.detector.ExecutionCompletedEvent;
import com.shipyard.orchestrator.detector.FailureDetector;
import com.shipyard.orchestrator.detector.WatchedExecution;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.RecoveryEpisode;
import com.shipyard.orchestrator.model.StateTransitionRecord;
import com.shipyard.orchestrator.notification.NotificationEvent;
import com.shipyard.orchestrator.notification.Notifier;
import com.shipyard.orchestrator.recovery.OverrideCommand;
import com.shipyard.orchestrator.recovery.RecoveryEngine;
import com.shipyard.orchestrator.recovery.RecoveryOutcome;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.statemachine.HistoryPage;
import com.shipyard.orchestrator.statemachine.PipelineStateMachine;
import com.shipyard.orchestrator.statemachine.PipelineTransitionedEvent;
import com.shipyard.orchestrator.statemachine.PipelineView;
import com.shipyard.orchestrator.statemachine.TransitionRequest;
import com.shipyard.orchestrator.statemachine.TransitionRetrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for everything outside the orchestrator: the REST layer and
 * agent completion events.
 *
 * Drives a workflow through planning → implementing → qa → deploying →
 * complete, starting each phase's agent as the pipeline enters it and
 * moving on when that agent finishes cleanly. A QA rejection sends the story
 * back to implementing, up to a configured number of rounds. Failures are the
 * recovery engine's business; this class only reacts to where they leave the pipeline.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String ACTOR = "system:orchestrator";
    static final String ACTOR_QA_REJECTION  = "system:qa-rejection";
    static final String ACTOR_QA_ESCALATION = "system:qa-escalation";

    // Phase that follows a clean finish of each working phase.
    private static final Map<PipelineState, PipelineState> NEXT_PHASE = new EnumMap<>(PipelineState.class);

    static {
        NEXT_PHASE.put(PipelineState.PLANNING,     PipelineState.IMPLEMENTING);
        NEXT_PHASE.put(PipelineState.IMPLEMENTING, PipelineState.QA);
        NEXT_PHASE.put(PipelineState.QA,           PipelineState.DEPLOYING);
        NEXT_PHASE.put(PipelineState.DEPLOYING,    PipelineState.COMPLETE);
    }

    private final PipelineStateMachine stateMachine;
    private final TransitionRetrier    transitions;
    private final ExecutionSupervisor  supervisor;
    private final FailureDetector      detector;
    private final RecoveryEngine       recovery;
    private final CheckpointService    checkpoints;
    private final Notifier             notifier;
    private final PipelineProperties   props;
    private final Clock                clock;

    public PipelineOrchestrator(PipelineStateMachine stateMachine,
                                TransitionRetrier transitions,
                                ExecutionSupervisor supervisor,
                                FailureDetector detector,
                                RecoveryEngine recovery,
                                CheckpointService checkpoints,
                                Notifier notifier,
                                PipelineProperties props,
                                Clock clock) {
        this.stateMachine = stateMachine;
        this.transitions  = transitions;
        this.supervisor   = supervisor;
        this.detector     = detector;
        this.recovery     = recovery;
        this.checkpoints  = checkpoints;
        this.notifier     = notifier;
        this.props        = props;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Workflow lifecycle
    // ------------------------------------------------------------------

    /** Create the workflow's pipeline, enter PLANNING and start the planner. */
    public Pipeline startWorkflow(String projectId, String workspaceId, String actor, String storyId) {
        Pipeline pipeline = stateMachine.start(projectId, workspaceId, actor, storyId);
        log.info("Workflow {} started for project {} by {}", pipeline.getWorkflowId(), projectId, actor);
        runPhase(pipeline);
        return pipeline;
    }

    /**
     * Apply an externally requested transition. Entering a working state
     * starts that phase's agent; leaving one stops whatever still runs.
     */
    public Pipeline transition(UUID workflowId, PipelineState target, TransitionRequest request) {
        if (target.isWorking() && request.agentId() == null) {
            request = request.withAgent(defaultAgentId(AgentType.forPhase(target)), request.storyId());
        }
        Pipeline pipeline = stateMachine.transition(workflowId, target, request);
        afterManualMove(pipeline);
        return pipeline;
    }

    public Pipeline pause(UUID workflowId, String actor, String reason) {
        Pipeline pipeline = stateMachine.pause(workflowId, actor, reason);
        stopExecutions(workflowId);
        return pipeline;
    }

    public Pipeline resume(UUID workflowId, String actor) {
        Pipeline pipeline = stateMachine.resume(workflowId, actor);
        runPhase(pipeline);
        return pipeline;
    }

    /**
     * Start the agent owning the pipeline's current phase, unless the
     * pipeline is not in a working state or that agent already runs.
     */
    public Optional<WatchedExecution> runPhase(Pipeline pipeline) {
        AgentType agentType = AgentType.forPhase(pipeline.getState());
        if (agentType == null) {
            return Optional.empty();
        }
        boolean running = detector.activeWatches().stream()
                .anyMatch(w -> w.workflowId().equals(pipeline.getWorkflowId()) && w.phase() == pipeline.getState());
        if (running) {
            log.debug("Workflow {}: {} already running", pipeline.getWorkflowId(), agentType);
            return Optional.empty();
        }
        String agentId = pipeline.getCurrentAgentId() != null ? pipeline.getCurrentAgentId() : defaultAgentId(agentType);
        String storyId = pipeline.storyKey();
        WatchedExecution execution = supervisor.launch(pipeline, agentType, agentId, storyId, phaseContext(pipeline, storyId));
        log.info("Workflow {}: {} started as {} on story {}",
                pipeline.getWorkflowId(), agentType, execution.sessionId(), storyId);
        return Optional.of(execution);
    }

    // ------------------------------------------------------------------
    // Phase completion
    // ------------------------------------------------------------------

    /**
     * An agent finished cleanly: advance the pipeline past its phase. A
     * passed QA records safe points before deployment starts; a rejected one
     * goes back for rework.
     */
    @EventListener
    public void onExecutionCompleted(ExecutionCompletedEvent event) {
        WatchedExecution execution = event.execution();
        PipelineState phase = execution.phase();
        PipelineState next = NEXT_PHASE.get(phase);
        if (next == null) return;

        if (phase == PipelineState.QA && event.isRejection()) {
            sendBackForRework(execution, event.verdict());
            return;
        }
        if (phase == PipelineState.QA) {
            Pipeline current = stateMachine.getCurrentState(execution.workflowId());
            if (current.getState() == PipelineState.QA) {
                checkpoints.captureSafePoint(current, CheckpointService.LABEL_QA_PASSED);
            }
        }

        AgentType nextAgent = AgentType.forPhase(next);
        TransitionRequest request = TransitionRequest.by(ACTOR)
                .withAgent(nextAgent != null ? defaultAgentId(nextAgent) : null, execution.storyId())
                .withMetadata(Map.of("completedSession", execution.sessionId()));
        Optional<Pipeline> moved = transitions.transition(execution.workflowId(),
                p -> p.getState() == phase ? Optional.of(next) : Optional.empty(),
                request);
        if (moved.isEmpty()) {
            log.info("Workflow {}: {} finished but pipeline is no longer in {}, not advancing",
                    execution.workflowId(), execution.agentId(), phase);
            return;
        }

        Pipeline pipeline = moved.get();
        if (next == PipelineState.DEPLOYING) {
            checkpoints.captureSafePoint(pipeline, CheckpointService.LABEL_PRE_DEPLOY);
        }
        runPhase(pipeline);
    }

    /**
     * QA rejected the story. Route it back to implementing with the round
     * number in the transition metadata, or pause the pipeline for an operator
     * once the rounds exceed {@code shipyard.pipeline.max-qa-iterations}.
     */
    private void sendBackForRework(WatchedExecution execution, String verdict) {
        UUID workflowId = execution.workflowId();
        Pipeline current = stateMachine.getCurrentState(workflowId);
        if (current.getState() != PipelineState.QA) {
            log.info("Workflow {}: QA verdict {} arrived after the pipeline left QA, ignored", workflowId, verdict);
            return;
        }

        String storyId = current.storyKey();
        long iteration = stateMachine.countTransitions(workflowId, storyId,
                PipelineState.QA, PipelineState.IMPLEMENTING) + 1;
        int limit = props.getMaxQaIterations();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("completedSession", execution.sessionId());
        metadata.put("verdict",          verdict);
        metadata.put("iterationCount",   iteration);

        if (iteration > limit) {
            String reason = "QA rejection cycle exceeded limit (%d/%d)".formatted(iteration, limit);
            TransitionRequest request = TransitionRequest.by(ACTOR_QA_ESCALATION)
                    .withMetadata(metadata)
                    .withError(reason);
            Optional<Pipeline> paused = transitions.transition(workflowId,
                    p -> p.getState() == PipelineState.QA ? Optional.of(PipelineState.PAUSED) : Optional.empty(),
                    request);
            if (paused.isEmpty()) return;

            log.warn("Workflow {}: story {} {}, paused for an operator", workflowId, storyId, reason);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("storyId",        storyId);
            details.put("verdict",        verdict);
            details.put("iterationCount", iteration);
            details.put("reason",         reason);
            notifier.notify(new NotificationEvent(NotificationEvent.Type.QA_ESCALATION, workflowId,
                    current.getProjectId(), current.getWorkspaceId(), details, clock.instant()));
            return;
        }

        TransitionRequest request = TransitionRequest.by(ACTOR_QA_REJECTION)
                .withAgent(defaultAgentId(AgentType.DEV), storyId)
                .withMetadata(metadata);
        Optional<Pipeline> moved = transitions.transition(workflowId,
                p -> p.getState() == PipelineState.QA ? Optional.of(PipelineState.IMPLEMENTING) : Optional.empty(),
                request);
        moved.ifPresent(pipeline -> {
            log.info("Workflow {}: QA returned {} on story {}, rework round {}/{}",
                    workflowId, verdict, storyId, iteration, limit);
            runPhase(pipeline);
        });
    }

    /** Terminal states notify and stop anything still running for the workflow. */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPipelineTransitioned(PipelineTransitionedEvent event) {
        if (!event.newState().isTerminal()) return;

        stopExecutions(event.workflowId());
        NotificationEvent.Type type = event.newState() == PipelineState.COMPLETE
                ? NotificationEvent.Type.PIPELINE_COMPLETE
                : NotificationEvent.Type.PIPELINE_FAILED;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousState", event.previousState().name());
        details.put("triggeredBy",   event.triggeredBy());
        if (event.storyId() != null)      details.put("storyId", event.storyId());
        if (event.errorMessage() != null) details.put("error", event.errorMessage());
        notifier.notify(new NotificationEvent(type, event.workflowId(), event.projectId(),
                event.workspaceId(), details, clock.instant()));
    }

    // ------------------------------------------------------------------
    // Queries and operator actions
    // ------------------------------------------------------------------

    public Pipeline getPipeline(UUID workflowId) {
        return stateMachine.getCurrentState(workflowId);
    }

    public HistoryPage<StateTransitionRecord> getHistory(UUID workflowId, Integer limit, String cursor) {
        return stateMachine.getHistory(workflowId, limit, cursor);
    }

    public PipelineView replay(UUID workflowId) {
        return stateMachine.replay(workflowId);
    }

    public HistoryPage<FailureRecoveryRecord> getRecoveryHistory(UUID workflowId, String storyId,
                                                                Integer limit, String cursor) {
        return recovery.getRecoveryHistory(workflowId, storyId, limit, cursor);
    }

    public List<RecoveryEpisode> getRecoveryStatus(UUID workflowId) {
        return recovery.getRecoveryStatus(workflowId);
    }

    public RecoveryOutcome manualOverride(OverrideCommand command) {
        stateMachine.getCurrentState(command.key().workflowId());
        return recovery.manualOverride(command);
    }

    public RecoveryOutcome cancelRecovery(EpisodeKey key, String operator) {
        stateMachine.getCurrentState(key.workflowId());
        return recovery.cancel(key, operator);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void afterManualMove(Pipeline pipeline) {
        if (pipeline.getState().isWorking()) {
            stopExecutions(pipeline.getWorkflowId(), pipeline.getState());
            runPhase(pipeline);
        } else if (pipeline.getState() == PipelineState.PAUSED) {
            stopExecutions(pipeline.getWorkflowId());
        }
    }

    private void stopExecutions(UUID workflowId) {
        stopExecutions(workflowId, null);
    }

    /** Stop the workflow's executions, except those of {@code keepPhase}. */
    private void stopExecutions(UUID workflowId, PipelineState keepPhase) {
        detector.activeWatches().stream()
                .filter(w -> w.workflowId().equals(workflowId) && w.phase() != keepPhase)
                .forEach(w -> {
                    log.info("Workflow {}: stopping {} ({})", workflowId, w.sessionId(), w.phase());
                    supervisor.stop(w);
                });
    }

    static String defaultAgentId(AgentType agentType) {
        return agentType.name().toLowerCase(Locale.ROOT) + "-agent";
    }

    private static Map<String, Object> phaseContext(Pipeline pipeline, String storyId) {
        Map<String, Object> context = new HashMap<>();
        context.put("workflowId",  pipeline.getWorkflowId().toString());
        context.put("projectId",   pipeline.getProjectId());
        context.put("workspaceId", pipeline.getWorkspaceId());
        context.put("phase",       pipeline.getState().name());
        context.put("storyId",     storyId);
        return context;
    }
}
