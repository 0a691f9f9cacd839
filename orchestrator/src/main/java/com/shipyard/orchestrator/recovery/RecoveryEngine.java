package com.shipyard.orchestrator.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.checkpoint.CheckpointRef;
import com.shipyard.orchestrator.checkpoint.CheckpointService;
import com.shipyard.orchestrator.config.RecoveryProperties;
import com.shipyard.orchestrator.detector.ExecutionCompletedEvent;
import com.shipyard.orchestrator.detector.FailureReport;
import com.shipyard.orchestrator.detector.WatchedExecution;
import com.shipyard.orchestrator.error.EpisodeNotFoundException;
import com.shipyard.orchestrator.error.OrchestrationException;
import com.shipyard.orchestrator.error.RestoreFailedException;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.EpisodeStatus;
import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.RecoveryEpisode;
import com.shipyard.orchestrator.model.RecoveryStrategy;
import com.shipyard.orchestrator.notification.NotificationEvent;
import com.shipyard.orchestrator.notification.Notifier;
import com.shipyard.orchestrator.repository.FailureRecoveryRepository;
import com.shipyard.orchestrator.service.ExecutionSupervisor;
import com.shipyard.orchestrator.statemachine.HistoryPage;
import com.shipyard.orchestrator.statemachine.PipelineStateMachine;
import com.shipyard.orchestrator.statemachine.TransitionRequest;
import com.shipyard.orchestrator.statemachine.TransitionRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Turns failure reports into recovery actions.
 *
 * Work for one episode runs on the recovery pool strictly one item at a
 * time, in arrival order; different episodes proceed in parallel. Callers
 * get a future and never wait on the action itself. Every attempt writes
 * exactly one {@link FailureRecoveryRecord}, successful or not.
 */
@Service
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    static final String ACTOR = "system:recovery";

    // Context entries an agent accumulates while working; dropped on CONTEXT_REFRESH.
    static final Set<String> TRANSIENT_CONTEXT_KEYS = Set.of("history", "conversation", "scratchpad", "observations");

    private final Map<EpisodeKey, CompletableFuture<?>> lanes    = new ConcurrentHashMap<>();
    private final Map<EpisodeKey, WatchedExecution>     inFlight = new ConcurrentHashMap<>();

    private final EpisodeTracker            tracker;
    private final RecoveryPolicy            policy;
    private final CheckpointService         checkpoints;
    private final ExecutionSupervisor       supervisor;
    private final PipelineStateMachine      stateMachine;
    private final TransitionRetrier         transitions;
    private final FailureRecoveryRepository recordRepo;
    private final Notifier                  notifier;
    private final RecoveryProperties        properties;
    private final TaskScheduler             scheduler;
    private final Executor                  workers;
    private final MeterRegistry             meterRegistry;
    private final ObjectMapper              objectMapper;
    private final Clock                     clock;

    public RecoveryEngine(EpisodeTracker tracker,
                          RecoveryPolicy policy,
                          CheckpointService checkpoints,
                          ExecutionSupervisor supervisor,
                          PipelineStateMachine stateMachine,
                          TransitionRetrier transitions,
                          FailureRecoveryRepository recordRepo,
                          Notifier notifier,
                          RecoveryProperties properties,
                          TaskScheduler scheduler,
                          @Qualifier("recoveryExecutor") Executor workers,
                          MeterRegistry meterRegistry,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.tracker       = tracker;
        this.policy        = policy;
        this.checkpoints   = checkpoints;
        this.supervisor    = supervisor;
        this.stateMachine  = stateMachine;
        this.transitions   = transitions;
        this.recordRepo    = recordRepo;
        this.notifier      = notifier;
        this.properties    = properties;
        this.scheduler     = scheduler;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Failure reports
    // ------------------------------------------------------------------

    @EventListener
    public void onFailureDetected(FailureReport report) {
        report(report).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Recovery for {} failed: {}", report.execution().episodeKey(), error.getMessage(), error);
            }
        });
    }

    /**
     * Queue a failure for recovery. The future completes once the chosen
     * action has been dispatched and recorded; a RETRY's re-invocation
     * happens later, after its backoff.
     */
    public CompletableFuture<RecoveryOutcome> report(FailureReport report) {
        return submit(report.execution().episodeKey(), () -> handle(report));
    }

    private RecoveryOutcome handle(FailureReport report) {
        WatchedExecution execution = report.execution();
        EpisodeKey key = execution.episodeKey();
        Instant started = clock.instant();
        inFlight.put(key, execution);

        RecoveryEpisode episode = tracker.beginFailure(key, report.failureType(), report.detectedAt());
        Optional<CheckpointRef> checkpoint =
                checkpoints.getLatestCheckpoint(execution.projectId(), execution.storyId());
        RecoveryDecision decision = policy.decide(episode, report.failureType(), execution.projectId(), checkpoint);

        log.info("Episode {}: {} → {} ({})", episode.getId(), report.describe(), decision.strategy(), decision.reason());

        return switch (decision.strategy()) {
            case RETRY               -> retry(report, episode, decision, started);
            case CHECKPOINT_RECOVERY -> rollback(report, episode, decision, started);
            case CONTEXT_REFRESH     -> refresh(report, episode, decision, started);
            case ESCALATION          -> escalate(report, episode, decision.reason(), report.failureType(),
                                                 started, new ArrayList<>(), false);
            case MANUAL_OVERRIDE     -> throw new IllegalStateException("MANUAL_OVERRIDE is operator-only");
        };
    }

    private RecoveryOutcome retry(FailureReport report, RecoveryEpisode episode,
                                  RecoveryDecision decision, Instant started) {
        WatchedExecution execution = report.execution();
        Map<String, Object> meta = evidence(report);
        meta.put("delayMs", decision.delay().toMillis());
        FailureRecoveryRecord record = write(episode, attempt(report, started)
                .success(false)
                .metadata(json(meta)), RecoveryStrategy.RETRY);

        EpisodeKey key = execution.episodeKey();
        Instant due = clock.instant().plus(decision.delay());
        scheduler.schedule(() -> submit(key, () -> retryNow(report, episode.getId()))
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("Delayed retry for {} failed: {}", key, error.getMessage(), error);
                    }
                }), due);
        log.info("Retrying {} for story {} at {}", execution.agentId(), execution.storyId(), due);
        return new RecoveryOutcome(execution.episodeKey(), episode.getId(), List.of(record), null);
    }

    /** The delayed half of a RETRY: re-invoke the step unless someone moved on meanwhile. */
    private RecoveryOutcome retryNow(FailureReport report, UUID episodeId) {
        WatchedExecution execution = report.execution();
        EpisodeKey key = execution.episodeKey();

        Optional<RecoveryEpisode> live = tracker.live(key);
        if (live.isEmpty() || !live.get().getId().equals(episodeId) || live.get().getStatus() != EpisodeStatus.OPEN) {
            log.info("Retry of {} skipped, episode {} is no longer open", execution.sessionId(), episodeId);
            return RecoveryOutcome.ignored(key, episodeId);
        }
        PipelineState state = stateMachine.getCurrentState(execution.workflowId()).getState();
        if (state != execution.phase()) {
            log.info("Retry of {} skipped, pipeline moved to {}", execution.sessionId(), state);
            return RecoveryOutcome.ignored(key, episodeId);
        }
        try {
            inFlight.put(key, supervisor.relaunch(execution, execution.context()));
            return RecoveryOutcome.ignored(key, episodeId);
        } catch (RuntimeException e) {
            log.error("Re-invoking {} failed: {}", execution.agentId(), e.getMessage());
            return escalate(report, live.get(), "retry could not restart the step: " + e.getMessage(),
                    report.failureType(), clock.instant(), new ArrayList<>(), true);
        }
    }

    private RecoveryOutcome rollback(FailureReport report, RecoveryEpisode episode,
                                     RecoveryDecision decision, Instant started) {
        CheckpointRef checkpoint = decision.checkpoint();
        List<FailureRecoveryRecord> written = new ArrayList<>();
        try {
            checkpoints.restoreTo(checkpoint);
        } catch (RestoreFailedException e) {
            written.add(write(episode, attempt(report, started)
                    .checkpointRef(checkpoint.ref())
                    .success(false)
                    .errorDetails(e.getMessage())
                    .metadata(json(evidence(report))), RecoveryStrategy.CHECKPOINT_RECOVERY));
            // A failed rollback is a crash of the recovery itself.
            return escalate(report, episode, "rollback to " + checkpoint.ref() + " failed",
                    FailureType.CRASH, clock.instant(), written, true);
        }
        return replace(report, episode, RecoveryStrategy.CHECKPOINT_RECOVERY, checkpoint.ref(),
                report.execution().context(), null, started, written);
    }

    private RecoveryOutcome refresh(FailureReport report, RecoveryEpisode episode,
                                    RecoveryDecision decision, Instant started) {
        String note = decision.cause() == null ? null : decision.cause().getMessage();
        return replace(report, episode, RecoveryStrategy.CONTEXT_REFRESH, null,
                refreshedContext(report), note, started, new ArrayList<>());
    }

    /** Spawn a replacement execution and record the attempt. */
    private RecoveryOutcome replace(FailureReport report, RecoveryEpisode episode, RecoveryStrategy strategy,
                                    String checkpointRef, Map<String, Object> context, String note,
                                    Instant started, List<FailureRecoveryRecord> written) {
        WatchedExecution execution = report.execution();
        WatchedExecution replacement;
        try {
            replacement = supervisor.relaunch(execution, context);
        } catch (RuntimeException e) {
            written.add(write(episode, attempt(report, started)
                    .checkpointRef(checkpointRef)
                    .success(false)
                    .errorDetails("replacement execution failed to start: " + e.getMessage())
                    .metadata(json(evidence(report))), strategy));
            return escalate(report, episode, strategy + " could not start a replacement",
                    report.failureType(), clock.instant(), written, true);
        }
        inFlight.put(execution.episodeKey(), replacement);
        written.add(write(episode, attempt(report, started)
                .checkpointRef(checkpointRef)
                .newSessionId(replacement.sessionId())
                .success(true)
                .errorDetails(note)
                .metadata(json(evidence(report))), strategy));
        return new RecoveryOutcome(execution.episodeKey(), episode.getId(), written, null);
    }

    /**
     * Halt automation for the episode: record, stop the execution, drive the
     * pipeline to the severity target and tell a human.
     *
     * @param severityType failure type whose severity decides PAUSED or FAILED
     * @param followUp     true when this escalation follows a failed action of the same failure
     */
    private RecoveryOutcome escalate(FailureReport report, RecoveryEpisode episode, String reason,
                                     FailureType severityType, Instant started,
                                     List<FailureRecoveryRecord> written, boolean followUp) {
        WatchedExecution execution = report.execution();
        EpisodeKey key = execution.episodeKey();
        PipelineState target = properties.escalationTarget(severityType);

        Map<String, Object> meta = evidence(report);
        meta.put("escalatedTo", target.name());
        if (followUp) meta.put("followUp", true);
        written.add(write(episode, attempt(report, started)
                .success(false)
                .errorDetails(reason)
                .metadata(json(meta)), RecoveryStrategy.ESCALATION));

        WatchedExecution running = inFlight.remove(key);
        supervisor.stop(running != null ? running : execution);

        PipelineState after = drivePipeline(execution.workflowId(), target, TransitionRequest.by(ACTOR)
                .withMetadata(Map.of("episodeId", episode.getId().toString(),
                                     "failureType", report.failureType().name()))
                .withError("Recovery escalated for story " + execution.storyId() + ": " + reason));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("episodeId",   episode.getId().toString());
        details.put("storyId",     execution.storyId());
        details.put("agentId",     execution.agentId());
        details.put("failureType", report.failureType().name());
        details.put("reason",      reason);
        details.put("escalatedTo", target.name());
        notifier.notify(new NotificationEvent(NotificationEvent.Type.RECOVERY_ESCALATION,
                execution.workflowId(), execution.projectId(), execution.workspaceId(), details, clock.instant()));

        log.warn("Episode {} escalated ({}), pipeline now {}", episode.getId(), reason, after);
        return new RecoveryOutcome(key, episode.getId(), written, after);
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /**
     * Stop automatic recovery for an episode: terminate what runs, escalate.
     * Cancelling an already escalated episode changes nothing.
     *
     * @throws EpisodeNotFoundException if the key has no open or escalated episode
     */
    public RecoveryOutcome cancel(EpisodeKey key, String operator) {
        return await(submit(key, () -> {
            RecoveryEpisode episode = tracker.live(key)
                    .filter(e -> e.getStatus().isUnresolved())
                    .orElseThrow(() -> new EpisodeNotFoundException(key));
            if (episode.getStatus() == EpisodeStatus.ESCALATED) {
                log.info("Episode {} already escalated, cancel by {} is a no-op", episode.getId(), operator);
                return new RecoveryOutcome(key, episode.getId(), List.of(), null);
            }
            FailureRecoveryRecord last = lastRecordOf(episode);
            stopInFlight(key);

            PipelineState target = properties.escalationTarget(last.getFailureType());
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("operator", operator);
            meta.put("action", "cancel");
            meta.put("escalatedTo", target.name());
            FailureRecoveryRecord record = tracker.recordAttempt(episode.getId(),
                    FailureRecoveryRecord.followUpOf(last)
                            .success(false)
                            .errorDetails("recovery cancelled by " + operator)
                            .durationMs(0)
                            .metadata(json(meta))
                            .createdAt(clock.instant()),
                    RecoveryStrategy.ESCALATION);
            count(record);

            PipelineState after = drivePipeline(key.workflowId(), target, TransitionRequest.by(operator)
                    .withMetadata(Map.of("episodeId", episode.getId().toString(), "action", "cancel"))
                    .withError("Recovery cancelled for story " + key.storyId()));
            notifier.notify(new NotificationEvent(NotificationEvent.Type.RECOVERY_ESCALATION,
                    key.workflowId(), last.getProjectId(), last.getWorkspaceId(),
                    Map.of("episodeId", episode.getId().toString(), "storyId", key.storyId(),
                           "agentId", key.agentId(), "reason", "cancelled by " + operator,
                           "escalatedTo", target.name()),
                    clock.instant()));
            log.warn("Episode {} cancelled by {}, pipeline now {}", episode.getId(), operator, after);
            return new RecoveryOutcome(key, episode.getId(), List.of(record), after);
        }));
    }

    /**
     * Force an outcome for an episode. Records a MANUAL_OVERRIDE attempt and
     * closes the episode; automatic policy no longer applies to it.
     *
     * @throws EpisodeNotFoundException if the key has no live episode
     */
    public RecoveryOutcome manualOverride(OverrideCommand command) {
        EpisodeKey key = command.key();
        return await(submit(key, () -> {
            RecoveryEpisode episode = tracker.live(key).orElseThrow(() -> new EpisodeNotFoundException(key));
            FailureRecoveryRecord last = lastRecordOf(episode);
            WatchedExecution previous = stopInFlight(key);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("operator", command.operator());
            meta.put("action", command.action().name());
            if (command.reason() != null)     meta.put("reason", command.reason());
            if (command.newAgentId() != null) meta.put("newAgentId", command.newAgentId());
            FailureRecoveryRecord record = tracker.recordAttempt(episode.getId(),
                    FailureRecoveryRecord.followUpOf(last)
                            .success(true)
                            .durationMs(0)
                            .metadata(json(meta))
                            .createdAt(clock.instant()),
                    RecoveryStrategy.MANUAL_OVERRIDE);
            count(record);
            tracker.close(key, EpisodeStatus.OVERRIDDEN);

            TransitionRequest request = TransitionRequest.by(command.operator())
                    .withMetadata(Map.of("episodeId", episode.getId().toString(),
                                         "override", command.action().name()));
            PipelineState after = switch (command.action()) {
                case TERMINATE -> drivePipeline(key.workflowId(), PipelineState.FAILED,
                        request.withError(command.reason() != null ? command.reason() : "terminated by " + command.operator()));
                case REASSIGN -> restartStep(key, last, previous,
                        command.newAgentId() != null ? command.newAgentId() : key.agentId(),
                        previous != null ? previous.context() : Map.of(), request);
                case PROVIDE_GUIDANCE -> restartStep(key, last, previous, key.agentId(),
                        withGuidance(previous, command.reason()), request);
            };
            log.info("Episode {} overridden by {} ({}), pipeline now {}",
                    episode.getId(), command.operator(), command.action(), after);
            return new RecoveryOutcome(key, episode.getId(), List.of(record), after);
        }));
    }

    private PipelineState restartStep(EpisodeKey key, FailureRecoveryRecord last, WatchedExecution previous,
                                      String agentId, Map<String, Object> context, TransitionRequest request) {
        AgentType agentType = last.getAgentType();
        Optional<Pipeline> resumed = transitions.transitionIfLegal(key.workflowId(), agentType.phase(), request);
        Pipeline pipeline = resumed.orElseGet(() -> stateMachine.getCurrentState(key.workflowId()));
        if (pipeline.getState() != agentType.phase()) {
            log.warn("Not restarting {} for story {}: pipeline is {}, not {}",
                    agentId, key.storyId(), pipeline.getState(), agentType.phase());
            return pipeline.getState();
        }
        WatchedExecution started = supervisor.launch(pipeline, agentType, agentId, key.storyId(), context);
        inFlight.put(started.episodeKey(), started);
        return pipeline.getState();
    }

    // ------------------------------------------------------------------
    // Episode closure
    // ------------------------------------------------------------------

    @EventListener
    public void onExecutionCompleted(ExecutionCompletedEvent event) {
        closeEpisode(event.execution().episodeKey()).whenComplete((closed, error) -> {
            if (error != null) {
                log.error("Closing episode {} failed: {}", event.execution().episodeKey(), error.getMessage(), error);
            }
        });
    }

    /** Forward progress: close the live episode without writing a record. */
    public CompletableFuture<Optional<RecoveryEpisode>> closeEpisode(EpisodeKey key) {
        return submit(key, () -> {
            inFlight.remove(key);
            return tracker.live(key)
                    .filter(e -> e.getStatus().isUnresolved())
                    .flatMap(e -> tracker.close(key, EpisodeStatus.CLOSED));
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Open and escalated episodes of a workflow. */
    public List<RecoveryEpisode> getRecoveryStatus(UUID workflowId) {
        stateMachine.getCurrentState(workflowId);
        return tracker.unresolved(workflowId);
    }

    /** Recovery attempts of a workflow, newest first, optionally for one story. */
    public HistoryPage<FailureRecoveryRecord> getRecoveryHistory(UUID workflowId, String storyId,
                                                                Integer limit, String cursor) {
        stateMachine.getCurrentState(workflowId);
        int pageSize = HistoryPage.clampLimit(limit);
        long before = HistoryPage.decodeCursor(cursor);
        List<FailureRecoveryRecord> items = storyId == null
                ? recordRepo.findPage(workflowId, before, PageRequest.of(0, pageSize))
                : recordRepo.findStoryPage(workflowId, storyId, before, PageRequest.of(0, pageSize));
        Long lastId = items.isEmpty() ? null : items.get(items.size() - 1).getId();
        return new HistoryPage<>(items, HistoryPage.nextCursor(items.size(), pageSize, lastId));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Append {@code work} to the episode's lane. The trigger is released only
     * after the lane map is updated, so work never runs inside compute().
     */
    private <T> CompletableFuture<T> submit(EpisodeKey key, Supplier<T> work) {
        CompletableFuture<Void> trigger = new CompletableFuture<>();
        CompletableFuture<T> result = new CompletableFuture<>();
        lanes.compute(key, (k, tail) -> {
            CompletableFuture<?> previous = tail == null
                    ? trigger
                    : tail.exceptionally(e -> null).thenCombine(trigger, (a, b) -> null);
            previous.thenApplyAsync(ignored -> inEpisodeContext(key, work), workers)
                    .whenComplete((value, error) -> {
                        if (error == null) {
                            result.complete(value);
                        } else {
                            result.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                                    ? error.getCause() : error);
                        }
                    });
            return result;
        });
        result.whenComplete((r, e) -> lanes.remove(key, result));
        trigger.complete(null);
        return result;
    }

    private <T> T inEpisodeContext(EpisodeKey key, Supplier<T> work) {
        MDC.put("workflowId", key.workflowId().toString());
        MDC.put("storyId",    key.storyId());
        MDC.put("agentId",    key.agentId());
        try {
            return work.get();
        } finally {
            MDC.clear();
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) throw cause;
            throw e;
        }
    }

    /**
     * Move the pipeline toward {@code target} from wherever it is now. A
     * paused pipeline that must fail is resumed first, since PAUSED has no
     * edge to FAILED. Returns the resulting state; a pipeline that could not
     * be moved is logged and its current state returned.
     */
    private PipelineState drivePipeline(UUID workflowId, PipelineState target, TransitionRequest request) {
        try {
            Optional<Pipeline> moved = transitions.transition(workflowId, p -> {
                PipelineState state = p.getState();
                if (state.isTerminal() || state == target) return Optional.empty();
                if (state == PipelineState.PAUSED) {
                    return target == PipelineState.FAILED ? Optional.of(p.getPausedFrom()) : Optional.empty();
                }
                return Optional.of(target);
            }, request);
            if (moved.isPresent() && moved.get().getState() != target) {
                moved = transitions.transitionIfLegal(workflowId, target, request);
            }
            return moved.map(Pipeline::getState)
                    .orElseGet(() -> stateMachine.getCurrentState(workflowId).getState());
        } catch (OrchestrationException e) {
            log.error("Could not move workflow {} to {}: {}", workflowId, target, e.getMessage(), e);
            return stateMachine.getCurrentState(workflowId).getState();
        }
    }

    private WatchedExecution stopInFlight(EpisodeKey key) {
        WatchedExecution running = inFlight.remove(key);
        if (running != null) supervisor.stop(running);
        return running;
    }

    private FailureRecoveryRecord lastRecordOf(RecoveryEpisode episode) {
        return tracker.lastRecord(episode.getId())
                .orElseThrow(() -> new EpisodeNotFoundException(episode.key()));
    }

    private FailureRecoveryRecord.Builder attempt(FailureReport report, Instant started) {
        WatchedExecution e = report.execution();
        Instant now = clock.instant();
        return FailureRecoveryRecord.builder()
                .workflowId(e.workflowId())
                .projectId(e.projectId())
                .workspaceId(e.workspaceId())
                .storyId(e.storyId())
                .sessionId(e.sessionId())
                .agentId(e.agentId())
                .agentType(e.agentType())
                .failureType(report.failureType())
                .durationMs(Duration.between(started, now).toMillis())
                .createdAt(now);
    }

    private FailureRecoveryRecord write(RecoveryEpisode episode, FailureRecoveryRecord.Builder attempt,
                                        RecoveryStrategy strategy) {
        FailureRecoveryRecord record = tracker.recordAttempt(episode.getId(), attempt, strategy);
        count(record);
        return record;
    }

    private void count(FailureRecoveryRecord record) {
        meterRegistry.counter("shipyard.recovery.attempts",
                "strategy", record.getRecoveryStrategy().name(),
                "success", String.valueOf(record.isSuccess())).increment();
    }

    private static Map<String, Object> evidence(FailureReport report) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("detectedAt", report.detectedAt().toString());
        if (report.evidence().lastProgressAt() != null) {
            meta.put("lastProgressAt", report.evidence().lastProgressAt().toString());
        }
        meta.put("repeatCount", report.evidence().repeatCount());
        if (report.evidence().exitCode() != null)   meta.put("exitCode", report.evidence().exitCode());
        if (report.evidence().statusCode() != null) meta.put("statusCode", report.evidence().statusCode());
        if (report.evidence().detail() != null)     meta.put("detail", report.evidence().detail());
        if (report.evidence().needsReview())        meta.put("needsReview", true);
        return meta;
    }

    static Map<String, Object> refreshedContext(FailureReport report) {
        Map<String, Object> context = new HashMap<>(report.execution().context());
        context.keySet().removeAll(TRANSIENT_CONTEXT_KEYS);
        context.put("refreshReason", report.describe());
        return context;
    }

    private static Map<String, Object> withGuidance(WatchedExecution previous, String guidance) {
        Map<String, Object> context = new HashMap<>(previous != null ? previous.context() : Map.of());
        if (guidance != null) context.put("operatorGuidance", guidance);
        return context;
    }

    private String json(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Recovery metadata is not serializable", e);
        }
    }
}
