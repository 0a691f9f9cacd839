package com.shipyard.orchestrator.service;

import com.shipyard.orchestrator.agent.ExecutionHandle;
import com.shipyard.orchestrator.checkpoint.CheckpointService;
import com.shipyard.orchestrator.config.PipelineProperties;
import com.shipyard.orchestrator.detector.ExecutionCompletedEvent;
import com.shipyard.orchestrator.detector.FailureDetector;
import com.shipyard.orchestrator.detector.WatchedExecution;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.notification.NotificationEvent;
import com.shipyard.orchestrator.notification.Notifier;
import com.shipyard.orchestrator.recovery.RecoveryEngine;
import com.shipyard.orchestrator.statemachine.PipelineStateMachine;
import com.shipyard.orchestrator.statemachine.PipelineTransitionedEvent;
import com.shipyard.orchestrator.statemachine.TransitionRequest;
import com.shipyard.orchestrator.statemachine.TransitionRetrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineOrchestrator.
 *
 * The state machine, agent supervision, recovery and notifications are all
 * mocked; these tests only check how the orchestrator wires phases together.
 */
@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock PipelineStateMachine stateMachine;
    @Mock TransitionRetrier    transitions;
    @Mock ExecutionSupervisor  supervisor;
    @Mock FailureDetector      detector;
    @Mock RecoveryEngine       recovery;
    @Mock CheckpointService    checkpoints;
    @Mock Notifier             notifier;

    PipelineProperties   props = new PipelineProperties();
    PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new PipelineOrchestrator(stateMachine, transitions, supervisor, detector,
                recovery, checkpoints, notifier, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // startWorkflow() / runPhase()
    // ------------------------------------------------------------------

    @Test
    void startWorkflow_startsPlannerOnStory() {
        Pipeline pipeline = pipeline(PipelineState.PLANNING, "story-1", null);
        when(stateMachine.start("proj-1", "ws-1", "user:42", "story-1")).thenReturn(pipeline);
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any()))
                .thenReturn(execution(pipeline, AgentType.PLANNER, "sess-1"));

        orchestrator.startWorkflow("proj-1", "ws-1", "user:42", "story-1");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
        verify(supervisor).launch(eq(pipeline), eq(AgentType.PLANNER), eq("planner-agent"), eq("story-1"),
                context.capture());
        assertThat(context.getValue())
                .containsEntry("workflowId", pipeline.getWorkflowId().toString())
                .containsEntry("phase", "PLANNING");
    }

    @Test
    void runPhase_noStory_usesWorkflowIdAsStory() {
        Pipeline pipeline = pipeline(PipelineState.IMPLEMENTING, null, "dev-agent-7");
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any()))
                .thenReturn(execution(pipeline, AgentType.DEV, "sess-1"));

        orchestrator.runPhase(pipeline);

        verify(supervisor).launch(eq(pipeline), eq(AgentType.DEV), eq("dev-agent-7"),
                eq(pipeline.getWorkflowId().toString()), any());
    }

    @Test
    void runPhase_agentAlreadyRunning_notStartedTwice() {
        Pipeline pipeline = pipeline(PipelineState.PLANNING, "story-1", null);
        when(detector.activeWatches()).thenReturn(List.of(execution(pipeline, AgentType.PLANNER, "sess-1")));

        assertThat(orchestrator.runPhase(pipeline)).isEmpty();

        verify(supervisor, never()).launch(any(), any(), any(), any(), any());
    }

    @Test
    void runPhase_pausedPipeline_nothingStarted() {
        Pipeline pipeline = pipeline(PipelineState.PLANNING, "story-1", null);
        pipeline.moveTo(PipelineState.PAUSED, null, null, NOW);

        assertThat(orchestrator.runPhase(pipeline)).isEmpty();

        verifyNoInteractions(supervisor, detector);
    }

    // ------------------------------------------------------------------
    // transition() / pause()
    // ------------------------------------------------------------------

    @Test
    void transition_intoWorkingState_defaultsAgentAndStartsIt() {
        Pipeline qa = pipeline(PipelineState.QA, "story-1", "qa-agent");
        when(stateMachine.transition(eq(qa.getWorkflowId()), eq(PipelineState.QA), any())).thenReturn(qa);
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any())).thenReturn(execution(qa, AgentType.QA, "sess-5"));

        orchestrator.transition(qa.getWorkflowId(), PipelineState.QA, TransitionRequest.by("user:42"));

        ArgumentCaptor<TransitionRequest> request = ArgumentCaptor.forClass(TransitionRequest.class);
        verify(stateMachine).transition(eq(qa.getWorkflowId()), eq(PipelineState.QA), request.capture());
        assertThat(request.getValue().agentId()).isEqualTo("qa-agent");
        verify(supervisor).launch(eq(qa), eq(AgentType.QA), eq("qa-agent"), eq("story-1"), any());
    }

    @Test
    void pause_stopsRunningExecutionsOfWorkflow() {
        Pipeline pipeline = pipeline(PipelineState.IMPLEMENTING, "story-1", "dev-agent");
        WatchedExecution running = execution(pipeline, AgentType.DEV, "sess-1");
        WatchedExecution otherWorkflow = execution(pipeline(PipelineState.PLANNING, "story-2", null),
                AgentType.PLANNER, "sess-2");
        pipeline.moveTo(PipelineState.PAUSED, null, null, NOW);
        when(stateMachine.pause(pipeline.getWorkflowId(), "user:42", "hold")).thenReturn(pipeline);
        when(detector.activeWatches()).thenReturn(List.of(running, otherWorkflow));

        orchestrator.pause(pipeline.getWorkflowId(), "user:42", "hold");

        verify(supervisor).stop(running);
        verify(supervisor, never()).stop(otherWorkflow);
    }

    // ------------------------------------------------------------------
    // onExecutionCompleted()
    // ------------------------------------------------------------------

    @Test
    void onExecutionCompleted_planning_advancesToImplementingAndStartsDev() {
        Pipeline planning = pipeline(PipelineState.PLANNING, "story-1", "planner-agent");
        Pipeline implementing = pipeline(PipelineState.IMPLEMENTING, "story-1", "dev-agent");
        WatchedExecution finished = execution(planning, AgentType.PLANNER, "sess-1");
        when(transitions.transition(eq(planning.getWorkflowId()), any(), any())).thenReturn(Optional.of(implementing));
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any()))
                .thenReturn(execution(implementing, AgentType.DEV, "sess-2"));

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(finished, NOW));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Function<Pipeline, Optional<PipelineState>>> decide = ArgumentCaptor.forClass(Function.class);
        ArgumentCaptor<TransitionRequest> request = ArgumentCaptor.forClass(TransitionRequest.class);
        verify(transitions).transition(eq(planning.getWorkflowId()), decide.capture(), request.capture());
        assertThat(decide.getValue().apply(planning)).contains(PipelineState.IMPLEMENTING);
        assertThat(decide.getValue().apply(implementing)).isEmpty();
        assertThat(request.getValue().agentId()).isEqualTo("dev-agent");
        assertThat(request.getValue().metadata()).containsEntry("completedSession", "sess-1");

        verify(supervisor).launch(eq(implementing), eq(AgentType.DEV), eq("dev-agent"), eq("story-1"), any());
        verifyNoInteractions(checkpoints);
    }

    @Test
    void onExecutionCompleted_qa_capturesSafePointsAroundDeploy() {
        Pipeline qa = pipeline(PipelineState.QA, "story-1", "qa-agent");
        Pipeline deploying = pipeline(PipelineState.DEPLOYING, "story-1", "devops-agent");
        when(stateMachine.getCurrentState(qa.getWorkflowId())).thenReturn(qa);
        when(transitions.transition(eq(qa.getWorkflowId()), any(), any())).thenReturn(Optional.of(deploying));
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any()))
                .thenReturn(execution(deploying, AgentType.DEVOPS, "sess-4"));

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(execution(qa, AgentType.QA, "sess-3"), NOW));

        verify(checkpoints).captureSafePoint(qa, CheckpointService.LABEL_QA_PASSED);
        verify(checkpoints).captureSafePoint(deploying, CheckpointService.LABEL_PRE_DEPLOY);
        verify(supervisor).launch(eq(deploying), eq(AgentType.DEVOPS), eq("devops-agent"), eq("story-1"), any());
    }

    @Test
    void onExecutionCompleted_qaRejected_sentBackToImplementingWithRound() {
        Pipeline qa = pipeline(PipelineState.QA, "story-1", "qa-agent");
        Pipeline implementing = pipeline(PipelineState.IMPLEMENTING, "story-1", "dev-agent");
        when(stateMachine.getCurrentState(qa.getWorkflowId())).thenReturn(qa);
        when(stateMachine.countTransitions(qa.getWorkflowId(), "story-1",
                PipelineState.QA, PipelineState.IMPLEMENTING)).thenReturn(1L);
        when(transitions.transition(eq(qa.getWorkflowId()), any(), any())).thenReturn(Optional.of(implementing));
        when(detector.activeWatches()).thenReturn(List.of());
        when(supervisor.launch(any(), any(), any(), any(), any()))
                .thenReturn(execution(implementing, AgentType.DEV, "sess-4"));

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(execution(qa, AgentType.QA, "sess-3"), NOW, "FAIL"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Function<Pipeline, Optional<PipelineState>>> decide = ArgumentCaptor.forClass(Function.class);
        ArgumentCaptor<TransitionRequest> request = ArgumentCaptor.forClass(TransitionRequest.class);
        verify(transitions).transition(eq(qa.getWorkflowId()), decide.capture(), request.capture());
        assertThat(decide.getValue().apply(qa)).contains(PipelineState.IMPLEMENTING);
        assertThat(request.getValue().actor()).isEqualTo(PipelineOrchestrator.ACTOR_QA_REJECTION);
        assertThat(request.getValue().agentId()).isEqualTo("dev-agent");
        assertThat(request.getValue().metadata())
                .containsEntry("iterationCount", 2L)
                .containsEntry("verdict", "FAIL")
                .containsEntry("completedSession", "sess-3");

        verify(supervisor).launch(eq(implementing), eq(AgentType.DEV), eq("dev-agent"), eq("story-1"), any());
        verifyNoInteractions(checkpoints, notifier);
    }

    @Test
    void onExecutionCompleted_qaRejectedPastLimit_pausesAndNotifies() {
        props.setMaxQaIterations(3);
        Pipeline qa = pipeline(PipelineState.QA, "story-1", "qa-agent");
        Pipeline paused = pipeline(PipelineState.QA, "story-1", "qa-agent");
        paused.moveTo(PipelineState.PAUSED, null, null, NOW);
        when(stateMachine.getCurrentState(qa.getWorkflowId())).thenReturn(qa);
        when(stateMachine.countTransitions(qa.getWorkflowId(), "story-1",
                PipelineState.QA, PipelineState.IMPLEMENTING)).thenReturn(3L);
        when(transitions.transition(eq(qa.getWorkflowId()), any(), any())).thenReturn(Optional.of(paused));

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(execution(qa, AgentType.QA, "sess-9"), NOW, "needs_changes"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Function<Pipeline, Optional<PipelineState>>> decide = ArgumentCaptor.forClass(Function.class);
        ArgumentCaptor<TransitionRequest> request = ArgumentCaptor.forClass(TransitionRequest.class);
        verify(transitions).transition(eq(qa.getWorkflowId()), decide.capture(), request.capture());
        assertThat(decide.getValue().apply(qa)).contains(PipelineState.PAUSED);
        assertThat(request.getValue().actor()).isEqualTo(PipelineOrchestrator.ACTOR_QA_ESCALATION);
        assertThat(request.getValue().metadata()).containsEntry("iterationCount", 4L);
        assertThat(request.getValue().errorMessage()).isEqualTo("QA rejection cycle exceeded limit (4/3)");

        ArgumentCaptor<NotificationEvent> sent = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notifier).notify(sent.capture());
        assertThat(sent.getValue().type()).isEqualTo(NotificationEvent.Type.QA_ESCALATION);
        assertThat(sent.getValue().details()).containsEntry("storyId", "story-1");
        verify(supervisor, never()).launch(any(), any(), any(), any(), any());
        verifyNoInteractions(checkpoints);
    }

    @Test
    void onExecutionCompleted_qaRejectedAfterPipelineLeftQa_ignored() {
        Pipeline paused = pipeline(PipelineState.QA, "story-1", "qa-agent");
        WatchedExecution finished = execution(paused, AgentType.QA, "sess-3");
        paused.moveTo(PipelineState.PAUSED, null, null, NOW);
        when(stateMachine.getCurrentState(paused.getWorkflowId())).thenReturn(paused);

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(finished, NOW, "FAIL"));

        verifyNoInteractions(transitions, checkpoints, notifier, supervisor);
    }

    @Test
    void onExecutionCompleted_qaPassVerdict_advancesToDeploying() {
        Pipeline qa = pipeline(PipelineState.QA, "story-1", "qa-agent");
        when(stateMachine.getCurrentState(qa.getWorkflowId())).thenReturn(qa);
        when(transitions.transition(eq(qa.getWorkflowId()), any(), any())).thenReturn(Optional.empty());

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(execution(qa, AgentType.QA, "sess-3"), NOW, "pass"));

        verify(checkpoints).captureSafePoint(qa, CheckpointService.LABEL_QA_PASSED);
        verify(stateMachine, never()).countTransitions(any(), any(), any(), any());
    }

    @Test
    void onExecutionCompleted_pipelineMovedOn_nothingStarted() {
        Pipeline planning = pipeline(PipelineState.PLANNING, "story-1", "planner-agent");
        when(transitions.transition(eq(planning.getWorkflowId()), any(), any())).thenReturn(Optional.empty());

        orchestrator.onExecutionCompleted(new ExecutionCompletedEvent(execution(planning, AgentType.PLANNER, "sess-1"), NOW));

        verify(supervisor, never()).launch(any(), any(), any(), any(), any());
    }

    // ------------------------------------------------------------------
    // onPipelineTransitioned()
    // ------------------------------------------------------------------

    @Test
    void onPipelineTransitioned_failed_stopsAgentsAndNotifies() {
        Pipeline pipeline = pipeline(PipelineState.QA, "story-1", "qa-agent");
        WatchedExecution running = execution(pipeline, AgentType.QA, "sess-1");
        when(detector.activeWatches()).thenReturn(List.of(running));

        orchestrator.onPipelineTransitioned(new PipelineTransitionedEvent(pipeline.getWorkflowId(), "proj-1", "ws-1",
                PipelineState.QA, PipelineState.FAILED, "user:42", "story-1", "qa-agent", 7L, "tests never pass"));

        verify(supervisor).stop(running);
        ArgumentCaptor<NotificationEvent> sent = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notifier).notify(sent.capture());
        assertThat(sent.getValue().type()).isEqualTo(NotificationEvent.Type.PIPELINE_FAILED);
        assertThat(sent.getValue().details())
                .containsEntry("previousState", "QA")
                .containsEntry("error", "tests never pass");
    }

    @Test
    void onPipelineTransitioned_complete_notifiesComplete() {
        when(detector.activeWatches()).thenReturn(List.of());

        orchestrator.onPipelineTransitioned(new PipelineTransitionedEvent(UUID.randomUUID(), "proj-1", "ws-1",
                PipelineState.DEPLOYING, PipelineState.COMPLETE, "system:orchestrator", null, "devops-agent", 9L, null));

        ArgumentCaptor<NotificationEvent> sent = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notifier).notify(sent.capture());
        assertThat(sent.getValue().type()).isEqualTo(NotificationEvent.Type.PIPELINE_COMPLETE);
    }

    @Test
    void onPipelineTransitioned_nonTerminal_ignored() {
        orchestrator.onPipelineTransitioned(new PipelineTransitionedEvent(UUID.randomUUID(), "proj-1", "ws-1",
                PipelineState.PLANNING, PipelineState.IMPLEMENTING, "system:orchestrator", null, "dev-agent", 2L, null));

        verifyNoInteractions(notifier, supervisor, detector);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Pipeline pipeline(PipelineState state, String storyId, String agentId) {
        Pipeline p = new Pipeline(UUID.randomUUID(), "proj-1", "ws-1", NOW);
        p.moveTo(state, storyId, agentId, NOW);
        return p;
    }

    private static WatchedExecution execution(Pipeline pipeline, AgentType agentType, String sessionId) {
        String storyId = pipeline.getCurrentStoryId() != null ? pipeline.getCurrentStoryId() : "story-x";
        String agentId = PipelineOrchestrator.defaultAgentId(agentType);
        return new WatchedExecution(pipeline.getWorkflowId(), pipeline.getProjectId(), pipeline.getWorkspaceId(),
                storyId, agentId, agentType, agentType.phase(),
                new ExecutionHandle(sessionId, agentId, storyId), Map.of(), NOW);
    }
}
