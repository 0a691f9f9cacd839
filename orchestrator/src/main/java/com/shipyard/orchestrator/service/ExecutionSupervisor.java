package com.shipyard.orchestrator.service;

import com.shipyard.orchestrator.agent.AgentRuntime;
import com.shipyard.orchestrator.agent.ExecutionHandle;
import com.shipyard.orchestrator.detector.FailureDetector;
import com.shipyard.orchestrator.detector.WatchedExecution;
import com.shipyard.orchestrator.model.AgentType;
import com.shipyard.orchestrator.model.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Starts and stops agent executions, keeping the failure detector's
 * watch list in step with what is actually running.
 */
@Component
public class ExecutionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final AgentRuntime    runtime;
    private final FailureDetector detector;
    private final Clock           clock;

    public ExecutionSupervisor(AgentRuntime runtime, FailureDetector detector, Clock clock) {
        this.runtime  = runtime;
        this.detector = detector;
        this.clock    = clock;
    }

    /** Start the agent for the pipeline's current phase and watch it. */
    public WatchedExecution launch(Pipeline pipeline, AgentType agentType, String agentId,
                                   String storyId, Map<String, Object> context) {
        ExecutionHandle handle = runtime.startExecution(agentId, storyId, context);
        WatchedExecution execution = new WatchedExecution(
                pipeline.getWorkflowId(), pipeline.getProjectId(), pipeline.getWorkspaceId(),
                storyId, agentId, agentType, agentType.phase(), handle, context, clock.instant());
        detector.watch(execution);
        return execution;
    }

    /** Stop {@code previous} (if still around) and run the same step again with {@code context}. */
    public WatchedExecution relaunch(WatchedExecution previous, Map<String, Object> context) {
        stop(previous);
        ExecutionHandle handle = runtime.startExecution(previous.agentId(), previous.storyId(), context);
        WatchedExecution next = previous.restartedAs(handle, context, clock.instant());
        detector.watch(next);
        log.info("Execution {} replaced by {} (agent={} story={})",
                previous.sessionId(), next.sessionId(), next.agentId(), next.storyId());
        return next;
    }

    /**
     * Stop watching and terminate. An execution that already exited is not
     * an error; the runtime failing to terminate is logged and left to it.
     */
    public void stop(WatchedExecution execution) {
        detector.unwatch(execution.sessionId());
        try {
            runtime.terminateExecution(execution.handle());
        } catch (RuntimeException e) {
            log.warn("Terminating execution {} failed, it may already be gone: {}",
                    execution.sessionId(), e.getMessage());
        }
    }
}
