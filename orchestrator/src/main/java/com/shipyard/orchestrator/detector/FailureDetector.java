package com.shipyard.orchestrator.detector;

import com.shipyard.orchestrator.agent.AgentRuntime;
import com.shipyard.orchestrator.agent.ExecutionStatus;
import com.shipyard.orchestrator.config.DetectorProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches running agent executions and reports the ones that go wrong.
 *
 * Every tick reads the status of each watched execution on the detector
 * pool, one poll per execution at a time. A failure or a clean exit is
 * published as an application event and the watch is dropped; the detector
 * itself never touches pipeline state.
 */
@Component
public class FailureDetector {

    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    private final Map<String, Slot> watches = new ConcurrentHashMap<>();

    private final AgentRuntime              runtime;
    private final DetectorProperties        properties;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meterRegistry;
    private final Executor                  pollers;
    private final Clock                     clock;

    public FailureDetector(AgentRuntime runtime,
                           DetectorProperties properties,
                           ApplicationEventPublisher events,
                           MeterRegistry meterRegistry,
                           @Qualifier("detectorExecutor") Executor pollers,
                           Clock clock) {
        this.runtime       = runtime;
        this.properties    = properties;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.pollers       = pollers;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public void watch(WatchedExecution execution) {
        watches.put(execution.sessionId(), new Slot(new ExecutionWatch(execution, properties)));
        log.info("Watching execution {} (agent={} story={} phase={})",
                execution.sessionId(), execution.agentId(), execution.storyId(), execution.phase());
    }

    /** Stop watching; returns false if the session was not watched. */
    public boolean unwatch(String sessionId) {
        return watches.remove(sessionId) != null;
    }

    public boolean isWatching(String sessionId) {
        return watches.containsKey(sessionId);
    }

    public List<WatchedExecution> activeWatches() {
        return watches.values().stream().map(s -> s.watch.execution()).toList();
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /**
     * Tick: hand every idle watch to the detector pool. A watch whose
     * previous poll has not returned yet is skipped this round.
     */
    @Scheduled(fixedDelayString = "${shipyard.detector.poll-interval:PT5S}")
    public void tick() {
        Instant now = clock.instant();
        for (Slot slot : watches.values()) {
            if (!slot.polling.compareAndSet(false, true)) continue;
            pollers.execute(() -> {
                try {
                    check(slot.watch, now);
                } catch (Exception e) {
                    log.error("Detector poll for {} failed: {}", slot.watch.execution().sessionId(), e.getMessage(), e);
                } finally {
                    slot.polling.set(false);
                }
            });
        }
    }

    void check(ExecutionWatch watch, Instant now) {
        WatchedExecution execution = watch.execution();
        String sessionId = execution.sessionId();

        ExecutionStatus status;
        try {
            status = runtime.getExecutionStatus(execution.handle());
        } catch (Exception e) {
            log.warn("Status of execution {} unavailable: {}", sessionId, e.getMessage());
            watch.observeUnreadable(e, now).ifPresent(this::reportFailure);
            return;
        }

        ExecutionWatch.Observation observation = watch.observe(status, now);
        switch (observation.verdict()) {
            case HEALTHY -> log.debug("Execution {} healthy", sessionId);
            case COMPLETED -> {
                if (unwatch(sessionId)) {
                    log.info("Execution {} completed (agent={} story={})",
                            sessionId, execution.agentId(), execution.storyId());
                    events.publishEvent(new ExecutionCompletedEvent(execution, now, status.verdict()));
                }
            }
            case FAILED -> reportFailure(observation.report());
        }
    }

    private void reportFailure(FailureReport report) {
        String sessionId = report.execution().sessionId();
        // A concurrent unwatch (operator cancel, phase change) wins over a late detection.
        if (!unwatch(sessionId)) return;

        meterRegistry.counter("shipyard.detector.failures",
                "type", report.failureType().name()).increment();
        log.warn("Execution {} failed: {} (workflow={} agent={} story={}{})",
                sessionId, report.describe(), report.execution().workflowId(),
                report.execution().agentId(), report.execution().storyId(),
                report.evidence().needsReview() ? ", needs review" : "");
        events.publishEvent(report);
    }

    Optional<ExecutionWatch> watchFor(String sessionId) {
        return Optional.ofNullable(watches.get(sessionId)).map(s -> s.watch);
    }

    private static final class Slot {
        final ExecutionWatch watch;
        final AtomicBoolean  polling = new AtomicBoolean(false);

        Slot(ExecutionWatch watch) {
            this.watch = watch;
        }
    }
}
