package com.shipyard.orchestrator.config;

import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.PipelineState;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Recovery policy knobs, bound from {@code shipyard.recovery.*}.
 */
@ConfigurationProperties(prefix = "shipyard.recovery")
public class RecoveryProperties {

    /** RETRY attempts allowed per episode before escalation. */
    private int maxRetries = 3;

    /** CONTEXT_REFRESH attempts allowed per episode before escalation. */
    private int maxContextRefreshes = 2;

    private Duration baseBackoff = Duration.ofSeconds(2);

    private Duration maxBackoff = Duration.ofMinutes(5);

    /** Random extra delay as a fraction of the computed backoff (0.0 – 1.0). */
    private double jitterFactor = 0.1;

    /** An unresolved episode stops carrying its counters forward after this long without failures. */
    private Duration episodeWindow = Duration.ofMinutes(30);

    /** Re-read/retry attempts for pipeline transitions issued by the orchestrator itself. */
    private int transitionAttempts = 5;

    /** Threads executing recovery actions. */
    private int workerThreads = 4;

    /**
     * Pipeline state an escalation drives to, per failure type: FAILED for
     * unrecoverable, PAUSED for "needs operator input".
     */
    private final Map<FailureType, PipelineState> severity = defaultSeverity();

    private static Map<FailureType, PipelineState> defaultSeverity() {
        Map<FailureType, PipelineState> m = new EnumMap<>(FailureType.class);
        for (FailureType type : FailureType.values()) {
            m.put(type, PipelineState.PAUSED);
        }
        m.put(FailureType.CRASH, PipelineState.FAILED);
        return m;
    }

    /** Escalation target for a failure type; PAUSED when unmapped. */
    public PipelineState escalationTarget(FailureType type) {
        PipelineState target = severity.getOrDefault(type, PipelineState.PAUSED);
        if (target != PipelineState.PAUSED && target != PipelineState.FAILED) {
            throw new IllegalStateException(
                    "shipyard.recovery.severity." + type + " must be PAUSED or FAILED, was " + target);
        }
        return target;
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getMaxContextRefreshes() { return maxContextRefreshes; }
    public void setMaxContextRefreshes(int maxContextRefreshes) { this.maxContextRefreshes = maxContextRefreshes; }

    public Duration getBaseBackoff() { return baseBackoff; }
    public void setBaseBackoff(Duration baseBackoff) { this.baseBackoff = baseBackoff; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public double getJitterFactor() { return jitterFactor; }
    public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }

    public Duration getEpisodeWindow() { return episodeWindow; }
    public void setEpisodeWindow(Duration episodeWindow) { this.episodeWindow = episodeWindow; }

    public int getTransitionAttempts() { return transitionAttempts; }
    public void setTransitionAttempts(int transitionAttempts) { this.transitionAttempts = transitionAttempts; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public Map<FailureType, PipelineState> getSeverity() { return severity; }
}
