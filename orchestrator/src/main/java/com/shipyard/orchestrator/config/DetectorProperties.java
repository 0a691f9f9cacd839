package com.shipyard.orchestrator.config;

import com.shipyard.orchestrator.model.PipelineState;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Failure detector thresholds, bound from {@code shipyard.detector.*}.
 *
 * Detection latency is bounded by pollInterval times the relevant threshold,
 * or by the state's idle window for timeouts.
 */
@ConfigurationProperties(prefix = "shipyard.detector")
public class DetectorProperties {

    private Duration pollInterval = Duration.ofSeconds(5);

    /** Consecutive polls with an unchanged progress signal before STUCK. */
    private int stuckPolls = 6;

    /** Consecutive identical action signatures before LOOP. */
    private int loopThreshold = 20;

    /** Consecutive provider errors (or unreadable statuses) before API_ERROR. */
    private int apiErrorThreshold = 5;

    /** Idle window for states not listed in {@link #idleWindow}. */
    private Duration defaultIdleWindow = Duration.ofMinutes(15);

    /** Per-state "no progress" budget before TIMEOUT. */
    private final Map<PipelineState, Duration> idleWindow = defaultIdleWindows();

    private static Map<PipelineState, Duration> defaultIdleWindows() {
        Map<PipelineState, Duration> m = new EnumMap<>(PipelineState.class);
        m.put(PipelineState.PLANNING,     Duration.ofMinutes(10));
        m.put(PipelineState.IMPLEMENTING, Duration.ofMinutes(15));
        m.put(PipelineState.QA,           Duration.ofMinutes(20));
        m.put(PipelineState.DEPLOYING,    Duration.ofMinutes(30));
        return m;
    }

    public Duration idleWindowFor(PipelineState state) {
        return idleWindow.getOrDefault(state, defaultIdleWindow);
    }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public int getStuckPolls() { return stuckPolls; }
    public void setStuckPolls(int stuckPolls) { this.stuckPolls = stuckPolls; }

    public int getLoopThreshold() { return loopThreshold; }
    public void setLoopThreshold(int loopThreshold) { this.loopThreshold = loopThreshold; }

    public int getApiErrorThreshold() { return apiErrorThreshold; }
    public void setApiErrorThreshold(int apiErrorThreshold) { this.apiErrorThreshold = apiErrorThreshold; }

    public Duration getDefaultIdleWindow() { return defaultIdleWindow; }
    public void setDefaultIdleWindow(Duration defaultIdleWindow) { this.defaultIdleWindow = defaultIdleWindow; }

    public Map<PipelineState, Duration> getIdleWindow() { return idleWindow; }
}
