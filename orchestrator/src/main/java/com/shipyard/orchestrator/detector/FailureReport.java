package com.shipyard.orchestrator.detector;

import com.shipyard.orchestrator.model.FailureType;

import java.time.Instant;
import java.util.Locale;

/**
 * One classified failure of one execution. Published as an application
 * event by the detector and consumed by the recovery engine.
 */
public record FailureReport(
        WatchedExecution execution,
        FailureType      failureType,
        FailureEvidence  evidence,
        Instant          detectedAt
) {
    public String describe() {
        StringBuilder sb = new StringBuilder(failureType.name().toLowerCase(Locale.ROOT));
        if (evidence.exitCode() != null)   sb.append(" exit_code=").append(evidence.exitCode());
        if (evidence.statusCode() != null) sb.append(" status=").append(evidence.statusCode());
        if (evidence.repeatCount() > 0)    sb.append(" repeats=").append(evidence.repeatCount());
        if (evidence.detail() != null)     sb.append(": ").append(evidence.detail());
        return sb.toString();
    }
}
