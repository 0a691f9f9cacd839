package com.shipyard.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Snapshot of an execution as reported by the agent runtime.
 *
 * @param progressSignal      opaque marker that changes whenever the agent makes progress; null if none reported yet
 * @param exitCode            process exit code once it has exited, null while running
 * @param providerErrorStatus HTTP status of the last model-provider call if it failed (429, 401, 5xx), else null
 * @param actionSignature     hash of the agent's latest action/output, used to spot repetition; may be null
 * @param verdict             result the agent reported for its phase ("PASS", "FAIL", ...); null if it reported none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionStatus(
        String  progressSignal,
        Integer exitCode,
        Integer providerErrorStatus,
        String  actionSignature,
        String  verdict
) {
    public boolean hasExited() {
        return exitCode != null;
    }

    public static ExecutionStatus running(String progressSignal) {
        return new ExecutionStatus(progressSignal, null, null, null, null);
    }

    public static ExecutionStatus exited(int exitCode) {
        return new ExecutionStatus(null, exitCode, null, null, null);
    }

    public static ExecutionStatus exited(int exitCode, String verdict) {
        return new ExecutionStatus(null, exitCode, null, null, verdict);
    }
}
