package com.shipyard.orchestrator.detector;

import com.shipyard.orchestrator.agent.ExecutionStatus;
import com.shipyard.orchestrator.config.DetectorProperties;
import com.shipyard.orchestrator.model.FailureType;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-execution detection state, fed one status poll at a time.
 *
 * Checks run in a fixed order and the first match wins, so each failure
 * gets exactly one type: exit code, provider errors, repeated actions,
 * frozen progress, missing progress. Not thread-safe; the detector never
 * polls the same watch concurrently.
 */
public class ExecutionWatch {

    public enum Verdict { HEALTHY, COMPLETED, FAILED }

    public record Observation(Verdict verdict, FailureReport report) {
        static final Observation HEALTHY   = new Observation(Verdict.HEALTHY, null);
        static final Observation COMPLETED = new Observation(Verdict.COMPLETED, null);

        static Observation failed(FailureReport report) {
            return new Observation(Verdict.FAILED, report);
        }
    }

    private final WatchedExecution execution;
    private final int      stuckPolls;
    private final int      loopThreshold;
    private final int      apiErrorThreshold;
    private final Duration idleWindow;

    private Instant lastProgressAt;
    private String  lastProgressSignal;
    private int     unchangedPolls;
    private String  lastActionSignature;
    private int     actionRepeats;
    private int     consecutiveApiErrors;
    private int     consecutiveUnreadable;

    public ExecutionWatch(WatchedExecution execution, DetectorProperties props) {
        this.execution         = execution;
        this.stuckPolls        = props.getStuckPolls();
        this.loopThreshold     = props.getLoopThreshold();
        this.apiErrorThreshold = props.getApiErrorThreshold();
        this.idleWindow        = props.idleWindowFor(execution.phase());
        this.lastProgressAt    = execution.startedAt();
    }

    public WatchedExecution execution() {
        return execution;
    }

    public Observation observe(ExecutionStatus status, Instant now) {
        consecutiveUnreadable = 0;

        if (status.hasExited()) {
            if (status.exitCode() == 0) return Observation.COMPLETED;
            return fail(FailureType.CRASH, 1, status.exitCode(), null,
                    "process exited with code " + status.exitCode(), false, now);
        }

        if (status.providerErrorStatus() != null) {
            consecutiveApiErrors++;
            if (consecutiveApiErrors >= apiErrorThreshold) {
                return fail(FailureType.API_ERROR, consecutiveApiErrors, null, status.providerErrorStatus(),
                        providerErrorKind(status.providerErrorStatus()), false, now);
            }
        } else {
            consecutiveApiErrors = 0;
        }

        if (status.actionSignature() != null) {
            if (status.actionSignature().equals(lastActionSignature)) {
                actionRepeats++;
            } else {
                lastActionSignature = status.actionSignature();
                actionRepeats = 1;
            }
            if (actionRepeats >= loopThreshold) {
                return fail(FailureType.LOOP, actionRepeats, null, null,
                        "action '" + lastActionSignature + "' repeated", false, now);
            }
        }

        String signal = status.progressSignal();
        if (signal == null) {
            if (Duration.between(lastProgressAt, now).compareTo(idleWindow) > 0) {
                return fail(FailureType.TIMEOUT, 0, null, null,
                        "no progress for more than " + idleWindow, false, now);
            }
            return Observation.HEALTHY;
        }
        if (Objects.equals(signal, lastProgressSignal)) {
            unchangedPolls++;
            if (unchangedPolls >= stuckPolls) {
                return fail(FailureType.STUCK, unchangedPolls, null, null,
                        "progress signal unchanged since " + lastProgressAt, false, now);
            }
        } else {
            lastProgressSignal = signal;
            lastProgressAt     = now;
            unchangedPolls     = 0;
        }
        return Observation.HEALTHY;
    }

    /**
     * The runtime could not tell us the status. Too many in a row is an
     * unclassified failure, reported as API_ERROR and flagged for review.
     */
    public Optional<FailureReport> observeUnreadable(Exception error, Instant now) {
        consecutiveUnreadable++;
        if (consecutiveUnreadable < apiErrorThreshold) return Optional.empty();
        return Optional.of(fail(FailureType.API_ERROR, consecutiveUnreadable, null, null,
                "execution status unavailable: " + error.getMessage(), true, now).report());
    }

    private Observation fail(FailureType type, int repeats, Integer exitCode, Integer statusCode,
                             String detail, boolean needsReview, Instant now) {
        FailureEvidence evidence = new FailureEvidence(
                lastProgressAt, repeats, exitCode, statusCode, detail, needsReview);
        return Observation.failed(new FailureReport(execution, type, evidence, now));
    }

    private static String providerErrorKind(int status) {
        if (status == 429) return "rate limited";
        if (status == 401 || status == 403) return "provider authentication failed";
        if (status >= 500) return "provider server error";
        return "provider error";
    }
}
