package com.shipyard.orchestrator.detector;

import java.time.Instant;

/**
 * What the detector saw when it classified a failure.
 *
 * @param lastProgressAt last time the progress signal changed (or the start time)
 * @param repeatCount    consecutive observations that triggered the classification
 * @param exitCode       exit code for crashes, else null
 * @param statusCode     provider HTTP status for API errors, else null
 * @param needsReview    true when the evidence was ambiguous and the type is a default
 */
public record FailureEvidence(
        Instant lastProgressAt,
        int     repeatCount,
        Integer exitCode,
        Integer statusCode,
        String  detail,
        boolean needsReview
) {}
