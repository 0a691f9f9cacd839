package com.shipyard.orchestrator.model;

/**
 * Classification of an agent execution anomaly.
 * Exactly one type is assigned per detected failure.
 */
public enum FailureType {
    STUCK,      // progress signal unchanged across N polls
    CRASH,      // unexpected non-zero exit
    API_ERROR,  // provider-level failure: rate limit, auth, 5xx
    LOOP,       // identical action signature repeated beyond threshold
    TIMEOUT     // no progress signal within the state's idle window
}
