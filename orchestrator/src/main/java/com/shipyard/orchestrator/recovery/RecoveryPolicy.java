package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.checkpoint.CheckpointRef;
import com.shipyard.orchestrator.config.RecoveryProperties;
import com.shipyard.orchestrator.error.CheckpointUnavailableException;
import com.shipyard.orchestrator.error.RecoveryExhaustedException;
import com.shipyard.orchestrator.model.EpisodeStatus;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.RecoveryEpisode;

import java.util.Optional;

/**
 * Chooses a recovery strategy for a failure, given the episode it belongs to.
 *
 * Pure decision logic: no I/O, no clock. The episode passed in already
 * counts the failure being decided (its stuckCount includes it), but not
 * the strategy about to be chosen.
 *
 * <pre>
 * ESCALATED episode                           → ESCALATION
 * checkpoint recovery already used            → ESCALATION
 * retryCount ≥ maxRetries                     → ESCALATION
 * API_ERROR, TIMEOUT                          → RETRY with backoff
 * CRASH                                       → CHECKPOINT_RECOVERY, else CONTEXT_REFRESH
 * STUCK (first in episode)                    → CONTEXT_REFRESH
 * STUCK (repeat)                              → CHECKPOINT_RECOVERY, else CONTEXT_REFRESH
 * LOOP                                        → CONTEXT_REFRESH
 * CONTEXT_REFRESH beyond maxContextRefreshes  → ESCALATION
 * </pre>
 *
 * MANUAL_OVERRIDE is never chosen here.
 */
public class RecoveryPolicy {

    private final int maxRetries;
    private final int maxContextRefreshes;
    private final BackoffCalculator backoff;

    public RecoveryPolicy(RecoveryProperties properties, BackoffCalculator backoff) {
        this.maxRetries          = properties.getMaxRetries();
        this.maxContextRefreshes = properties.getMaxContextRefreshes();
        this.backoff             = backoff;
    }

    public RecoveryDecision decide(RecoveryEpisode episode,
                                   FailureType failureType,
                                   String projectId,
                                   Optional<CheckpointRef> checkpoint) {
        if (episode.getStatus() == EpisodeStatus.ESCALATED) {
            return RecoveryDecision.escalate(null, "episode already escalated, awaiting operator");
        }
        if (episode.isCheckpointRecoveryUsed()) {
            return exhausted(episode, failureType + " recurred after checkpoint recovery");
        }
        if (episode.getRetryCount() >= maxRetries) {
            return exhausted(episode, "retry budget of " + maxRetries + " spent");
        }

        return switch (failureType) {
            case API_ERROR, TIMEOUT -> RecoveryDecision.retry(
                    backoff.delayFor(episode.getRetryCount()),
                    "retry " + (episode.getRetryCount() + 1) + " of " + maxRetries);
            case CRASH -> rollbackOrRefresh(episode, projectId, checkpoint);
            case STUCK -> episode.getStuckCount() <= 1
                    ? contextRefresh(episode, null, "first stall in episode")
                    : rollbackOrRefresh(episode, projectId, checkpoint);
            case LOOP -> contextRefresh(episode, null, "repeated action");
        };
    }

    private RecoveryDecision rollbackOrRefresh(RecoveryEpisode episode,
                                               String projectId,
                                               Optional<CheckpointRef> checkpoint) {
        if (checkpoint.isPresent()) {
            return RecoveryDecision.checkpointRecovery(checkpoint.get(),
                    "rolling back to " + checkpoint.get().ref());
        }
        return contextRefresh(episode,
                new CheckpointUnavailableException(projectId, episode.getStoryId()),
                "no checkpoint, refreshing context instead");
    }

    private RecoveryDecision contextRefresh(RecoveryEpisode episode, CheckpointUnavailableException cause,
                                            String reason) {
        if (episode.getContextRefreshCount() >= maxContextRefreshes) {
            return exhausted(episode, "context refresh budget of " + maxContextRefreshes + " spent");
        }
        return RecoveryDecision.contextRefresh(cause, reason);
    }

    private static RecoveryDecision exhausted(RecoveryEpisode episode, String reason) {
        RecoveryExhaustedException cause = new RecoveryExhaustedException(episode.key(), reason);
        return RecoveryDecision.escalate(cause, cause.getMessage());
    }
}
