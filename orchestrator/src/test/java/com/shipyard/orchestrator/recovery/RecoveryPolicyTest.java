package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.checkpoint.CheckpointRef;
import com.shipyard.orchestrator.config.RecoveryProperties;
import com.shipyard.orchestrator.error.CheckpointUnavailableException;
import com.shipyard.orchestrator.error.RecoveryExhaustedException;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.RecoveryEpisode;
import com.shipyard.orchestrator.model.RecoveryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryPolicyTest {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    static final EpisodeKey KEY = new EpisodeKey(UUID.randomUUID(), "story-1", "dev-agent");
    static final Optional<CheckpointRef> CHECKPOINT = Optional.of(new CheckpointRef("proj-1", "story-1", "abc123"));

    RecoveryPolicy policy;

    @BeforeEach
    void setUp() {
        RecoveryProperties props = new RecoveryProperties();
        props.setMaxRetries(3);
        props.setMaxContextRefreshes(2);
        BackoffCalculator backoff = new BackoffCalculator(Duration.ofSeconds(2), Duration.ofMinutes(5), 0.0, () -> 0.0);
        policy = new RecoveryPolicy(props, backoff);
    }

    // ------------------------------------------------------------------
    // Transient failures
    // ------------------------------------------------------------------

    @ParameterizedTest
    @EnumSource(value = FailureType.class, names = {"API_ERROR", "TIMEOUT"})
    void transientFailure_retriedWithGrowingBackoff(FailureType type) {
        RecoveryEpisode episode = episodeWith(type);

        RecoveryDecision first = policy.decide(episode, type, "proj-1", Optional.empty());
        episode.recordStrategy(RecoveryStrategy.RETRY);
        episode.recordFailure(type, NOW);
        RecoveryDecision second = policy.decide(episode, type, "proj-1", Optional.empty());

        assertThat(first.strategy()).isEqualTo(RecoveryStrategy.RETRY);
        assertThat(first.delay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(second.delay()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void retryBudgetSpent_escalatesWithExhaustedCause() {
        RecoveryEpisode episode = episodeWith(FailureType.API_ERROR);
        for (int i = 0; i < 3; i++) {
            episode.recordStrategy(RecoveryStrategy.RETRY);
        }

        RecoveryDecision decision = policy.decide(episode, FailureType.API_ERROR, "proj-1", Optional.empty());

        assertThat(decision.strategy()).isEqualTo(RecoveryStrategy.ESCALATION);
        assertThat(decision.cause()).isInstanceOf(RecoveryExhaustedException.class);
        assertThat(decision.reason()).contains("retry budget of 3 spent");
    }

    // ------------------------------------------------------------------
    // Crashes
    // ------------------------------------------------------------------

    @Test
    void crash_withCheckpoint_rollsBack() {
        RecoveryDecision decision = policy.decide(episodeWith(FailureType.CRASH), FailureType.CRASH, "proj-1", CHECKPOINT);

        assertThat(decision.strategy()).isEqualTo(RecoveryStrategy.CHECKPOINT_RECOVERY);
        assertThat(decision.checkpoint().ref()).isEqualTo("abc123");
    }

    @Test
    void crash_withoutCheckpoint_downgradesToContextRefresh() {
        RecoveryDecision decision = policy.decide(episodeWith(FailureType.CRASH), FailureType.CRASH,
                "proj-1", Optional.empty());

        assertThat(decision.strategy()).isEqualTo(RecoveryStrategy.CONTEXT_REFRESH);
        assertThat(decision.cause()).isInstanceOf(CheckpointUnavailableException.class);
    }

    @Test
    void failureAfterCheckpointRecovery_escalates() {
        RecoveryEpisode episode = episodeWith(FailureType.CRASH);
        episode.recordStrategy(RecoveryStrategy.CHECKPOINT_RECOVERY);
        episode.recordFailure(FailureType.TIMEOUT, NOW);

        RecoveryDecision decision = policy.decide(episode, FailureType.TIMEOUT, "proj-1", CHECKPOINT);

        assertThat(decision.strategy()).isEqualTo(RecoveryStrategy.ESCALATION);
        assertThat(decision.reason()).contains("after checkpoint recovery");
    }

    // ------------------------------------------------------------------
    // Stuck and loop
    // ------------------------------------------------------------------

    @Test
    void stuck_firstThenRepeat_refreshThenRollback() {
        RecoveryEpisode episode = episodeWith(FailureType.STUCK);

        RecoveryDecision first = policy.decide(episode, FailureType.STUCK, "proj-1", CHECKPOINT);
        episode.recordStrategy(first.strategy());
        episode.recordFailure(FailureType.STUCK, NOW);
        RecoveryDecision second = policy.decide(episode, FailureType.STUCK, "proj-1", CHECKPOINT);

        assertThat(first.strategy()).isEqualTo(RecoveryStrategy.CONTEXT_REFRESH);
        assertThat(second.strategy()).isEqualTo(RecoveryStrategy.CHECKPOINT_RECOVERY);
    }

    @Test
    void loop_contextRefreshUntilBudgetSpent() {
        RecoveryEpisode episode = episodeWith(FailureType.LOOP);

        assertThat(policy.decide(episode, FailureType.LOOP, "proj-1", CHECKPOINT).strategy())
                .isEqualTo(RecoveryStrategy.CONTEXT_REFRESH);
        episode.recordStrategy(RecoveryStrategy.CONTEXT_REFRESH);
        episode.recordStrategy(RecoveryStrategy.CONTEXT_REFRESH);

        RecoveryDecision third = policy.decide(episode, FailureType.LOOP, "proj-1", CHECKPOINT);
        assertThat(third.strategy()).isEqualTo(RecoveryStrategy.ESCALATION);
        assertThat(third.reason()).contains("context refresh budget");
    }

    // ------------------------------------------------------------------
    // Episode status
    // ------------------------------------------------------------------

    @Test
    void escalatedEpisode_escalatesAgain() {
        RecoveryEpisode episode = episodeWith(FailureType.TIMEOUT);
        episode.recordStrategy(RecoveryStrategy.ESCALATION);

        RecoveryDecision decision = policy.decide(episode, FailureType.TIMEOUT, "proj-1", CHECKPOINT);

        assertThat(decision.strategy()).isEqualTo(RecoveryStrategy.ESCALATION);
        assertThat(decision.cause()).isNull();
    }

    @ParameterizedTest
    @EnumSource(FailureType.class)
    void neverChoosesManualOverride(FailureType type) {
        RecoveryDecision decision = policy.decide(episodeWith(type), type, "proj-1", CHECKPOINT);

        assertThat(decision.strategy()).isNotEqualTo(RecoveryStrategy.MANUAL_OVERRIDE);
    }

    private static RecoveryEpisode episodeWith(FailureType firstFailure) {
        RecoveryEpisode episode = new RecoveryEpisode(KEY, NOW);
        episode.recordFailure(firstFailure, NOW);
        return episode;
    }
}
