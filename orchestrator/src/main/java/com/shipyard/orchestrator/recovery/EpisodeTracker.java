package com.shipyard.orchestrator.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.config.RecoveryProperties;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.EpisodeStatus;
import com.shipyard.orchestrator.model.FailureRecoveryRecord;
import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.RecoveryEpisode;
import com.shipyard.orchestrator.model.RecoveryStrategy;
import com.shipyard.orchestrator.repository.FailureRecoveryRepository;
import com.shipyard.orchestrator.repository.RecoveryEpisodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent episode bookkeeping for the recovery engine.
 *
 * An episode is live until it is closed (healthy completion, operator
 * override, expiry). Each recovery attempt is written together with the
 * episode counters it changes, in one transaction.
 */
@Service
public class EpisodeTracker {

    private static final Logger log = LoggerFactory.getLogger(EpisodeTracker.class);

    private final RecoveryEpisodeRepository episodeRepo;
    private final FailureRecoveryRepository recordRepo;
    private final RecoveryProperties        properties;
    private final ObjectMapper              objectMapper;
    private final Clock                     clock;

    public EpisodeTracker(RecoveryEpisodeRepository episodeRepo,
                          FailureRecoveryRepository recordRepo,
                          RecoveryProperties properties,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.episodeRepo  = episodeRepo;
        this.recordRepo   = recordRepo;
        this.properties   = properties;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Attach a failure to the live episode for {@code key}, opening a new one
     * if there is none or the live one went stale.
     */
    @Transactional
    public RecoveryEpisode beginFailure(EpisodeKey key, FailureType type, Instant now) {
        Optional<RecoveryEpisode> live = live(key);
        if (live.isPresent() && live.get().isStale(now, properties.getEpisodeWindow())) {
            RecoveryEpisode stale = live.get();
            stale.close(EpisodeStatus.EXPIRED, now);
            episodeRepo.save(stale);
            log.info("Episode {} for {} expired (last failure {})", stale.getId(), key, stale.getLastFailureAt());
            live = Optional.empty();
        }

        RecoveryEpisode episode = live.orElseGet(() -> {
            log.info("Opening recovery episode for {}", key);
            return new RecoveryEpisode(key, now);
        });
        episode.recordFailure(type, now);
        return episodeRepo.save(episode);
    }

    /**
     * Append one attempt record and count its strategy on the episode.
     * The record carries the episode's retryCount as it was before this attempt.
     */
    @Transactional
    public FailureRecoveryRecord recordAttempt(UUID episodeId, FailureRecoveryRecord.Builder attempt,
                                               RecoveryStrategy strategy) {
        RecoveryEpisode episode = episodeRepo.findById(episodeId)
                .orElseThrow(() -> new IllegalStateException("Episode " + episodeId + " vanished"));
        FailureRecoveryRecord record = recordRepo.save(attempt
                .episodeId(episodeId)
                .recoveryStrategy(strategy)
                .retryCount(episode.getRetryCount())
                .build());
        episode.recordStrategy(strategy);
        episodeRepo.save(episode);
        return record;
    }

    /** Close the live episode for {@code key}, if any. */
    @Transactional
    public Optional<RecoveryEpisode> close(EpisodeKey key, EpisodeStatus finalStatus) {
        return live(key).map(episode -> {
            episode.close(finalStatus, clock.instant());
            log.info("Episode {} for {} closed as {}", episode.getId(), key, finalStatus);
            return episodeRepo.save(episode);
        });
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<RecoveryEpisode> live(EpisodeKey key) {
        return episodeRepo.findFirstByWorkflowIdAndStoryIdAndAgentIdOrderByOpenedAtDesc(
                        key.workflowId(), key.storyId(), key.agentId())
                .filter(e -> e.getClosedAt() == null);
    }

    @Transactional(readOnly = true)
    public List<RecoveryEpisode> unresolved(UUID workflowId) {
        return episodeRepo.findByWorkflowIdAndStatusIn(workflowId,
                EnumSet.of(EpisodeStatus.OPEN, EpisodeStatus.ESCALATED));
    }

    @Transactional(readOnly = true)
    public Optional<FailureRecoveryRecord> lastRecord(UUID episodeId) {
        return recordRepo.findFirstByEpisodeIdOrderByIdDesc(episodeId);
    }

    /**
     * Recompute an episode's counters and status from its records alone.
     * Closure is not recorded as an attempt, so a rebuilt episode is never CLOSED.
     *
     * @throws IllegalArgumentException if the episode has no records
     */
    @Transactional(readOnly = true)
    public RecoveryEpisode rebuild(UUID episodeId) {
        List<FailureRecoveryRecord> records = recordRepo.findByEpisodeIdOrderByIdAsc(episodeId);
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No recovery records for episode " + episodeId);
        }
        FailureRecoveryRecord first = records.get(0);
        RecoveryEpisode episode = new RecoveryEpisode(episodeId,
                new EpisodeKey(first.getWorkflowId(), first.getStoryId(), first.getAgentId()),
                first.getCreatedAt());
        for (FailureRecoveryRecord r : records) {
            // Operator actions and escalations that follow a failed action do not add a failure.
            if (!isOperatorAction(r) && !isFollowUp(r)) {
                episode.recordFailure(r.getFailureType(), r.getCreatedAt());
            }
            episode.recordStrategy(r.getRecoveryStrategy());
        }
        return episode;
    }

    private boolean isOperatorAction(FailureRecoveryRecord record) {
        return metadataHas(record, "operator");
    }

    private boolean isFollowUp(FailureRecoveryRecord record) {
        return metadataHas(record, "followUp");
    }

    private boolean metadataHas(FailureRecoveryRecord record, String field) {
        if (record.getMetadata() == null) return false;
        try {
            return objectMapper.readTree(record.getMetadata()).has(field);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable metadata on recovery record " + record.getId(), e);
        }
    }
}
