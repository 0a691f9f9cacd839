package com.shipyard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Materialized state of one failure episode: a bounded run of
 * failure/recovery attempts for one agent's work on one story.
 *
 * Counters are derived from the recovery records carrying this episode's id,
 * so the row can be rebuilt by replaying failure_recovery_records.
 *
 * DB table: recovery_episodes  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "recovery_episodes")
public class RecoveryEpisode {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    @Column(name = "story_id", nullable = false, updatable = false)
    private String storyId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private String agentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EpisodeStatus status = EpisodeStatus.OPEN;

    // Only RETRY attempts count here; switching strategy class leaves it alone.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "stuck_count", nullable = false)
    private int stuckCount = 0;

    @Column(name = "context_refresh_count", nullable = false)
    private int contextRefreshCount = 0;

    @Column(name = "checkpoint_recovery_used", nullable = false)
    private boolean checkpointRecoveryUsed = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_failure_type")
    private FailureType lastFailureType;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "last_failure_at", nullable = false)
    private Instant lastFailureAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    protected RecoveryEpisode() {}   // required by JPA

    public RecoveryEpisode(EpisodeKey key, Instant now) {
        this(UUID.randomUUID(), key, now);
    }

    /** Rebuild an episode under its original id, e.g. when replaying its records. */
    public RecoveryEpisode(UUID id, EpisodeKey key, Instant now) {
        this.id            = id;
        this.workflowId    = key.workflowId();
        this.storyId       = key.storyId();
        this.agentId       = key.agentId();
        this.openedAt      = now;
        this.lastFailureAt = now;
    }

    public EpisodeKey key() {
        return new EpisodeKey(workflowId, storyId, agentId);
    }

    /** An unresolved episode whose last failure fell outside the window no longer carries forward. */
    public boolean isStale(Instant now, Duration window) {
        return lastFailureAt.plus(window).isBefore(now);
    }

    public void recordFailure(FailureType type, Instant now) {
        this.lastFailureType = type;
        this.lastFailureAt   = now;
        if (type == FailureType.STUCK) stuckCount++;
    }

    /** Count the strategy the policy just chose. */
    public void recordStrategy(RecoveryStrategy strategy) {
        switch (strategy) {
            case RETRY               -> retryCount++;
            case CONTEXT_REFRESH     -> contextRefreshCount++;
            case CHECKPOINT_RECOVERY -> checkpointRecoveryUsed = true;
            case ESCALATION          -> status = EpisodeStatus.ESCALATED;
            case MANUAL_OVERRIDE     -> status = EpisodeStatus.OVERRIDDEN;
        }
    }

    public void close(EpisodeStatus finalStatus, Instant now) {
        this.status   = finalStatus;
        this.closedAt = now;
    }

    public UUID          getId()                       { return id; }
    public UUID          getWorkflowId()               { return workflowId; }
    public String        getStoryId()                  { return storyId; }
    public String        getAgentId()                  { return agentId; }
    public EpisodeStatus getStatus()                   { return status; }
    public int           getRetryCount()               { return retryCount; }
    public int           getStuckCount()               { return stuckCount; }
    public int           getContextRefreshCount()      { return contextRefreshCount; }
    public boolean       isCheckpointRecoveryUsed()    { return checkpointRecoveryUsed; }
    public FailureType   getLastFailureType()          { return lastFailureType; }
    public Instant       getOpenedAt()                 { return openedAt; }
    public Instant       getLastFailureAt()            { return lastFailureAt; }
    public Instant       getClosedAt()                 { return closedAt; }
}
