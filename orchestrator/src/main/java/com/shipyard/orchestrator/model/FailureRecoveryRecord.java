package com.shipyard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable row per recovery attempt, whatever its outcome.
 *
 * checkpoint_ref is only ever set for CHECKPOINT_RECOVERY; {@link Builder#build()}
 * rejects anything else and the V1 migration backs it with a CHECK constraint.
 *
 * DB table: failure_recovery_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "failure_recovery_records")
public class FailureRecoveryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private String workspaceId;

    @Column(name = "story_id", nullable = false, updatable = false)
    private String storyId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private String agentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "agent_type", nullable = false, updatable = false)
    private AgentType agentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_type", nullable = false, updatable = false)
    private FailureType failureType;

    @Enumerated(EnumType.STRING)
    @Column(name = "recovery_strategy", nullable = false, updatable = false)
    private RecoveryStrategy recoveryStrategy;

    @Column(name = "retry_count", nullable = false, updatable = false)
    private int retryCount;

    @Column(name = "checkpoint_ref", updatable = false)
    private String checkpointRef;

    @Column(name = "new_session_id", updatable = false)
    private String newSessionId;

    @Column(nullable = false, updatable = false)
    private boolean success;

    @Column(name = "error_details", columnDefinition = "TEXT", updatable = false)
    private String errorDetails;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private long durationMs;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "episode_id", nullable = false, updatable = false)
    private UUID episodeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected FailureRecoveryRecord() {}   // required by JPA

    private FailureRecoveryRecord(Builder b) {
        this.workflowId       = b.workflowId;
        this.projectId        = b.projectId;
        this.workspaceId      = b.workspaceId;
        this.storyId          = b.storyId;
        this.sessionId        = b.sessionId;
        this.agentId          = b.agentId;
        this.agentType        = b.agentType;
        this.failureType      = b.failureType;
        this.recoveryStrategy = b.recoveryStrategy;
        this.retryCount       = b.retryCount;
        this.checkpointRef    = b.checkpointRef;
        this.newSessionId     = b.newSessionId;
        this.success          = b.success;
        this.errorDetails     = b.errorDetails;
        this.durationMs       = b.durationMs;
        this.metadata         = b.metadata;
        this.episodeId        = b.episodeId;
        this.createdAt        = b.createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for a later attempt on the same execution and episode, e.g. an operator action. */
    public static Builder followUpOf(FailureRecoveryRecord previous) {
        return new Builder()
                .workflowId(previous.workflowId)
                .projectId(previous.projectId)
                .workspaceId(previous.workspaceId)
                .storyId(previous.storyId)
                .sessionId(previous.sessionId)
                .agentId(previous.agentId)
                .agentType(previous.agentType)
                .failureType(previous.failureType)
                .episodeId(previous.episodeId);
    }

    public Long             getId()               { return id; }
    public UUID             getWorkflowId()       { return workflowId; }
    public String           getProjectId()        { return projectId; }
    public String           getWorkspaceId()      { return workspaceId; }
    public String           getStoryId()          { return storyId; }
    public String           getSessionId()        { return sessionId; }
    public String           getAgentId()          { return agentId; }
    public AgentType        getAgentType()        { return agentType; }
    public FailureType      getFailureType()      { return failureType; }
    public RecoveryStrategy getRecoveryStrategy() { return recoveryStrategy; }
    public int              getRetryCount()       { return retryCount; }
    public String           getCheckpointRef()    { return checkpointRef; }
    public String           getNewSessionId()     { return newSessionId; }
    public boolean          isSuccess()           { return success; }
    public String           getErrorDetails()     { return errorDetails; }
    public long             getDurationMs()       { return durationMs; }
    public String           getMetadata()         { return metadata; }
    public UUID             getEpisodeId()        { return episodeId; }
    public Instant          getCreatedAt()        { return createdAt; }

    public static final class Builder {
        private UUID workflowId;
        private String projectId;
        private String workspaceId;
        private String storyId;
        private String sessionId;
        private String agentId;
        private AgentType agentType;
        private FailureType failureType;
        private RecoveryStrategy recoveryStrategy;
        private int retryCount;
        private String checkpointRef;
        private String newSessionId;
        private boolean success;
        private String errorDetails;
        private long durationMs;
        private String metadata;
        private UUID episodeId;
        private Instant createdAt;

        private Builder() {}

        public Builder workflowId(UUID v)                 { this.workflowId = v; return this; }
        public Builder projectId(String v)                { this.projectId = v; return this; }
        public Builder workspaceId(String v)              { this.workspaceId = v; return this; }
        public Builder storyId(String v)                  { this.storyId = v; return this; }
        public Builder sessionId(String v)                { this.sessionId = v; return this; }
        public Builder agentId(String v)                  { this.agentId = v; return this; }
        public Builder agentType(AgentType v)             { this.agentType = v; return this; }
        public Builder failureType(FailureType v)         { this.failureType = v; return this; }
        public Builder recoveryStrategy(RecoveryStrategy v) { this.recoveryStrategy = v; return this; }
        public Builder retryCount(int v)                  { this.retryCount = v; return this; }
        public Builder checkpointRef(String v)            { this.checkpointRef = v; return this; }
        public Builder newSessionId(String v)             { this.newSessionId = v; return this; }
        public Builder success(boolean v)                 { this.success = v; return this; }
        public Builder errorDetails(String v)             { this.errorDetails = v; return this; }
        public Builder durationMs(long v)                 { this.durationMs = v; return this; }
        public Builder metadata(String v)                 { this.metadata = v; return this; }
        public Builder episodeId(UUID v)                  { this.episodeId = v; return this; }
        public Builder createdAt(Instant v)               { this.createdAt = v; return this; }

        public FailureRecoveryRecord build() {
            Objects.requireNonNull(workflowId, "workflowId");
            Objects.requireNonNull(failureType, "failureType");
            Objects.requireNonNull(recoveryStrategy, "recoveryStrategy");
            Objects.requireNonNull(episodeId, "episodeId");
            Objects.requireNonNull(createdAt, "createdAt");
            if (checkpointRef != null && recoveryStrategy != RecoveryStrategy.CHECKPOINT_RECOVERY) {
                throw new IllegalStateException(
                        "checkpointRef is only valid for CHECKPOINT_RECOVERY, not " + recoveryStrategy);
            }
            if (recoveryStrategy == RecoveryStrategy.ESCALATION && success) {
                throw new IllegalStateException("An escalation is never recorded as successful");
            }
            return new FailureRecoveryRecord(this);
        }
    }
}
