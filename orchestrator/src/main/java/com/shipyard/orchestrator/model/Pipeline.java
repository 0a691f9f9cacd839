package com.shipyard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The live state of one workflow: one row per workflowId.
 *
 * Only the state machine mutates this row. Every write goes through JPA's
 * optimistic lock on {@code version}, so a writer holding a stale copy fails
 * instead of overwriting a newer state.
 *
 * DB table: pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineState state = PipelineState.IDLE;

    @Column(name = "current_story_id")
    private String currentStoryId;

    @Column(name = "current_agent_id")
    private String currentAgentId;

    // Origin state while PAUSED; null otherwise.
    @Enumerated(EnumType.STRING)
    @Column(name = "paused_from")
    private PipelineState pausedFrom;

    @Column(name = "entered_state_at", nullable = false)
    private Instant enteredStateAt;

    // Null until first persisted; Hibernate starts it at 0 and bumps it on every UPDATE.
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Pipeline() {}   // required by JPA

    public Pipeline(UUID workflowId, String projectId, String workspaceId, Instant now) {
        this.workflowId     = workflowId;
        this.projectId      = projectId;
        this.workspaceId    = workspaceId;
        this.enteredStateAt = now;
        this.createdAt      = now;
        this.updatedAt      = now;
    }

    // ------------------------------------------------------------------
    // Mutation (state machine only)
    // ------------------------------------------------------------------

    /**
     * Move to {@code target}. Legality is checked by the caller; this only
     * keeps the row's derived fields consistent.
     */
    public void moveTo(PipelineState target, String storyId, String agentId, Instant now) {
        if (target == PipelineState.PAUSED) {
            this.pausedFrom = this.state;
        } else {
            this.pausedFrom = null;
        }
        this.state          = target;
        this.enteredStateAt = now;
        this.updatedAt      = now;
        if (storyId != null) this.currentStoryId = storyId;
        if (agentId != null) this.currentAgentId = agentId;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID          getWorkflowId()     { return workflowId; }
    public String        getProjectId()      { return projectId; }
    public String        getWorkspaceId()    { return workspaceId; }
    public PipelineState getState()          { return state; }
    public String        getCurrentStoryId() { return currentStoryId; }
    public String        getCurrentAgentId() { return currentAgentId; }
    public PipelineState getPausedFrom()     { return pausedFrom; }
    public Instant       getEnteredStateAt() { return enteredStateAt; }
    public Long          getVersion()        { return version; }
    public Instant       getCreatedAt()      { return createdAt; }
    public Instant       getUpdatedAt()      { return updatedAt; }

    /** Story that executions and checkpoints are keyed by; a workflow with no story in flight uses its own id. */
    public String storyKey() {
        return currentStoryId != null ? currentStoryId : workflowId.toString();
    }

    /** Version as a primitive; a not-yet-persisted pipeline reports 0. */
    public long versionOrZero() {
        return version == null ? 0L : version;
    }
}
