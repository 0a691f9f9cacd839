package com.shipyard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable row of the pipeline transition log.
 *
 * The id is a database identity and doubles as the pagination cursor:
 * newer records always carry larger ids. {@code version} is the pipeline
 * version this transition produced; (workflow_id, version) is unique, so two
 * writers can never both record the same step.
 *
 * DB table: pipeline_transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_transitions")
public class StateTransitionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state", nullable = false, updatable = false)
    private PipelineState previousState;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_state", nullable = false, updatable = false)
    private PipelineState newState;

    @Column(name = "triggered_by", nullable = false, updatable = false)
    private String triggeredBy;

    @Column(name = "agent_id", updatable = false)
    private String agentId;

    @Column(name = "story_id", updatable = false)
    private String storyId;

    // JSON object, serialized by the state machine.
    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    @Column(nullable = false, updatable = false)
    private long version;

    @Column(name = "request_id", updatable = false)
    private String requestId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected StateTransitionRecord() {}   // required by JPA

    public StateTransitionRecord(Pipeline pipeline,
                                 PipelineState previousState,
                                 String triggeredBy,
                                 String metadata,
                                 String errorMessage,
                                 String requestId) {
        this.workflowId    = pipeline.getWorkflowId();
        this.projectId     = pipeline.getProjectId();
        this.workspaceId   = pipeline.getWorkspaceId();
        this.previousState = previousState;
        this.newState      = pipeline.getState();
        this.triggeredBy   = triggeredBy;
        this.agentId       = pipeline.getCurrentAgentId();
        this.storyId       = pipeline.getCurrentStoryId();
        this.metadata      = metadata;
        this.errorMessage  = errorMessage;
        this.version       = pipeline.versionOrZero();
        this.requestId     = requestId;
        this.occurredAt    = pipeline.getEnteredStateAt();
    }

    public Long          getId()            { return id; }
    public UUID          getWorkflowId()    { return workflowId; }
    public String        getProjectId()     { return projectId; }
    public String        getWorkspaceId()   { return workspaceId; }
    public PipelineState getPreviousState() { return previousState; }
    public PipelineState getNewState()      { return newState; }
    public String        getTriggeredBy()   { return triggeredBy; }
    public String        getAgentId()       { return agentId; }
    public String        getStoryId()       { return storyId; }
    public String        getMetadata()      { return metadata; }
    public String        getErrorMessage()  { return errorMessage; }
    public long          getVersion()       { return version; }
    public String        getRequestId()     { return requestId; }
    public Instant       getOccurredAt()    { return occurredAt; }
}
