package com.shipyard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A restorable reference (typically a commit) recorded at a safe point of
 * the normal pipeline flow. The newest row per (project, story) wins.
 *
 * DB table: checkpoints  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "checkpoints")
public class Checkpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "story_id", nullable = false, updatable = false)
    private String storyId;

    @Column(name = "ref", nullable = false, updatable = false)
    private String ref;

    // Workflow that reached the safe point; null for checkpoints recorded by hand.
    @Column(name = "workflow_id", updatable = false)
    private UUID workflowId;

    // qa_passed, pre_deploy or manual.
    @Column(nullable = false, updatable = false)
    private String label;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Checkpoint() {}   // required by JPA

    public Checkpoint(String projectId, String storyId, String ref,
                      UUID workflowId, String label, Instant createdAt) {
        this.projectId  = projectId;
        this.storyId    = storyId;
        this.ref        = ref;
        this.workflowId = workflowId;
        this.label      = label;
        this.createdAt  = createdAt;
    }

    public Long    getId()         { return id; }
    public String  getProjectId()  { return projectId; }
    public String  getStoryId()    { return storyId; }
    public String  getRef()        { return ref; }
    public UUID    getWorkflowId() { return workflowId; }
    public String  getLabel()      { return label; }
    public Instant getCreatedAt()  { return createdAt; }
}
