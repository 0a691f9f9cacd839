package com.shipyard.orchestrator.checkpoint;

import com.shipyard.orchestrator.model.Checkpoint;

/** The restorable part of a checkpoint. */
public record CheckpointRef(String projectId, String storyId, String ref) {

    public static CheckpointRef of(Checkpoint checkpoint) {
        return new CheckpointRef(checkpoint.getProjectId(), checkpoint.getStoryId(), checkpoint.getRef());
    }
}
