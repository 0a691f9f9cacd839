package com.shipyard.orchestrator.checkpoint;

import com.shipyard.orchestrator.error.RestoreFailedException;
import com.shipyard.orchestrator.model.Checkpoint;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.repository.CheckpointRepository;
import com.shipyard.orchestrator.vcs.VersionControlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Maps (projectId, storyId) to the latest restorable reference.
 *
 * Checkpoints are written by the normal pipeline flow at safe points (after
 * a QA pass, before deploy) or by hand. Recovery only reads them.
 */
@Service
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    public static final String LABEL_QA_PASSED  = "qa_passed";
    public static final String LABEL_PRE_DEPLOY = "pre_deploy";
    public static final String LABEL_MANUAL     = "manual";

    private final CheckpointRepository checkpointRepo;
    private final VersionControlClient vcs;
    private final Clock                clock;

    public CheckpointService(CheckpointRepository checkpointRepo, VersionControlClient vcs, Clock clock) {
        this.checkpointRepo = checkpointRepo;
        this.vcs            = vcs;
        this.clock          = clock;
    }

    @Transactional
    public CheckpointRef createCheckpoint(String projectId, String storyId, String ref) {
        return save(new Checkpoint(projectId, storyId, ref, null, LABEL_MANUAL, clock.instant()));
    }

    /**
     * Record the project's current ref under the pipeline's story key, the
     * same key its executions carry. Returns empty (and logs) if the ref is
     * unavailable; a missing safe point only narrows later recovery options.
     */
    @Transactional
    public Optional<CheckpointRef> captureSafePoint(Pipeline pipeline, String label) {
        String storyId = pipeline.storyKey();
        String ref;
        try {
            ref = vcs.currentRef(pipeline.getProjectId());
        } catch (RuntimeException e) {
            log.warn("Could not read current ref for project {}, {} checkpoint skipped: {}",
                    pipeline.getProjectId(), label, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(save(new Checkpoint(pipeline.getProjectId(), storyId, ref,
                pipeline.getWorkflowId(), label, clock.instant())));
    }

    @Transactional(readOnly = true)
    public Optional<CheckpointRef> getLatestCheckpoint(String projectId, String storyId) {
        return checkpointRepo.findFirstByProjectIdAndStoryIdOrderByIdDesc(projectId, storyId)
                .map(CheckpointRef::of);
    }

    /**
     * Roll the project back to a checkpoint.
     *
     * @throws RestoreFailedException if the version-control collaborator fails
     */
    public void restoreTo(CheckpointRef checkpoint) {
        try {
            vcs.restoreTo(checkpoint.projectId(), checkpoint.ref());
            log.info("Project {} restored to checkpoint '{}' (story {})",
                    checkpoint.projectId(), checkpoint.ref(), checkpoint.storyId());
        } catch (RuntimeException e) {
            log.error("Restore of project {} to '{}' failed: {}",
                    checkpoint.projectId(), checkpoint.ref(), e.getMessage());
            throw new RestoreFailedException(checkpoint.ref(), e);
        }
    }

    private CheckpointRef save(Checkpoint checkpoint) {
        Checkpoint saved = checkpointRepo.save(checkpoint);
        log.info("Checkpoint '{}' recorded for project {}, story {} ({})",
                saved.getRef(), saved.getProjectId(), saved.getStoryId(), saved.getLabel());
        return CheckpointRef.of(saved);
    }
}
