package com.shipyard.orchestrator.api;

import com.shipyard.orchestrator.api.dto.ActorBody;
import com.shipyard.orchestrator.api.dto.CancelBody;
import com.shipyard.orchestrator.api.dto.EpisodeResponse;
import com.shipyard.orchestrator.api.dto.OverrideBody;
import com.shipyard.orchestrator.api.dto.PageResponse;
import com.shipyard.orchestrator.api.dto.PipelineResponse;
import com.shipyard.orchestrator.api.dto.RecoveryOutcomeResponse;
import com.shipyard.orchestrator.api.dto.RecoveryRecordResponse;
import com.shipyard.orchestrator.api.dto.StartWorkflowRequest;
import com.shipyard.orchestrator.api.dto.TransitionBody;
import com.shipyard.orchestrator.api.dto.TransitionRecordResponse;
import com.shipyard.orchestrator.model.EpisodeKey;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.service.PipelineOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for workflow pipelines and their recovery.
 *
 * POST /workflows                           start a workflow
 * POST /workflows/{id}/transition           move the pipeline (409 on conflict, 400 on illegal edge)
 * POST /workflows/{id}/pause | resume       operator pause and resume
 * GET  /workflows/{id}                      current pipeline
 * GET  /workflows/{id}/history              transition log, newest first
 * GET  /workflows/{id}/recovery-history     recovery attempts, newest first
 * GET  /workflows/{id}/recovery-status      open and escalated episodes
 * POST /workflows/{id}/recovery/override    operator forces an outcome
 * POST /workflows/{id}/recovery/cancel      operator stops automatic recovery
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final PipelineOrchestrator orchestrator;

    public WorkflowController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Start a workflow.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"projectId":"p-1","workspaceId":"w-1","actor":"user:42","storyId":"story-7"}'
     */
    @PostMapping
    public ResponseEntity<PipelineResponse> start(@RequestBody StartWorkflowRequest req) {
        Pipeline pipeline = orchestrator.startWorkflow(req.projectId(), req.workspaceId(), req.actor(), req.storyId());
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(pipeline));
    }

    @PostMapping("/{id}/transition")
    public PipelineResponse transition(@PathVariable UUID id, @RequestBody TransitionBody body) {
        return PipelineResponse.from(orchestrator.transition(id, body.targetState(), body.toRequest()));
    }

    @PostMapping("/{id}/pause")
    public PipelineResponse pause(@PathVariable UUID id, @RequestBody ActorBody body) {
        return PipelineResponse.from(orchestrator.pause(id, body.actor(), body.reason()));
    }

    @PostMapping("/{id}/resume")
    public PipelineResponse resume(@PathVariable UUID id, @RequestBody ActorBody body) {
        return PipelineResponse.from(orchestrator.resume(id, body.actor()));
    }

    @GetMapping("/{id}")
    public PipelineResponse get(@PathVariable UUID id) {
        return PipelineResponse.from(orchestrator.getPipeline(id));
    }

    @GetMapping("/{id}/history")
    public PageResponse<TransitionRecordResponse> history(@PathVariable UUID id,
                                                          @RequestParam(required = false) Integer limit,
                                                          @RequestParam(required = false) String cursor) {
        return PageResponse.from(orchestrator.getHistory(id, limit, cursor), TransitionRecordResponse::from);
    }

    @GetMapping("/{id}/recovery-history")
    public PageResponse<RecoveryRecordResponse> recoveryHistory(@PathVariable UUID id,
                                                                @RequestParam(required = false) String storyId,
                                                                @RequestParam(required = false) Integer limit,
                                                                @RequestParam(required = false) String cursor) {
        return PageResponse.from(orchestrator.getRecoveryHistory(id, storyId, limit, cursor),
                RecoveryRecordResponse::from);
    }

    @GetMapping("/{id}/recovery-status")
    public List<EpisodeResponse> recoveryStatus(@PathVariable UUID id) {
        return orchestrator.getRecoveryStatus(id).stream().map(EpisodeResponse::from).toList();
    }

    @PostMapping("/{id}/recovery/override")
    public RecoveryOutcomeResponse override(@PathVariable UUID id, @RequestBody OverrideBody body) {
        return RecoveryOutcomeResponse.from(orchestrator.manualOverride(body.toCommand(id)));
    }

    @PostMapping("/{id}/recovery/cancel")
    public RecoveryOutcomeResponse cancel(@PathVariable UUID id, @RequestBody CancelBody body) {
        EpisodeKey key = new EpisodeKey(id, body.storyId(), body.agentId());
        return RecoveryOutcomeResponse.from(orchestrator.cancelRecovery(key, body.operator()));
    }
}
