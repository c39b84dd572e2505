package com.devpipeline.orchestrator.api;

import com.devpipeline.orchestrator.api.dto.ArtifactResponse;
import com.devpipeline.orchestrator.api.dto.EventResponse;
import com.devpipeline.orchestrator.api.dto.StartWorkflowRequest;
import com.devpipeline.orchestrator.api.dto.WorkflowResponse;
import com.devpipeline.orchestrator.bypass.BypassAnalysisService;
import com.devpipeline.orchestrator.bypass.BypassFinding;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.service.WorkflowService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for workflow lifecycle.
 *
 * POST /workflows                           start a workflow (runs in the background)
 * GET  /workflows/{id}                      status, reason and exit code
 * POST /workflows/{id}/resume               continue from the stored artifacts
 * POST /workflows/{id}/stages/{stage}/rerun supersede a failed stage and resume
 * POST /workflows/{id}/cancel               abort the active run
 * GET  /workflows/{id}/artifacts            current artifacts in write order
 * GET  /workflows/{id}/events               execution log
 * GET  /workflows/{id}/findings             bypass analysis of this workflow
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowService       workflowService;
    private final BypassAnalysisService bypassAnalysis;

    public WorkflowController(WorkflowService workflowService, BypassAnalysisService bypassAnalysis) {
        this.workflowService = workflowService;
        this.bypassAnalysis  = bypassAnalysis;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"request":"fix a typo in a comment","mode":"standard"}'
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> start(@Valid @RequestBody StartWorkflowRequest req) {
        Workflow workflow = workflowService.start(req.request(), req.mode());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WorkflowResponse.from(workflow));
    }

    @GetMapping("/{id}")
    public WorkflowResponse status(@PathVariable String id) {
        return WorkflowResponse.from(workflowService.status(id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<WorkflowResponse> resume(@PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WorkflowResponse.from(workflowService.resume(id)));
    }

    @PostMapping("/{id}/stages/{stage}/rerun")
    public ResponseEntity<WorkflowResponse> rerun(@PathVariable String id, @PathVariable String stage) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WorkflowResponse.from(workflowService.rerun(id, stage)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<WorkflowResponse> cancel(@PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WorkflowResponse.from(workflowService.cancel(id)));
    }

    @GetMapping("/{id}/artifacts")
    public List<ArtifactResponse> artifacts(@PathVariable String id) {
        return workflowService.artifacts(id).stream()
                .map(ArtifactResponse::from)
                .toList();
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> events(@PathVariable String id) {
        return workflowService.events(id).stream()
                .map(EventResponse::from)
                .toList();
    }

    @GetMapping("/{id}/findings")
    public List<BypassFinding> findings(@PathVariable String id) {
        return bypassAnalysis.analyze(id);
    }
}
