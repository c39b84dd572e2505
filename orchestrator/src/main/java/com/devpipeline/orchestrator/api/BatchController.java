package com.devpipeline.orchestrator.api;

import com.devpipeline.orchestrator.api.dto.BatchResponse;
import com.devpipeline.orchestrator.api.dto.StartBatchRequest;
import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.service.BatchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batches.
 *
 * POST /batches               run a list of requests one after another (in the background)
 * GET  /batches/{id}          progress, per-item outcomes and exit codes
 * POST /batches/{id}/resume   continue a halted or orphaned batch
 * POST /batches/{id}/cancel   stop before the next item
 */
@RestController
@RequestMapping("/batches")
public class BatchController {

    private final BatchService batchService;

    public BatchController(BatchService batchService) {
        this.batchService = batchService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/batches \
     *     -H "Content-Type: application/json" \
     *     -d '{"requests":["add retry to the client","document the config keys"]}'
     */
    @PostMapping
    public ResponseEntity<BatchResponse> start(@Valid @RequestBody StartBatchRequest req) {
        Batch batch = batchService.start(req.requests(), req.mode());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view(batch));
    }

    @GetMapping("/{id}")
    public BatchResponse status(@PathVariable String id) {
        return view(batchService.status(id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<BatchResponse> resume(@PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view(batchService.resume(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BatchResponse> cancel(@PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view(batchService.cancel(id)));
    }

    private BatchResponse view(Batch batch) {
        return BatchResponse.from(batch, batchService.items(batch.getId()));
    }
}
