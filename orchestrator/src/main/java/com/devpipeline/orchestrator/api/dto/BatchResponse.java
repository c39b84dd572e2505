package com.devpipeline.orchestrator.api.dto;

import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.model.BatchItem;

import java.time.Instant;
import java.util.List;

/**
 * Response body for batch endpoints. Each item carries the exit code of its
 * workflow once that workflow has finished.
 */
public record BatchResponse(
        String             id,
        String             status,
        String             mode,
        int                totalItems,
        int                nextIndex,
        int                consecutiveFailures,
        String             reason,
        List<ItemResponse> items,
        Instant            createdAt,
        Instant            updatedAt
) {
    public record ItemResponse(int position, String request, String workflowId, String outcome, Integer exitCode) {

        public static ItemResponse from(BatchItem item) {
            return new ItemResponse(
                    item.getPosition(),
                    item.getRequest(),
                    item.getWorkflowId(),
                    item.getOutcome() == null ? null : item.getOutcome().name(),
                    item.getOutcome() == null ? null : item.getOutcome().exitCode());
        }
    }

    public static BatchResponse from(Batch batch, List<BatchItem> items) {
        return new BatchResponse(
                batch.getId(),
                batch.getStatus().name(),
                batch.getMode(),
                batch.getTotalItems(),
                batch.getNextIndex(),
                batch.getConsecutiveFailures(),
                batch.getReason(),
                items.stream().map(ItemResponse::from).toList(),
                batch.getCreatedAt(),
                batch.getUpdatedAt()
        );
    }
}
