package com.devpipeline.orchestrator.api.dto;

import com.devpipeline.orchestrator.model.Workflow;

import java.time.Instant;

/**
 * Response body for workflow endpoints. {@code exitCode} is null while the
 * workflow is still pending or running.
 */
public record WorkflowResponse(
        String  id,
        String  status,
        Integer exitCode,
        String  mode,
        String  request,
        String  currentStage,
        String  reason,
        Instant createdAt,
        Instant updatedAt
) {
    public static WorkflowResponse from(Workflow workflow) {
        return new WorkflowResponse(
                workflow.getId(),
                workflow.getStatus().name(),
                workflow.getStatus().exitCode(),
                workflow.getMode(),
                workflow.getRequest(),
                workflow.getCurrentStage(),
                workflow.getReason(),
                workflow.getCreatedAt(),
                workflow.getUpdatedAt()
        );
    }
}
