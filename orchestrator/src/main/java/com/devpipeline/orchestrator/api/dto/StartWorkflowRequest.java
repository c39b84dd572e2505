package com.devpipeline.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /workflows.
 *
 * @param mode workflow mode ("standard", "issue", "local"); defaults to "standard"
 */
public record StartWorkflowRequest(
        @NotBlank @Size(max = 20_000) String request,
        @Size(max = 32) String mode) {
}
