package com.devpipeline.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /batches. Requests run in the given order, all with the same mode.
 */
public record StartBatchRequest(
        @NotEmpty List<@NotBlank @Size(max = 20_000) String> requests,
        @Size(max = 32) String mode) {
}
