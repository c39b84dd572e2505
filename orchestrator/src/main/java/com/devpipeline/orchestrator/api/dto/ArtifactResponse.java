package com.devpipeline.orchestrator.api.dto;

import com.devpipeline.orchestrator.model.Artifact;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * One stored artifact. The payload is emitted as embedded JSON, not as a string.
 */
public record ArtifactResponse(
        String  stageName,
        String  version,
        String  status,
        String  reason,
        int     attempts,
        @JsonRawValue String payload,
        Instant createdAt
) {
    public static ArtifactResponse from(Artifact artifact) {
        return new ArtifactResponse(
                artifact.getStageName(),
                artifact.getVersion(),
                artifact.getStatus().name(),
                artifact.getReason(),
                artifact.getAttempts(),
                artifact.getPayload(),
                artifact.getCreatedAt()
        );
    }
}
