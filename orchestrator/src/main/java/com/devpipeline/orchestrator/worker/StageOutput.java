package com.devpipeline.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw result of a worker invocation. The payload is not trusted until the
 * envelope validator and the stage's quality gate have accepted it.
 *
 * @param status the worker's own verdict ("completed" or "failed"), taken from the envelope
 */
public record StageOutput(JsonNode payload, String status) {

    public static final String FAILED = "failed";

    public static StageOutput of(JsonNode payload) {
        String status = payload == null ? null : payload.path("status").asText(null);
        return new StageOutput(payload, status);
    }

    public boolean reportsFailure() {
        return FAILED.equalsIgnoreCase(status);
    }
}
