package com.devpipeline.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Structural check of the envelope every stage payload must carry:
 * <pre>
 *   { "producer": "...", "timestamp": "2024-05-01T12:00:00Z",
 *     "status": "...", "schema_version": "&lt;stage output version&gt;", ... }
 * </pre>
 * Stage-specific fields are left to the quality gates.
 */
public final class EnvelopeValidator {

    private EnvelopeValidator() {}

    /** @throws StageException of kind VALIDATION describing the first problem found */
    public static void validate(JsonNode payload, String expectedSchemaVersion) {
        if (payload == null || !payload.isObject()) {
            throw invalid("payload is not a JSON object");
        }
        requireText(payload, "producer");
        requireText(payload, "status");
        String timestamp = requireText(payload, "timestamp");
        try {
            OffsetDateTime.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw invalid("timestamp '" + timestamp + "' is not ISO-8601");
        }
        String version = requireText(payload, "schema_version");
        if (!version.equals(expectedSchemaVersion)) {
            throw invalid("schema_version " + version + " does not match expected " + expectedSchemaVersion);
        }
    }

    private static String requireText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isValueNode() || node.isNull() || node.asText().isBlank()) {
            throw invalid("missing envelope field '" + field + "'");
        }
        return node.asText();
    }

    private static StageException invalid(String detail) {
        return new StageException(StageException.Kind.VALIDATION, detail);
    }
}
