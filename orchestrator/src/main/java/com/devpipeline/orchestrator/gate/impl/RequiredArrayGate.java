package com.devpipeline.orchestrator.gate.impl;

import com.devpipeline.orchestrator.gate.GateResult;
import com.devpipeline.orchestrator.gate.QualityGate;
import com.fasterxml.jackson.databind.JsonNode;

/** Passes when the payload carries a non-empty array under a fixed field. */
abstract class RequiredArrayGate implements QualityGate {

    private final String field;

    RequiredArrayGate(String field) {
        this.field = field;
    }

    @Override
    public GateResult evaluate(JsonNode payload) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || !node.isArray()) {
            return GateResult.fail("missing array '" + field + "'");
        }
        if (node.isEmpty()) {
            return GateResult.fail("'" + field + "' is empty");
        }
        return GateResult.pass();
    }
}
