package com.devpipeline.orchestrator.gate.impl;

import com.devpipeline.orchestrator.gate.GateResult;
import com.devpipeline.orchestrator.gate.QualityGate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/** The reviewer must have set {@code approved: true}. */
@Component
public class ReviewApprovalGate implements QualityGate {

    @Override
    public String name() {
        return "review_approval";
    }

    @Override
    public GateResult evaluate(JsonNode payload) {
        if (payload != null && payload.path("approved").asBoolean(false)) {
            return GateResult.pass();
        }
        String comment = payload == null ? "" : payload.path("summary").asText("");
        return GateResult.fail(comment.isBlank() ? "review not approved" : "review not approved: " + comment);
    }
}
