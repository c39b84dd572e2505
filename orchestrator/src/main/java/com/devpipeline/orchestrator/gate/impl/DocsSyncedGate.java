package com.devpipeline.orchestrator.gate.impl;

import com.devpipeline.orchestrator.gate.GateResult;
import com.devpipeline.orchestrator.gate.QualityGate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class DocsSyncedGate implements QualityGate {

    @Override
    public String name() {
        return "docs_synced";
    }

    @Override
    public GateResult evaluate(JsonNode payload) {
        if (payload != null
                && (payload.path("docs_updated").asBoolean(false)
                    || payload.path("no_changes_needed").asBoolean(false))) {
            return GateResult.pass();
        }
        return GateResult.fail("documentation neither updated nor declared current");
    }
}
