package com.devpipeline.orchestrator.gate.impl;

import com.devpipeline.orchestrator.gate.GateResult;
import com.devpipeline.orchestrator.gate.QualityGate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Requires {@code passed: true} and no critical or high severity entry in
 * {@code vulnerabilities}, whatever the auditor claimed in 'passed'.
 */
@Component
public class SecurityClearanceGate implements QualityGate {

    private static final Set<String> BLOCKING = Set.of("critical", "high");

    @Override
    public String name() {
        return "security_clearance";
    }

    @Override
    public GateResult evaluate(JsonNode payload) {
        if (payload == null) {
            return GateResult.fail("empty security report");
        }
        int blocking = 0;
        for (JsonNode vuln : payload.path("vulnerabilities")) {
            String severity = vuln.path("severity").asText("").toLowerCase(Locale.ROOT);
            if (BLOCKING.contains(severity)) {
                blocking++;
            }
        }
        if (blocking > 0) {
            return GateResult.fail(blocking + " critical/high vulnerabilities");
        }
        if (!payload.path("passed").asBoolean(false)) {
            return GateResult.fail("security audit did not pass");
        }
        return GateResult.pass();
    }
}
