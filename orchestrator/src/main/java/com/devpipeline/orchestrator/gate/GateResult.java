package com.devpipeline.orchestrator.gate;

/** Outcome of a quality gate; 'reason' is null when the gate passed. */
public record GateResult(boolean passed, String reason) {

    public static GateResult pass() {
        return new GateResult(true, null);
    }

    public static GateResult fail(String reason) {
        return new GateResult(false, reason);
    }
}
