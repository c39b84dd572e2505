package com.devpipeline.orchestrator.gate;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pass/fail check applied to a stage's payload after envelope validation.
 *
 * Implementations must be deterministic and side-effect free; they are
 * collected by {@link QualityGateRegistry} from the Spring context.
 */
public interface QualityGate {

    /** Name referenced by stage definitions. */
    String name();

    GateResult evaluate(JsonNode payload);
}
