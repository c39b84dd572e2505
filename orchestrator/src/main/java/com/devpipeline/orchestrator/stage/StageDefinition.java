package com.devpipeline.orchestrator.stage;

import java.time.Duration;
import java.util.Set;

/**
 * Static description of one pipeline stage.
 *
 * @param name                unique stage name; also the artifact key
 * @param order               position in the pipeline; members of a parallel group share it
 * @param requiredInputs      stages whose completed artifacts this stage consumes
 * @param outputSchemaVersion schema_version the stage's payload envelope must carry
 * @param timeout             wall-clock bound for a single worker invocation
 * @param parallelGroup       group name, or null for a sequential stage
 * @param qualityGate         name of the gate applied to the payload, or null for none
 */
public record StageDefinition(
        String       name,
        int          order,
        Set<String>  requiredInputs,
        String       outputSchemaVersion,
        Duration     timeout,
        String       parallelGroup,
        String       qualityGate) {

    public StageDefinition {
        requiredInputs = requiredInputs == null ? Set.of() : Set.copyOf(requiredInputs);
        if (parallelGroup != null && parallelGroup.isBlank()) {
            parallelGroup = null;
        }
        if (qualityGate != null && qualityGate.isBlank()) {
            qualityGate = null;
        }
    }

    public boolean isParallel() {
        return parallelGroup != null;
    }
}
