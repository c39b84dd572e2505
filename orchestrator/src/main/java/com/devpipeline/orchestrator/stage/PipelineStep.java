package com.devpipeline.orchestrator.stage;

import java.util.List;

/**
 * One position in the execution plan: a single sequential stage, or all
 * members of a parallel group, which share the same order.
 */
public record PipelineStep(int order, String parallelGroup, List<StageDefinition> stages) {

    public PipelineStep {
        stages = List.copyOf(stages);
    }

    public boolean isParallel() {
        return parallelGroup != null;
    }
}
