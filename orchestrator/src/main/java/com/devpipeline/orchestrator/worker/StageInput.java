package com.devpipeline.orchestrator.worker;

import com.devpipeline.orchestrator.model.Artifact;

import java.util.Map;

/**
 * Everything a worker receives for one invocation.
 *
 * @param artifacts completed artifacts of the stage's required inputs, keyed by stage name
 */
public record StageInput(
        String                workflowId,
        String                stageName,
        String                request,
        Map<String, Artifact> artifacts) {

    public StageInput {
        artifacts = Map.copyOf(artifacts);
    }
}
