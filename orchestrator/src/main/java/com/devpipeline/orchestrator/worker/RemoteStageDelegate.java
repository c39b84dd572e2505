package com.devpipeline.orchestrator.worker;

import com.devpipeline.orchestrator.model.Artifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the request document for a stage and sends it to the reasoning service.
 * Shared by the stage workers, each of which supplies its own objective.
 *
 * Request document:
 * <pre>
 *   { "workflow_id": ..., "stage": ..., "request": ..., "objective": ...,
 *     "inputs": { "&lt;stage&gt;": &lt;payload&gt;, ... } }
 * </pre>
 */
@Component
public final class RemoteStageDelegate {

    private final ReasoningServiceClient client;
    private final ObjectMapper           json;

    public RemoteStageDelegate(ReasoningServiceClient client, ObjectMapper json) {
        this.client = client;
        this.json   = json;
    }

    public StageOutput invoke(StageInput input, String objective) throws InterruptedException {
        ObjectNode body = json.createObjectNode();
        body.put("workflow_id", input.workflowId());
        body.put("stage",       input.stageName());
        body.put("request",     input.request());
        body.put("objective",   objective);
        ObjectNode inputs = body.putObject("inputs");
        for (Map.Entry<String, Artifact> e : input.artifacts().entrySet()) {
            try {
                inputs.set(e.getKey(), json.readTree(e.getValue().getPayload()));
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Stored payload of '" + e.getKey() + "' is not JSON", ex);
            }
        }
        return StageOutput.of(client.invokeStage(input.stageName(), body));
    }
}
