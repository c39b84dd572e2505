package com.devpipeline.orchestrator.publish;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.Workflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the git service: {@code POST {base-url}/publish}.
 *
 * Request:  { "workflow_id", "mode", "request", "artifacts": { stage: payload } }
 * Response: { "commit_id", "issue_reference", "actions": [ ... ] }
 */
@Component
public class GitPublishClient implements PublishCollaborator {

    private static final Logger log = LoggerFactory.getLogger(GitPublishClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public GitPublishClient(@Value("${devpipeline.publish.base-url}") String baseUrl,
                            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public PublishResult publish(Workflow workflow, List<Artifact> artifacts) throws InterruptedException {
        log.info("Publishing workflow {} (mode {})", workflow.getId(), workflow.getMode());
        String body = toJson(workflow, artifacts);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/publish"))
                .timeout(Duration.ofMinutes(5))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new PublishException("publish failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            JsonNode node = json.readTree(resp.body());
            List<String> actions = new ArrayList<>();
            node.path("actions").forEach(a -> actions.add(a.asText()));
            return new PublishResult(
                    node.path("commit_id").asText(null),
                    node.path("issue_reference").asText(null),
                    actions);
        } catch (IOException e) {
            throw new PublishException("publish failed for " + workflow.getId(), e);
        }
    }

    private String toJson(Workflow workflow, List<Artifact> artifacts) {
        try {
            ObjectNode root = json.createObjectNode();
            root.put("workflow_id", workflow.getId());
            root.put("mode",        workflow.getMode());
            root.put("request",     workflow.getRequest());
            ObjectNode byStage = root.putObject("artifacts");
            for (Artifact a : artifacts) {
                byStage.set(a.getStageName(), json.readTree(a.getPayload()));
            }
            return json.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PublishException("JSON serialization failed", e);
        }
    }
}
