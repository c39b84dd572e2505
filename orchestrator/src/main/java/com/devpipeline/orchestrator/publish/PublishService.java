package com.devpipeline.orchestrator.publish;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.stage.StageRegistry;
import com.devpipeline.orchestrator.store.ArtifactStore;
import com.devpipeline.orchestrator.store.WorkflowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Runs the publish hand-off after a workflow completed.
 *
 * The outcome is stored as the trailing "publish" artifact and every action
 * the git service performed becomes an ACTION_RECORDED event, which is what
 * the completeness checks of the bypass detector read. A failed publish is
 * recorded but never changes the workflow's status.
 */
@Service
public class PublishService {

    private static final Logger log = LoggerFactory.getLogger(PublishService.class);

    static final String SCHEMA_VERSION = "1.0";

    private final PublishCollaborator collaborator;
    private final ArtifactStore       artifacts;
    private final WorkflowStore       workflows;
    private final ObjectMapper        json;
    private final boolean             enabled;

    public PublishService(PublishCollaborator collaborator,
                          ArtifactStore artifacts,
                          WorkflowStore workflows,
                          ObjectMapper json,
                          @Value("${devpipeline.publish.enabled:true}") boolean enabled) {
        this.collaborator = collaborator;
        this.artifacts    = artifacts;
        this.workflows    = workflows;
        this.json         = json;
        this.enabled      = enabled;
    }

    public void publish(Workflow workflow) {
        if (!enabled) {
            log.info("Publishing disabled; workflow {} left unpublished", workflow.getId());
            return;
        }
        String id = workflow.getId();
        if (artifacts.get(id, StageRegistry.PUBLISH).isPresent()) {
            return;
        }
        try {
            List<Artifact> current = artifacts.list(id);
            PublishResult result = collaborator.publish(workflow, current);

            ObjectNode payload = json.createObjectNode();
            payload.put("producer",        "git-publisher");
            payload.put("timestamp",       Instant.now().toString());
            payload.put("status",          "completed");
            payload.put("schema_version",  SCHEMA_VERSION);
            payload.put("commit_id",       result.commitId());
            payload.put("issue_reference", result.issueReference());
            result.actions().forEach(payload.putArray("actions")::add);

            artifacts.put(id, StageRegistry.PUBLISH,
                    Artifact.completed(id, StageRegistry.PUBLISH, SCHEMA_VERSION, payload.toString(), 1));
            for (String action : result.actions()) {
                workflows.appendEvent(id, EventType.ACTION_RECORDED, StageRegistry.PUBLISH, action);
            }
            log.info("Workflow {} published: commit={} actions={}", id, result.commitId(), result.actions());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(id, "interrupted");
        } catch (RuntimeException e) {
            recordFailure(id, e.getMessage());
        }
    }

    private void recordFailure(String workflowId, String message) {
        log.warn("Publishing workflow {} failed: {}", workflowId, message);
        workflows.appendEvent(workflowId, EventType.PUBLISH_FAILED, StageRegistry.PUBLISH, message);
    }
}
