package com.devpipeline.orchestrator.bypass;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.Workflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * What the bypass detector sees of one workflow: the record, its compact
 * event log, and its artifacts, which are only loaded when a check asks for them.
 */
public class ExecutionLog {

    private final Workflow                 workflow;
    private final List<ExecutionEvent>     events;
    private final Supplier<List<Artifact>> artifactLoader;
    private final ObjectMapper             json;

    private List<Artifact>              artifacts;
    private final Map<Artifact, JsonNode> payloads = new IdentityHashMap<>();

    public ExecutionLog(Workflow workflow,
                        List<ExecutionEvent> events,
                        Supplier<List<Artifact>> artifactLoader,
                        ObjectMapper json) {
        this.workflow       = workflow;
        this.events         = List.copyOf(events);
        this.artifactLoader = artifactLoader;
        this.json           = json;
    }

    public Workflow workflow() {
        return workflow;
    }

    public String workflowId() {
        return workflow.getId();
    }

    public List<ExecutionEvent> events() {
        return events;
    }

    public List<ExecutionEvent> events(EventType type) {
        return events.stream().filter(e -> e.getType() == type).toList();
    }

    /** Current artifacts, loaded on first use. */
    public synchronized List<Artifact> artifacts() {
        if (artifacts == null) {
            artifacts = List.copyOf(artifactLoader.get());
        }
        return artifacts;
    }

    public Optional<Artifact> artifact(String stageName) {
        return artifacts().stream().filter(a -> a.getStageName().equals(stageName)).findFirst();
    }

    /** Parsed payload; a MissingNode if the stored text is not JSON. */
    public synchronized JsonNode payload(Artifact artifact) {
        return payloads.computeIfAbsent(artifact, a -> {
            try {
                return json.readTree(a.getPayload());
            } catch (JsonProcessingException e) {
                return MissingNode.getInstance();
            }
        });
    }

    /**
     * Every path the workflow reports as changed: FILE_CHANGED events plus
     * files_changed arrays of completed payloads, in first-seen order.
     */
    public Set<String> changedPaths() {
        Set<String> paths = new LinkedHashSet<>();
        events(EventType.FILE_CHANGED).forEach(e -> paths.add(e.getDetail()));
        for (Artifact artifact : artifacts()) {
            if (!artifact.isCompleted()) {
                continue;
            }
            for (JsonNode file : payload(artifact).path("files_changed")) {
                String path = file.isTextual() ? file.asText() : file.path("path").asText("");
                if (!path.isBlank()) {
                    paths.add(path);
                }
            }
        }
        return paths;
    }
}
