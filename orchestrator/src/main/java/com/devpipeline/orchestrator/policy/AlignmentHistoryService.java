package com.devpipeline.orchestrator.policy;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.stage.StageRegistry;
import com.devpipeline.orchestrator.store.ArtifactStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * History of alignment verdicts and approval statistics.
 *
 * Every workflow stores its verdict once as the "alignment" artifact, so the
 * artifact table is the decision log; nothing is written here.
 */
@Service
public class AlignmentHistoryService {

    private static final Logger log = LoggerFactory.getLogger(AlignmentHistoryService.class);

    private final ArtifactStore artifacts;
    private final ObjectMapper  json;

    public AlignmentHistoryService(ArtifactStore artifacts, ObjectMapper json) {
        this.artifacts = artifacts;
        this.json      = json;
    }

    /**
     * Decisions recorded inside [from, to), oldest first. Unreadable payloads are skipped.
     *
     * @throws IllegalArgumentException if 'from' is after 'to'
     */
    public List<AlignmentDecision> decisions(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from (" + from + ") is after to (" + to + ")");
        }
        List<AlignmentDecision> out = new ArrayList<>();
        for (Artifact artifact : artifacts.listByStage(StageRegistry.ALIGNMENT, from, to)) {
            try {
                out.add(toDecision(artifact, json.readTree(artifact.getPayload())));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable alignment artifact of workflow {}: {}",
                        artifact.getWorkflowId(), e.getOriginalMessage());
            }
        }
        return out;
    }

    public AlignmentStats stats(Instant from, Instant to) {
        return AlignmentStats.of(decisions(from, to));
    }

    private static AlignmentDecision toDecision(Artifact artifact, JsonNode payload) {
        return new AlignmentDecision(
                artifact.getWorkflowId(),
                payload.path("aligned").asBoolean(true),
                payload.path("confidence").asDouble(0.0),
                texts(payload.path("matching_goals")),
                texts(payload.path("violations")),
                payload.path("reasoning").asText(""),
                artifact.getCreatedAt());
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }
}
