package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.Artifact;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned, write-once storage of stage artifacts keyed by (workflowId, stageName).
 *
 * Writes are synchronous and durable when the call returns. Readers observe
 * artifacts of a workflow in the order they were written and never see a
 * partially written one.
 */
public interface ArtifactStore {

    /**
     * Store the artifact under its key.
     *
     * @throws ArtifactAlreadyExistsException if a current artifact exists for the key
     * @throws IllegalArgumentException       if the artifact belongs to a different key
     * @throws StoreException                 on persistence failure
     */
    void put(String workflowId, String stageName, Artifact artifact);

    /** The current artifact for the key, if any. */
    Optional<Artifact> get(String workflowId, String stageName);

    /** All current artifacts of a workflow in write order. */
    List<Artifact> list(String workflowId);

    /** Current artifacts of one stage across all workflows, created inside [from, to), oldest first. */
    List<Artifact> listByStage(String stageName, Instant from, Instant to);

    /**
     * Override path used only by reruns: retire the current artifact for the key
     * so a new one can be written. The retired row is kept for audit.
     *
     * @return true if an artifact was superseded
     */
    boolean supersede(String workflowId, String stageName);
}
