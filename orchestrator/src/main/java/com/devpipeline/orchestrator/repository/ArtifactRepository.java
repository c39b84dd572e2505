package com.devpipeline.orchestrator.repository;

import com.devpipeline.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queries over the artifacts table. "Current" means not superseded.
 */
public interface ArtifactRepository extends JpaRepository<Artifact, Long> {

    Optional<Artifact> findByWorkflowIdAndStageNameAndSupersededFalse(String workflowId, String stageName);

    /** Current artifacts of a workflow in the order they were durably written. */
    List<Artifact> findByWorkflowIdAndSupersededFalseOrderByIdAsc(String workflowId);

    List<Artifact> findByStageNameAndSupersededFalseAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByIdAsc(
            String stageName, Instant from, Instant to);
}
