package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.repository.ArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed artifact store.
 *
 * The existence check in put() gives a readable error; the partial unique
 * index on (workflow_id, stage_name) WHERE NOT superseded is what actually
 * guarantees write-once semantics when two writers race.
 */
@Component
public class JpaArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(JpaArtifactStore.class);

    private final ArtifactRepository artifactRepo;

    public JpaArtifactStore(ArtifactRepository artifactRepo) {
        this.artifactRepo = artifactRepo;
    }

    @Override
    @Transactional
    public void put(String workflowId, String stageName, Artifact artifact) {
        if (!workflowId.equals(artifact.getWorkflowId()) || !stageName.equals(artifact.getStageName())) {
            throw new IllegalArgumentException("Artifact key (%s, %s) does not match (%s, %s)".formatted(
                    artifact.getWorkflowId(), artifact.getStageName(), workflowId, stageName));
        }
        try {
            Optional<Artifact> existing =
                    artifactRepo.findByWorkflowIdAndStageNameAndSupersededFalse(workflowId, stageName);
            if (existing.isPresent()) {
                throw new ArtifactAlreadyExistsException(workflowId, stageName, existing.get().getStatus());
            }
            artifactRepo.saveAndFlush(artifact);
            log.debug("Stored {} artifact for stage '{}' of workflow {}",
                    artifact.getStatus(), stageName, workflowId);
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent writer for the same key.
            throw new ArtifactAlreadyExistsException(workflowId, stageName, artifact.getStatus());
        } catch (DataAccessException e) {
            throw new StoreException("Could not store artifact for stage '" + stageName
                    + "' of workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Artifact> get(String workflowId, String stageName) {
        try {
            return artifactRepo.findByWorkflowIdAndStageNameAndSupersededFalse(workflowId, stageName);
        } catch (DataAccessException e) {
            throw new StoreException("Could not read artifact '" + stageName + "' of workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Artifact> list(String workflowId) {
        try {
            return artifactRepo.findByWorkflowIdAndSupersededFalseOrderByIdAsc(workflowId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not list artifacts of workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Artifact> listByStage(String stageName, Instant from, Instant to) {
        try {
            return artifactRepo.findByStageNameAndSupersededFalseAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByIdAsc(
                    stageName, from, to);
        } catch (DataAccessException e) {
            throw new StoreException("Could not list '" + stageName + "' artifacts created in [" + from + ", " + to + ")", e);
        }
    }

    @Override
    @Transactional
    public boolean supersede(String workflowId, String stageName) {
        try {
            Optional<Artifact> current =
                    artifactRepo.findByWorkflowIdAndStageNameAndSupersededFalse(workflowId, stageName);
            if (current.isEmpty()) {
                return false;
            }
            Artifact artifact = current.get();
            artifact.markSuperseded();
            artifactRepo.saveAndFlush(artifact);
            log.info("Superseded {} artifact for stage '{}' of workflow {}",
                    artifact.getStatus(), stageName, workflowId);
            return true;
        } catch (DataAccessException e) {
            throw new StoreException("Could not supersede artifact '" + stageName
                    + "' of workflow " + workflowId, e);
        }
    }
}
