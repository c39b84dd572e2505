package com.devpipeline.orchestrator.repository;

import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

/**
 * CRUD + query operations for the workflows table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface WorkflowRepository extends JpaRepository<Workflow, String> {

    /** Workflows in a state whose record has not been touched since 'cutoff' (recovery sweep). */
    List<Workflow> findByStatusAndUpdatedAtBefore(WorkflowStatus status, Instant cutoff);

    /** Workflows touched inside [from, to), oldest first (bypass analysis ranges). */
    List<Workflow> findByUpdatedAtGreaterThanEqualAndUpdatedAtLessThanOrderByCreatedAtAsc(
            Instant from, Instant to);
}
