package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.repository.ExecutionEventRepository;
import com.devpipeline.orchestrator.repository.WorkflowRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed workflow records and execution logs.
 *
 * Every method runs in its own short transaction; a save() that returns has
 * been committed, so a crash never loses an acknowledged transition.
 */
@Component
public class JpaWorkflowStore implements WorkflowStore {

    private final WorkflowRepository       workflowRepo;
    private final ExecutionEventRepository eventRepo;

    public JpaWorkflowStore(WorkflowRepository workflowRepo, ExecutionEventRepository eventRepo) {
        this.workflowRepo = workflowRepo;
        this.eventRepo    = eventRepo;
    }

    @Override
    @Transactional
    public Workflow create(String workflowId, String request, String mode) {
        try {
            return workflowRepo.saveAndFlush(new Workflow(workflowId, request, mode));
        } catch (DataAccessException e) {
            throw new StoreException("Could not create workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Workflow> find(String workflowId) {
        try {
            return workflowRepo.findById(workflowId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not load workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional
    public Workflow save(Workflow workflow) {
        try {
            return workflowRepo.saveAndFlush(workflow);
        } catch (DataAccessException e) {
            throw new StoreException("Could not save workflow " + workflow.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Workflow> findStale(WorkflowStatus status, Instant cutoff) {
        try {
            return workflowRepo.findByStatusAndUpdatedAtBefore(status, cutoff);
        } catch (DataAccessException e) {
            throw new StoreException("Could not query stale workflows", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Workflow> findUpdatedBetween(Instant from, Instant to) {
        try {
            return workflowRepo.findByUpdatedAtGreaterThanEqualAndUpdatedAtLessThanOrderByCreatedAtAsc(from, to);
        } catch (DataAccessException e) {
            throw new StoreException("Could not query workflows updated in [" + from + ", " + to + ")", e);
        }
    }

    @Override
    @Transactional
    public void appendEvent(String workflowId, EventType type, String stageName, String detail) {
        try {
            eventRepo.save(new ExecutionEvent(workflowId, type, stageName, detail));
        } catch (DataAccessException e) {
            throw new StoreException("Could not append " + type + " event to workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionEvent> events(String workflowId) {
        try {
            return eventRepo.findByWorkflowIdOrderByIdAsc(workflowId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not read execution log of workflow " + workflowId, e);
        }
    }
}
