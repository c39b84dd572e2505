package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of workflow instances and their append-only execution logs.
 */
public interface WorkflowStore {

    /** Persist a new PENDING workflow. */
    Workflow create(String workflowId, String request, String mode);

    Optional<Workflow> find(String workflowId);

    /** @throws WorkflowNotFoundException if no workflow has this id */
    default Workflow get(String workflowId) {
        return find(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    Workflow save(Workflow workflow);

    /** Workflows in 'status' not updated since 'cutoff'. */
    List<Workflow> findStale(WorkflowStatus status, Instant cutoff);

    /** Workflows updated inside [from, to), oldest first. */
    List<Workflow> findUpdatedBetween(Instant from, Instant to);

    /** Append one record to the workflow's execution log. Safe to call from several threads. */
    void appendEvent(String workflowId, EventType type, String stageName, String detail);

    /** The execution log in append order. */
    List<ExecutionEvent> events(String workflowId);
}
