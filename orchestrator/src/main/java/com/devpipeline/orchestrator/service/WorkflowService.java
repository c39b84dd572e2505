package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.store.ArtifactStore;
import com.devpipeline.orchestrator.store.StoreException;
import com.devpipeline.orchestrator.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Workflow lifecycle as seen by callers: start, inspect, resume, rerun, cancel.
 *
 * Runs are executed asynchronously on the workflow pool. At most one run per
 * workflow is active in this process; a second start/resume/rerun of an
 * active workflow is rejected with IllegalStateException.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowCoordinator coordinator;
    private final WorkflowStore       workflows;
    private final ArtifactStore       artifacts;
    private final Executor            workflowExecutor;

    private final Map<String, RunContext> active = new ConcurrentHashMap<>();

    public WorkflowService(WorkflowCoordinator coordinator,
                           WorkflowStore workflows,
                           ArtifactStore artifacts,
                           @Qualifier("workflowExecutor") Executor workflowExecutor) {
        this.coordinator      = coordinator;
        this.workflows        = workflows;
        this.artifacts        = artifacts;
        this.workflowExecutor = workflowExecutor;
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Create a PENDING workflow and start running it in the background.
     *
     * @throws IllegalArgumentException if the request is blank
     */
    public Workflow start(String request, String mode) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be blank");
        }
        Workflow workflow = workflows.create(WorkflowIds.next(), request.trim(), mode);
        log.info("Created workflow {} (mode {})", workflow.getId(), workflow.getMode());
        RunContext ctx = reserve(workflow.getId());
        submit(ctx, c -> coordinator.run(c, workflow.getRequest(), workflow.getMode()));
        return workflow;
    }

    /**
     * Continue a workflow from its stored artifacts. No-op for BLOCKED and COMPLETED workflows.
     */
    public Workflow resume(String workflowId) {
        Workflow workflow = workflows.get(workflowId);
        if (workflow.getStatus() == WorkflowStatus.BLOCKED || workflow.getStatus() == WorkflowStatus.COMPLETED) {
            return workflow;
        }
        RunContext ctx = reserve(workflowId);
        submit(ctx, coordinator::resume);
        return workflow;
    }

    /**
     * Supersede the failed artifact of 'stageName', then resume in the background.
     *
     * @throws IllegalStateException    if the workflow is not FAILED or the stage completed
     * @throws IllegalArgumentException if the stage is unknown
     */
    public Workflow rerun(String workflowId, String stageName) {
        workflows.get(workflowId);
        RunContext ctx = reserve(workflowId);
        try {
            coordinator.prepareRerun(workflowId, stageName);
        } catch (RuntimeException e) {
            active.remove(workflowId, ctx);
            throw e;
        }
        submit(ctx, coordinator::resume);
        return workflows.get(workflowId);
    }

    /**
     * Run a workflow on the calling thread until this run stops. The workflow
     * is created on first use and resumed from its stored artifacts afterwards.
     *
     * @throws IllegalStateException if the workflow is already running in this process
     */
    public Workflow runInline(String workflowId, String request, String mode) {
        RunContext ctx = reserve(workflowId);
        try {
            return workflows.find(workflowId).isPresent()
                    ? coordinator.resume(ctx)
                    : coordinator.run(ctx, request, mode);
        } finally {
            active.remove(workflowId, ctx);
        }
    }

    /**
     * Abort a workflow. Active stage invocations are interrupted; completed
     * artifacts are kept. A non-terminal workflow with no run in this process
     * (left over from a crash) is marked cancelled directly.
     *
     * @throws IllegalStateException if the workflow already reached a terminal status
     */
    public Workflow cancel(String workflowId) {
        Workflow workflow = workflows.get(workflowId);
        RunContext ctx = active.get(workflowId);
        if (ctx != null) {
            log.info("Cancelling workflow {}", workflowId);
            ctx.cancel();
            return workflow;
        }
        if (workflow.getStatus().isTerminal()) {
            throw new IllegalStateException("Workflow " + workflowId + " is already " + workflow.getStatus());
        }
        workflow.setStatus(WorkflowStatus.FAILED);
        workflow.setReason(WorkflowCoordinator.CANCELLED_REASON);
        workflow = workflows.save(workflow);
        workflows.appendEvent(workflowId, EventType.WORKFLOW_CANCELLED, workflow.getCurrentStage(),
                WorkflowCoordinator.CANCELLED_REASON);
        return workflow;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Workflow status(String workflowId) {
        return workflows.get(workflowId);
    }

    public List<Artifact> artifacts(String workflowId) {
        workflows.get(workflowId);
        return artifacts.list(workflowId);
    }

    public List<ExecutionEvent> events(String workflowId) {
        workflows.get(workflowId);
        return workflows.events(workflowId);
    }

    public boolean isActive(String workflowId) {
        return active.containsKey(workflowId);
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    private RunContext reserve(String workflowId) {
        RunContext ctx = new RunContext(workflowId);
        if (active.putIfAbsent(workflowId, ctx) != null) {
            throw new IllegalStateException("Workflow " + workflowId + " is already running");
        }
        return ctx;
    }

    private void submit(RunContext ctx, Function<RunContext, Workflow> body) {
        String id = ctx.workflowId();
        try {
            workflowExecutor.execute(() -> {
                try {
                    Workflow result = body.apply(ctx);
                    log.info("Run of workflow {} ended with status {}", id, result.getStatus());
                } catch (Exception e) {
                    log.error("Unhandled error in workflow {}: {}", id, e.getMessage(), e);
                    markFailed(id, "internal error: " + e.getMessage());
                } finally {
                    active.remove(id, ctx);
                }
            });
        } catch (RejectedExecutionException e) {
            active.remove(id, ctx);
            throw new IllegalStateException("Workflow pool is not accepting work", e);
        }
    }

    private void markFailed(String workflowId, String reason) {
        try {
            Workflow workflow = workflows.get(workflowId);
            if (!workflow.getStatus().isTerminal()) {
                workflow.setStatus(WorkflowStatus.FAILED);
                workflow.setReason(reason);
                workflows.save(workflow);
                workflows.appendEvent(workflowId, EventType.WORKFLOW_FAILED, workflow.getCurrentStage(), reason);
            }
        } catch (StoreException e) {
            log.error("Could not record failure of workflow {}: {}", workflowId, e.getMessage());
        }
    }
}
