package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.policy.Alignment;
import com.devpipeline.orchestrator.policy.Policy;
import com.devpipeline.orchestrator.policy.PolicyEvaluator;
import com.devpipeline.orchestrator.policy.PolicyParseException;
import com.devpipeline.orchestrator.policy.PolicySource;
import com.devpipeline.orchestrator.publish.PublishService;
import com.devpipeline.orchestrator.stage.PipelineStep;
import com.devpipeline.orchestrator.stage.StageDefinition;
import com.devpipeline.orchestrator.stage.StageRegistry;
import com.devpipeline.orchestrator.store.ArtifactStore;
import com.devpipeline.orchestrator.store.StoreException;
import com.devpipeline.orchestrator.store.WorkflowStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Drives one workflow through the stage registry.
 *
 * <pre>
 *   alignment ──rejected──▶ BLOCKED
 *       │
 *       ▼
 *   step 1 ─▶ step 2 ─▶ ... ─▶ step N ─▶ COMPLETED ─▶ publish
 *       │         │                │
 *       └─────────┴──── failed ────┴──▶ FAILED (reason names the stage)
 * </pre>
 *
 * Everything the coordinator decides is derived from stored artifacts, so a
 * run can be resumed at any point: stages with a completed artifact are
 * skipped, the first stage without one is invoked again.
 *
 * A user cancel ends the run FAILED with reason "cancelled". Any other
 * interrupt (process shutdown) leaves the record RUNNING and untouched so the
 * recovery sweep picks it up after restart.
 *
 * The thread calling {@link #run}/{@link #resume} is the only one that writes
 * the workflow record. Parallel group members only write their own artifacts
 * and events.
 */
@Service
public class WorkflowCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    static final String ALIGNMENT_SCHEMA_VERSION = "1.0";
    static final String CANCELLED_REASON         = "cancelled";

    private final StageRegistry   registry;
    private final ArtifactStore   artifacts;
    private final WorkflowStore   workflows;
    private final PolicySource    policySource;
    private final PolicyEvaluator evaluator;
    private final StageInvoker    invoker;
    private final PublishService  publishService;
    private final ExecutorService stageExecutor;
    private final ObjectMapper    json;

    public WorkflowCoordinator(StageRegistry registry,
                               ArtifactStore artifacts,
                               WorkflowStore workflows,
                               PolicySource policySource,
                               PolicyEvaluator evaluator,
                               StageInvoker invoker,
                               PublishService publishService,
                               @Qualifier("stageExecutor") ExecutorService stageExecutor,
                               ObjectMapper json) {
        this.registry       = registry;
        this.artifacts      = artifacts;
        this.workflows      = workflows;
        this.policySource   = policySource;
        this.evaluator      = evaluator;
        this.invoker        = invoker;
        this.publishService = publishService;
        this.stageExecutor  = stageExecutor;
        this.json           = json;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run the workflow identified by the context, creating it if it does not exist yet.
     *
     * @return the workflow in its final state for this run
     * @throws StoreException if the workflow cannot be loaded or created
     */
    public Workflow run(RunContext ctx, String request, String mode) {
        Workflow workflow = workflows.find(ctx.workflowId())
                .orElseGet(() -> workflows.create(ctx.workflowId(), request, mode));
        return drive(ctx, workflow);
    }

    /**
     * Continue a workflow from its stored artifacts. BLOCKED and COMPLETED
     * workflows are returned unchanged.
     */
    public Workflow resume(RunContext ctx) {
        Workflow workflow = workflows.get(ctx.workflowId());
        if (workflow.getStatus() == WorkflowStatus.BLOCKED || workflow.getStatus() == WorkflowStatus.COMPLETED) {
            log.info("Workflow {} is {}; nothing to resume", workflow.getId(), workflow.getStatus());
            return workflow;
        }
        return drive(ctx, workflow);
    }

    /**
     * Retire the failed artifact of 'stageName' so the next resume invokes the stage again.
     *
     * @throws IllegalArgumentException if the stage is unknown
     * @throws IllegalStateException    if the workflow is not FAILED or the stage already completed
     */
    public void prepareRerun(String workflowId, String stageName) {
        Workflow workflow = workflows.get(workflowId);
        if (workflow.getStatus() != WorkflowStatus.FAILED) {
            throw new IllegalStateException(
                    "Workflow " + workflowId + " is " + workflow.getStatus() + "; only FAILED workflows can be rerun");
        }
        if (registry.find(stageName).isEmpty()) {
            throw new IllegalArgumentException("Unknown stage: " + stageName);
        }
        Optional<Artifact> current = artifacts.get(workflowId, stageName);
        if (current.isPresent() && current.get().isCompleted()) {
            throw new IllegalStateException("Stage '" + stageName + "' already completed in workflow " + workflowId);
        }
        if (current.isPresent() && artifacts.supersede(workflowId, stageName)) {
            workflows.appendEvent(workflowId, EventType.STAGE_SUPERSEDED, stageName, current.get().getReason());
            log.info("Superseded failed artifact of stage '{}' in workflow {}", stageName, workflowId);
        }
    }

    /** {@link #prepareRerun} followed by {@link #resume}. */
    public Workflow rerun(RunContext ctx, String stageName) {
        prepareRerun(ctx.workflowId(), stageName);
        return resume(ctx);
    }

    // ------------------------------------------------------------------
    // Main loop
    // ------------------------------------------------------------------

    private Workflow drive(RunContext ctx, Workflow workflow) {
        String id = workflow.getId();
        MDC.put("workflowId", id);
        try {
            workflow.setStatus(WorkflowStatus.RUNNING);
            workflow.setReason(null);
            workflow = workflows.save(workflow);

            JsonNode alignment = alignment(workflow);
            if (!alignment.path("aligned").asBoolean(true)) {
                String reason = "policy rejected: " + joinText(alignment.path("violations"));
                workflow.setStatus(WorkflowStatus.BLOCKED);
                workflow.setReason(reason);
                workflow = workflows.save(workflow);
                workflows.appendEvent(id, EventType.WORKFLOW_BLOCKED, StageRegistry.ALIGNMENT, reason);
                log.info("Workflow {} blocked: {}", id, reason);
                return workflow;
            }
            Set<String> skipped = textSet(alignment.path("skip_stages"));

            for (PipelineStep step : registry.steps()) {
                ctx.throwIfCancelled();
                workflow.setCurrentStage(step.isParallel()
                        ? step.parallelGroup()
                        : step.stages().get(0).name());
                workflow = workflows.save(workflow);

                String halt = step.isParallel()
                        ? runGroup(ctx, workflow, step, skipped)
                        : runStage(ctx, workflow, step.stages().get(0), skipped);
                if (halt != null) {
                    return fail(workflow, halt);
                }
            }
            ctx.throwIfCancelled();

            workflow.setStatus(WorkflowStatus.COMPLETED);
            workflow.setCurrentStage(null);
            workflow = workflows.save(workflow);
            workflows.appendEvent(id, EventType.WORKFLOW_COMPLETED, null, workflow.getMode());
            log.info("Workflow {} completed", id);

            publishService.publish(workflow);
            return workflow;

        } catch (StageException e) {
            if (e.getKind() == StageException.Kind.INTERRUPTED) {
                Thread.currentThread().interrupt();
                log.warn("Workflow {} interrupted; left {} for resumption", id, workflow.getStatus());
                return workflow;
            }
            if (e.getKind() != StageException.Kind.CANCELLED) {
                throw e;
            }
            workflow.setStatus(WorkflowStatus.FAILED);
            workflow.setReason(CANCELLED_REASON);
            workflow = workflows.save(workflow);
            workflows.appendEvent(id, EventType.WORKFLOW_CANCELLED, workflow.getCurrentStage(), CANCELLED_REASON);
            log.info("Workflow {} cancelled", id);
            return workflow;
        } catch (StoreException e) {
            log.error("Store failure in workflow {}; left in last durable state ({}): {}",
                    id, workflow.getStatus(), e.getMessage(), e);
            return workflow;
        } finally {
            MDC.clear();
        }
    }

    private Workflow fail(Workflow workflow, String reason) {
        workflow.setStatus(WorkflowStatus.FAILED);
        workflow.setReason(reason);
        workflow = workflows.save(workflow);
        workflows.appendEvent(workflow.getId(), EventType.WORKFLOW_FAILED, workflow.getCurrentStage(), reason);
        log.warn("Workflow {} failed: {}", workflow.getId(), reason);
        return workflow;
    }

    // ------------------------------------------------------------------
    // Alignment
    // ------------------------------------------------------------------

    /** Stored alignment payload, evaluating and storing it first if this is the first run. */
    private JsonNode alignment(Workflow workflow) {
        Optional<Artifact> stored = artifacts.get(workflow.getId(), StageRegistry.ALIGNMENT);
        if (stored.isPresent()) {
            return readPayload(stored.get());
        }
        workflows.appendEvent(workflow.getId(), EventType.WORKFLOW_STARTED, null, workflow.getMode());

        Policy policy;
        Alignment verdict;
        try {
            policy  = policySource.load().orElse(null);
            verdict = evaluator.evaluate(workflow.getRequest(), policy);
        } catch (PolicyParseException e) {
            log.warn("Policy document unusable, allowing request: {}", e.getMessage());
            policy  = null;
            verdict = Alignment.noPolicy("unparsable: " + e.getMessage());
        }

        ObjectNode payload = json.createObjectNode();
        payload.put("producer",       "policy-evaluator");
        payload.put("timestamp",      Instant.now().toString());
        payload.put("status",         "completed");
        payload.put("schema_version", ALIGNMENT_SCHEMA_VERSION);
        payload.put("aligned",        verdict.aligned());
        payload.put("confidence",     verdict.confidence());
        payload.put("reasoning",      verdict.reasoning());
        verdict.matchingGoals().forEach(payload.putArray("matching_goals")::add);
        verdict.violations().forEach(payload.putArray("violations")::add);
        ArrayNode skip = payload.putArray("skip_stages");
        if (policy != null && verdict.aligned()) {
            for (StageDefinition stage : registry.stages()) {
                if (policy.skippableStages().contains(stage.name()) && !registry.hasDependents(stage.name())) {
                    skip.add(stage.name());
                }
            }
        }

        artifacts.put(workflow.getId(), StageRegistry.ALIGNMENT, Artifact.completed(
                workflow.getId(), StageRegistry.ALIGNMENT, ALIGNMENT_SCHEMA_VERSION, payload.toString(), 1));
        workflows.appendEvent(workflow.getId(), EventType.ALIGNMENT_EVALUATED, StageRegistry.ALIGNMENT,
                (verdict.aligned() ? "aligned" : "rejected") + " confidence=" + verdict.confidence());
        log.info("Alignment for workflow {}: aligned={} confidence={}",
                workflow.getId(), verdict.aligned(), verdict.confidence());
        return payload;
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    /**
     * Bring one stage to a stored outcome.
     *
     * @return null if the pipeline may continue, otherwise the reason to halt
     */
    private String runStage(RunContext ctx, Workflow workflow, StageDefinition stage, Set<String> skipped) {
        String id   = workflow.getId();
        String name = stage.name();

        Optional<Artifact> existing = artifacts.get(id, name);
        if (existing.isPresent()) {
            if (existing.get().isCompleted()) {
                log.debug("Stage '{}' already completed; skipping", name);
                return null;
            }
            return "stage '" + name + "' failed: " + existing.get().getReason() + " (rerun required)";
        }

        if (skipped.contains(name)) {
            boolean logged = workflows.events(id).stream()
                    .anyMatch(e -> e.getType() == EventType.STAGE_SKIPPED && name.equals(e.getStageName()));
            if (!logged) {
                workflows.appendEvent(id, EventType.STAGE_SKIPPED, name, "skipped by policy");
            }
            log.info("Stage '{}' skipped by policy", name);
            return null;
        }

        Map<String, Artifact> inputs = new LinkedHashMap<>();
        for (String required : stage.requiredInputs()) {
            Optional<Artifact> input = artifacts.get(id, required);
            if (input.isEmpty() || !input.get().isCompleted()) {
                return "stage '" + name + "' blocked: required input '" + required + "' "
                        + (input.isEmpty() ? "missing" : "failed");
            }
            inputs.put(required, input.get());
        }

        MDC.put("stage", name);
        try {
            workflows.appendEvent(id, EventType.STAGE_STARTED, name, null);
            log.info("Stage '{}' started", name);

            Artifact result = invoker.invoke(ctx, stage, workflow.getRequest(), inputs);
            artifacts.put(id, name, result);

            if (result.isCompleted()) {
                workflows.appendEvent(id, EventType.STAGE_COMPLETED, name, "attempts=" + result.getAttempts());
                recordFileChanges(result);
                log.info("Stage '{}' completed after {} attempt(s)", name, result.getAttempts());
                return null;
            }
            workflows.appendEvent(id, EventType.STAGE_FAILED, name, result.getReason());
            return "stage '" + name + "' failed: " + result.getReason();
        } finally {
            MDC.remove("stage");
        }
    }

    /**
     * Dispatch every member of a parallel group and wait for all of them.
     * A failed member does not interrupt its siblings; all outcomes are stored.
     */
    private String runGroup(RunContext ctx, Workflow workflow, PipelineStep step, Set<String> skipped) {
        List<CompletableFuture<String>> members = new ArrayList<>();
        for (StageDefinition stage : step.stages()) {
            members.add(CompletableFuture.supplyAsync(() -> {
                MDC.put("workflowId", workflow.getId());
                try {
                    return runStage(ctx, workflow, stage, skipped);
                } finally {
                    MDC.clear();
                }
            }, stageExecutor));
        }

        List<String>     halts   = new ArrayList<>();
        boolean          stopped = false;
        RuntimeException failure = null;
        for (CompletableFuture<String> member : members) {
            try {
                String halt = member.join();
                if (halt != null) {
                    halts.add(halt);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StageException && ((StageException) cause).stopsRun()) {
                    stopped = true;
                } else if (failure == null) {
                    failure = cause instanceof RuntimeException
                            ? (RuntimeException) cause
                            : new IllegalStateException(cause);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        if (stopped) {
            throw ctx.interruption("parallel group interrupted", null);
        }
        return halts.isEmpty() ? null : String.join("; ", halts);
    }

    /** One FILE_CHANGED event per path listed in the payload's files_changed. */
    private void recordFileChanges(Artifact artifact) {
        JsonNode files = readPayload(artifact).path("files_changed");
        for (JsonNode file : files) {
            String path = file.isTextual() ? file.asText() : file.path("path").asText("");
            if (!path.isBlank()) {
                workflows.appendEvent(artifact.getWorkflowId(), EventType.FILE_CHANGED, artifact.getStageName(), path);
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode readPayload(Artifact artifact) {
        try {
            return json.readTree(artifact.getPayload());
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored payload of '" + artifact.getStageName() + "' is not valid JSON", e);
        }
    }

    private static Set<String> textSet(JsonNode array) {
        Set<String> out = new LinkedHashSet<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    private static String joinText(JsonNode array) {
        List<String> parts = new ArrayList<>();
        array.forEach(n -> parts.add(n.asText()));
        return String.join("; ", parts);
    }
}
