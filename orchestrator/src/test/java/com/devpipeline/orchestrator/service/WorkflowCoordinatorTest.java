package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.gate.QualityGateRegistry;
import com.devpipeline.orchestrator.gate.impl.CodeChangesGate;
import com.devpipeline.orchestrator.gate.impl.DocsSyncedGate;
import com.devpipeline.orchestrator.gate.impl.PlanStepsGate;
import com.devpipeline.orchestrator.gate.impl.ResearchFindingsGate;
import com.devpipeline.orchestrator.gate.impl.ReviewApprovalGate;
import com.devpipeline.orchestrator.gate.impl.SecurityClearanceGate;
import com.devpipeline.orchestrator.gate.impl.TestsWrittenGate;
import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.ArtifactStatus;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.policy.PolicyEvaluator;
import com.devpipeline.orchestrator.policy.PolicySource;
import com.devpipeline.orchestrator.publish.PublishCollaborator;
import com.devpipeline.orchestrator.publish.PublishException;
import com.devpipeline.orchestrator.publish.PublishResult;
import com.devpipeline.orchestrator.publish.PublishService;
import com.devpipeline.orchestrator.stage.StageDefinition;
import com.devpipeline.orchestrator.stage.StageRegistry;
import com.devpipeline.orchestrator.support.InMemoryArtifactStore;
import com.devpipeline.orchestrator.support.InMemoryWorkflowStore;
import com.devpipeline.orchestrator.support.Payloads;
import com.devpipeline.orchestrator.support.ScriptedStageWorker;
import com.devpipeline.orchestrator.worker.ReasoningServiceException;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import com.devpipeline.orchestrator.worker.StageWorkerRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the coordinator against the default seven-stage pipeline with scripted
 * workers, real quality gates and in-memory stores.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowCoordinatorTest {

    private static final String   WF_ID   = "20240501-120000-0000abcd";
    private static final String   REQUEST = "fix a typo in a comment";
    private static final Duration IMPLEMENTATION_TIMEOUT = Duration.ofMillis(300);

    private static final List<String> STAGES = List.of(
            "research", "planning", "test-generation", "implementation",
            "review", "security-audit", "doc-sync");

    @TempDir
    Path tempDir;

    @Mock
    private PublishCollaborator publisher;

    private final InMemoryArtifactStore            artifacts = new InMemoryArtifactStore();
    private final InMemoryWorkflowStore            workflows = new InMemoryWorkflowStore();
    private final Map<String, ScriptedStageWorker> workers   = new LinkedHashMap<>();

    private ExecutorService stageExecutor;
    private ExecutorService workerExecutor;
    private Path            policyFile;
    private WorkflowCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        STAGES.forEach(name -> workers.put(name, new ScriptedStageWorker(name)));
        stageExecutor  = Executors.newCachedThreadPool();
        workerExecutor = Executors.newCachedThreadPool();
        policyFile     = tempDir.resolve("POLICY.md");

        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        QualityGateRegistry gates = new QualityGateRegistry(List.of(
                new ResearchFindingsGate(), new PlanStepsGate(), new TestsWrittenGate(),
                new CodeChangesGate(), new ReviewApprovalGate(), new SecurityClearanceGate(),
                new DocsSyncedGate()), meters);
        StageWorkerRegistry workerRegistry = new StageWorkerRegistry(new ArrayList<StageWorker>(workers.values()));
        StageRegistry registry = new StageRegistry(definitions(), gates::contains, workerRegistry::contains);

        StageInvoker invoker = new StageInvoker(workerRegistry, gates, workflows,
                new RetryPolicy(3, Duration.ZERO, Duration.ZERO), workerExecutor, meters);
        PublishService publishService = new PublishService(publisher, artifacts, workflows, Payloads.JSON, true);

        coordinator = new WorkflowCoordinator(registry, artifacts, workflows,
                new PolicySource(policyFile), new PolicyEvaluator(0.8), invoker, publishService,
                stageExecutor, Payloads.JSON);

        lenient().when(publisher.publish(any(), anyList()))
                .thenReturn(new PublishResult("c0ffee1", null, List.of("commit", "push", "pr-create")));
    }

    @AfterEach
    void tearDown() {
        stageExecutor.shutdownNow();
        workerExecutor.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_allStagesPass_completesAndPublishes() throws Exception {
        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(result.getStatus().exitCode()).isZero();
        assertThat(result.getCurrentStage()).isNull();
        assertThat(stageNames()).containsExactlyInAnyOrder(
                "alignment", "research", "planning", "test-generation", "implementation",
                "review", "security-audit", "doc-sync", "publish");
        assertThat(artifacts.list(WF_ID)).allMatch(Artifact::isCompleted);
        STAGES.forEach(name -> assertThat(workers.get(name).invocations()).as(name).isEqualTo(1));

        List<EventType> types = workflows.eventTypes(WF_ID);
        assertThat(types.get(0)).isEqualTo(EventType.WORKFLOW_STARTED);
        assertThat(types).contains(EventType.ALIGNMENT_EVALUATED, EventType.WORKFLOW_COMPLETED, EventType.FILE_CHANGED);
        assertThat(eventsOf(EventType.ACTION_RECORDED)).extracting(ExecutionEvent::getDetail)
                .containsExactly("commit", "push", "pr-create");
        assertThat(eventsOf(EventType.STAGE_COMPLETED)).hasSize(7);
        verify(publisher).publish(any(), anyList());
    }

    @Test
    void run_passesRequiredInputsToWorkers() {
        coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(workers.get("planning").lastInput().artifacts()).containsOnlyKeys("research");
        assertThat(workers.get("implementation").lastInput().artifacts())
                .containsOnlyKeys("planning", "test-generation");
        assertThat(workers.get("research").lastInput().request()).isEqualTo(REQUEST);
    }

    @Test
    void resume_completedWorkflow_isNoOp() throws Exception {
        coordinator.run(new RunContext(WF_ID), REQUEST, "standard");
        int eventsBefore = workflows.events(WF_ID).size();

        Workflow again = coordinator.resume(new RunContext(WF_ID));

        assertThat(again.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(workflows.events(WF_ID)).hasSize(eventsBefore);
        assertThat(workers.get("research").invocations()).isEqualTo(1);
        verify(publisher, times(1)).publish(any(), anyList());
    }

    // ------------------------------------------------------------------
    // Alignment
    // ------------------------------------------------------------------

    @Test
    void run_requestInExcludedScope_blocksBeforeAnyStage() throws Exception {
        writePolicy("""
                ## GOALS
                - Reliable stage orchestration
                ## SCOPE
                ### Out of Scope
                - Payment processing
                """);

        Workflow result = coordinator.run(new RunContext(WF_ID), "add a payment processor integration", "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.BLOCKED);
        assertThat(result.getStatus().exitCode()).isEqualTo(1);
        assertThat(result.getReason()).isEqualTo("policy rejected: scope-out: Payment processing");
        assertThat(stageNames()).containsExactly("alignment");
        assertThat(workers.get("research").invocations()).isZero();
        assertThat(workflows.eventTypes(WF_ID)).containsExactly(
                EventType.WORKFLOW_STARTED, EventType.ALIGNMENT_EVALUATED, EventType.WORKFLOW_BLOCKED);
        verify(publisher, never()).publish(any(), anyList());
    }

    @Test
    void run_unparsablePolicy_failsOpen() throws Exception {
        writePolicy("Just some prose without any recognised heading.\n");

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        JsonNode alignment = payload("alignment");
        assertThat(alignment.path("aligned").asBoolean()).isTrue();
        assertThat(alignment.path("reasoning").asText()).contains("unparsable");
    }

    @Test
    void run_policySkipsStageWithoutDependents_onlyThatStageIsSkipped() throws Exception {
        writePolicy("""
                ## GOALS
                - Reliable stage orchestration
                ## PIPELINE
                - skip: doc-sync
                - skip: planning
                """);

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(workers.get("doc-sync").invocations()).isZero();
        assertThat(workers.get("planning").invocations()).isEqualTo(1);
        assertThat(stageNames()).doesNotContain("doc-sync");
        assertThat(eventsOf(EventType.STAGE_SKIPPED)).extracting(ExecutionEvent::getStageName)
                .containsExactly("doc-sync");
        assertThat(payload("alignment").path("skip_stages").toString()).isEqualTo("[\"doc-sync\"]");
    }

    // ------------------------------------------------------------------
    // Retries and failures
    // ------------------------------------------------------------------

    @Test
    void run_twoTimeoutsThenSuccess_completesOnThirdAttempt() {
        workers.get("implementation").thenHang().thenHang();

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(artifacts.get(WF_ID, "implementation")).get()
                .extracting(Artifact::getAttempts).isEqualTo(3);
        assertThat(eventsOf(EventType.STAGE_RETRIED)).hasSize(2)
                .allMatch(e -> e.getDetail().endsWith(": timeout"));
    }

    @Test
    void run_timeoutOnEveryAttempt_failsAfterRetryBound() {
        workers.get("implementation").thenHang().thenHang().thenHang();

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.getStatus().exitCode()).isEqualTo(2);
        assertThat(result.getReason()).isEqualTo("stage 'implementation' failed: timeout");
        assertThat(workers.get("implementation").invocations()).isEqualTo(3);
        Artifact failed = artifacts.get(WF_ID, "implementation").orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(ArtifactStatus.FAILED);
        assertThat(failed.getReason()).isEqualTo("timeout");
        assertThat(eventsOf(EventType.STAGE_RETRIED)).hasSize(2);
        assertThat(workers.get("review").invocations()).isZero();
    }

    @Test
    void run_transientWorkerError_isRetried() {
        workers.get("research").then(input -> {
            throw new ReasoningServiceException("reasoning service busy", 503);
        });

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(artifacts.get(WF_ID, "research").orElseThrow().getAttempts()).isEqualTo(2);
        assertThat(eventsOf(EventType.STAGE_RETRIED)).singleElement()
                .extracting(ExecutionEvent::getDetail).asString().startsWith("attempt 1: transient");
    }

    @Test
    void run_envelopeSchemaMismatch_failsWithoutRetry() {
        workers.get("implementation").then(input -> {
            ObjectNode payload = Payloads.passing("implementation");
            payload.put("schema_version", "2.0");
            return StageOutput.of(payload);
        });

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.getCurrentStage()).isEqualTo("implementation");
        assertThat(workers.get("implementation").invocations()).isEqualTo(1);
        assertThat(artifacts.get(WF_ID, "implementation").orElseThrow().getReason()).startsWith("validation");
        assertThat(eventsOf(EventType.STAGE_RETRIED)).isEmpty();
    }

    @Test
    void run_malformedWorkerBody_failsAsValidationWithoutRetry() {
        workers.get("implementation").then(input -> {
            throw ReasoningServiceException.malformedResponse(
                    "Stage 'implementation' returned malformed JSON: x", 200, null);
        });

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(workers.get("implementation").invocations()).isEqualTo(1);
        assertThat(artifacts.get(WF_ID, "implementation").orElseThrow().getReason())
                .isEqualTo("validation: Stage 'implementation' returned malformed JSON: x");
        assertThat(eventsOf(EventType.STAGE_RETRIED)).isEmpty();
    }

    @Test
    void run_securityGateFails_siblingsStillComplete() {
        workers.get("security-audit").then(input -> {
            ObjectNode payload = Payloads.passing("security-audit");
            payload.putArray("vulnerabilities").addObject().put("severity", "critical").put("id", "CVE-1");
            return StageOutput.of(payload);
        });

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.getReason()).isEqualTo(
                "stage 'security-audit' failed: quality-gate: 1 critical/high vulnerabilities");
        assertThat(result.getCurrentStage()).isEqualTo("validation");
        assertThat(artifacts.get(WF_ID, "review").orElseThrow().isCompleted()).isTrue();
        assertThat(artifacts.get(WF_ID, "doc-sync").orElseThrow().isCompleted()).isTrue();
        assertThat(artifacts.get(WF_ID, "security-audit").orElseThrow().isCompleted()).isFalse();
        assertThat(stageNames()).doesNotContain("publish");
    }

    @Test
    void resume_failedStage_requiresRerun() {
        workers.get("security-audit").then(input -> StageOutput.of(Payloads.passing("security-audit")
                .put("passed", false)));
        coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        Workflow again = coordinator.resume(new RunContext(WF_ID));

        assertThat(again.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(again.getReason()).endsWith("(rerun required)");
        assertThat(workers.get("security-audit").invocations()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Resume after interruption
    // ------------------------------------------------------------------

    @Test
    void resume_afterStoreOutage_reproducesUninterruptedRun() {
        artifacts.failNextPut("implementation");

        Workflow interrupted = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");
        assertThat(interrupted.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(interrupted.getCurrentStage()).isEqualTo("implementation");

        Workflow resumed = coordinator.resume(new RunContext(WF_ID));

        assertThat(resumed.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(stageNames()).containsExactlyInAnyOrder(
                "alignment", "research", "planning", "test-generation", "implementation",
                "review", "security-audit", "doc-sync", "publish");
        assertThat(artifacts.list(WF_ID)).allMatch(Artifact::isCompleted);
        assertThat(workers.get("research").invocations()).isEqualTo(1);
        assertThat(workers.get("test-generation").invocations()).isEqualTo(1);
        assertThat(workers.get("implementation").invocations()).isEqualTo(2);
        assertThat(eventsOf(EventType.WORKFLOW_STARTED)).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Rerun
    // ------------------------------------------------------------------

    @Test
    void rerun_failedStage_supersedesAndCompletes() {
        workers.get("security-audit").then(input -> StageOutput.of(Payloads.passing("security-audit")
                .put("passed", false)));
        coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        Workflow result = coordinator.rerun(new RunContext(WF_ID), "security-audit");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(result.getReason()).isNull();
        assertThat(workers.get("security-audit").invocations()).isEqualTo(2);
        assertThat(workers.get("review").invocations()).isEqualTo(1);
        assertThat(eventsOf(EventType.STAGE_SUPERSEDED)).singleElement()
                .extracting(ExecutionEvent::getDetail).isEqualTo("quality-gate: security audit did not pass");
        assertThat(artifacts.allRows()).filteredOn(a -> a.getStageName().equals("security-audit"))
                .extracting(Artifact::isSuperseded).containsExactly(true, false);
    }

    @Test
    void rerun_rejectsCompletedStageUnknownStageAndNonFailedWorkflow() {
        workers.get("security-audit").then(input -> StageOutput.of(Payloads.passing("security-audit")
                .put("passed", false)));
        coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThatThrownBy(() -> coordinator.prepareRerun(WF_ID, "review"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already completed");
        assertThatThrownBy(() -> coordinator.prepareRerun(WF_ID, "deploy"))
                .isInstanceOf(IllegalArgumentException.class);

        coordinator.rerun(new RunContext(WF_ID), "security-audit");
        assertThatThrownBy(() -> coordinator.prepareRerun(WF_ID, "security-audit"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("only FAILED");
    }

    // ------------------------------------------------------------------
    // Cancellation and publishing
    // ------------------------------------------------------------------

    @Test
    void cancel_duringHangingStage_failsWithoutArtifact() throws Exception {
        workers.get("research").then(input -> {
            Thread.sleep(60_000);
            return StageOutput.of(Payloads.passing("research"));
        });
        RunContext ctx = new RunContext(WF_ID);
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Workflow> run = CompletableFuture.supplyAsync(
                    () -> coordinator.run(ctx, REQUEST, "standard"), runner);
            awaitTrue(() -> workers.get("research").invocations() == 1);

            ctx.cancel();
            Workflow result = run.get(5, TimeUnit.SECONDS);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.getReason()).isEqualTo(WorkflowCoordinator.CANCELLED_REASON);
            assertThat(artifacts.get(WF_ID, "research")).isEmpty();
            assertThat(workflows.eventTypes(WF_ID)).contains(EventType.WORKFLOW_CANCELLED);
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    void shutdownInterrupt_duringHangingStage_leavesWorkflowRunningForResume() throws Exception {
        workers.get("research").thenHang();
        ExecutorService runner = Executors.newSingleThreadExecutor();
        Workflow result;
        try {
            CompletableFuture<Workflow> run = CompletableFuture.supplyAsync(
                    () -> coordinator.run(new RunContext(WF_ID), REQUEST, "standard"), runner);
            awaitTrue(() -> workers.get("research").invocations() == 1);

            runner.shutdownNow();
            result = run.get(5, TimeUnit.SECONDS);
        } finally {
            runner.shutdownNow();
        }

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(result.getReason()).isNull();
        assertThat(workflows.get(WF_ID).getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(artifacts.get(WF_ID, "research")).isEmpty();
        assertThat(workflows.eventTypes(WF_ID)).containsExactly(
                EventType.WORKFLOW_STARTED, EventType.ALIGNMENT_EVALUATED, EventType.STAGE_STARTED);

        Workflow resumed = coordinator.resume(new RunContext(WF_ID));

        assertThat(resumed.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(workers.get("research").invocations()).isEqualTo(2);
    }

    @Test
    void run_publishFailure_keepsWorkflowCompleted() throws Exception {
        when(publisher.publish(any(), anyList())).thenThrow(new PublishException("remote rejected push"));

        Workflow result = coordinator.run(new RunContext(WF_ID), REQUEST, "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(stageNames()).doesNotContain("publish");
        assertThat(eventsOf(EventType.PUBLISH_FAILED)).singleElement()
                .extracting(ExecutionEvent::getDetail).isEqualTo("remote rejected push");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<StageDefinition> definitions() {
        return List.of(
                stage("research",        1, Set.of(),                                   null,         "research_findings"),
                stage("planning",        2, Set.of("research"),                         null,         "plan_steps"),
                stage("test-generation", 3, Set.of("planning"),                         null,         "tests_written"),
                stage("implementation",  4, Set.of("planning", "test-generation"),      null,         "code_changes"),
                stage("review",          5, Set.of("implementation"),                   "validation", "review_approval"),
                stage("security-audit",  5, Set.of("implementation"),                   "validation", "security_clearance"),
                stage("doc-sync",        5, Set.of("implementation"),                   "validation", "docs_synced"));
    }

    private static StageDefinition stage(String name, int order, Set<String> requires, String group, String gate) {
        Duration timeout = name.equals("implementation") ? IMPLEMENTATION_TIMEOUT : Duration.ofSeconds(10);
        return new StageDefinition(name, order, requires, "1.0", timeout, group, gate);
    }

    private void writePolicy(String markdown) throws Exception {
        Files.writeString(policyFile, markdown);
    }

    private List<String> stageNames() {
        return artifacts.list(WF_ID).stream().map(Artifact::getStageName).toList();
    }

    private List<ExecutionEvent> eventsOf(EventType type) {
        return workflows.events(WF_ID).stream().filter(e -> e.getType() == type).toList();
    }

    private JsonNode payload(String stage) throws Exception {
        return Payloads.JSON.readTree(artifacts.get(WF_ID, stage).orElseThrow().getPayload());
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
