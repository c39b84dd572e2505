package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.store.WorkflowNotFoundException;
import com.devpipeline.orchestrator.support.InMemoryArtifactStore;
import com.devpipeline.orchestrator.support.InMemoryWorkflowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    @Mock
    private WorkflowCoordinator coordinator;

    private final InMemoryWorkflowStore workflows = new InMemoryWorkflowStore();
    private final InMemoryArtifactStore artifacts = new InMemoryArtifactStore();
    private final List<Runnable>        queued    = new ArrayList<>();

    private WorkflowService service;

    @BeforeEach
    void setUp() {
        Executor queueing = queued::add;
        service = new WorkflowService(coordinator, workflows, artifacts, queueing);
    }

    private void drainQueue() {
        List<Runnable> batch = new ArrayList<>(queued);
        queued.clear();
        batch.forEach(Runnable::run);
    }

    private Workflow existing(String id, WorkflowStatus status) {
        Workflow workflow = workflows.create(id, "fix a typo in a comment", "standard");
        workflow.setStatus(status);
        return workflows.save(workflow);
    }

    // ------------------------------------------------------------------
    // start
    // ------------------------------------------------------------------

    @Test
    void start_createsPendingWorkflowAndRunsItInBackground() {
        when(coordinator.run(any(), anyString(), anyString()))
                .thenAnswer(inv -> workflows.get(inv.<RunContext>getArgument(0).workflowId()));

        Workflow created = service.start("  fix a typo in a comment  ", null);

        assertThat(created.getStatus()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(created.getRequest()).isEqualTo("fix a typo in a comment");
        assertThat(created.getMode()).isEqualTo(Workflow.DEFAULT_MODE);
        assertThat(created.getId()).matches("\\d{8}-\\d{6}-[0-9a-f]{8}");
        assertThat(service.isActive(created.getId())).isTrue();

        drainQueue();

        ArgumentCaptor<RunContext> ctx = ArgumentCaptor.forClass(RunContext.class);
        verify(coordinator).run(ctx.capture(), eq("fix a typo in a comment"), eq("standard"));
        assertThat(ctx.getValue().workflowId()).isEqualTo(created.getId());
        assertThat(service.isActive(created.getId())).isFalse();
    }

    @Test
    void start_blankRequest_rejected() {
        assertThatThrownBy(() -> service.start("   ", "standard"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void start_coordinatorThrows_workflowMarkedFailed() {
        when(coordinator.run(any(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        Workflow created = service.start("fix a typo", "standard");
        drainQueue();

        Workflow after = service.status(created.getId());
        assertThat(after.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(after.getReason()).isEqualTo("internal error: boom");
        assertThat(workflows.eventTypes(created.getId())).containsExactly(EventType.WORKFLOW_FAILED);
        assertThat(service.isActive(created.getId())).isFalse();
    }

    @Test
    void start_poolRejects_conflictAndNotActive() {
        service = new WorkflowService(coordinator, workflows, artifacts, r -> {
            throw new RejectedExecutionException("shutting down");
        });

        assertThatThrownBy(() -> service.start("fix a typo", "standard"))
                .isInstanceOf(IllegalStateException.class);
        List<Workflow> pending = workflows.findStale(WorkflowStatus.PENDING, Instant.now().plusSeconds(1));
        assertThat(pending).hasSize(1);
        assertThat(service.isActive(pending.get(0).getId())).isFalse();
    }

    // ------------------------------------------------------------------
    // resume / rerun
    // ------------------------------------------------------------------

    @Test
    void resume_activeWorkflow_rejected() {
        existing("wf-1", WorkflowStatus.FAILED);

        service.resume("wf-1");

        assertThatThrownBy(() -> service.resume("wf-1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
        assertThat(queued).hasSize(1);
    }

    @Test
    void resume_completedWorkflow_notSubmitted() {
        existing("wf-1", WorkflowStatus.COMPLETED);

        Workflow result = service.resume("wf-1");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(queued).isEmpty();
        assertThat(service.isActive("wf-1")).isFalse();
    }

    @Test
    void rerun_prepareFails_releasesReservation() {
        existing("wf-1", WorkflowStatus.FAILED);
        doThrow(new IllegalStateException("Stage 'review' already completed"))
                .when(coordinator).prepareRerun("wf-1", "review");

        assertThatThrownBy(() -> service.rerun("wf-1", "review"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(service.isActive("wf-1")).isFalse();
        assertThat(queued).isEmpty();
    }

    @Test
    void rerun_preparedStage_resumesInBackground() {
        existing("wf-1", WorkflowStatus.FAILED);
        when(coordinator.resume(any())).thenAnswer(inv -> workflows.get("wf-1"));

        service.rerun("wf-1", "security-audit");
        drainQueue();

        verify(coordinator).prepareRerun("wf-1", "security-audit");
        verify(coordinator).resume(any());
    }

    // ------------------------------------------------------------------
    // cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_activeRun_signalsItsContext() {
        AtomicBoolean sawCancel = new AtomicBoolean();
        when(coordinator.run(any(), anyString(), anyString())).thenAnswer(inv -> {
            RunContext ctx = inv.getArgument(0);
            sawCancel.set(ctx.isCancelled());
            return workflows.get(ctx.workflowId());
        });
        Workflow created = service.start("fix a typo", "standard");

        service.cancel(created.getId());
        drainQueue();

        assertThat(sawCancel).isTrue();
    }

    @Test
    void cancel_orphanedRunningWorkflow_markedCancelled() {
        existing("wf-1", WorkflowStatus.RUNNING);

        Workflow result = service.cancel("wf-1");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.getReason()).isEqualTo("cancelled");
        assertThat(workflows.eventTypes("wf-1")).containsExactly(EventType.WORKFLOW_CANCELLED);
    }

    @Test
    void cancel_terminalWorkflow_rejected() {
        existing("wf-1", WorkflowStatus.BLOCKED);

        assertThatThrownBy(() -> service.cancel("wf-1")).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // runInline
    // ------------------------------------------------------------------

    @Test
    void runInline_newWorkflow_runsOnCallingThreadAndReleases() {
        when(coordinator.run(any(), eq("add retries"), eq("standard"))).thenAnswer(inv -> {
            assertThat(service.isActive("wf-batch-1")).isTrue();
            Workflow created = workflows.create("wf-batch-1", "add retries", "standard");
            created.setStatus(WorkflowStatus.COMPLETED);
            return workflows.save(created);
        });

        Workflow result = service.runInline("wf-batch-1", "add retries", "standard");

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(queued).isEmpty();
        assertThat(service.isActive("wf-batch-1")).isFalse();
    }

    @Test
    void runInline_storedWorkflow_resumedInsteadOfRestarted() {
        Workflow stored = existing("wf-1", WorkflowStatus.RUNNING);
        when(coordinator.resume(any())).thenReturn(stored);

        service.runInline("wf-1", "fix a typo in a comment", "standard");

        verify(coordinator).resume(any());
        verify(coordinator, never()).run(any(), anyString(), anyString());
    }

    // ------------------------------------------------------------------
    // queries
    // ------------------------------------------------------------------

    @Test
    void queries_unknownWorkflow_notFound() {
        assertThatThrownBy(() -> service.status("nope")).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.artifacts("nope")).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.events("nope")).isInstanceOf(WorkflowNotFoundException.class);
    }
}
