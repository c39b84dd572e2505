package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.store.StoreException;
import com.devpipeline.orchestrator.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Resumes workflows orphaned by a process restart.
 *
 * A workflow still PENDING or RUNNING after 'stale-after' without an active
 * run in this process lost its thread; resuming it continues from the last
 * stored artifact.
 */
@Component
public class WorkflowRecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRecoveryScheduler.class);

    private final WorkflowStore   workflows;
    private final WorkflowService workflowService;
    private final Duration        staleAfter;

    public WorkflowRecoveryScheduler(WorkflowStore workflows,
                                     WorkflowService workflowService,
                                     @Value("${devpipeline.recovery.stale-after:PT5M}") Duration staleAfter) {
        this.workflows       = workflows;
        this.workflowService = workflowService;
        this.staleAfter      = staleAfter;
    }

    @Scheduled(fixedDelayString = "${devpipeline.recovery.interval-ms:60000}",
               initialDelayString = "${devpipeline.recovery.initial-delay-ms:10000}")
    public void sweep() {
        Instant cutoff = Instant.now().minus(staleAfter);
        try {
            recover(workflows.findStale(WorkflowStatus.RUNNING, cutoff));
            recover(workflows.findStale(WorkflowStatus.PENDING, cutoff));
        } catch (StoreException e) {
            log.error("Recovery sweep failed: {}", e.getMessage());
        }
    }

    private void recover(List<Workflow> stale) {
        for (Workflow workflow : stale) {
            if (workflowService.isActive(workflow.getId())) {
                continue;
            }
            log.info("Resuming orphaned workflow {} (status {}, last update {})",
                    workflow.getId(), workflow.getStatus(), workflow.getUpdatedAt());
            try {
                workflowService.resume(workflow.getId());
            } catch (IllegalStateException e) {
                log.debug("Workflow {} picked up concurrently: {}", workflow.getId(), e.getMessage());
            }
        }
    }
}
