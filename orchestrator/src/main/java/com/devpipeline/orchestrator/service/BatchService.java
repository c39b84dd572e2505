package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.model.BatchItem;
import com.devpipeline.orchestrator.model.BatchStatus;
import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.store.BatchStore;
import com.devpipeline.orchestrator.store.StoreException;
import com.devpipeline.orchestrator.store.WorkflowStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an ordered list of requests, one workflow after another.
 *
 * Progress is stored after every item, so a batch stopped by a restart is
 * continued with {@link #resume}. After {@code failure-threshold} FAILED
 * workflows in a row the batch is HALTED instead of burning through the rest
 * of the list; BLOCKED workflows neither count nor reset the streak.
 *
 * Metrics:
 * <pre>
 *   devpipeline.batch.items{outcome="completed|blocked|failed"}
 *   devpipeline.batch.halts
 * </pre>
 */
@Service
public class BatchService {

    private static final Logger log = LoggerFactory.getLogger(BatchService.class);

    private final BatchStore      batches;
    private final WorkflowStore   workflows;
    private final WorkflowService workflowService;
    private final Executor        batchExecutor;
    private final MeterRegistry   meterRegistry;
    private final int             failureThreshold;
    private final int             maxRequests;

    // Batches with a runner in this process, and their cancel flags.
    private final Map<String, AtomicBoolean> active = new ConcurrentHashMap<>();

    public BatchService(BatchStore batches,
                        WorkflowStore workflows,
                        WorkflowService workflowService,
                        @Qualifier("batchExecutor") Executor batchExecutor,
                        MeterRegistry meterRegistry,
                        @Value("${devpipeline.batch.failure-threshold:5}") int failureThreshold,
                        @Value("${devpipeline.batch.max-requests:100}") int maxRequests) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failure-threshold must be at least 1");
        }
        this.batches          = batches;
        this.workflows        = workflows;
        this.workflowService  = workflowService;
        this.batchExecutor    = batchExecutor;
        this.meterRegistry    = meterRegistry;
        this.failureThreshold = failureThreshold;
        this.maxRequests      = maxRequests;
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Store the batch and start running it in the background.
     *
     * @throws IllegalArgumentException if the list is empty, too long, or holds a blank request
     */
    public Batch start(List<String> requests, String mode) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("requests must not be empty");
        }
        if (requests.size() > maxRequests) {
            throw new IllegalArgumentException(
                    "Too many requests: " + requests.size() + " provided, max " + maxRequests);
        }
        for (int i = 0; i < requests.size(); i++) {
            if (requests.get(i) == null || requests.get(i).isBlank()) {
                throw new IllegalArgumentException("request " + i + " is blank");
            }
        }
        Batch batch = batches.create("batch-" + WorkflowIds.next(), mode,
                requests.stream().map(String::trim).toList());
        log.info("Created batch {} with {} request(s)", batch.getId(), batch.getTotalItems());
        submit(batch.getId(), reserve(batch.getId()));
        return batch;
    }

    /**
     * Continue a HALTED batch, or a RUNNING one whose runner died with the
     * previous process. A HALTED batch starts with a fresh failure count.
     *
     * @throws IllegalStateException if the batch is COMPLETED, CANCELLED or running here
     */
    public Batch resume(String batchId) {
        Batch batch = batches.get(batchId);
        if (batch.getStatus().isTerminal()) {
            throw new IllegalStateException("Batch " + batchId + " is already " + batch.getStatus());
        }
        AtomicBoolean cancel = reserve(batchId);
        try {
            if (batch.getStatus() == BatchStatus.HALTED) {
                batch.setStatus(BatchStatus.RUNNING);
                batch.setConsecutiveFailures(0);
                batch.setReason(null);
                batch = batches.save(batch);
            }
        } catch (RuntimeException e) {
            active.remove(batchId, cancel);
            throw e;
        }
        log.info("Resuming batch {} at item {}", batchId, batch.getNextIndex());
        submit(batchId, cancel);
        return batch;
    }

    /**
     * Abort a batch. A running batch stops before its next item and the
     * workflow it is running now is cancelled; items already finished keep
     * their outcome.
     *
     * @throws IllegalStateException if the batch is already COMPLETED or CANCELLED
     */
    public Batch cancel(String batchId) {
        Batch batch = batches.get(batchId);
        AtomicBoolean flag = active.get(batchId);
        if (flag != null) {
            log.info("Cancelling batch {}", batchId);
            flag.set(true);
            currentWorkflow(batch).filter(workflowService::isActive).ifPresent(this::cancelWorkflow);
            return batch;
        }
        if (batch.getStatus().isTerminal()) {
            throw new IllegalStateException("Batch " + batchId + " is already " + batch.getStatus());
        }
        return markCancelled(batch);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Batch status(String batchId) {
        return batches.get(batchId);
    }

    public List<BatchItem> items(String batchId) {
        batches.get(batchId);
        return batches.items(batchId);
    }

    public boolean isActive(String batchId) {
        return active.containsKey(batchId);
    }

    // ------------------------------------------------------------------
    // Runner
    // ------------------------------------------------------------------

    /** Run the batch on the calling thread from its stored position. */
    void runBatch(String batchId, AtomicBoolean cancelRequested) {
        try {
            Batch batch = batches.get(batchId);
            List<BatchItem> items = batches.items(batchId);

            while (batch.getNextIndex() < items.size()) {
                if (cancelRequested.get()) {
                    markCancelled(batch);
                    return;
                }
                BatchItem item = items.get(batch.getNextIndex());
                Workflow result = runItem(batch, item);
                if (!result.getStatus().isTerminal()) {
                    if (Thread.currentThread().isInterrupted()) {
                        log.warn("Batch {} interrupted at item {}; left RUNNING for resumption",
                                batchId, item.getPosition());
                    } else {
                        halt(batch, "workflow " + result.getId() + " stopped in status " + result.getStatus());
                    }
                    return;
                }
                record(batch, item, result.getStatus());

                if (batch.getConsecutiveFailures() >= failureThreshold
                        && batch.getNextIndex() < items.size()
                        && !cancelRequested.get()) {
                    meterRegistry.counter("devpipeline.batch.halts").increment();
                    halt(batch, "circuit breaker: " + batch.getConsecutiveFailures() + " consecutive failed workflows");
                    return;
                }
            }

            batch.setStatus(BatchStatus.COMPLETED);
            batches.save(batch);
            log.info("Batch {} completed ({} item(s))", batchId, items.size());
        } catch (RuntimeException e) {
            log.error("Batch {} stopped by an unexpected error: {}", batchId, e.getMessage(), e);
            haltQuietly(batchId, "internal error: " + e.getMessage());
        }
    }

    /** The item's workflow after this run; an already finished workflow is not run again. */
    private Workflow runItem(Batch batch, BatchItem item) {
        if (item.getWorkflowId() != null) {
            Optional<Workflow> existing = workflows.find(item.getWorkflowId());
            if (existing.isPresent() && existing.get().getStatus().isTerminal()) {
                return existing.get();
            }
        } else {
            item.setWorkflowId(WorkflowIds.next());
            batches.saveItem(item);
        }
        log.info("Batch {} item {}: running workflow {}", batch.getId(), item.getPosition(), item.getWorkflowId());
        return workflowService.runInline(item.getWorkflowId(), item.getRequest(), batch.getMode());
    }

    private void record(Batch batch, BatchItem item, WorkflowStatus outcome) {
        item.setOutcome(outcome);
        batches.saveItem(item);
        meterRegistry.counter("devpipeline.batch.items", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();

        if (outcome == WorkflowStatus.FAILED) {
            batch.setConsecutiveFailures(batch.getConsecutiveFailures() + 1);
        } else if (outcome == WorkflowStatus.COMPLETED) {
            batch.setConsecutiveFailures(0);
        }
        batch.setNextIndex(batch.getNextIndex() + 1);
        batches.save(batch);
        log.info("Batch {} item {} ended {}", batch.getId(), item.getPosition(), outcome);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AtomicBoolean reserve(String batchId) {
        AtomicBoolean cancel = new AtomicBoolean();
        if (active.putIfAbsent(batchId, cancel) != null) {
            throw new IllegalStateException("Batch " + batchId + " is already running");
        }
        return cancel;
    }

    private void submit(String batchId, AtomicBoolean cancel) {
        try {
            batchExecutor.execute(() -> {
                try {
                    runBatch(batchId, cancel);
                } finally {
                    active.remove(batchId, cancel);
                }
            });
        } catch (RejectedExecutionException e) {
            active.remove(batchId, cancel);
            throw new IllegalStateException("Batch pool is not accepting work", e);
        }
    }

    private Optional<String> currentWorkflow(Batch batch) {
        List<BatchItem> items = batches.items(batch.getId());
        if (batch.getNextIndex() >= items.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(batch.getNextIndex()).getWorkflowId());
    }

    private void cancelWorkflow(String workflowId) {
        try {
            workflowService.cancel(workflowId);
        } catch (IllegalStateException e) {
            log.debug("Workflow {} finished before it could be cancelled: {}", workflowId, e.getMessage());
        }
    }

    private Batch markCancelled(Batch batch) {
        batch.setStatus(BatchStatus.CANCELLED);
        batch.setReason("cancelled");
        Batch saved = batches.save(batch);
        log.info("Batch {} cancelled at item {}", batch.getId(), batch.getNextIndex());
        return saved;
    }

    private void halt(Batch batch, String reason) {
        batch.setStatus(BatchStatus.HALTED);
        batch.setReason(reason);
        batches.save(batch);
        log.warn("Batch {} halted at item {}: {}", batch.getId(), batch.getNextIndex(), reason);
    }

    private void haltQuietly(String batchId, String reason) {
        try {
            Batch batch = batches.get(batchId);
            if (!batch.getStatus().isTerminal()) {
                halt(batch, reason);
            }
        } catch (StoreException e) {
            log.error("Could not record halt of batch {}: {}", batchId, e.getMessage());
        }
    }
}
