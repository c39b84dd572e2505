package com.devpipeline.orchestrator.service;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation handle for one workflow run.
 *
 * Stage invocations register their futures here; {@link #cancel()} interrupts
 * every one of them and wakes any retry backoff in progress.
 */
public class RunContext {

    private final String              workflowId;
    private final Set<Future<?>>      active    = ConcurrentHashMap.newKeySet();
    private final CountDownLatch      cancelled = new CountDownLatch(1);

    public RunContext(String workflowId) {
        this.workflowId = workflowId;
    }

    public String workflowId() {
        return workflowId;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void cancel() {
        cancelled.countDown();
        active.forEach(f -> f.cancel(true));
    }

    void register(Future<?> future) {
        active.add(future);
        // cancel() may have run between submit and register
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void unregister(Future<?> future) {
        active.remove(future);
    }

    /**
     * Wait for 'delay' or until the run is cancelled.
     *
     * @return true if the run was cancelled
     * @throws StageException of kind INTERRUPTED if the thread is interrupted
     *                        for any other reason; the interrupt flag is restored
     */
    boolean awaitCancellation(Duration delay) {
        try {
            return cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (isCancelled()) {
                return true;
            }
            throw new StageException(StageException.Kind.INTERRUPTED, "interrupted during retry backoff", e);
        }
    }

    /**
     * The stop an interrupt of the running thread stands for: CANCELLED when
     * {@link #cancel()} caused it, INTERRUPTED otherwise.
     */
    StageException interruption(String detail, Throwable cause) {
        return isCancelled()
                ? new StageException(StageException.Kind.CANCELLED, "workflow cancelled", cause)
                : new StageException(StageException.Kind.INTERRUPTED, detail, cause);
    }

    void throwIfCancelled() {
        if (isCancelled()) {
            throw new StageException(StageException.Kind.CANCELLED, "workflow cancelled");
        }
    }
}
