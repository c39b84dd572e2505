package com.devpipeline.orchestrator.service;

import com.devpipeline.orchestrator.gate.GateResult;
import com.devpipeline.orchestrator.gate.QualityGateRegistry;
import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.stage.StageDefinition;
import com.devpipeline.orchestrator.store.WorkflowStore;
import com.devpipeline.orchestrator.worker.ReasoningServiceException;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import com.devpipeline.orchestrator.worker.StageWorkerRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage to a final outcome: worker call under a deadline, retries of
 * transient failures, envelope validation and the quality gate.
 *
 * Returns an unsaved artifact (completed or failed); persisting it is the
 * coordinator's job. A cancelled or interrupted run yields no artifact at all.
 *
 * Metrics:
 * <pre>
 *   devpipeline.stage.duration{stage, outcome}
 *   devpipeline.stage.outcomes{stage, outcome="completed|failed|cancelled|interrupted"}
 * </pre>
 */
@Component
public class StageInvoker {

    private static final Logger log = LoggerFactory.getLogger(StageInvoker.class);

    private final StageWorkerRegistry workers;
    private final QualityGateRegistry gates;
    private final WorkflowStore       workflowStore;
    private final RetryPolicy         retryPolicy;
    private final ExecutorService     workerExecutor;
    private final MeterRegistry       meterRegistry;

    public StageInvoker(StageWorkerRegistry workers,
                        QualityGateRegistry gates,
                        WorkflowStore workflowStore,
                        RetryPolicy retryPolicy,
                        @Qualifier("workerExecutor") ExecutorService workerExecutor,
                        MeterRegistry meterRegistry) {
        this.workers        = workers;
        this.gates          = gates;
        this.workflowStore  = workflowStore;
        this.retryPolicy    = retryPolicy;
        this.workerExecutor = workerExecutor;
        this.meterRegistry  = meterRegistry;
    }

    /**
     * @param inputs completed artifacts of the stage's required inputs
     * @return the stage's artifact, not yet stored
     * @throws StageException of kind CANCELLED if the run was cancelled, or
     *                        INTERRUPTED if the thread was interrupted otherwise
     */
    public Artifact invoke(RunContext ctx, StageDefinition stage, String request, Map<String, Artifact> inputs) {
        StageWorker worker = workers.get(stage.name());
        StageInput  input  = new StageInput(ctx.workflowId(), stage.name(), request, inputs);
        Timer.Sample sample = Timer.start(meterRegistry);

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                ctx.throwIfCancelled();
                StageOutput output = callWorker(ctx, worker, input, stage.timeout());
                Artifact artifact = judge(ctx.workflowId(), stage, output, attempt);
                finish(sample, stage, artifact.isCompleted() ? "completed" : "failed");
                return artifact;
            } catch (StageException e) {
                if (e.stopsRun()) {
                    finish(sample, stage, e.getKind() == StageException.Kind.CANCELLED ? "cancelled" : "interrupted");
                    throw e;
                }
                if (!e.isRetryable() || !retryPolicy.canRetryAfter(attempt)) {
                    log.warn("Stage '{}' failed after {} attempt(s): {}", stage.name(), attempt, e.reason());
                    finish(sample, stage, "failed");
                    return Artifact.failed(ctx.workflowId(), stage.name(), stage.outputSchemaVersion(),
                            null, e.reason(), attempt);
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                log.info("Stage '{}' attempt {} failed ({}); retrying in {} ms",
                        stage.name(), attempt, e.reason(), delay.toMillis());
                workflowStore.appendEvent(ctx.workflowId(), EventType.STAGE_RETRIED, stage.name(),
                        "attempt " + attempt + ": " + e.reason());
                boolean cancelled;
                try {
                    cancelled = ctx.awaitCancellation(delay);
                } catch (StageException interrupted) {
                    finish(sample, stage, "interrupted");
                    throw interrupted;
                }
                if (cancelled) {
                    finish(sample, stage, "cancelled");
                    throw new StageException(StageException.Kind.CANCELLED, "workflow cancelled");
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private StageOutput callWorker(RunContext ctx, StageWorker worker, StageInput input, Duration timeout) {
        Future<StageOutput> future = workerExecutor.submit(() -> worker.invoke(input));
        ctx.register(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageException(StageException.Kind.TIMEOUT, "no result within " + timeout);
        } catch (CancellationException e) {
            throw ctx.interruption("worker call cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ctx.interruption("interrupted while waiting for the worker", e);
        } catch (ExecutionException e) {
            throw classify(ctx, e.getCause());
        } finally {
            ctx.unregister(future);
        }
    }

    private static StageException classify(RunContext ctx, Throwable cause) {
        if (cause instanceof StageException) {
            return (StageException) cause;
        }
        if (cause instanceof ReasoningServiceException) {
            ReasoningServiceException rse = (ReasoningServiceException) cause;
            if (rse.isMalformedResponse()) {
                return new StageException(StageException.Kind.VALIDATION, rse.getMessage(), rse);
            }
            return new StageException(rse.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.WORKER_ERROR,
                    rse.getMessage(), rse);
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return new StageException(StageException.Kind.TRANSIENT, String.valueOf(cause.getMessage()), cause);
        }
        if (cause instanceof InterruptedException) {
            return ctx.interruption("worker interrupted", cause);
        }
        return new StageException(StageException.Kind.WORKER_ERROR,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    /** Envelope, then the worker's own verdict, then the quality gate. Never retried. */
    private Artifact judge(String workflowId, StageDefinition stage, StageOutput output, int attempt) {
        JsonNode payload = output.payload();
        String version = stage.outputSchemaVersion();
        try {
            EnvelopeValidator.validate(payload, version);
        } catch (StageException e) {
            log.error("Stage '{}' violated its output contract: {}", stage.name(), e.reason());
            return Artifact.failed(workflowId, stage.name(), version, jsonOrNull(payload), e.reason(), attempt);
        }
        if (output.reportsFailure()) {
            String why = payload.path("error").asText("worker reported status failed");
            return Artifact.failed(workflowId, stage.name(), version, payload.toString(),
                    new StageException(StageException.Kind.WORKER_ERROR, why).reason(), attempt);
        }
        if (stage.qualityGate() != null) {
            GateResult gate = gates.evaluate(stage.qualityGate(), payload);
            if (!gate.passed()) {
                log.info("Stage '{}' rejected by gate '{}': {}", stage.name(), stage.qualityGate(), gate.reason());
                return Artifact.failed(workflowId, stage.name(), version, payload.toString(),
                        new StageException(StageException.Kind.QUALITY_GATE, gate.reason()).reason(), attempt);
            }
        }
        return Artifact.completed(workflowId, stage.name(), version, payload.toString(), attempt);
    }

    private static String jsonOrNull(JsonNode payload) {
        return payload != null && payload.isObject() ? payload.toString() : null;
    }

    private void finish(Timer.Sample sample, StageDefinition stage, String outcome) {
        sample.stop(meterRegistry.timer("devpipeline.stage.duration", "stage", stage.name(), "outcome", outcome));
        meterRegistry.counter("devpipeline.stage.outcomes", "stage", stage.name(), "outcome", outcome).increment();
    }
}
