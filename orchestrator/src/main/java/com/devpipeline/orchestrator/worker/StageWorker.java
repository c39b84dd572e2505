package com.devpipeline.orchestrator.worker;

/**
 * Performs the work of one named stage.
 *
 * Implementations must honour thread interruption: the coordinator cancels an
 * invocation that outlives its deadline by interrupting the calling thread.
 * Transient failures should surface as {@link ReasoningServiceException} with
 * {@link ReasoningServiceException#isTransient()} set, or as a
 * {@code StageException} of kind TRANSIENT.
 */
public interface StageWorker {

    /** Name of the stage this worker serves. */
    String stageName();

    StageOutput invoke(StageInput input) throws InterruptedException;
}
