package com.devpipeline.orchestrator.store;

public class BatchNotFoundException extends RuntimeException {
    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
    }
}
