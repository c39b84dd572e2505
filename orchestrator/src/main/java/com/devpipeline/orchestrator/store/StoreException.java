package com.devpipeline.orchestrator.store;

/**
 * Thrown when the workflow or artifact store cannot complete a durable write
 * or read. The current stage attempt is abandoned; the workflow keeps its last
 * durable state and can be resumed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
