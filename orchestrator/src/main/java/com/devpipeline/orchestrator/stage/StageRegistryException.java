package com.devpipeline.orchestrator.stage;

/** The configured stage list does not form a valid pipeline. Fatal at startup. */
public class StageRegistryException extends RuntimeException {

    public StageRegistryException(String message) {
        super(message);
    }
}
