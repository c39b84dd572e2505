package com.devpipeline.orchestrator.publish;

/** The git service rejected the publish request or could not be reached. */
public class PublishException extends RuntimeException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
