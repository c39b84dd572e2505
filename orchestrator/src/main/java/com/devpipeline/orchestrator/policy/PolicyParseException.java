package com.devpipeline.orchestrator.policy;

/**
 * The policy document exists but cannot be read or contains none of the
 * recognised sections.
 */
public class PolicyParseException extends RuntimeException {

    public PolicyParseException(String message) {
        super(message);
    }

    public PolicyParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
