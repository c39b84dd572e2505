package com.devpipeline.orchestrator.worker;

/**
 * Thrown when the reasoning service returns an error or is unreachable.
 *
 * {@code statusCode} is the HTTP status, or -1 when no response was received.
 * A 2xx response whose body could not be parsed is flagged as malformed.
 */
public class ReasoningServiceException extends RuntimeException {

    private final int     statusCode;
    private final boolean malformedResponse;

    public ReasoningServiceException(String message, int statusCode) {
        this(message, statusCode, false, null);
    }

    public ReasoningServiceException(String message, Throwable cause) {
        this(message, -1, false, cause);
    }

    private ReasoningServiceException(String message, int statusCode, boolean malformedResponse, Throwable cause) {
        super(message, cause);
        this.statusCode        = statusCode;
        this.malformedResponse = malformedResponse;
    }

    /** The service answered with a success status but the body is not a JSON document. */
    public static ReasoningServiceException malformedResponse(String message, int statusCode, Throwable cause) {
        return new ReasoningServiceException(message, statusCode, true, cause);
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isMalformedResponse() {
        return malformedResponse;
    }

    /** Connection failures, 5xx and 429 are worth retrying; other 4xx and malformed bodies are not. */
    public boolean isTransient() {
        return !malformedResponse && (statusCode == -1 || statusCode == 429 || statusCode >= 500);
    }
}
