package com.devpipeline.orchestrator.service;

import java.util.Locale;

/**
 * Failure of a single stage invocation.
 *
 * Only TIMEOUT and TRANSIENT are retried. VALIDATION means the worker broke
 * its output contract; QUALITY_GATE means the output was well formed but not
 * good enough. Neither improves by asking again.
 *
 * CANCELLED is a user abort of the run. INTERRUPTED is any other interrupt of
 * the running thread, typically the process shutting down; the workflow is
 * left as it is so it can be resumed.
 */
public class StageException extends RuntimeException {

    public enum Kind { TIMEOUT, TRANSIENT, VALIDATION, QUALITY_GATE, WORKER_ERROR, CANCELLED, INTERRUPTED }

    private final Kind   kind;
    private final String detail;

    public StageException(Kind kind, String detail) {
        super("[" + kind + "] " + detail);
        this.kind   = kind;
        this.detail = detail;
    }

    public StageException(Kind kind, String detail, Throwable cause) {
        super("[" + kind + "] " + detail, cause);
        this.kind   = kind;
        this.detail = detail;
    }

    public Kind getKind() { return kind; }

    /** The run must stop now: cancelled by the user or interrupted by shutdown. */
    public boolean stopsRun() {
        return kind == Kind.CANCELLED || kind == Kind.INTERRUPTED;
    }

    public boolean isRetryable() {
        return kind == Kind.TIMEOUT || kind == Kind.TRANSIENT;
    }

    /** Short form stored as the artifact reason, e.g. "timeout" or "validation: missing producer". */
    public String reason() {
        String prefix = kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
        if (kind == Kind.TIMEOUT || kind == Kind.CANCELLED || kind == Kind.INTERRUPTED || detail == null || detail.isBlank()) {
            return prefix;
        }
        return prefix + ": " + detail;
    }
}
