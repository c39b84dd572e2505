package com.devpipeline.orchestrator.model;

/**
 * Lifecycle of a Workflow.
 *
 * Transitions:
 *   PENDING → RUNNING                 (coordinator picked it up)
 *   RUNNING → BLOCKED                 (policy rejected the request, no stage ran)
 *   RUNNING → COMPLETED               (every declared stage has a completed artifact)
 *   RUNNING → FAILED                  (stage failure, missing input, or user abort)
 *   FAILED  → RUNNING                 (resume after abort, or explicit stage rerun)
 *
 * BLOCKED and COMPLETED are final.
 */
public enum WorkflowStatus {
    PENDING,
    RUNNING,
    BLOCKED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == BLOCKED || this == COMPLETED || this == FAILED;
    }

    /**
     * Process exit code reported to automation callers.
     * Null while the workflow has not reached a terminal state.
     */
    public Integer exitCode() {
        return switch (this) {
            case COMPLETED -> 0;
            case BLOCKED   -> 1;
            case FAILED    -> 2;
            case PENDING, RUNNING -> null;
        };
    }
}
