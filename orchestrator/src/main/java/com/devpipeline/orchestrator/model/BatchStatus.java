package com.devpipeline.orchestrator.model;

/**
 * Lifecycle of a Batch.
 *
 * Transitions:
 *   RUNNING → COMPLETED   (every request ran to a terminal workflow status)
 *   RUNNING → HALTED      (consecutive-failure breaker tripped, or an internal error)
 *   RUNNING → CANCELLED   (user abort)
 *   HALTED  → RUNNING     (explicit resume; the failure count starts over)
 *
 * COMPLETED and CANCELLED are final.
 */
public enum BatchStatus {
    RUNNING,
    COMPLETED,
    HALTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
