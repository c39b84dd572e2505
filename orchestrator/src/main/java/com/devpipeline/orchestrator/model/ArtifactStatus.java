package com.devpipeline.orchestrator.model;

/**
 * Outcome recorded on an artifact. There is no in-between state: an artifact
 * is written once, after the stage has finished one way or the other.
 */
public enum ArtifactStatus {
    COMPLETED,
    FAILED
}
