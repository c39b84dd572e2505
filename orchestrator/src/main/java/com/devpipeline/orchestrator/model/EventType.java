package com.devpipeline.orchestrator.model;

/**
 * Kinds of compact records written to a workflow's execution log.
 */
public enum EventType {
    WORKFLOW_STARTED,
    ALIGNMENT_EVALUATED,
    WORKFLOW_BLOCKED,
    STAGE_STARTED,
    STAGE_RETRIED,
    STAGE_COMPLETED,
    STAGE_FAILED,
    STAGE_SKIPPED,
    STAGE_SUPERSEDED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED,
    ACTION_RECORDED,
    PUBLISH_FAILED,
    FILE_CHANGED
}
