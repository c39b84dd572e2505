package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.ArtifactStatus;

/**
 * Write-once violation: a current artifact already exists for the key.
 * The caller must supersede it explicitly before writing a new one.
 */
public class ArtifactAlreadyExistsException extends StoreException {

    private final String workflowId;
    private final String stageName;

    public ArtifactAlreadyExistsException(String workflowId, String stageName, ArtifactStatus existing) {
        super("Artifact for stage '%s' of workflow %s already exists (%s); supersede it before writing again"
                .formatted(stageName, workflowId, existing));
        this.workflowId = workflowId;
        this.stageName  = stageName;
    }

    public String getWorkflowId() { return workflowId; }
    public String getStageName()  { return stageName; }
}
