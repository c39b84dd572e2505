package com.devpipeline.orchestrator.publish;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.Workflow;

import java.util.List;

/**
 * Hand-off of a completed workflow to version control.
 */
public interface PublishCollaborator {

    /**
     * @param artifacts current artifacts of the workflow in write order
     * @throws PublishException if publishing failed
     */
    PublishResult publish(Workflow workflow, List<Artifact> artifacts) throws InterruptedException;
}
