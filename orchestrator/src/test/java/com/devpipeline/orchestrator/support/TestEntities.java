package com.devpipeline.orchestrator.support;

import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.model.WorkflowStatus;

/** Helpers for entities whose ids are normally assigned by the database. */
public final class TestEntities {

    private TestEntities() {}

    public static void setId(Object entity, Object id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static Workflow workflow(String id, WorkflowStatus status) {
        return workflow(id, status, "standard");
    }

    public static Workflow workflow(String id, WorkflowStatus status, String mode) {
        Workflow workflow = new Workflow(id, "fix a typo in a comment", mode);
        workflow.setStatus(status);
        return workflow;
    }
}
