package com.devpipeline.orchestrator.model;

import jakarta.persistence.*;

/**
 * One request of a batch and the workflow that ran it.
 *
 * {@code workflowId} is assigned and stored before the workflow starts, so a
 * batch interrupted mid-item resumes that same workflow instead of starting
 * a second one. {@code outcome} is set once the workflow is terminal.
 *
 * DB table: batch_items  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "batch_items")
public class BatchItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, length = 64)
    private String batchId;

    // 0-based position in the submitted list.
    @Column(nullable = false)
    private int position;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String request;

    @Column(name = "workflow_id", length = 64)
    private String workflowId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private WorkflowStatus outcome;

    protected BatchItem() {}   // required by JPA

    public BatchItem(String batchId, int position, String request) {
        this.batchId  = batchId;
        this.position = position;
        this.request  = request;
    }

    public Long           getId()         { return id; }
    public String         getBatchId()    { return batchId; }
    public int            getPosition()   { return position; }
    public String         getRequest()    { return request; }
    public String         getWorkflowId() { return workflowId; }
    public WorkflowStatus getOutcome()    { return outcome; }

    public void setWorkflowId(String workflowId)   { this.workflowId = workflowId; }
    public void setOutcome(WorkflowStatus outcome) { this.outcome = outcome; }
}
