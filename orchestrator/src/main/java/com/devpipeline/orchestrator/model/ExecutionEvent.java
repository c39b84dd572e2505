package com.devpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One compact, append-only record in a workflow's execution log.
 *
 * Events carry names, ids and short reasons only. Consumers that need stage
 * content resolve it from the artifact store on demand.
 *
 * DB table: execution_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_events")
public class ExecutionEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false, length = 64)
    private String workflowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EventType type;

    @Column(name = "stage_name", length = 64)
    private String stageName;

    // Reason, action name, or file path depending on the type.
    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt = Instant.now();

    protected ExecutionEvent() {}   // required by JPA

    public ExecutionEvent(String workflowId, EventType type, String stageName, String detail) {
        this.workflowId = workflowId;
        this.type       = type;
        this.stageName  = stageName;
        this.detail     = detail;
    }

    public Long      getId()         { return id; }
    public String    getWorkflowId() { return workflowId; }
    public EventType getType()       { return type; }
    public String    getStageName()  { return stageName; }
    public String    getDetail()     { return detail; }
    public Instant   getOccurredAt() { return occurredAt; }
}
