package com.devpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One end-to-end run of the stage pipeline for a single request.
 *
 * Only the WorkflowCoordinator thread that owns the run mutates this record.
 * Rows are never deleted; they are kept for audit and bypass analysis.
 *
 * DB table: workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflows")
public class Workflow {

    public static final String DEFAULT_MODE = "standard";

    // Opaque id assigned by the caller (timestamp + random suffix).
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String request;

    // Declared workflow mode; selects the terminal actions the bypass detector expects.
    @Column(nullable = false, length = 32)
    private String mode = DEFAULT_MODE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WorkflowStatus status = WorkflowStatus.PENDING;

    // Stage (or parallel group) currently being dispatched. Null when idle.
    @Column(name = "current_stage", length = 64)
    private String currentStage;

    // Human-readable cause of BLOCKED or FAILED.
    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Workflow() {}   // required by JPA

    public Workflow(String id, String request, String mode) {
        this.id      = id;
        this.request = request;
        this.mode    = (mode == null || mode.isBlank()) ? DEFAULT_MODE : mode;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String         getId()           { return id; }
    public String         getRequest()      { return request; }
    public String         getMode()         { return mode; }
    public WorkflowStatus getStatus()       { return status; }
    public String         getCurrentStage() { return currentStage; }
    public String         getReason()       { return reason; }
    public Instant        getCreatedAt()    { return createdAt; }
    public Instant        getUpdatedAt()    { return updatedAt; }

    public void setStatus(WorkflowStatus status)     { this.status = status; }
    public void setCurrentStage(String currentStage) { this.currentStage = currentStage; }
    public void setReason(String reason)             { this.reason = reason; }
    public void setUpdatedAt(Instant updatedAt)      { this.updatedAt = updatedAt; }
}
