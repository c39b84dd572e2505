package com.devpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * An ordered list of requests run one workflow at a time.
 *
 * {@code nextIndex} is the position of the first item without a terminal
 * outcome; a resumed batch continues from there.
 *
 * DB table: batches  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "batches")
public class Batch {

    @Id
    @Column(length = 64)
    private String id;

    // Mode given to every workflow of the batch.
    @Column(nullable = false, length = 32)
    private String mode = Workflow.DEFAULT_MODE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BatchStatus status = BatchStatus.RUNNING;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "next_index", nullable = false)
    private int nextIndex;

    // FAILED workflows in a row; reset by a COMPLETED one.
    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    // Why the batch is HALTED or CANCELLED.
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

    protected Batch() {}   // required by JPA

    public Batch(String id, String mode, int totalItems) {
        this.id         = id;
        this.mode       = (mode == null || mode.isBlank()) ? Workflow.DEFAULT_MODE : mode;
        this.totalItems = totalItems;
    }

    public String      getId()                  { return id; }
    public String      getMode()                { return mode; }
    public BatchStatus getStatus()              { return status; }
    public int         getTotalItems()          { return totalItems; }
    public int         getNextIndex()           { return nextIndex; }
    public int         getConsecutiveFailures() { return consecutiveFailures; }
    public String      getReason()              { return reason; }
    public Instant     getCreatedAt()           { return createdAt; }
    public Instant     getUpdatedAt()           { return updatedAt; }

    public void setStatus(BatchStatus status)        { this.status = status; }
    public void setNextIndex(int nextIndex)          { this.nextIndex = nextIndex; }
    public void setConsecutiveFailures(int failures) { this.consecutiveFailures = failures; }
    public void setReason(String reason)             { this.reason = reason; }
    public void setUpdatedAt(Instant updatedAt)      { this.updatedAt = updatedAt; }
}
