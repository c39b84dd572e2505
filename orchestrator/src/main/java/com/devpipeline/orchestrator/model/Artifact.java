package com.devpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Immutable output of one stage for one workflow.
 *
 * At most one non-superseded artifact exists per (workflow_id, stage_name);
 * a partial unique index enforces this in the database. The only mutation
 * ever applied to a stored row is {@link #markSuperseded()}, used by the
 * explicit rerun path.
 *
 * DB table: artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "artifacts")
public class Artifact {

    // Identity column: ascending ids give the durable write order.
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false, length = 64)
    private String workflowId;

    @Column(name = "stage_name", nullable = false, length = 64)
    private String stageName;

    // Schema version of the payload, e.g. "1.0".
    @Column(nullable = false, length = 32)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ArtifactStatus status;

    // Stage payload as JSON text, envelope included.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    // Why the artifact is FAILED: "timeout", "validation: ...", "quality-gate: ...".
    @Column(columnDefinition = "TEXT")
    private String reason;

    // Worker invocations spent producing this artifact.
    @Column(nullable = false)
    private int attempts;

    @Column(nullable = false)
    private boolean superseded = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Artifact() {}   // required by JPA

    private Artifact(String workflowId, String stageName, String version,
                     ArtifactStatus status, String payload, String reason, int attempts) {
        this.workflowId = workflowId;
        this.stageName  = stageName;
        this.version    = version;
        this.status     = status;
        this.payload    = payload;
        this.reason     = reason;
        this.attempts   = attempts;
    }

    public static Artifact completed(String workflowId, String stageName, String version,
                                     String payload, int attempts) {
        return new Artifact(workflowId, stageName, version,
                ArtifactStatus.COMPLETED, payload, null, attempts);
    }

    public static Artifact failed(String workflowId, String stageName, String version,
                                  String payload, String reason, int attempts) {
        return new Artifact(workflowId, stageName, version,
                ArtifactStatus.FAILED, payload == null ? "{}" : payload, reason, attempts);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public Long           getId()         { return id; }
    public String         getWorkflowId() { return workflowId; }
    public String         getStageName()  { return stageName; }
    public String         getVersion()    { return version; }
    public ArtifactStatus getStatus()     { return status; }
    public String         getPayload()    { return payload; }
    public String         getReason()     { return reason; }
    public int            getAttempts()   { return attempts; }
    public boolean        isSuperseded()  { return superseded; }
    public Instant        getCreatedAt()  { return createdAt; }

    public boolean isCompleted() { return status == ArtifactStatus.COMPLETED; }

    public void markSuperseded() { this.superseded = true; }
}
