package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Append-only snapshot of an instance taken around every step. Never updated.
 */
@Entity
@Table(name = "workflow_checkpoints",
        uniqueConstraints = @UniqueConstraint(name = "uk_checkpoint_instance_seq", columnNames = {"instance_id", "seq"}))
public class Checkpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_id", nullable = false, length = 64)
    private String instanceId;

    @Column(name = "seq", nullable = false)
    private long seq;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false)
    private WorkflowState state;

    @Column(name = "pending_step")
    private String pendingStep;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false)
    private CheckpointPhase phase;

    @Lob
    @Column(name = "snapshot", nullable = false)
    private String snapshot;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    protected Checkpoint() {}

    public Checkpoint(String instanceId, long seq, WorkflowState state, String pendingStep,
                      CheckpointPhase phase, String snapshot) {
        this.instanceId = instanceId;
        this.seq = seq;
        this.state = state;
        this.pendingStep = pendingStep;
        this.phase = phase;
        this.snapshot = snapshot;
    }

    public Long getId() { return id; }
    public String getInstanceId() { return instanceId; }
    public long getSeq() { return seq; }
    public WorkflowState getState() { return state; }
    public String getPendingStep() { return pendingStep; }
    public CheckpointPhase getPhase() { return phase; }
    public String getSnapshot() { return snapshot; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
