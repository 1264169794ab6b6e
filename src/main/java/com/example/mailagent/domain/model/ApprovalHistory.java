package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;


@Entity
@Table(name = "approval_history", indexes = {
        @Index(name = "idx_approval_history_user_decided", columnList = "user_id, decided_at"),
        @Index(name = "idx_approval_history_decision", columnList = "decision")
})
public class ApprovalHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "instance_id", nullable = false, length = 64)
    private String instanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false)
    private Decision decision;

    @Column(name = "proposed_folder")
    private String proposedFolder;

    @Column(name = "selected_folder")
    private String selectedFolder;

    @Column(name = "actor_id")
    private String actorId;

    @Column(name = "decided_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime decidedAt;

    protected ApprovalHistory() {}

    public ApprovalHistory(WorkflowInstance instance, String actorId) {
        this.userId = instance.getUserId();
        this.instanceId = instance.getId();
        this.decision = instance.getDecision();
        this.proposedFolder = instance.getProposedFolder();
        this.selectedFolder = instance.getTargetFolder();
        this.actorId = actorId;
    }

    public Long getId() { return id; }
    public String getUserId() { return userId; }
    public String getInstanceId() { return instanceId; }
    public Decision getDecision() { return decision; }
    public String getProposedFolder() { return proposedFolder; }
    public String getSelectedFolder() { return selectedFolder; }
    public String getActorId() { return actorId; }
    public LocalDateTime getDecidedAt() { return decidedAt; }
}
