package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;


@Entity
@Table(name = "batch_queue", indexes = @Index(name = "idx_batch_queue_user", columnList = "user_id"))
public class BatchQueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "instance_id", nullable = false, unique = true, length = 64)
    private String instanceId;

    @Column(name = "category")
    private String category;

    @Column(name = "proposed_folder")
    private String proposedFolder;

    @Column(name = "scheduled_time", nullable = false)
    private LocalDateTime scheduledTime;

    // Key of the dispatch offering this entry, set before the digest is sent
    @Column(name = "dispatch_key")
    private String dispatchKey;

    @Column(name = "created_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    public BatchQueueEntry() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getProposedFolder() { return proposedFolder; }
    public void setProposedFolder(String proposedFolder) { this.proposedFolder = proposedFolder; }

    public LocalDateTime getScheduledTime() { return scheduledTime; }
    public void setScheduledTime(LocalDateTime scheduledTime) { this.scheduledTime = scheduledTime; }

    public String getDispatchKey() { return dispatchKey; }
    public void setDispatchKey(String dispatchKey) { this.dispatchKey = dispatchKey; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
