package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;


@Entity
@Table(name = "digest_dispatches")
public class DigestDispatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "digest_key", nullable = false, unique = true, length = 128)
    private String digestKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DigestStatus status;

    @Column(name = "message_ref")
    private String messageRef;

    @Column(name = "entry_count", nullable = false)
    private int entryCount;

    // Archive of the drained instances, comma separated
    @Column(name = "instance_ids", length = 8000)
    private String instanceIds;

    @Column(name = "created_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    public DigestDispatch() {}

    public Long getId() { return id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getDigestKey() { return digestKey; }
    public void setDigestKey(String digestKey) { this.digestKey = digestKey; }

    public DigestStatus getStatus() { return status; }
    public void setStatus(DigestStatus status) { this.status = status; }

    public String getMessageRef() { return messageRef; }
    public void setMessageRef(String messageRef) { this.messageRef = messageRef; }

    public int getEntryCount() { return entryCount; }
    public void setEntryCount(int entryCount) { this.entryCount = entryCount; }

    public String getInstanceIds() { return instanceIds; }
    public void setInstanceIds(String instanceIds) { this.instanceIds = instanceIds; }

    @Transient
    public Set<String> getInstanceIdSet() {
        if (instanceIds == null || instanceIds.isBlank()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(instanceIds.split(",")));
    }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getSentAt() { return sentAt; }
    public void setSentAt(LocalDateTime sentAt) { this.sentAt = sentAt; }
}
