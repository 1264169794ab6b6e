package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Open link between an outbound notification and the suspended instance waiting for its answer.
 * Exists exactly while the instance is in {@link WorkflowState#AWAITING_APPROVAL}.
 */
@Entity
@Table(name = "external_correlations")
public class ExternalCorrelation {

    @Id
    @Column(name = "correlation_key", length = 64)
    private String correlationKey;

    @Column(name = "instance_id", nullable = false, unique = true, length = 64)
    private String instanceId;

    @Column(name = "notification_message_id")
    private String notificationMessageId;

    @Column(name = "created_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    protected ExternalCorrelation() {}

    public ExternalCorrelation(String correlationKey, String instanceId, String notificationMessageId) {
        this.correlationKey = correlationKey;
        this.instanceId = instanceId;
        this.notificationMessageId = notificationMessageId;
    }

    public String getCorrelationKey() { return correlationKey; }
    public String getInstanceId() { return instanceId; }
    public String getNotificationMessageId() { return notificationMessageId; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
