package com.example.mailagent.domain.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.time.LocalTime;


@Entity
@Table(name = "notification_preferences")
public class NotificationPreferences {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Column(name = "batch_enabled", nullable = false)
    private boolean batchEnabled = true;

    @Column(name = "batch_time", nullable = false)
    private LocalTime batchTime;

    @Column(name = "quiet_hours_start")
    private LocalTime quietHoursStart;

    @Column(name = "quiet_hours_end")
    private LocalTime quietHoursEnd;

    @Column(name = "timezone", nullable = false, length = 50)
    private String timezone;

    // Local date-time (in the user's zone) of the last dispatched digest
    @Column(name = "last_digest_at")
    private LocalDateTime lastDigestAt;

    public NotificationPreferences() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public boolean isBatchEnabled() { return batchEnabled; }
    public void setBatchEnabled(boolean batchEnabled) { this.batchEnabled = batchEnabled; }

    public LocalTime getBatchTime() { return batchTime; }
    public void setBatchTime(LocalTime batchTime) { this.batchTime = batchTime; }

    public LocalTime getQuietHoursStart() { return quietHoursStart; }
    public void setQuietHoursStart(LocalTime quietHoursStart) { this.quietHoursStart = quietHoursStart; }

    public LocalTime getQuietHoursEnd() { return quietHoursEnd; }
    public void setQuietHoursEnd(LocalTime quietHoursEnd) { this.quietHoursEnd = quietHoursEnd; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public LocalDateTime getLastDigestAt() { return lastDigestAt; }
    public void setLastDigestAt(LocalDateTime lastDigestAt) { this.lastDigestAt = lastDigestAt; }
}
