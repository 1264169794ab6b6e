package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;


@Entity
@Table(name = "channel_links")
public class ChannelLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Column(name = "mattermost_user_id", nullable = false, unique = true)
    private String mattermostUserId;

    // Direct channel between the bot and the user
    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "created_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "last_interaction")
    @UpdateTimestamp
    private LocalDateTime lastInteraction;

    public ChannelLink() {}

    public ChannelLink(String userId, String mattermostUserId, String channelId) {
        this.userId = userId;
        this.mattermostUserId = mattermostUserId;
        this.channelId = channelId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getMattermostUserId() { return mattermostUserId; }
    public void setMattermostUserId(String mattermostUserId) { this.mattermostUserId = mattermostUserId; }

    public String getChannelId() { return channelId; }
    public void setChannelId(String channelId) { this.channelId = channelId; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getLastInteraction() { return lastInteraction; }
    public void setLastInteraction(LocalDateTime lastInteraction) { this.lastInteraction = lastInteraction; }

}
