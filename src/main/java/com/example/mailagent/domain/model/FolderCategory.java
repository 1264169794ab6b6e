package com.example.mailagent.domain.model;

import jakarta.persistence.*;

/**
 * A user's sorting folder and the mailbox label backing it. Maintained outside the engine.
 */
@Entity
@Table(name = "folder_categories",
        uniqueConstraints = @UniqueConstraint(name = "uk_folder_user_name", columnNames = {"user_id", "name"}))
public class FolderCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "label_id", nullable = false)
    private String labelId;

    // Comma separated sender addresses or domains that are always priority for this folder
    @Column(name = "priority_senders", length = 2000)
    private String prioritySenders;

    public FolderCategory() {}

    public FolderCategory(String userId, String name, String labelId) {
        this.userId = userId;
        this.name = name;
        this.labelId = labelId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getLabelId() { return labelId; }
    public void setLabelId(String labelId) { this.labelId = labelId; }

    public String getPrioritySenders() { return prioritySenders; }
    public void setPrioritySenders(String prioritySenders) { this.prioritySenders = prioritySenders; }
}
