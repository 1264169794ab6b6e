package com.example.mailagent.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;


@Entity
@Table(name = "workflow_instances")
public class WorkflowInstance {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "correlation_key", nullable = false, unique = true, length = 64)
    private String correlationKey;

    @Column(name = "item_ref", nullable = false, unique = true)
    private String itemRef;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "thread_id")
    private String threadId;

    @Column(name = "sender")
    private String sender;

    @Column(name = "subject", length = 1000)
    private String subject;

    @Lob
    @Column(name = "body")
    private String body;

    @Column(name = "rfc_message_id")
    private String rfcMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_state", nullable = false)
    private WorkflowState currentState;

    @Enumerated(EnumType.STRING)
    @Column(name = "terminal_reason")
    private TerminalReason terminalReason;

    // Classification
    @Column(name = "category")
    private String category;

    @Column(name = "proposed_folder")
    private String proposedFolder;

    @Column(name = "reasoning", length = 2000)
    private String reasoning;

    @Column(name = "needs_response")
    private boolean needsResponse;

    @Lob
    @Column(name = "draft_response")
    private String draftResponse;

    // Reply text as edited by the user, replaces the draft when set
    @Lob
    @Column(name = "edited_response")
    private String editedResponse;

    @Column(name = "reply_declined", nullable = false)
    private boolean replyDeclined;

    @Column(name = "priority_score")
    private int priorityScore;

    @Column(name = "is_priority")
    private boolean priority;

    // Approval
    @Enumerated(EnumType.STRING)
    @Column(name = "decision")
    private Decision decision;

    @Column(name = "selected_folder")
    private String selectedFolder;

    @Column(name = "notification_ref")
    private String notificationRef;

    // Action outcome
    @Column(name = "reply_sent")
    private boolean replySent;

    @Column(name = "label_applied")
    private boolean labelApplied;

    @Column(name = "action_errors", length = 4000)
    private String actionErrors;

    // Blocked marker
    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    @Enumerated(EnumType.STRING)
    @Column(name = "blocked_kind")
    private ErrorKind blockedKind;

    @Column(name = "blocked_reason", length = 2000)
    private String blockedReason;

    @Column(name = "blocked_at")
    private LocalDateTime blockedAt;

    @Column(name = "block_count", nullable = false)
    private int blockCount;

    @Version
    @Column(name = "version")
    private long version;

    @Column(name = "created_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public WorkflowInstance() {}

    /**
     * Folder the label/move sub-action targets: the user's pick on CHANGE, otherwise the proposal.
     */
    @Transient
    public String getTargetFolder() {
        return decision == Decision.CHANGE ? selectedFolder : proposedFolder;
    }

    /**
     * A reply goes out when the user did not decline it and either the classifier asked for one
     * or the user wrote one.
     */
    @Transient
    public boolean isReplyWanted() {
        return !replyDeclined && (needsResponse || hasText(editedResponse));
    }

    @Transient
    public String getReplyBody() {
        return hasText(editedResponse) ? editedResponse : draftResponse;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public void markBlocked(ErrorKind kind, String reason) {
        this.blocked = true;
        this.blockedKind = kind;
        this.blockedReason = reason;
        this.blockedAt = LocalDateTime.now();
        this.blockCount++;
    }

    public void clearBlocked() {
        this.blocked = false;
        this.blockedKind = null;
        this.blockedReason = null;
        this.blockedAt = null;
    }

    public void terminate(TerminalReason reason) {
        this.currentState = WorkflowState.TERMINAL;
        this.terminalReason = reason;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCorrelationKey() { return correlationKey; }
    public void setCorrelationKey(String correlationKey) { this.correlationKey = correlationKey; }

    public String getItemRef() { return itemRef; }
    public void setItemRef(String itemRef) { this.itemRef = itemRef; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getSender() { return sender; }
    public void setSender(String sender) { this.sender = sender; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    public String getRfcMessageId() { return rfcMessageId; }
    public void setRfcMessageId(String rfcMessageId) { this.rfcMessageId = rfcMessageId; }

    public WorkflowState getCurrentState() { return currentState; }
    public void setCurrentState(WorkflowState currentState) { this.currentState = currentState; }

    public TerminalReason getTerminalReason() { return terminalReason; }
    public void setTerminalReason(TerminalReason terminalReason) { this.terminalReason = terminalReason; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getProposedFolder() { return proposedFolder; }
    public void setProposedFolder(String proposedFolder) { this.proposedFolder = proposedFolder; }

    public String getReasoning() { return reasoning; }
    public void setReasoning(String reasoning) { this.reasoning = reasoning; }

    public boolean isNeedsResponse() { return needsResponse; }
    public void setNeedsResponse(boolean needsResponse) { this.needsResponse = needsResponse; }

    public String getDraftResponse() { return draftResponse; }
    public void setDraftResponse(String draftResponse) { this.draftResponse = draftResponse; }

    public String getEditedResponse() { return editedResponse; }
    public void setEditedResponse(String editedResponse) { this.editedResponse = editedResponse; }

    public boolean isReplyDeclined() { return replyDeclined; }
    public void setReplyDeclined(boolean replyDeclined) { this.replyDeclined = replyDeclined; }

    public int getPriorityScore() { return priorityScore; }
    public void setPriorityScore(int priorityScore) { this.priorityScore = priorityScore; }

    public boolean isPriority() { return priority; }
    public void setPriority(boolean priority) { this.priority = priority; }

    public Decision getDecision() { return decision; }
    public void setDecision(Decision decision) { this.decision = decision; }

    public String getSelectedFolder() { return selectedFolder; }
    public void setSelectedFolder(String selectedFolder) { this.selectedFolder = selectedFolder; }

    public String getNotificationRef() { return notificationRef; }
    public void setNotificationRef(String notificationRef) { this.notificationRef = notificationRef; }

    public boolean isReplySent() { return replySent; }
    public void setReplySent(boolean replySent) { this.replySent = replySent; }

    public boolean isLabelApplied() { return labelApplied; }
    public void setLabelApplied(boolean labelApplied) { this.labelApplied = labelApplied; }

    public String getActionErrors() { return actionErrors; }
    public void setActionErrors(String actionErrors) { this.actionErrors = actionErrors; }

    public boolean isBlocked() { return blocked; }
    public void setBlocked(boolean blocked) { this.blocked = blocked; }

    public ErrorKind getBlockedKind() { return blockedKind; }
    public void setBlockedKind(ErrorKind blockedKind) { this.blockedKind = blockedKind; }

    public String getBlockedReason() { return blockedReason; }
    public void setBlockedReason(String blockedReason) { this.blockedReason = blockedReason; }

    public LocalDateTime getBlockedAt() { return blockedAt; }
    public void setBlockedAt(LocalDateTime blockedAt) { this.blockedAt = blockedAt; }

    public int getBlockCount() { return blockCount; }
    public void setBlockCount(int blockCount) { this.blockCount = blockCount; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

}
