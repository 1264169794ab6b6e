package com.example.mailagent.workflow;

import com.example.mailagent.domain.model.Decision;

/**
 * @param selectedFolder required for {@link Decision#CHANGE}, ignored otherwise
 * @param actorId who decided, kept in the approval history
 * @param replyText reply as rewritten by the user, sent instead of the draft when not blank
 * @param skipReply file the email without sending any reply
 */
public record ApprovalInput(Decision decision, String selectedFolder, String actorId, String replyText, boolean skipReply) {

    public ApprovalInput(Decision decision, String selectedFolder, String actorId) {
        this(decision, selectedFolder, actorId, null, false);
    }
}
