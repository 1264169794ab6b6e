package com.example.mailagent.service;

import com.example.mailagent.domain.model.Decision;

/**
 * A decision received from the messaging channel.
 *
 * @param actorId channel-side id of the person who clicked
 * @param folder target folder, only meaningful for {@link Decision#CHANGE}
 * @param replyText edited reply, null to keep the draft
 * @param skipReply approve without sending a reply
 */
public record ApprovalEvent(String correlationKey, Decision decision, String actorId, String folder,
                            String replyText, boolean skipReply) {

    public ApprovalEvent(String correlationKey, Decision decision, String actorId, String folder) {
        this(correlationKey, decision, actorId, folder, null, false);
    }
}
