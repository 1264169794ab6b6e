package com.example.mailagent.integration;

import java.time.LocalDateTime;

/**
 * An inbound email as handed to the engine.
 *
 * @param messageId mailbox-side id, used as the item reference
 * @param rfcMessageId the RFC 822 Message-ID header, used to thread replies
 */
public record EmailItem(String userId,
                        String messageId,
                        String threadId,
                        String rfcMessageId,
                        String sender,
                        String subject,
                        String body,
                        LocalDateTime receivedAt) {
}
