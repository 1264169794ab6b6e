package com.example.mailagent.integration;

import java.util.Optional;

public interface MailboxClient {

    /**
     * Adds the label and removes the message from the inbox.
     */
    PortResult<MailboxReceipt> applyLabel(String messageId, String labelId);

    PortResult<MailboxReceipt> sendReply(ReplyRequest request);

    /**
     * Looks for a reply previously sent with the given idempotency key.
     */
    PortResult<Optional<MailboxReceipt>> findReply(String idempotencyKey);

    /**
     * Reads the message back; the receipt is confirmed when it carries the label and left the inbox.
     */
    PortResult<MailboxReceipt> checkLabel(String messageId, String labelId);
}
