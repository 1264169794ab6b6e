package com.example.mailagent.integration;

/**
 * @param externalId id of the message the mailbox acted on or created
 * @param confirmed the response proves the effect took place (label present, message stored)
 */
public record MailboxReceipt(String externalId, boolean confirmed) {
}
