package com.example.mailagent.integration;

public record ReplyRequest(String idempotencyKey,
                           String threadId,
                           String to,
                           String subject,
                           String inReplyTo,
                           String body) {
}
