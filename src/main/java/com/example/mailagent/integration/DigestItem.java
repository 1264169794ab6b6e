package com.example.mailagent.integration;

/**
 * One queued email inside a digest. {@code entryId} is stable across redispatches.
 */
public record DigestItem(String entryId, String summary, ActionSet actions) {
}
