package com.example.mailagent.integration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The messaging channel a user approves proposals in. Content passed in is already sanitised.
 *
 * Every message is sent with an idempotency key the channel stores alongside it, so an attempt
 * whose outcome was lost can be looked up with {@link #findDelivered} before sending again.
 */
public interface Notifier {

    /**
     * Sends one proposal with its action set and returns the channel's message reference.
     */
    PortResult<String> notify(String userId, String idempotencyKey, String summary, ActionSet actions);

    /**
     * Sends one aggregated message for several queued items. The digest key is its idempotency key.
     */
    PortResult<String> notifyDigest(String userId, String summary, List<DigestItem> items, String digestKey);

    /**
     * Replaces a previously sent proposal with its final outcome.
     */
    PortResult<Void> confirm(String userId, String messageRef, String text);

    /**
     * Plain message without actions, used for failure notices.
     */
    PortResult<String> alert(String userId, String idempotencyKey, String text);

    /**
     * Message reference of a message sent since {@code since} under the given key, if there is one.
     */
    PortResult<Optional<String>> findDelivered(String userId, String idempotencyKey, Instant since);
}
