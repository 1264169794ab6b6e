package com.example.mailagent.workflow.action;

/**
 * Idempotency keys for side effects. Each key identifies one effect of one instance for its whole life.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String notify(String instanceId) {
        return instanceId + ":notify";
    }

    public static String reply(String instanceId) {
        return instanceId + ":reply";
    }

    public static String label(String instanceId) {
        return instanceId + ":label";
    }

    public static String failureNotice(String instanceId, int blockCount) {
        return instanceId + ":failure-notice:" + blockCount;
    }

    public static String manualReview(String instanceId) {
        return instanceId + ":manual-review";
    }
}
