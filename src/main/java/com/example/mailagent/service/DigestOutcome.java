package com.example.mailagent.service;

/**
 * @param itemCount entries offered (or reconciled) by this run
 * @param digestKey key of the dispatch, null when nothing was sent
 */
public record DigestOutcome(Status status, int itemCount, String digestKey) {

    public enum Status {
        SENT,
        EMPTY,
        SKIPPED,
        FAILED
    }

    public static DigestOutcome sent(int itemCount, String digestKey) {
        return new DigestOutcome(Status.SENT, itemCount, digestKey);
    }

    public static DigestOutcome empty() {
        return new DigestOutcome(Status.EMPTY, 0, null);
    }

    public static DigestOutcome skipped() {
        return new DigestOutcome(Status.SKIPPED, 0, null);
    }

    public static DigestOutcome failed(String digestKey) {
        return new DigestOutcome(Status.FAILED, 0, digestKey);
    }
}
