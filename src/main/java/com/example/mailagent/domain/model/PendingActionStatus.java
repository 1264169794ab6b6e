package com.example.mailagent.domain.model;

public enum PendingActionStatus {
    PENDING,
    SENT,
    FAILED,
    CONFIRMED;

    /**
     * The external call went through at least once; it must not be issued again.
     */
    public boolean isDelivered() {
        return this == SENT || this == CONFIRMED;
    }
}
