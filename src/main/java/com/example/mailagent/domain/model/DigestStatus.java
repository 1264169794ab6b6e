package com.example.mailagent.domain.model;

public enum DigestStatus {
    PENDING,
    SENT,
    /** Recorded but none of its entries were left to offer. */
    DISCARDED
}
