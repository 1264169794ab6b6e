package com.example.mailagent.domain.model;

public enum TerminalReason {
    COMPLETED,
    QUEUED, // parked in the batch queue until the next digest
    REJECTED,
    MANUAL_REVIEW
}
