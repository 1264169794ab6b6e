package com.example.mailagent.domain.model;

public enum WorkflowState {
    CREATED,
    CLASSIFIED,
    ROUTED_IMMEDIATE,
    ROUTED_BATCH,
    AWAITING_APPROVAL, // suspended until the approval gateway resumes it
    RESOLVED,
    ACTION_EXECUTED, // side effects have happened, cancellation no longer allowed
    CONFIRMED,
    TERMINAL;

    public boolean isTerminal() {
        return this == TERMINAL;
    }

    public boolean isCancellable() {
        return ordinal() <= AWAITING_APPROVAL.ordinal();
    }
}
