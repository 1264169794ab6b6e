package com.example.mailagent.integration;

import com.example.mailagent.domain.model.ErrorKind;

public record PortFailure(ErrorKind kind, String message) {

    public static PortFailure transientFailure(String message) {
        return new PortFailure(ErrorKind.TRANSIENT_EXTERNAL, message);
    }

    public static PortFailure permanentFailure(String message) {
        return new PortFailure(ErrorKind.PERMANENT_EXTERNAL, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
