package com.example.mailagent.domain.model;

public enum ErrorKind {
    /** Network failure, timeout, 5xx or rate limit. Retried with backoff. */
    TRANSIENT_EXTERNAL,
    /** 4xx or validation failure. Parks the instance, never retried automatically. */
    PERMANENT_EXTERNAL,
    /** Callback for an unknown, expired or already resolved correlation. */
    STALE_CALLBACK,
    /** Idempotency key already sent or confirmed; the recorded result is reused. */
    DUPLICATE_ACTION;

    public boolean isRetryable() {
        return this == TRANSIENT_EXTERNAL;
    }
}
