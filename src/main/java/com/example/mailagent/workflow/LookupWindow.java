package com.example.mailagent.workflow;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Lower bound for searching the channel for a message sent by an earlier attempt.
 */
public final class LookupWindow {

    static final Duration CLOCK_SKEW = Duration.ofMinutes(5);
    static final Duration UNKNOWN_START = Duration.ofDays(1);

    private LookupWindow() {
    }

    /**
     * @param recordedAt when the attempt was recorded locally, or null if not known
     */
    public static Instant since(LocalDateTime recordedAt) {
        if (recordedAt == null) {
            return Instant.now().minus(UNKNOWN_START);
        }
        return recordedAt.atZone(ZoneId.systemDefault()).toInstant().minus(CLOCK_SKEW);
    }
}
