package com.example.mailagent.domain.model;

import java.util.Locale;

/**
 * A human decision on a proposed sort/reply.
 */
public enum Decision {
    APPROVE,
    REJECT,
    CHANGE;

    public boolean isAffirmative() {
        return this != REJECT;
    }

    /**
     * Parses the decision as sent by the messaging channel ("approve", "reject", "change",
     * and the legacy "change_folder").
     */
    public static Decision fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("decision is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("CHANGE_FOLDER")) {
            return CHANGE;
        }
        return Decision.valueOf(normalized);
    }

    public String toWire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
